package com.conveyor.engine.notify;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Subject and HTML body with {@code {placeholder}} markers.
 *
 * Unknown placeholders render as empty text. Values are inserted verbatim;
 * escaping is the caller's job.
 */
public record ReportTemplate(String subject, String body) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_.-]+)}");

    /** The report layout used when a pipeline does not bring its own. */
    public static ReportTemplate standard() {
        return new ReportTemplate(
                "[{status}] {pipeline} run {runId}",
                """
                <html><body>
                <h2>{pipeline}: {status}</h2>
                <p>Run <b>{runId}</b> finished in {durationSeconds}s.</p>
                <p>Branch: {branch}</p>
                <table border="1" cellpadding="4" cellspacing="0">
                <tr><th>Stage</th><th>Status</th><th>Duration (ms)</th><th>Attempts</th><th>Message</th></tr>
                {stageRows}
                </table>
                <h3>Artifacts</h3>
                <ul>
                {artifactLinks}
                </ul>
                <p>{buildLink}</p>
                </body></html>
                """);
    }

    public String renderSubject(Map<String, String> values) {
        return render(subject, values);
    }

    public String renderBody(Map<String, String> values) {
        return render(body, values);
    }

    static String render(String template, Map<String, String> values) {
        if (template == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(value != null ? value : ""));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
