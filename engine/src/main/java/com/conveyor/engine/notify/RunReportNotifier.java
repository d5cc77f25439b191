package com.conveyor.engine.notify;

import com.conveyor.engine.model.PipelineRun;
import com.conveyor.engine.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the HTML run report and hands it to the {@link NotificationSender}.
 *
 * Runs in which no stage executed are not reported. State entries whose key
 * ends in {@code _URL} or {@code _URI} are listed as artifact links.
 */
@Component
public class RunReportNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(RunReportNotifier.class);

    private final NotificationSender sender;
    private final String             buildUrl;

    public RunReportNotifier(NotificationSender sender,
                             @Value("${conveyor.notify.build-url:}") String buildUrl) {
        this.sender   = sender;
        this.buildUrl = buildUrl;
    }

    @Override
    public void notify(PipelineRun run, NotificationChannel channel, ReportTemplate template) {
        if (run.allSkipped()) {
            log.info("Run {} executed no stage; no report sent", run.runId());
            return;
        }
        if (channel.to().isEmpty()) {
            log.warn("Run {} has no report recipients", run.runId());
            return;
        }

        Map<String, String> values = values(run);
        List<Path> attachments = channel.attachments().stream()
                .filter(Files::isRegularFile)
                .toList();

        sender.send(channel.to(), template.renderSubject(values), template.renderBody(values), attachments);
        log.info("Report for run {} ({}) sent to {} recipient(s)", run.runId(), run.status(), channel.to().size());
    }

    Map<String, String> values(PipelineRun run) {
        Map<String, String> values = new HashMap<>();
        values.put("pipeline",        escape(run.pipelineName()));
        values.put("runId",           escape(run.runId()));
        values.put("status",          run.status().name());
        values.put("durationSeconds", String.valueOf(run.durationMs() / 1000));
        values.put("branch",          escape(String.valueOf(run.state().getOrDefault("BRANCH_NAME", "-"))));
        values.put("failure",         escape(run.firstFailureMessage().orElse("")));
        values.put("stageRows",       stageRows(run.stages()));
        values.put("artifactLinks",   artifactLinks(run.state()));
        values.put("buildLink",       buildUrl.isBlank() ? ""
                : "<a href=\"" + escape(buildUrl + run.runId()) + "\">Build log</a>");
        return values;
    }

    private static String stageRows(List<StageResult> stages) {
        return stages.stream()
                .map(r -> "<tr><td>" + escape(r.stageId())
                        + "</td><td>" + r.status()
                        + "</td><td>" + r.durationMs()
                        + "</td><td>" + r.attempts()
                        + "</td><td>" + escape(r.message() == null ? "" : r.message())
                        + "</td></tr>")
                .collect(Collectors.joining("\n"));
    }

    private static String artifactLinks(Map<String, Object> state) {
        return state.entrySet().stream()
                .filter(e -> e.getKey().endsWith("_URL") || e.getKey().endsWith("_URI"))
                .map(e -> {
                    String link = escape(e.getValue().toString());
                    return "<li>" + escape(e.getKey()) + ": <a href=\"" + link + "\">" + link + "</a></li>";
                })
                .collect(Collectors.joining("\n"));
    }

    private static String escape(String text) {
        return HtmlUtils.htmlEscape(text);
    }
}
