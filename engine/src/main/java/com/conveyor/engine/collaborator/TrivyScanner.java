package com.conveyor.engine.collaborator;

import com.conveyor.engine.retry.Retrier;
import com.conveyor.engine.retry.RetryPolicy;
import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import com.conveyor.engine.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Scans images with {@code trivy}. The vulnerability database download is
 * flaky on shared runners, so it is done separately and retried; the scan
 * itself then runs against the warm cache.
 */
@Component
public class TrivyScanner implements VulnerabilityScanner {

    private static final Logger log = LoggerFactory.getLogger(TrivyScanner.class);

    static final RetryPolicy DB_DOWNLOAD_RETRY = RetryPolicy.of(3, Duration.ofSeconds(10));

    private final ToolAdapter tools;
    private final Path        reportDir;
    private final RetryPolicy dbDownloadRetry;

    public TrivyScanner(ToolAdapter tools, @Value("${conveyor.reports.dir:work/reports}") Path reportDir) {
        this(tools, reportDir, DB_DOWNLOAD_RETRY);
    }

    TrivyScanner(ToolAdapter tools, Path reportDir, RetryPolicy dbDownloadRetry) {
        this.tools           = tools;
        this.reportDir       = reportDir;
        this.dbDownloadRetry = dbDownloadRetry;
    }

    @Override
    public ScanReport scanImage(String imageRef, String severityFilter, Path cacheDir) {
        ToolResult download = Retrier.withRetry("trivy DB download",
                () -> tools.invoke(ToolInvocation.of(
                        "trivy", "image", "--download-db-only", "--cache-dir", cacheDir.toString())),
                ToolResult::succeeded, dbDownloadRetry);
        download.orThrow("trivy DB download");

        Path reportPath = reportDir.resolve(reportFileName(imageRef));
        ToolResult scan = tools.invoke(ToolInvocation.of(
                        "trivy", "image",
                        "--exit-code", "1",
                        "--cache-dir", cacheDir.toString(),
                        "--severity", severityFilter,
                        "--format", "table",
                        "--output", reportPath.toString(),
                        imageRef)
                .withTimeout(Duration.ofMinutes(15)));
        log.info("trivy exited {} for {} [{}]", scan.exitCode(), imageRef, severityFilter);
        return new ScanReport(scan.exitCode(), reportPath);
    }

    static String reportFileName(String imageRef) {
        return "trivy-report-" + imageRef.replaceAll("[^A-Za-z0-9._-]", "_") + ".txt";
    }
}
