package com.conveyor.engine.ci;

import com.conveyor.engine.collaborator.ArtifactCoordinates;
import com.conveyor.engine.collaborator.ArtifactRepository;
import com.conveyor.engine.collaborator.BuildOutput;
import com.conveyor.engine.collaborator.BuildTool;
import com.conveyor.engine.collaborator.ContainerRuntime;
import com.conveyor.engine.collaborator.HealthCheck;
import com.conveyor.engine.collaborator.ImageRegistry;
import com.conveyor.engine.collaborator.ObjectStorage;
import com.conveyor.engine.collaborator.ScanReport;
import com.conveyor.engine.collaborator.SecretScanner;
import com.conveyor.engine.collaborator.SourceControl;
import com.conveyor.engine.collaborator.StaticAnalyzer;
import com.conveyor.engine.collaborator.VulnerabilityScanner;
import com.conveyor.engine.exception.CleanupException;
import com.conveyor.engine.exception.ConfigurationException;
import com.conveyor.engine.gate.ScanGate;
import com.conveyor.engine.gate.ScanStatus;
import com.conveyor.engine.model.FailurePolicy;
import com.conveyor.engine.model.Parameter;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.notify.NotificationChannel;
import com.conveyor.engine.notify.ReportTemplate;
import com.conveyor.engine.pipeline.PipelineDefinition;
import com.conveyor.engine.pipeline.PipelineDefinitionBuilder;
import com.conveyor.engine.pipeline.Stage;
import com.conveyor.engine.pipeline.StageContext;
import com.conveyor.engine.pipeline.StageOutcome;
import com.conveyor.engine.retry.Retrier;
import com.conveyor.engine.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The CI/CD pipeline: checkout, secret scan, build, quality checks, artifact
 * publishing, image build and scan, report upload, push, smoke test, cleanup.
 *
 * Declared once through {@link PipelineDefinitionBuilder}; variants differ only
 * in {@link CiPipelineConfig}.
 */
public class CiPipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(CiPipelineFactory.class);

    // ------------------------------------------------------------------
    // Stage ids
    // ------------------------------------------------------------------

    public static final String CHECKOUT          = "checkout";
    public static final String SECRETS_SCAN      = "secrets-scan";
    public static final String BUILD             = "build";
    public static final String STATIC_ANALYSIS   = "static-analysis";
    public static final String DOCKERFILE_CHECK  = "dockerfile-check";
    public static final String PUBLISH_ARTIFACTS = "publish-artifacts";
    public static final String IMAGE_BUILD       = "image-build";
    public static final String IMAGE_SCAN        = "image-scan";
    public static final String UPLOAD_REPORT     = "upload-report";
    public static final String PUSH              = "push";
    public static final String SMOKE_TEST        = "smoke-test";
    public static final String CLEANUP           = "cleanup";

    public static final String QUALITY_GROUP = "quality";

    // ------------------------------------------------------------------
    // State keys
    // ------------------------------------------------------------------

    // parameters
    public static final String BRANCH_NAME      = "BRANCH_NAME";
    public static final String PROJECT_VERSION  = "PROJECT_VERSION";
    public static final String TRIVY_SEVERITY   = "TRIVY_SEVERITY";
    public static final String FAIL_ON_LEAKS    = "FAIL_ON_LEAKS";
    public static final String SKIP_TESTS       = "SKIP_TESTS";
    public static final String DEPLOY_ARTIFACTS = "DEPLOY_ARTIFACTS";
    public static final String HOST_PORT        = "HOST_PORT";
    public static final String CONTAINER_PORT   = "CONTAINER_PORT";
    public static final String RECIPIENTS       = "RECIPIENTS";

    // environment
    public static final String IMAGE_NAME      = "IMAGE_NAME";
    public static final String CONTAINER_NAME  = "CONTAINER_NAME";
    public static final String TRIVY_CACHE_DIR = "TRIVY_CACHE_DIR";
    public static final String REPORT_DIR      = "REPORT_DIR";
    public static final String HEALTH_URL      = "HEALTH_URL";
    public static final String NOTIFY_TO       = "NOTIFY_TO";
    public static final String GIT_CREDENTIALS = "GIT_CREDENTIALS";

    // outputs
    public static final String WORKSPACE_DIR       = "WORKSPACE_DIR";
    public static final String LEAKS_FOUND         = "LEAKS_FOUND";
    public static final String SECRETS_REPORT_PATH = "SECRETS_REPORT_PATH";
    public static final String ARTIFACT_PATH       = "ARTIFACT_PATH";
    public static final String BINARIES_PATH       = "BINARIES_PATH";
    public static final String ANALYSIS_URL        = "ANALYSIS_URL";
    public static final String DOCKERFILE_USER     = "DOCKERFILE_USER";
    public static final String ARTIFACT_URL        = "ARTIFACT_URL";
    public static final String SCAN_EXIT_CODE      = "SCAN_EXIT_CODE";
    public static final String SCAN_REPORT_PATH    = "SCAN_REPORT_PATH";
    public static final String REPORT_URL          = "REPORT_URL";
    public static final String PUSHED_IMAGE        = "PUSHED_IMAGE";
    public static final String CONTAINER_ID        = "CONTAINER_ID";

    private final CiPipelineConfig      config;
    private final SourceControl         sourceControl;
    private final SecretScanner         secretScanner;
    private final BuildTool             buildTool;
    private final StaticAnalyzer        staticAnalyzer;
    private final ArtifactRepository    artifactRepository;
    private final VulnerabilityScanner  vulnerabilityScanner;
    private final ObjectStorage         objectStorage;
    private final ImageRegistry         imageRegistry;
    private final ContainerRuntime      containerRuntime;
    private final HealthCheck           healthCheck;
    private final ScanGate              scanGate;
    private final RecipientDirectory    recipients;
    private final DockerfilePolicyCheck dockerfilePolicy;

    public CiPipelineFactory(CiPipelineConfig config,
                             SourceControl sourceControl,
                             SecretScanner secretScanner,
                             BuildTool buildTool,
                             StaticAnalyzer staticAnalyzer,
                             ArtifactRepository artifactRepository,
                             VulnerabilityScanner vulnerabilityScanner,
                             ObjectStorage objectStorage,
                             ImageRegistry imageRegistry,
                             ContainerRuntime containerRuntime,
                             HealthCheck healthCheck,
                             ScanGate scanGate,
                             RecipientDirectory recipients,
                             DockerfilePolicyCheck dockerfilePolicy) {
        this.config               = config;
        this.sourceControl        = sourceControl;
        this.secretScanner        = secretScanner;
        this.buildTool            = buildTool;
        this.staticAnalyzer       = staticAnalyzer;
        this.artifactRepository   = artifactRepository;
        this.vulnerabilityScanner = vulnerabilityScanner;
        this.objectStorage        = objectStorage;
        this.imageRegistry        = imageRegistry;
        this.containerRuntime     = containerRuntime;
        this.healthCheck          = healthCheck;
        this.scanGate             = scanGate;
        this.recipients           = recipients;
        this.dockerfilePolicy     = dockerfilePolicy;
    }

    public PipelineDefinition create() {
        PipelineDefinitionBuilder builder = PipelineDefinitionBuilder.pipeline(config.name())
                .parameter(Parameter.string(BRANCH_NAME, "main", "Branch to build"))
                .parameter(Parameter.string(PROJECT_VERSION, null, "Version of the artifacts and image tag"))
                .parameter(Parameter.choice(TRIVY_SEVERITY, config.severityChoices(),
                        "Severities the image scan reports"))
                .parameter(Parameter.bool(FAIL_ON_LEAKS, true, "Fail the build when secrets are detected"))
                .parameter(Parameter.bool(SKIP_TESTS, false, "Skip unit tests during the build"))
                .parameter(Parameter.bool(DEPLOY_ARTIFACTS, false, "Publish build artifacts to the repository"))
                .parameter(Parameter.string(HOST_PORT, "8084", "Host port for the smoke test container"))
                .parameter(Parameter.string(CONTAINER_PORT, "8080", "Port the application listens on"))
                .parameter(Parameter.string(RECIPIENTS, "", "Comma-separated user ids to notify"))

                .environment(IMAGE_NAME, v -> config.imageRepository() + ":" + v.get(PROJECT_VERSION))
                .environment(CONTAINER_NAME, v -> config.containerNamePrefix() + "-"
                        + v.get(PROJECT_VERSION).toString().replaceAll("[^A-Za-z0-9_.-]", "-"))
                .environment(TRIVY_CACHE_DIR, v -> config.trivyCacheDir())
                .environment(REPORT_DIR, v -> config.reportDir())
                .environment(HEALTH_URL, v -> {
                    int hostPort = port(HOST_PORT, v.get(HOST_PORT));
                    port(CONTAINER_PORT, v.get(CONTAINER_PORT));
                    return "http://localhost:" + hostPort + config.healthPath();
                })
                .environment(NOTIFY_TO, v -> String.join(",", recipients.resolve((String) v.get(RECIPIENTS))))
                .environment(GIT_CREDENTIALS, v -> config.gitCredentialsRef())

                .stage(Stage.named(CHECKOUT)
                        .reads(BRANCH_NAME, GIT_CREDENTIALS)
                        .outputs(WORKSPACE_DIR)
                        .body(this::checkout)
                        .build())
                .stage(Stage.named(SECRETS_SCAN)
                        .reads(WORKSPACE_DIR, REPORT_DIR, FAIL_ON_LEAKS)
                        .outputs(LEAKS_FOUND, SECRETS_REPORT_PATH)
                        .body(this::scanSecrets)
                        .build())
                .stage(Stage.named(BUILD)
                        .reads(WORKSPACE_DIR, SKIP_TESTS)
                        .outputs(ARTIFACT_PATH, BINARIES_PATH)
                        .body(this::build)
                        .build())
                .stage(Stage.named(STATIC_ANALYSIS)
                        .inParallelGroup(QUALITY_GROUP)
                        .reads(BINARIES_PATH)
                        .outputs(ANALYSIS_URL)
                        .body(this::analyze)
                        .build())
                .stage(Stage.named(DOCKERFILE_CHECK)
                        .inParallelGroup(QUALITY_GROUP)
                        .reads(WORKSPACE_DIR)
                        .outputs(DOCKERFILE_USER)
                        .body(this::checkDockerfile)
                        .build())
                .stage(Stage.named(PUBLISH_ARTIFACTS)
                        .when(state -> state.getBoolean(DEPLOY_ARTIFACTS))
                        .reads(DEPLOY_ARTIFACTS, ARTIFACT_PATH, PROJECT_VERSION)
                        .outputs(ARTIFACT_URL)
                        .body(this::publishArtifacts)
                        .build())
                .stage(Stage.named(IMAGE_BUILD)
                        .reads(WORKSPACE_DIR, IMAGE_NAME)
                        .body(this::buildImage)
                        .build())
                .stage(Stage.named(IMAGE_SCAN)
                        .reads(IMAGE_NAME, TRIVY_SEVERITY, TRIVY_CACHE_DIR)
                        .outputs(SCAN_EXIT_CODE, SCAN_REPORT_PATH)
                        .body(this::scanImage)
                        .build())
                .stage(Stage.named(UPLOAD_REPORT)
                        .when(state -> isNonEmptyFile(state.getString(SCAN_REPORT_PATH)))
                        .policy(FailurePolicy.UNSTABLE)
                        .reads(SCAN_REPORT_PATH)
                        .outputs(REPORT_URL)
                        .body(this::uploadReport)
                        .build())
                .stage(Stage.named(PUSH)
                        .when(state -> scanGate.canProceed(
                                state.getInt(SCAN_EXIT_CODE, ScanStatus.ERROR.code()),
                                state.getString(TRIVY_SEVERITY)))
                        .reads(SCAN_EXIT_CODE, TRIVY_SEVERITY, IMAGE_NAME)
                        .outputs(PUSHED_IMAGE)
                        .body(this::push)
                        .build())
                .stage(Stage.named(SMOKE_TEST)
                        .reads(IMAGE_NAME, CONTAINER_NAME, HOST_PORT, CONTAINER_PORT, HEALTH_URL)
                        .outputs(CONTAINER_ID)
                        .body(this::smokeTest)
                        .build())
                .stage(Stage.named(CLEANUP)
                        .alwaysRun()
                        .policy(FailurePolicy.IGNORED)
                        .reads(IMAGE_NAME, CONTAINER_NAME)
                        .body(this::cleanup)
                        .build())

                .notifyWith(this::notificationChannel, ReportTemplate.standard());

        if (config.triggersDownstream()) {
            builder.triggerOnSuccess(config.downstreamJob(), this::downstreamParameters);
        }
        return builder.build();
    }

    // ------------------------------------------------------------------
    // Stage bodies
    // ------------------------------------------------------------------

    private StageOutcome checkout(StageContext ctx) {
        Path workspace = sourceControl.checkout(ctx.require(BRANCH_NAME), ctx.getString(GIT_CREDENTIALS));
        ctx.put(WORKSPACE_DIR, workspace.toString());
        return StageOutcome.success("checked out " + ctx.require(BRANCH_NAME));
    }

    private StageOutcome scanSecrets(StageContext ctx) {
        Path reportDir = createDirectories(Path.of(ctx.require(REPORT_DIR)));
        Path report = reportDir.resolve("gitleaks-report.json");
        int exitCode = secretScanner.scan(Path.of(ctx.require(WORKSPACE_DIR)), report);
        ctx.put(SECRETS_REPORT_PATH, report.toString());

        if (exitCode == 0) {
            ctx.put(LEAKS_FOUND, false);
            return StageOutcome.success("no secrets detected");
        }
        if (exitCode != 1) {
            return StageOutcome.failed("gitleaks failed to run, exit code " + exitCode, exitCode);
        }
        ctx.put(LEAKS_FOUND, true);
        if (ctx.getBoolean(FAIL_ON_LEAKS)) {
            return StageOutcome.failed("Secrets detected by gitleaks, see " + report, exitCode);
        }
        log.warn("Secrets detected by gitleaks but FAIL_ON_LEAKS is off; see {}", report);
        return StageOutcome.success("secrets detected, not failing (FAIL_ON_LEAKS=false)");
    }

    private StageOutcome build(StageContext ctx) {
        BuildOutput output = buildTool.build(Path.of(ctx.require(WORKSPACE_DIR)), ctx.getBoolean(SKIP_TESTS));
        Path artifact = output.artifactPaths().get(0);
        ctx.put(ARTIFACT_PATH, artifact.toString());
        ctx.put(BINARIES_PATH, output.binariesPath().toString());
        return StageOutcome.success("built " + artifact.getFileName());
    }

    private StageOutcome analyze(StageContext ctx) {
        String reportRef = staticAnalyzer.analyze(Path.of(ctx.require(BINARIES_PATH)),
                config.sonarProjectKey(), config.sonarOrganization());
        ctx.put(ANALYSIS_URL, reportRef);
        return StageOutcome.success();
    }

    private StageOutcome checkDockerfile(StageContext ctx) {
        Path dockerfile = Path.of(ctx.require(WORKSPACE_DIR)).resolve(config.dockerfile());
        DockerfilePolicyCheck.Report report = dockerfilePolicy.check(dockerfile);
        if (report.hasViolations()) {
            return StageOutcome.failed(String.join("; ", report.violations()));
        }
        ctx.put(DOCKERFILE_USER, report.user());
        return StageOutcome.success("runs as " + report.user());
    }

    private StageOutcome publishArtifacts(StageContext ctx) {
        ArtifactCoordinates coordinates = new ArtifactCoordinates(config.artifactGroupId(), config.artifactId(),
                ctx.require(PROJECT_VERSION), extension(ctx.require(ARTIFACT_PATH)));
        URI location = artifactRepository.publish(Path.of(ctx.require(ARTIFACT_PATH)), coordinates);
        ctx.put(ARTIFACT_URL, location.toString());
        return StageOutcome.success("published " + coordinates.gav());
    }

    private StageOutcome buildImage(StageContext ctx) {
        Path workspace = Path.of(ctx.require(WORKSPACE_DIR));
        containerRuntime.build(workspace, workspace.resolve(config.dockerfile()), ctx.require(IMAGE_NAME));
        return StageOutcome.success();
    }

    private StageOutcome scanImage(StageContext ctx) {
        String severity = ctx.require(TRIVY_SEVERITY);
        Path cacheDir = createDirectories(Path.of(ctx.require(TRIVY_CACHE_DIR)));
        ScanReport report = vulnerabilityScanner.scanImage(ctx.require(IMAGE_NAME), severity, cacheDir);
        ScanStatus status = ScanStatus.fromExitCode(report.exitCode());
        ctx.put(SCAN_EXIT_CODE, report.exitCode());
        ctx.put(SCAN_REPORT_PATH, report.reportPath().toString());

        if (status == ScanStatus.ERROR) {
            return StageOutcome.failed("Vulnerability scan errored, exit code " + report.exitCode(),
                    report.exitCode());
        }
        if (!Files.isRegularFile(report.reportPath())) {
            return StageOutcome.failed("Scan report not generated at " + report.reportPath(), report.exitCode());
        }
        if (status == ScanStatus.FINDINGS) {
            return StageOutcome.unstable("Vulnerabilities found at severity " + severity, report.exitCode());
        }
        return StageOutcome.success("no vulnerabilities at severity " + severity);
    }

    private StageOutcome uploadReport(StageContext ctx) {
        Path report = Path.of(ctx.require(SCAN_REPORT_PATH));
        URI location = objectStorage.upload(report, config.reportKeyPrefix() + "/" + report.getFileName());
        ctx.put(REPORT_URL, location.toString());
        return StageOutcome.success("uploaded to " + location);
    }

    private StageOutcome push(StageContext ctx) {
        String image = ctx.require(IMAGE_NAME);
        boolean pushed = Retrier.withRetry("docker push " + image,
                () -> imageRegistry.push(image),
                Boolean::booleanValue,
                RetryPolicy.of(config.pushAttempts(), config.pushDelay()),
                ctx.abortSignal());
        if (!pushed) {
            return StageOutcome.failed("Registry rejected " + image + " after " + config.pushAttempts() + " attempt(s)");
        }
        ctx.put(PUSHED_IMAGE, image);
        return StageOutcome.success("pushed " + image);
    }

    private StageOutcome smokeTest(StageContext ctx) {
        String image = ctx.require(IMAGE_NAME);
        String containerId = containerRuntime.run(image, ctx.require(CONTAINER_NAME),
                Integer.parseInt(ctx.require(HOST_PORT)), Integer.parseInt(ctx.require(CONTAINER_PORT)));
        ctx.put(CONTAINER_ID, containerId);

        try {
            if (!ctx.abortSignal().sleep(config.smokeStartupDelay())) {
                return StageOutcome.failed("Run aborted while waiting for the container to start");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StageOutcome.failed("Interrupted while waiting for the container to start");
        }

        String url = ctx.require(HEALTH_URL);
        int status = Retrier.withRetry("health check " + url,
                () -> healthCheck.httpGet(url),
                code -> code == 200,
                RetryPolicy.of(config.healthCheckAttempts(), config.healthCheckDelay()),
                ctx.abortSignal());
        if (status != 200) {
            return StageOutcome.failed("Health check of " + url + " answered HTTP " + status
                    + " after " + config.healthCheckAttempts() + " attempt(s)");
        }
        return StageOutcome.success(url + " answered 200");
    }

    private StageOutcome cleanup(StageContext ctx) {
        String container = ctx.require(CONTAINER_NAME);
        String image = ctx.require(IMAGE_NAME);
        List<String> failures = new ArrayList<>();
        bestEffort("docker stop " + container, () -> containerRuntime.stop(container), failures);
        bestEffort("docker rm " + container, () -> containerRuntime.remove(container), failures);
        bestEffort("docker rmi " + image, () -> containerRuntime.removeImage(image), failures);
        return failures.isEmpty()
                ? StageOutcome.success()
                : StageOutcome.success("best-effort cleanup skipped: " + String.join(", ", failures));
    }

    private static void bestEffort(String step, Runnable action, List<String> failures) {
        try {
            action.run();
        } catch (RuntimeException e) {
            CleanupException failure = new CleanupException(step + " failed", e);
            log.warn("{}: {}", failure.getMessage(), e.getMessage(), failure);
            failures.add(step);
        }
    }

    // ------------------------------------------------------------------
    // Post-run wiring
    // ------------------------------------------------------------------

    private NotificationChannel notificationChannel(PipelineState state) {
        List<String> to = Arrays.stream(state.getString(NOTIFY_TO).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        String report = state.getString(SCAN_REPORT_PATH);
        return new NotificationChannel(to, report == null ? List.of() : List.of(Path.of(report)));
    }

    private Map<String, String> downstreamParameters(PipelineState state) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("IMAGE", state.getString(IMAGE_NAME));
        params.put("VERSION", state.getString(PROJECT_VERSION));
        params.put("BRANCH", state.getString(BRANCH_NAME));
        return params;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static int port(String name, Object raw) {
        try {
            int port = Integer.parseInt(raw.toString().trim());
            if (port < 1 || port > 65535) {
                throw new ConfigurationException(name + " out of range: " + port);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " is not a port number: '" + raw + "'", e);
        }
    }

    static boolean isNonEmptyFile(String path) {
        if (path == null) {
            return false;
        }
        try {
            Path p = Path.of(path);
            return Files.isRegularFile(p) && Files.size(p) > 0;
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", path, e.getMessage());
            return false;
        }
    }

    private static Path createDirectories(Path dir) {
        try {
            return Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create " + dir, e);
        }
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "jar" : fileName.substring(dot + 1);
    }
}
