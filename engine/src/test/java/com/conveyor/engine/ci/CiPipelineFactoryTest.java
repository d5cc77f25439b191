package com.conveyor.engine.ci;

import com.conveyor.engine.collaborator.ArtifactCoordinates;
import com.conveyor.engine.collaborator.ArtifactRepository;
import com.conveyor.engine.collaborator.BuildOutput;
import com.conveyor.engine.collaborator.BuildTool;
import com.conveyor.engine.collaborator.ContainerRuntime;
import com.conveyor.engine.collaborator.HealthCheck;
import com.conveyor.engine.collaborator.ImageRegistry;
import com.conveyor.engine.collaborator.JobTrigger;
import com.conveyor.engine.collaborator.ObjectStorage;
import com.conveyor.engine.collaborator.ScanReport;
import com.conveyor.engine.collaborator.SecretScanner;
import com.conveyor.engine.collaborator.SourceControl;
import com.conveyor.engine.collaborator.StaticAnalyzer;
import com.conveyor.engine.collaborator.VulnerabilityScanner;
import com.conveyor.engine.exception.LaunchFailureException;
import com.conveyor.engine.gate.ScanGate;
import com.conveyor.engine.model.PipelineRun;
import com.conveyor.engine.model.RunStatus;
import com.conveyor.engine.model.StageResult;
import com.conveyor.engine.model.StageStatus;
import com.conveyor.engine.notify.NotificationChannel;
import com.conveyor.engine.notify.Notifier;
import com.conveyor.engine.pipeline.PipelineDefinition;
import com.conveyor.engine.pipeline.PipelineExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.conveyor.engine.ci.CiPipelineFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CiPipelineFactoryTest {

    private static final String IMAGE = "conveyor/app:1.0";

    @Mock SourceControl        sourceControl;
    @Mock SecretScanner        secretScanner;
    @Mock BuildTool            buildTool;
    @Mock StaticAnalyzer       staticAnalyzer;
    @Mock ArtifactRepository   artifactRepository;
    @Mock VulnerabilityScanner vulnerabilityScanner;
    @Mock ObjectStorage        objectStorage;
    @Mock ImageRegistry        imageRegistry;
    @Mock ContainerRuntime     containerRuntime;
    @Mock HealthCheck          healthCheck;
    @Mock Notifier             notifier;
    @Mock JobTrigger           jobTrigger;

    @TempDir Path tmp;

    Path workspace;
    Path scanReport;
    PipelineExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        workspace = Files.createDirectories(tmp.resolve("ws"));
        Files.writeString(workspace.resolve("Dockerfile"), "FROM eclipse-temurin:17-jre\nUSER app\n");
        scanReport = tmp.resolve("reports").resolve("trivy-report-conveyor_app_1.0.txt");
        executor = new PipelineExecutor(notifier, jobTrigger, new SimpleMeterRegistry(), true);
    }

    // ------------------------------------------------------------------
    // Scan gate scenarios
    // ------------------------------------------------------------------

    @Test
    void cleanScan_pushesAndSucceeds() throws Exception {
        stubThroughImageScan(0);
        stubUploadPushAndSmoke();

        PipelineRun run = executor.run(definition(""), params());

        assertThat(run.status()).isEqualTo(RunStatus.SUCCESS);
        assertThat(run.stages()).extracting(StageResult::stageId).containsExactly(
                CHECKOUT, SECRETS_SCAN, BUILD, STATIC_ANALYSIS, DOCKERFILE_CHECK, PUBLISH_ARTIFACTS,
                IMAGE_BUILD, IMAGE_SCAN, UPLOAD_REPORT, PUSH, SMOKE_TEST, CLEANUP);
        assertThat(status(run, PUBLISH_ARTIFACTS)).isEqualTo(StageStatus.SKIPPED);
        assertThat(run.state())
                .containsEntry(PUSHED_IMAGE, IMAGE)
                .containsEntry(CONTAINER_ID, "c0ffee")
                .containsEntry(REPORT_URL, "s3://reports/trivy-reports/trivy-report-conveyor_app_1.0.txt")
                .containsEntry(DOCKERFILE_USER, "app");
        verify(containerRuntime).build(workspace, workspace.resolve("Dockerfile"), IMAGE);
        verify(imageRegistry, times(1)).push(IMAGE);
        verify(containerRuntime).run(IMAGE, "conveyor-smoke-1.0", 8084, 8080);
        verify(healthCheck).httpGet("http://localhost:8084/");
        verify(notifier, times(1)).notify(eq(run), any(), any());
    }

    @Test
    void findingsWithToleratedSeverity_stillPushesButRunIsUnstable() throws Exception {
        stubThroughImageScan(1);
        stubUploadPushAndSmoke();

        PipelineRun run = executor.run(definition(""), params(TRIVY_SEVERITY, "LOW,MEDIUM"));

        assertThat(status(run, IMAGE_SCAN)).isEqualTo(StageStatus.UNSTABLE);
        assertThat(status(run, PUSH)).isEqualTo(StageStatus.SUCCESS);
        assertThat(run.status()).isEqualTo(RunStatus.UNSTABLE);
        assertThat(run.exitCode(false)).isEqualTo(1);
        verify(imageRegistry).push(IMAGE);
    }

    @Test
    void findingsAtHighSeverity_skipPushButSmokeTestRuns() throws Exception {
        stubThroughImageScan(1);
        when(objectStorage.upload(any(), anyString())).thenReturn(URI.create("s3://reports/r.txt"));
        when(containerRuntime.run(anyString(), anyString(), anyInt(), anyInt())).thenReturn("c0ffee");
        when(healthCheck.httpGet(anyString())).thenReturn(200);

        PipelineRun run = executor.run(definition(""), params());

        assertThat(status(run, PUSH)).isEqualTo(StageStatus.SKIPPED);
        assertThat(run.result(PUSH).orElseThrow().message()).isEqualTo("condition not met");
        assertThat(status(run, SMOKE_TEST)).isEqualTo(StageStatus.SUCCESS);
        assertThat(run.status()).isEqualTo(RunStatus.UNSTABLE);
        verify(imageRegistry, never()).push(anyString());
    }

    @Test
    void scannerError_failsRunSkipsPushAndStillCleansUp() throws Exception {
        stubThroughImageScan(2);

        PipelineRun run = executor.run(definition(""), params(RECIPIENTS, "user1,user2"));

        assertThat(run.status()).isEqualTo(RunStatus.FAILURE);
        assertThat(run.result(IMAGE_SCAN).orElseThrow().exitCode()).isEqualTo(2);
        assertThat(status(run, UPLOAD_REPORT)).isEqualTo(StageStatus.SKIPPED);
        assertThat(status(run, PUSH)).isEqualTo(StageStatus.SKIPPED);
        assertThat(status(run, SMOKE_TEST)).isEqualTo(StageStatus.SKIPPED);
        assertThat(status(run, CLEANUP)).isEqualTo(StageStatus.SUCCESS);
        verify(imageRegistry, never()).push(anyString());
        verify(containerRuntime).stop("conveyor-smoke-1.0");
        verify(containerRuntime).removeImage(IMAGE);

        ArgumentCaptor<NotificationChannel> channel = ArgumentCaptor.forClass(NotificationChannel.class);
        verify(notifier, times(1)).notify(eq(run), channel.capture(), any());
        assertThat(channel.getValue().to()).containsExactly("user1@example.com", "user2@example.com");
        assertThat(channel.getValue().attachments()).containsExactly(scanReport);
    }

    // ------------------------------------------------------------------
    // Early failures
    // ------------------------------------------------------------------

    @Test
    void buildLaunchFailure_onlyCleanupRunsAfterwards() {
        when(sourceControl.checkout(anyString(), anyString())).thenReturn(workspace);
        when(secretScanner.scan(any(), any())).thenReturn(0);
        when(buildTool.build(any(), anyBoolean()))
                .thenThrow(new LaunchFailureException("mvn", "No such file or directory"));

        PipelineRun run = executor.run(definition(""), params());

        assertThat(run.exitCode(false)).isEqualTo(1);
        assertThat(run.result(BUILD).orElseThrow().message()).isEqualTo("mvn: No such file or directory");
        assertThat(run.stages())
                .filteredOn(StageResult::executed)
                .extracting(StageResult::stageId)
                .containsExactly(CHECKOUT, SECRETS_SCAN, BUILD, CLEANUP);
        verifyNoInteractions(staticAnalyzer, vulnerabilityScanner, imageRegistry, healthCheck);
    }

    @Test
    void leakedSecrets_failTheRunByDefault() {
        when(sourceControl.checkout(anyString(), anyString())).thenReturn(workspace);
        when(secretScanner.scan(any(), any())).thenReturn(1);

        PipelineRun run = executor.run(definition(""), params());

        StageResult secrets = run.result(SECRETS_SCAN).orElseThrow();
        assertThat(secrets.status()).isEqualTo(StageStatus.FAILURE);
        assertThat(secrets.exitCode()).isEqualTo(1);
        assertThat(run.state()).containsEntry(LEAKS_FOUND, true);
        verifyNoInteractions(buildTool);
    }

    @Test
    void leakedSecrets_toleratedWhenFailOnLeaksIsOff() {
        when(sourceControl.checkout(anyString(), anyString())).thenReturn(workspace);
        when(secretScanner.scan(any(), any())).thenReturn(1);
        when(buildTool.build(any(), anyBoolean()))
                .thenThrow(new LaunchFailureException("mvn", "stop here"));

        PipelineRun run = executor.run(definition(""), params(FAIL_ON_LEAKS, "false"));

        assertThat(status(run, SECRETS_SCAN)).isEqualTo(StageStatus.SUCCESS);
        verify(buildTool).build(workspace, false);
    }

    @Test
    void rootDockerfile_failsQualityGroup() throws Exception {
        Files.writeString(workspace.resolve("Dockerfile"), "FROM ubuntu:22.04\nUSER root\n");
        when(sourceControl.checkout(anyString(), anyString())).thenReturn(workspace);
        when(secretScanner.scan(any(), any())).thenReturn(0);
        when(buildTool.build(any(), anyBoolean())).thenReturn(buildOutput());
        lenient().when(staticAnalyzer.analyze(any(), anyString(), anyString())).thenReturn("http://sonar/x");

        PipelineRun run = executor.run(definition(""), params());

        assertThat(run.result(DOCKERFILE_CHECK).orElseThrow().message()).contains("USER is root");
        assertThat(status(run, IMAGE_BUILD)).isEqualTo(StageStatus.SKIPPED);
        assertThat(run.status()).isEqualTo(RunStatus.FAILURE);
    }

    // ------------------------------------------------------------------
    // Retries and cleanup
    // ------------------------------------------------------------------

    @Test
    void push_retriedUntilRegistryAccepts() throws Exception {
        stubThroughImageScan(0);
        when(objectStorage.upload(any(), anyString())).thenReturn(URI.create("s3://reports/r.txt"));
        when(imageRegistry.push(IMAGE)).thenReturn(false, false, true);
        when(containerRuntime.run(anyString(), anyString(), anyInt(), anyInt())).thenReturn("c0ffee");
        when(healthCheck.httpGet(anyString())).thenReturn(200);

        PipelineRun run = executor.run(definition(""), params());

        assertThat(status(run, PUSH)).isEqualTo(StageStatus.SUCCESS);
        verify(imageRegistry, times(3)).push(IMAGE);
    }

    @Test
    void smokeTest_unhealthyContainerFailsAfterAllProbes() throws Exception {
        stubThroughImageScan(0);
        when(objectStorage.upload(any(), anyString())).thenReturn(URI.create("s3://reports/r.txt"));
        when(imageRegistry.push(anyString())).thenReturn(true);
        when(containerRuntime.run(anyString(), anyString(), anyInt(), anyInt())).thenReturn("c0ffee");
        when(healthCheck.httpGet(anyString())).thenReturn(503);

        PipelineRun run = executor.run(definition(""), params());

        assertThat(run.result(SMOKE_TEST).orElseThrow().message()).contains("HTTP 503 after 3 attempt(s)");
        assertThat(status(run, CLEANUP)).isEqualTo(StageStatus.SUCCESS);
        verify(healthCheck, times(3)).httpGet("http://localhost:8084/");
    }

    @Test
    void cleanup_continuesPastFailingSteps() throws Exception {
        stubThroughImageScan(0);
        stubUploadPushAndSmoke();
        doThrow(new IllegalStateException("No such container")).when(containerRuntime).stop(anyString());

        PipelineRun run = executor.run(definition(""), params());

        StageResult cleanup = run.result(CLEANUP).orElseThrow();
        assertThat(cleanup.status()).isEqualTo(StageStatus.SUCCESS);
        assertThat(cleanup.message()).contains("docker stop conveyor-smoke-1.0");
        verify(containerRuntime).remove("conveyor-smoke-1.0");
        verify(containerRuntime).removeImage(IMAGE);
        assertThat(run.status()).isEqualTo(RunStatus.SUCCESS);
    }

    // ------------------------------------------------------------------
    // Optional stages and downstream
    // ------------------------------------------------------------------

    @Test
    void deployArtifacts_publishesWithProjectCoordinates() throws Exception {
        stubThroughImageScan(0);
        stubUploadPushAndSmoke();
        when(artifactRepository.publish(any(), any()))
                .thenReturn(URI.create("https://nexus.example.com/repository/releases/com/example/app/1.0/app-1.0.jar"));

        PipelineRun run = executor.run(definition("deploy-app"), params(DEPLOY_ARTIFACTS, "true"));

        verify(artifactRepository).publish(workspace.resolve("target/app-1.0.jar"),
                new ArtifactCoordinates("com.example", "app", "1.0", "jar"));
        assertThat(run.state()).containsKey(ARTIFACT_URL);
        verify(jobTrigger).triggerJob("deploy-app", Map.of("IMAGE", IMAGE, "VERSION", "1.0", "BRANCH", "main"));
    }

    // ------------------------------------------------------------------
    // Configuration errors
    // ------------------------------------------------------------------

    @Test
    void unknownRecipient_rejectsRunBeforeAnyStage() {
        PipelineRun run = executor.run(definition(""), params(RECIPIENTS, "user9"));

        assertThat(run.isConfigurationError()).isTrue();
        assertThat(run.configurationError()).contains("Invalid recipient ID: user9");
        assertThat(run.exitCode(false)).isEqualTo(PipelineRun.EXIT_CONFIG_ERROR);
        verifyNoInteractions(sourceControl, notifier);
    }

    @Test
    void invalidPort_rejectsRun() {
        PipelineRun run = executor.run(definition(""), params(HOST_PORT, "99999"));

        assertThat(run.configurationError()).contains("HOST_PORT out of range");
        verifyNoInteractions(sourceControl);
    }

    @Test
    void missingVersion_rejectsRun() {
        PipelineRun run = executor.run(definition(""), Map.of());

        assertThat(run.configurationError()).contains("PROJECT_VERSION");
    }

    @Test
    void isNonEmptyFile_requiresExistingContent() throws Exception {
        Path empty = Files.createFile(tmp.resolve("empty.txt"));
        Path full = Files.writeString(tmp.resolve("full.txt"), "x");

        assertThat(CiPipelineFactory.isNonEmptyFile(null)).isFalse();
        assertThat(CiPipelineFactory.isNonEmptyFile(tmp.resolve("absent.txt").toString())).isFalse();
        assertThat(CiPipelineFactory.isNonEmptyFile(empty.toString())).isFalse();
        assertThat(CiPipelineFactory.isNonEmptyFile(full.toString())).isTrue();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineDefinition definition(String downstreamJob) {
        CiPipelineConfig config = new CiPipelineConfig(
                "ci", "conveyor/app", "conveyor-smoke", "Dockerfile",
                tmp.resolve("trivy-cache").toString(), tmp.resolve("reports").toString(), "trivy-reports",
                "conveyor-app", "conveyor", "com.example", "app", "", "/",
                Duration.ZERO, 3, Duration.ZERO, 3, Duration.ZERO,
                List.of("HIGH,CRITICAL", "LOW,MEDIUM"), downstreamJob);
        return new CiPipelineFactory(config, sourceControl, secretScanner, buildTool, staticAnalyzer,
                artifactRepository, vulnerabilityScanner, objectStorage, imageRegistry, containerRuntime,
                healthCheck, new ScanGate(List.of("LOW", "MEDIUM")),
                new RecipientDirectory(Map.of("user1", "user1@example.com", "user2", "user2@example.com")),
                new DockerfilePolicyCheck()).create();
    }

    private static Map<String, String> params(String... extra) {
        Map<String, String> params = new java.util.HashMap<>();
        params.put(PROJECT_VERSION, "1.0");
        for (int i = 0; i < extra.length; i += 2) {
            params.put(extra[i], extra[i + 1]);
        }
        return params;
    }

    private BuildOutput buildOutput() {
        return new BuildOutput(workspace.resolve("target/classes"), List.of(workspace.resolve("target/app-1.0.jar")));
    }

    private void stubThroughImageScan(int scanExitCode) throws Exception {
        Files.createDirectories(scanReport.getParent());
        Files.writeString(scanReport, "conveyor/app:1.0 (debian 12)\nTotal: 0\n");
        when(sourceControl.checkout(anyString(), anyString())).thenReturn(workspace);
        when(secretScanner.scan(any(), any())).thenReturn(0);
        when(buildTool.build(any(), anyBoolean())).thenReturn(buildOutput());
        when(staticAnalyzer.analyze(any(), anyString(), anyString()))
                .thenReturn("https://sonar.example.com/dashboard?id=conveyor-app");
        when(vulnerabilityScanner.scanImage(anyString(), anyString(), any()))
                .thenReturn(new ScanReport(scanExitCode, scanReport));
    }

    private void stubUploadPushAndSmoke() {
        when(objectStorage.upload(any(), anyString()))
                .thenAnswer(inv -> URI.create("s3://reports/" + inv.getArgument(1, String.class)));
        when(imageRegistry.push(anyString())).thenReturn(true);
        when(containerRuntime.run(anyString(), anyString(), anyInt(), anyInt())).thenReturn("c0ffee");
        when(healthCheck.httpGet(anyString())).thenReturn(200);
    }

    private static StageStatus status(PipelineRun run, String stageId) {
        return run.result(stageId).orElseThrow().status();
    }
}
