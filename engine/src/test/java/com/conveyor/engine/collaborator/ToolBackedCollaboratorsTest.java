package com.conveyor.engine.collaborator;

import com.conveyor.engine.exception.ToolFailureException;
import com.conveyor.engine.retry.RetryPolicy;
import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import com.conveyor.engine.tool.ToolResult;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Command lines and result handling of the CLI-backed collaborators.
 * The {@link ToolAdapter} is mocked; no external tool is started.
 */
@ExtendWith(MockitoExtension.class)
class ToolBackedCollaboratorsTest {

    private static final ToolResult OK = new ToolResult(0, "", "", 5);

    @Mock ToolAdapter tools;

    @TempDir Path tmp;

    // ------------------------------------------------------------------
    // Trivy
    // ------------------------------------------------------------------

    @Test
    void trivy_retriesDbDownloadThenScansWithSeverityAndReportPath() {
        when(tools.invoke(any()))
                .thenReturn(failed(1, "TLS handshake timeout"), OK, new ToolResult(1, "", "", 900));
        TrivyScanner scanner = new TrivyScanner(tools, tmp, RetryPolicy.of(3, Duration.ZERO));

        ScanReport report = scanner.scanImage("registry.io/acme/app:1.0", "HIGH,CRITICAL", tmp.resolve("cache"));

        assertThat(report.exitCode()).isEqualTo(1);
        assertThat(report.reportPath()).isEqualTo(tmp.resolve("trivy-report-registry.io_acme_app_1.0.txt"));
        List<ToolInvocation> calls = captureInvocations(3);
        assertThat(calls.get(0).command()).contains("--download-db-only");
        assertThat(calls.get(2).command()).containsSubsequence(
                "--exit-code", "1", "--severity", "HIGH,CRITICAL", "--format", "table",
                "--output", report.reportPath().toString(), "registry.io/acme/app:1.0");
    }

    @Test
    void trivy_dbDownloadNeverSucceeds_throwsWithoutScanning() {
        when(tools.invoke(any())).thenReturn(failed(2, "rate limited"));
        TrivyScanner scanner = new TrivyScanner(tools, tmp, RetryPolicy.of(2, Duration.ZERO));

        assertThatThrownBy(() -> scanner.scanImage("app:1", "LOW", tmp))
                .isInstanceOf(ToolFailureException.class)
                .hasMessageContaining("trivy DB download failed")
                .hasMessageContaining("rate limited");
        verify(tools, times(2)).invoke(any());
    }

    // ------------------------------------------------------------------
    // S3
    // ------------------------------------------------------------------

    @Test
    void s3_uploadCopiesToBucketKey() {
        when(tools.invoke(any())).thenReturn(OK);
        S3CliObjectStorage storage = new S3CliObjectStorage(tools, "s3://ci-reports/trivy/");

        URI location = storage.upload(Path.of("/tmp/r.txt"), "trivy-reports/r.txt");

        assertThat(location).isEqualTo(URI.create("s3://ci-reports/trivy/trivy-reports/r.txt"));
        assertThat(captureInvocations(1).get(0).command())
                .containsExactly("aws", "s3", "cp", "/tmp/r.txt", "s3://ci-reports/trivy/trivy-reports/r.txt");
    }

    @Test
    void s3_uploadFailure_carriesExitCode() {
        when(tools.invoke(any())).thenReturn(failed(255, "AccessDenied"));
        S3CliObjectStorage storage = new S3CliObjectStorage(tools, "ci-reports");

        assertThatThrownBy(() -> storage.upload(Path.of("/tmp/r.txt"), "r.txt"))
                .isInstanceOfSatisfying(ToolFailureException.class,
                        e -> assertThat(e.getExitCode()).isEqualTo(255))
                .hasMessageContaining("AccessDenied");
    }

    @Test
    void s3_stripScheme_normalizesBucket() {
        assertThat(S3CliObjectStorage.stripScheme("s3://bucket//")).isEqualTo("bucket");
        assertThat(S3CliObjectStorage.stripScheme("bucket/prefix")).isEqualTo("bucket/prefix");
    }

    // ------------------------------------------------------------------
    // Maven repository and build
    // ------------------------------------------------------------------

    @Test
    void mavenRepository_publishDeploysFileAndReturnsDownloadUrl() {
        when(tools.invoke(any())).thenReturn(OK);
        MavenArtifactRepository repo = new MavenArtifactRepository(tools,
                "https://nexus.example.com/repository/releases", "nexus");
        ArtifactCoordinates coordinates = new ArtifactCoordinates("com.example", "app", "1.0", "jar");

        URI location = repo.publish(Path.of("/ws/target/app-1.0.jar"), coordinates);

        assertThat(location).hasToString(
                "https://nexus.example.com/repository/releases/com/example/app/1.0/app-1.0.jar");
        assertThat(captureInvocations(1).get(0).command()).contains(
                "deploy:deploy-file", "-DrepositoryId=nexus", "-Dfile=/ws/target/app-1.0.jar",
                "-DgroupId=com.example", "-DartifactId=app", "-Dversion=1.0", "-Dpackaging=jar");
    }

    @Test
    void mavenRepository_fetchCopiesArtifactIntoTargetDir() {
        when(tools.invoke(any())).thenReturn(OK);
        MavenArtifactRepository repo = new MavenArtifactRepository(tools,
                "https://nexus.example.com/repository/releases", "nexus");

        Path file = repo.fetch(new ArtifactCoordinates("com.example", "app", "1.0", "war"), tmp);

        assertThat(file).isEqualTo(tmp.resolve("app-1.0.war"));
        assertThat(captureInvocations(1).get(0).command()).contains(
                "dependency:copy", "-Dartifact=com.example:app:1.0:war", "-DoutputDirectory=" + tmp,
                "-DremoteRepositories=nexus::default::https://nexus.example.com/repository/releases");
    }

    @Test
    void mavenBuild_listsPackagedArtifactsOnly() throws Exception {
        Path target = Files.createDirectories(tmp.resolve("target"));
        for (String name : List.of("app-1.0.jar", "app-1.0-sources.jar", "app-1.0-javadoc.jar",
                "original-app-1.0.jar", "app-1.0.pom")) {
            Files.createFile(target.resolve(name));
        }
        when(tools.invoke(any())).thenReturn(OK);

        BuildOutput output = new MavenBuildTool(tools).build(tmp, true);

        assertThat(output.artifactPaths()).containsExactly(target.resolve("app-1.0.jar"));
        assertThat(output.binariesPath()).isEqualTo(target.resolve("classes"));
        ToolInvocation call = captureInvocations(1).get(0);
        assertThat(call.command()).containsExactly("mvn", "-B", "package", "-DskipTests");
        assertThat(call.workingDirectory()).isEqualTo(tmp);
    }

    @Test
    void mavenBuild_withoutArtifact_isToolFailure() {
        when(tools.invoke(any())).thenReturn(OK);

        assertThatThrownBy(() -> new MavenBuildTool(tools).build(tmp, false))
                .isInstanceOf(ToolFailureException.class)
                .hasMessageContaining("produced no artifact");
    }

    @Test
    void mavenBuild_compileError_isToolFailureWithMavenOutput() {
        when(tools.invoke(any())).thenReturn(failed(1, "[ERROR] COMPILATION ERROR"));

        assertThatThrownBy(() -> new MavenBuildTool(tools).build(tmp, false))
                .isInstanceOf(ToolFailureException.class)
                .hasMessageContaining("COMPILATION ERROR");
    }

    // ------------------------------------------------------------------
    // Git, gitleaks, sonar
    // ------------------------------------------------------------------

    @Test
    void git_clonesWhenWorkspaceIsEmpty() {
        when(tools.invoke(any())).thenReturn(OK);
        Path workspace = tmp.resolve("source");

        Path checkedOut = new GitSourceControl(tools, "https://git.example.com/app.git", workspace)
                .checkout("main", "jenkins-git");

        assertThat(checkedOut).isEqualTo(workspace);
        ToolInvocation call = captureInvocations(1).get(0);
        assertThat(call.command()).containsExactly(
                "git", "clone", "--branch", "main", "https://git.example.com/app.git", workspace.toString());
        assertThat(call.envOverrides()).containsEntry("GIT_CREDENTIALS_REF", "jenkins-git");
    }

    @Test
    void git_refreshesExistingClone() throws Exception {
        Files.createDirectories(tmp.resolve(".git"));
        when(tools.invoke(any())).thenReturn(OK);

        new GitSourceControl(tools, "https://git.example.com/app.git", tmp).checkout("release", null);

        List<ToolInvocation> calls = captureInvocations(2);
        assertThat(calls.get(0).command()).containsExactly("git", "fetch", "--prune", "origin");
        assertThat(calls.get(1).command()).containsExactly("git", "checkout", "-B", "release", "origin/release");
        assertThat(calls.get(1).workingDirectory()).isEqualTo(tmp);
    }

    @Test
    void gitleaks_returnsExitCodeWithoutInterpretingIt() {
        when(tools.invoke(any())).thenReturn(new ToolResult(1, "", "leaks found: 2", 40));

        int exit = new GitleaksScanner(tools).scan(tmp, tmp.resolve("gitleaks.json"));

        assertThat(exit).isEqualTo(1);
        assertThat(captureInvocations(1).get(0).command())
                .containsSubsequence("gitleaks", "detect", "--source", tmp.toString());
    }

    @Test
    void sonar_runsFromProjectRootAndReturnsDashboard() {
        when(tools.invoke(any())).thenReturn(OK);

        String url = new SonarScannerAnalyzer(tools, "https://sonar.example.com")
                .analyze(tmp.resolve("target/classes"), "app", "acme");

        assertThat(url).isEqualTo("https://sonar.example.com/dashboard?id=app");
        ToolInvocation call = captureInvocations(1).get(0);
        assertThat(call.workingDirectory()).isEqualTo(tmp);
        assertThat(call.command()).contains("-Dsonar.projectKey=app", "-Dsonar.organization=acme");
    }

    // ------------------------------------------------------------------
    // Docker
    // ------------------------------------------------------------------

    @Test
    void docker_buildUsesDockerfileAndContext() {
        when(tools.invoke(any())).thenReturn(OK);

        new DockerContainerRuntime(tools).build(tmp, tmp.resolve("docker/Dockerfile"), "app:1.0");

        ToolInvocation call = captureInvocations(1).get(0);
        assertThat(call.command()).containsExactly(
                "docker", "build", "--pull", "-t", "app:1.0", "-f", tmp.resolve("docker/Dockerfile").toString(), ".");
        assertThat(call.workingDirectory()).isEqualTo(tmp);
    }

    @Test
    void docker_runReturnsContainerId() {
        when(tools.invoke(any())).thenReturn(new ToolResult(0, "4f2a9c\n", "", 300));

        String id = new DockerContainerRuntime(tools).run("app:1.0", "smoke", 8084, 8080);

        assertThat(id).isEqualTo("4f2a9c");
        assertThat(captureInvocations(1).get(0).command()).containsSubsequence("-p", "8084:8080", "app:1.0");
    }

    @Test
    void docker_stopOfMissingContainer_throws() {
        when(tools.invoke(any())).thenReturn(failed(1, "No such container: smoke"));

        assertThatThrownBy(() -> new DockerContainerRuntime(tools).stop("smoke"))
                .isInstanceOf(ToolFailureException.class)
                .hasMessageContaining("No such container");
    }

    @Test
    void docker_removeForcesContainerAndImage() {
        when(tools.invoke(any())).thenReturn(OK);
        DockerContainerRuntime runtime = new DockerContainerRuntime(tools);

        runtime.remove("smoke");
        runtime.removeImage("app:1.0");

        List<ToolInvocation> calls = captureInvocations(2);
        assertThat(calls.get(0).command()).containsExactly("docker", "rm", "-f", "smoke");
        assertThat(calls.get(1).command()).containsExactly("docker", "rmi", "-f", "app:1.0");
    }

    @Test
    void registry_pushReportsRejectionAsFalse() {
        when(tools.invoke(any())).thenReturn(failed(1, "denied: requested access to the resource is denied"));

        assertThat(new DockerImageRegistry(tools).push("app:1.0")).isFalse();
    }

    // ------------------------------------------------------------------

    private static ToolResult failed(int exitCode, String stderr) {
        return new ToolResult(exitCode, "", stderr, 10);
    }

    private List<ToolInvocation> captureInvocations(int expected) {
        ArgumentCaptor<ToolInvocation> captor = ArgumentCaptor.forClass(ToolInvocation.class);
        verify(tools, times(expected)).invoke(captor.capture());
        return captor.getAllValues();
    }
}
