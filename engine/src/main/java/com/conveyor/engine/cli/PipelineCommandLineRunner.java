package com.conveyor.engine.cli;

import com.conveyor.engine.model.PipelineRun;
import com.conveyor.engine.model.StageResult;
import com.conveyor.engine.pipeline.PipelineDefinition;
import com.conveyor.engine.pipeline.PipelineExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the pipeline once from the command line and maps the result to a
 * process exit code: 0 success, 1 failure, 2 configuration error.
 *
 * Parameters are given as option arguments, e.g.
 * {@code --conveyor.cli.enabled=true --param.PROJECT_VERSION=1.4.0 --param.TRIVY_SEVERITY=LOW,MEDIUM}.
 */
@Component
@ConditionalOnProperty(prefix = "conveyor.cli", name = "enabled", havingValue = "true")
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommandLineRunner.class);

    static final String PARAM_PREFIX = "param.";

    private final PipelineExecutor   executor;
    private final PipelineDefinition definition;
    private final boolean            unstableIsSuccess;

    private int exitCode = PipelineRun.EXIT_FAILURE;

    public PipelineCommandLineRunner(PipelineExecutor executor,
                                     PipelineDefinition definition,
                                     @Value("${conveyor.engine.unstable-is-success:false}") boolean unstableIsSuccess) {
        this.executor          = executor;
        this.definition        = definition;
        this.unstableIsSuccess = unstableIsSuccess;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineRun run = executor.run(definition, parameters(args));
        exitCode = run.exitCode(unstableIsSuccess);

        if (run.isConfigurationError()) {
            log.error("Configuration error: {}", run.configurationError());
        }
        for (StageResult r : run.stages()) {
            log.info("  {} {} ({} ms){}", pad(r.stageId()), r.status(), r.durationMs(),
                    r.message() == null ? "" : " " + r.message().lines().findFirst().orElse(""));
        }
        log.info("Pipeline '{}' finished {}; exit code {}", definition.name(), run.status(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    static Map<String, String> parameters(ApplicationArguments args) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String option : args.getOptionNames()) {
            if (!option.startsWith(PARAM_PREFIX)) {
                continue;
            }
            List<String> values = args.getOptionValues(option);
            // a bare --param.NAME flag means true
            String value = values == null || values.isEmpty() ? "true" : values.get(values.size() - 1);
            params.put(option.substring(PARAM_PREFIX.length()), value);
        }
        return params;
    }

    private static String pad(String stageId) {
        return String.format("%-18s", stageId);
    }
}
