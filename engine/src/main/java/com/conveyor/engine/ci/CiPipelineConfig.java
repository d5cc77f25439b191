package com.conveyor.engine.ci;

import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Everything that differs between deployments of the CI pipeline. Bound from
 * {@code conveyor.pipeline.*}; one definition serves every variant.
 *
 * @param dockerfile        path of the Dockerfile, relative to the checkout
 * @param smokeStartupDelay wait between starting the container and the first health probe
 * @param downstreamJob     job triggered on success; blank for none
 */
public record CiPipelineConfig(
        @DefaultValue("ci")                      String       name,
        @DefaultValue("conveyor/app")            String       imageRepository,
        @DefaultValue("conveyor-smoke")          String       containerNamePrefix,
        @DefaultValue("Dockerfile")              String       dockerfile,
        @DefaultValue("work/trivy-cache")        String       trivyCacheDir,
        @DefaultValue("work/reports")            String       reportDir,
        @DefaultValue("trivy-reports")           String       reportKeyPrefix,
        @DefaultValue("conveyor-app")            String       sonarProjectKey,
        @DefaultValue("conveyor")                String       sonarOrganization,
        @DefaultValue("com.example")             String       artifactGroupId,
        @DefaultValue("app")                     String       artifactId,
        @DefaultValue("")                        String       gitCredentialsRef,
        @DefaultValue("/")                       String       healthPath,
        @DefaultValue("30s")                     Duration     smokeStartupDelay,
        @DefaultValue("3")                       int          healthCheckAttempts,
        @DefaultValue("5s")                      Duration     healthCheckDelay,
        @DefaultValue("3")                       int          pushAttempts,
        @DefaultValue("10s")                     Duration     pushDelay,
        @DefaultValue({"HIGH,CRITICAL", "LOW,MEDIUM", "LOW,MEDIUM,HIGH,CRITICAL", "CRITICAL"})
                                                 List<String> severityChoices,
        @DefaultValue("")                        String       downstreamJob
) {
    public CiPipelineConfig {
        severityChoices = List.copyOf(severityChoices);
    }

    public boolean triggersDownstream() {
        return downstreamJob != null && !downstreamJob.isBlank();
    }
}
