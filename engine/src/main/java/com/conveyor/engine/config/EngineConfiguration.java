package com.conveyor.engine.config;

import com.conveyor.engine.ci.CiPipelineFactory;
import com.conveyor.engine.ci.DockerfilePolicyCheck;
import com.conveyor.engine.ci.RecipientDirectory;
import com.conveyor.engine.collaborator.ArtifactRepository;
import com.conveyor.engine.collaborator.BuildTool;
import com.conveyor.engine.collaborator.ContainerRuntime;
import com.conveyor.engine.collaborator.HealthCheck;
import com.conveyor.engine.collaborator.ImageRegistry;
import com.conveyor.engine.collaborator.ObjectStorage;
import com.conveyor.engine.collaborator.SecretScanner;
import com.conveyor.engine.collaborator.SourceControl;
import com.conveyor.engine.collaborator.StaticAnalyzer;
import com.conveyor.engine.collaborator.VulnerabilityScanner;
import com.conveyor.engine.gate.ScanGate;
import com.conveyor.engine.notify.LoggingNotificationSender;
import com.conveyor.engine.notify.NotificationSender;
import com.conveyor.engine.notify.WebhookNotificationSender;
import com.conveyor.engine.pipeline.PipelineDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the CI pipeline definition and the beans that need structured
 * configuration. Collaborator implementations are plain components.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    ScanGate scanGate(EngineProperties properties) {
        return new ScanGate(properties.gate().toleratedSeverities());
    }

    @Bean
    RecipientDirectory recipientDirectory(EngineProperties properties) {
        return new RecipientDirectory(properties.recipients());
    }

    @Bean
    DockerfilePolicyCheck dockerfilePolicyCheck() {
        return new DockerfilePolicyCheck();
    }

    @Bean
    NotificationSender notificationSender(EngineProperties properties, ObjectMapper objectMapper) {
        String webhookUrl = properties.notification().webhookUrl();
        if (webhookUrl.isBlank()) {
            log.info("No notification webhook configured; run reports go to the log");
            return new LoggingNotificationSender();
        }
        return new WebhookNotificationSender(webhookUrl, objectMapper);
    }

    @Bean
    CiPipelineFactory ciPipelineFactory(EngineProperties properties,
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
                                        RecipientDirectory recipientDirectory,
                                        DockerfilePolicyCheck dockerfilePolicyCheck) {
        return new CiPipelineFactory(properties.pipeline(), sourceControl, secretScanner, buildTool,
                staticAnalyzer, artifactRepository, vulnerabilityScanner, objectStorage, imageRegistry,
                containerRuntime, healthCheck, scanGate, recipientDirectory, dockerfilePolicyCheck);
    }

    /** Built (and validated) once at startup; a broken definition stops the application. */
    @Bean
    PipelineDefinition pipelineDefinition(CiPipelineFactory factory) {
        PipelineDefinition definition = factory.create();
        log.info("Pipeline '{}' ready: {} stages in {} groups",
                definition.name(), definition.stages().size(), definition.groups().size());
        return definition;
    }
}
