package com.conveyor.engine.config;

import com.conveyor.engine.ci.CiPipelineConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.context.properties.bind.Name;

import java.util.List;
import java.util.Map;

/**
 * Structured settings under {@code conveyor.*}. Single scalar switches
 * (fail-fast, CLI mode, endpoint URLs) are read with {@code @Value} where
 * they are used.
 *
 * @param notification bound from {@code conveyor.notify.*}
 * @param recipients   user id → email address, for the RECIPIENTS parameter
 */
@ConfigurationProperties(prefix = "conveyor")
public record EngineProperties(
        @DefaultValue Gate             gate,
        @DefaultValue @Name("notify") Notification notification,
        Map<String, String>            recipients,
        @DefaultValue CiPipelineConfig pipeline
) {
    public EngineProperties {
        recipients = recipients == null ? Map.of() : Map.copyOf(recipients);
    }

    /** @param toleratedSeverities severities whose findings may still be pushed */
    public record Gate(@DefaultValue({"LOW", "MEDIUM"}) List<String> toleratedSeverities) {}

    /** @param webhookUrl mail gateway endpoint; blank logs reports instead of sending them */
    public record Notification(@DefaultValue("") String webhookUrl) {}
}
