package com.conveyor.engine.notify;

import com.conveyor.engine.exception.ToolFailureException;
import com.conveyor.engine.exception.TransientNetworkException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts reports as JSON to a mail gateway webhook.
 *
 * Payload: {@code {"to": [...], "subject": "...", "html": "...",
 * "attachments": [{"name": "...", "content": "<base64>"}]}}.
 */
public class WebhookNotificationSender implements NotificationSender {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSender.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       webhookUrl;

    public WebhookNotificationSender(String webhookUrl, ObjectMapper objectMapper) {
        this.webhookUrl = webhookUrl;
        this.json       = objectMapper;
        this.http       = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public void send(List<String> to, String subject, String htmlBody, List<Path> attachments) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("to", to);
        payload.put("subject", subject);
        payload.put("html", htmlBody);
        payload.put("attachments", encode(attachments));

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(webhookUrl))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (JsonProcessingException e) {
            throw new ToolFailureException("Report payload could not be serialized", e);
        } catch (IOException e) {
            throw new TransientNetworkException("Notification webhook unreachable: " + webhookUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolFailureException("Interrupted while sending report '" + subject + "'", e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ToolFailureException("Notification webhook answered HTTP " + resp.statusCode()
                    + ": " + resp.body());
        }
        log.info("Report '{}' sent to {}", subject, to);
    }

    private static List<Map<String, String>> encode(List<Path> attachments) {
        List<Map<String, String>> encoded = new ArrayList<>();
        for (Path path : attachments) {
            try {
                encoded.add(Map.of(
                        "name",    path.getFileName().toString(),
                        "content", Base64.getEncoder().encodeToString(Files.readAllBytes(path))));
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read attachment " + path, e);
            }
        }
        return encoded;
    }
}
