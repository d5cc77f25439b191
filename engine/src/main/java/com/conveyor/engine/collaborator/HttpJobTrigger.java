package com.conveyor.engine.collaborator;

import com.conveyor.engine.exception.ToolFailureException;
import com.conveyor.engine.exception.TransientNetworkException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Posts the job parameters as JSON to {@code <base-url>/job/<name>/trigger}.
 * With no base URL configured, triggering is disabled and every request
 * reports "not accepted".
 */
@Component
public class HttpJobTrigger implements JobTrigger {

    private static final Logger log = LoggerFactory.getLogger(HttpJobTrigger.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;

    public HttpJobTrigger(@Value("${conveyor.trigger.base-url:}") String baseUrl, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public boolean triggerJob(String jobName, Map<String, String> params) {
        if (baseUrl.isBlank()) {
            log.warn("No trigger base URL configured; job '{}' not triggered", jobName);
            return false;
        }
        String url = baseUrl + "/job/" + URLEncoder.encode(jobName, StandardCharsets.UTF_8) + "/trigger";
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(Duration.ofSeconds(30))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(params)))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            boolean accepted = resp.statusCode() >= 200 && resp.statusCode() < 300;
            if (!accepted) {
                log.warn("Job '{}' trigger answered HTTP {}: {}", jobName, resp.statusCode(), resp.body());
            }
            return accepted;
        } catch (JsonProcessingException e) {
            throw new ToolFailureException("Parameters for job '" + jobName + "' could not be serialized", e);
        } catch (IOException e) {
            throw new TransientNetworkException("Job trigger endpoint unreachable: " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolFailureException("Interrupted while triggering job '" + jobName + "'", e);
        }
    }
}
