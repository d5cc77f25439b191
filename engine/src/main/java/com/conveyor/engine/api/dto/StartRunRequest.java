package com.conveyor.engine.api.dto;

import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * Parameter values are strings exactly as a CI server would pass them;
 * omitted parameters take their declared defaults.
 */
public record StartRunRequest(Map<String, String> parameters) {

    public StartRunRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }
}
