package com.conveyor.engine.collaborator;

public interface HealthCheck {

    /**
     * @return the HTTP status code
     * @throws com.conveyor.engine.exception.TransientNetworkException if nothing answered
     */
    int httpGet(String url);
}
