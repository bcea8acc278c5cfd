package com.libragraph.forge.api;

import com.libragraph.forge.core.status.Outcome;

import java.util.List;

/**
 * JSON rendering of an {@link Outcome}.
 */
public record StatusView(
        String state,
        List<String> components,
        ErrorView error,
        String recordedAt
) {

    public static final String HEALTHY = "HEALTHY";
    public static final String UNHEALTHY = "UNHEALTHY";

    public record ErrorView(String type, String message, String failingKey) {}

    public static StatusView from(Outcome outcome) {
        ErrorView error = null;
        if (outcome instanceof Outcome.Unhealthy unhealthy) {
            error = new ErrorView(
                    unhealthy.error().getClass().getName(),
                    unhealthy.error().getMessage(),
                    unhealthy.failingKey().orElse(null));
        }
        return new StatusView(
                outcome.isHealthy() ? HEALTHY : UNHEALTHY,
                outcome.system().names(),
                error,
                outcome.recordedAt().toString());
    }
}
