package com.libragraph.forge.core.status;

import com.libragraph.forge.core.lifecycle.SystemLifecycleException;
import com.libragraph.forge.core.system.SystemMap;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of a system transition, as published by the {@link StatusRegister}.
 */
public sealed interface Outcome {

    Instant recordedAt();

    /** The last transition succeeded; {@code system} is what it produced. */
    record Healthy(SystemMap system, Instant recordedAt) implements Outcome {
        public Healthy {
            Objects.requireNonNull(system, "system cannot be null");
            Objects.requireNonNull(recordedAt, "recordedAt cannot be null");
        }
    }

    /** The last transition failed; {@code partialSystem} is the state it left behind. */
    record Unhealthy(Throwable error, SystemMap partialSystem, Instant recordedAt) implements Outcome {
        public Unhealthy {
            Objects.requireNonNull(error, "error cannot be null");
            Objects.requireNonNull(partialSystem, "partialSystem cannot be null");
            Objects.requireNonNull(recordedAt, "recordedAt cannot be null");
        }

        /** Key of the component at fault, when the error names one. */
        public Optional<String> failingKey() {
            if (error instanceof SystemLifecycleException lifecycle) {
                return lifecycle.failingKey();
            }
            return Optional.empty();
        }
    }

    static Outcome healthy(SystemMap system) {
        return new Healthy(system, Instant.now());
    }

    static Outcome unhealthy(Throwable error, SystemMap partialSystem) {
        return new Unhealthy(error, partialSystem, Instant.now());
    }

    /** The value a fresh register holds before any transition. */
    static Outcome initial() {
        return healthy(SystemMap.empty());
    }

    default boolean isHealthy() {
        return this instanceof Healthy;
    }

    /** The system this outcome describes, partial when unhealthy. */
    default SystemMap system() {
        if (this instanceof Healthy healthy) {
            return healthy.system();
        }
        return ((Unhealthy) this).partialSystem();
    }

    default Optional<Throwable> failure() {
        if (this instanceof Unhealthy unhealthy) {
            return Optional.of(unhealthy.error());
        }
        return Optional.empty();
    }
}
