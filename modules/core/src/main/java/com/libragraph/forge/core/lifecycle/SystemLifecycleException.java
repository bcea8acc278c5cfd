package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.system.SystemMap;

import java.util.Optional;

/**
 * A failed system transition. Carries the best-known system at the time of
 * failure and, when a single component was at fault, its key.
 */
public abstract class SystemLifecycleException extends RuntimeException {

    private final transient SystemMap partialSystem;
    private final String failingKey;

    protected SystemLifecycleException(String message, SystemMap partialSystem,
                                       String failingKey, Throwable cause) {
        super(message, cause);
        this.partialSystem = partialSystem == null ? SystemMap.empty() : partialSystem;
        this.failingKey = failingKey;
    }

    /** System state reached before the failure. Never contains {@link #failingKey()}. */
    public SystemMap partialSystem() {
        return partialSystem;
    }

    public Optional<String> failingKey() {
        return Optional.ofNullable(failingKey);
    }
}
