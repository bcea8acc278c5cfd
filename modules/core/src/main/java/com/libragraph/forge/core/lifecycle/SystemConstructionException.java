package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.system.SystemMap;

/**
 * The {@link SystemConstructor} threw. No system state was changed.
 */
public class SystemConstructionException extends SystemLifecycleException {

    public SystemConstructionException(Throwable cause) {
        super("Error while constructing system: " + cause.getMessage(), SystemMap.empty(), null, cause);
    }
}
