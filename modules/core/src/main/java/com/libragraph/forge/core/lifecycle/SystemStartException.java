package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.system.SystemMap;

/**
 * A component threw while starting. The partial system holds the components
 * started before it, in started form. A failed rollback is attached as a
 * suppressed {@link SystemStopException}.
 */
public class SystemStartException extends SystemLifecycleException {

    public SystemStartException(String failingKey, SystemMap partialSystem, Throwable cause) {
        super("Error while starting component '" + failingKey + "': " + cause.getMessage(),
                partialSystem, failingKey, cause);
    }
}
