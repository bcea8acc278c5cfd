package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.system.SystemMap;

/**
 * A component threw while stopping. The partial system has the components
 * stopped so far in stopped form, those not yet reached untouched, and the
 * failing component removed.
 */
public class SystemStopException extends SystemLifecycleException {

    public SystemStopException(String failingKey, SystemMap partialSystem, Throwable cause) {
        super("Error while stopping component '" + failingKey + "': " + cause.getMessage(),
                partialSystem, failingKey, cause);
    }
}
