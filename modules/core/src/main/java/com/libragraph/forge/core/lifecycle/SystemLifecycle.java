package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.system.Component;
import com.libragraph.forge.core.system.SystemMap;
import org.jboss.logging.Logger;

/**
 * Walks a {@link SystemMap} starting or stopping each component in order.
 * Failures carry the partial system reached so far. Linkage and initializer
 * errors from a component are failures like any exception.
 */
public final class SystemLifecycle {

    private static final Logger log = Logger.getLogger(SystemLifecycle.class);

    private SystemLifecycle() {
    }

    /**
     * Starts every component in start order.
     *
     * @return the system with every component in started form
     * @throws SystemStartException holding only the components started before the failure
     */
    public static SystemMap start(SystemMap system) {
        SystemMap.Builder started = SystemMap.builder();
        for (String key : system.startOrder()) {
            Component component = system.get(key).orElseThrow();
            try {
                log.debugf("Starting component '%s'", key);
                started.add(key, requireResult(component.start(), key, "start"));
            } catch (Throwable e) {
                throw new SystemStartException(key, started.build(), e);
            }
        }
        return started.build();
    }

    /**
     * Stops every component in stop order.
     *
     * @return the system with every component in stopped form, in the original order
     * @throws SystemStopException holding the system with stopped-so-far components
     *         replaced and the failing one removed
     */
    public static SystemMap stop(SystemMap system) {
        SystemMap current = system;
        for (String key : system.stopOrder()) {
            Component component = system.get(key).orElseThrow();
            try {
                log.debugf("Stopping component '%s'", key);
                current = current.with(key, requireResult(component.stop(), key, "stop"));
            } catch (Throwable e) {
                throw new SystemStopException(key, current.without(key), e);
            }
        }
        return current;
    }

    private static Component requireResult(Component result, String key, String operation) {
        if (result == null) {
            throw new IllegalStateException(
                    "Component '" + key + "' returned null from " + operation + "()");
        }
        return result;
    }
}
