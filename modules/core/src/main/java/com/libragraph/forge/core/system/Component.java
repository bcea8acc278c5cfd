package com.libragraph.forge.core.system;

/**
 * A named unit of a {@link SystemMap} with a start/stop lifecycle.
 * <p>
 * Both operations return the component's post-transition value, which may be
 * {@code this} or a new instance. Implementations must only touch their own
 * state; siblings are reached through the system, never mutated directly.
 * Idempotence (stopping something already stopped) is the component's
 * responsibility.
 */
public interface Component {

    Component start() throws Exception;

    Component stop() throws Exception;
}
