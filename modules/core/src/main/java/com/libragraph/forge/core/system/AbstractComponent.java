package com.libragraph.forge.core.system;

import java.util.concurrent.atomic.AtomicReference;

import org.jboss.logging.Logger;

/**
 * Base class for mutable {@link Component}s that return {@code this} from both
 * transitions. Provides:
 * <ul>
 *   <li>Thread-safe state machine via {@link AtomicReference}</li>
 *   <li>Idempotent {@link #start()} and {@link #stop()}</li>
 *   <li>Logged state transitions</li>
 * </ul>
 * Subclasses implement {@link #doStart()} and {@link #doStop()}.
 */
public abstract class AbstractComponent implements Component {

    public enum State { STOPPED, STARTING, RUNNING, STOPPING, FAILED }

    private final AtomicReference<State> state = new AtomicReference<>(State.STOPPED);

    protected final Logger log = Logger.getLogger(getClass());

    // -- template methods for subclasses --

    /** Short name used in log lines. */
    protected abstract String componentId();

    protected abstract void doStart() throws Exception;

    protected abstract void doStop() throws Exception;

    // -- Component contract --

    public State state() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    @Override
    public Component start() throws Exception {
        if (state.get() == State.RUNNING) {
            return this; // idempotent
        }

        transition(State.STARTING);
        try {
            doStart();
            transition(State.RUNNING);
            return this;
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    @Override
    public Component stop() throws Exception {
        State current = state.get();
        if (current == State.STOPPED) {
            return this; // idempotent
        }

        transition(State.STOPPING);
        try {
            doStop();
            transition(State.STOPPED);
            return this;
        } catch (Exception e) {
            fail(e);
            throw e;
        }
    }

    private void fail(Throwable cause) {
        State old = state.getAndSet(State.FAILED);
        log.errorf("Component '%s' failed (was %s): %s", componentId(), old, cause.getMessage());
    }

    private void transition(State newState) {
        State old = state.getAndSet(newState);
        log.debugf("Component '%s': %s -> %s", componentId(), old, newState);
    }
}
