package com.libragraph.forge.core.lifecycle;

import com.libragraph.forge.core.status.Outcome;
import com.libragraph.forge.core.status.StatusRegister;
import com.libragraph.forge.core.system.SystemMap;
import org.jboss.logging.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the current {@link SystemMap} and replaces it on {@link #reset(SystemConstructor)}.
 * <p>
 * A reset constructs the next system, stops the current one, then starts the
 * next one, all under a single lock shared with {@link #stop()}. Every terminal
 * outcome is published to the {@link StatusRegister} and every failure is
 * rethrown. Failures are handled as follows:
 * <pre>
 *   construct next system
 *     throws? store nothing, throw
 *     ok?     stop current system
 *       throws? store partially stopped system (failing key removed), throw
 *       ok?     start next system
 *         throws? stop the partially started system
 *           throws? store partially stopped system (failing key removed), throw start error
 *           ok?     store stopped partial system, throw start error
 *         ok?     store and return started system
 * </pre>
 * The stored system never references a component that threw while starting or
 * stopping, so it can always be handed to the next reset as "previous".
 */
public class LifecycleSupervisor {

    private static final Logger log = Logger.getLogger(LifecycleSupervisor.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final StatusRegister status;
    private final SystemConstructor defaultConstructor;

    // Last committed system; null until the first transition stores one.
    private volatile SystemMap system;

    public LifecycleSupervisor(StatusRegister status) {
        this(status, null);
    }

    /**
     * @param defaultConstructor used by {@link #reset()}; may be null, in which case
     *                           only {@link #reset(SystemConstructor)} works
     */
    public LifecycleSupervisor(StatusRegister status, SystemConstructor defaultConstructor) {
        this.status = Objects.requireNonNull(status, "status register cannot be null");
        this.defaultConstructor = defaultConstructor;
    }

    /** Last committed system. Empty before the first transition. */
    public Optional<SystemMap> current() {
        return Optional.ofNullable(system);
    }

    public StatusRegister status() {
        return status;
    }

    public boolean isTransitionInProgress() {
        return lock.isLocked();
    }

    public boolean hasDefaultConstructor() {
        return defaultConstructor != null;
    }

    /** Resets using the constructor supplied at creation. */
    public SystemMap reset() {
        lock.lock();
        try {
            if (defaultConstructor == null) {
                IllegalStateException e = new IllegalStateException(
                        "No system constructor configured; pass one to reset(SystemConstructor)");
                publish(Outcome.unhealthy(e, currentOrEmpty()));
                throw e;
            }
            return resetLocked(defaultConstructor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the current system with the one {@code constructor} builds.
     *
     * @return the started system
     * @throws SystemConstructionException if the constructor throws
     * @throws SystemStopException if the current system fails to stop
     * @throws SystemStartException if the next system fails to start
     */
    public SystemMap reset(SystemConstructor constructor) {
        Objects.requireNonNull(constructor, "constructor cannot be null");
        lock.lock();
        try {
            return resetLocked(constructor);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops the current system, keeping it in stopped form. A no-op success
     * when nothing was ever stored.
     *
     * @throws SystemStopException if a component fails to stop
     */
    public SystemMap stop() {
        lock.lock();
        try {
            SystemMap previous = system;
            if (previous == null) {
                log.debug("Stop requested with no system; nothing to do");
                publish(Outcome.healthy(SystemMap.empty()));
                return SystemMap.empty();
            }

            log.infof("Stopping system %s", previous.names());
            SystemMap stopped = stopOrStorePartial(previous);
            commit(stopped);
            publish(Outcome.healthy(stopped));
            log.info("System stopped");
            return stopped;
        } finally {
            lock.unlock();
        }
    }

    // -- internals; callers hold the lock --

    private SystemMap resetLocked(SystemConstructor constructor) {
        SystemMap previous = system;
        log.infof("Resetting system (previous=%s)", previous == null ? "none" : previous.names());

        SystemMap next = construct(constructor, previous);

        if (previous != null) {
            stopOrStorePartial(previous);
        }

        try {
            SystemMap started = SystemLifecycle.start(next);
            commit(started);
            publish(Outcome.healthy(started));
            log.infof("System started: %s", started.names());
            return started;
        } catch (SystemStartException e) {
            log.errorf(e, "Component '%s' failed to start; rolling back %s",
                    e.failingKey().orElse("?"), e.partialSystem().names());
            SystemMap rolledBack = rollback(e);
            commit(rolledBack);
            publish(Outcome.unhealthy(e, rolledBack));
            throw e;
        }
    }

    private SystemMap construct(SystemConstructor constructor, SystemMap previous) {
        try {
            SystemMap next = constructor.create(Optional.ofNullable(previous));
            if (next == null) {
                throw new IllegalStateException("System constructor returned null");
            }
            return next;
        } catch (Throwable e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            SystemConstructionException failure = new SystemConstructionException(e);
            log.errorf(e, "System construction failed");
            publish(Outcome.unhealthy(failure, currentOrEmpty()));
            throw failure;
        }
    }

    private SystemMap stopOrStorePartial(SystemMap running) {
        try {
            return SystemLifecycle.stop(running);
        } catch (SystemStopException e) {
            log.errorf(e, "Component '%s' failed to stop; keeping %s",
                    e.failingKey().orElse("?"), e.partialSystem().names());
            commit(e.partialSystem());
            publish(Outcome.unhealthy(e, e.partialSystem()));
            throw e;
        }
    }

    private SystemMap rollback(SystemStartException startFailure) {
        try {
            SystemMap stopped = SystemLifecycle.stop(startFailure.partialSystem());
            log.infof("Rolled back partially started system %s", stopped.names());
            return stopped;
        } catch (SystemStopException stopFailure) {
            log.warnf(stopFailure, "Rollback failed at component '%s'; keeping %s",
                    stopFailure.failingKey().orElse("?"), stopFailure.partialSystem().names());
            startFailure.addSuppressed(stopFailure);
            return stopFailure.partialSystem();
        }
    }

    private void commit(SystemMap snapshot) {
        system = snapshot;
    }

    private void publish(Outcome outcome) {
        status.set(outcome);
    }

    private SystemMap currentOrEmpty() {
        SystemMap snapshot = system;
        return snapshot == null ? SystemMap.empty() : snapshot;
    }
}
