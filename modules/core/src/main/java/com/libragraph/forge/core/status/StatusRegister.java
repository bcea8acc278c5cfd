package com.libragraph.forge.core.status;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Holds the latest {@link Outcome} and lets any number of observers wait for
 * the next one.
 * <p>
 * Each call to {@link #nextChange()} registers one waiter. A {@link #set(Outcome)}
 * releases exactly the waiters registered before it, each once, with the new
 * outcome; waiters registering afterwards wait for the following change, so
 * callers that also need the current value read {@link #get()} first.
 * Cancelled or timed-out waiters deregister themselves immediately.
 * <p>
 * Written only by the lifecycle supervisor. Writes never wait on readers:
 * waiters are swapped out under a short lock and completed after it is released.
 */
public class StatusRegister {

    private static final Logger log = Logger.getLogger(StatusRegister.class);

    private final Object lock = new Object();
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();

    private volatile Outcome current;

    // guarded by lock
    private Set<CompletableFuture<Outcome>> waiters = new HashSet<>();

    public StatusRegister() {
        this(Outcome.initial());
    }

    public StatusRegister(Outcome initial) {
        this.current = Objects.requireNonNull(initial, "initial outcome cannot be null");
    }

    /** Latest outcome. Never blocks. */
    public Outcome get() {
        return current;
    }

    /**
     * Registers a waiter for the next change. The future completes with the
     * outcome of the next {@link #set(Outcome)}; cancelling it releases the
     * registration without affecting other waiters.
     */
    public CompletableFuture<Outcome> nextChange() {
        CompletableFuture<Outcome> waiter = new CompletableFuture<>();
        synchronized (lock) {
            waiters.add(waiter);
        }
        waiter.whenComplete((outcome, error) -> {
            if (error != null) {
                deregister(waiter);
            }
        });
        return waiter;
    }

    /** Blocks until the next change and returns its outcome. */
    public Outcome awaitChange() throws InterruptedException {
        CompletableFuture<Outcome> waiter = nextChange();
        try {
            return waiter.get();
        } catch (InterruptedException e) {
            waiter.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Status waiter failed", e.getCause());
        }
    }

    /** Like {@link #awaitChange()}, giving up after {@code timeout}. */
    public Outcome awaitChange(Duration timeout) throws InterruptedException, TimeoutException {
        CompletableFuture<Outcome> waiter = nextChange();
        try {
            return waiter.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException | TimeoutException e) {
            waiter.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Status waiter failed", e.getCause());
        }
    }

    /**
     * Records a new outcome and releases every waiter registered before this call.
     * Listeners run afterwards on the calling thread.
     */
    public void set(Outcome outcome) {
        Objects.requireNonNull(outcome, "outcome cannot be null");

        Set<CompletableFuture<Outcome>> released;
        synchronized (lock) {
            current = outcome;
            released = waiters;
            waiters = new HashSet<>();
        }

        log.debugf("Status changed to %s, releasing %d waiter(s)",
                outcome.isHealthy() ? "HEALTHY" : "UNHEALTHY", released.size());

        for (CompletableFuture<Outcome> waiter : released) {
            waiter.complete(outcome);
        }
        for (StatusListener listener : listeners) {
            try {
                listener.onStatusChanged(outcome);
            } catch (RuntimeException e) {
                log.warnf(e, "Status listener %s failed", listener);
            }
        }
    }

    public void addListener(StatusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(StatusListener listener) {
        listeners.remove(listener);
    }

    /** Number of waiters currently registered for the next change. */
    public int pendingWaiters() {
        synchronized (lock) {
            return waiters.size();
        }
    }

    private void deregister(CompletableFuture<Outcome> waiter) {
        synchronized (lock) {
            waiters.remove(waiter);
        }
    }
}
