package com.libragraph.forge.app.demo;

import com.libragraph.forge.core.system.AbstractComponent;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts ticks on a single scheduler thread while running.
 */
public class TickerComponent extends AbstractComponent {

    private final Duration interval;
    private final AtomicLong ticks = new AtomicLong();
    private ScheduledExecutorService scheduler;

    public TickerComponent(Duration interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("tick interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    @Override
    protected String componentId() {
        return "ticker";
    }

    @Override
    protected void doStart() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "forge-ticker");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        scheduler.scheduleAtFixedRate(ticks::incrementAndGet, millis, millis, TimeUnit.MILLISECONDS);
        log.infof("Ticker started, interval %s", interval);
    }

    @Override
    protected void doStop() throws InterruptedException {
        scheduler.shutdownNow();
        if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
            throw new IllegalStateException("ticker thread did not terminate");
        }
        scheduler = null;
        log.infof("Ticker stopped after %d ticks", ticks.get());
    }

    public long ticks() {
        return ticks.get();
    }

    public Duration interval() {
        return interval;
    }
}
