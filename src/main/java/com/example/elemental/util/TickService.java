package com.example.elemental.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-rate scheduler for periodic simulation ticks.
 * A single daemon thread runs every task, so ticks never overlap.
 */
public class TickService {

    private static final Logger logger = LoggerFactory.getLogger(TickService.class);

    private final ScheduledExecutorService scheduler;
    private final Map<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public TickService() {
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "elemental-tick");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedule a named task. A failing run is logged and the schedule continues.
     * Scheduling under an existing name cancels the previous task.
     */
    public ScheduledFuture<?> scheduleAtFixedRate(String name, Runnable task, long initialDelayMs, long periodMs) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                logger.error("Tick task {} failed: {}", name, e.getMessage(), e);
            }
        };
        ScheduledFuture<?> f = scheduler.scheduleAtFixedRate(guarded, initialDelayMs, periodMs, TimeUnit.MILLISECONDS);
        ScheduledFuture<?> previous = tasks.put(name, f);
        if (previous != null) previous.cancel(false);
        return f;
    }

    /**
     * Drive a tick consumer with the period converted to seconds as its delta.
     */
    public ScheduledFuture<?> scheduleTicks(String name, TickConsumer consumer, long periodMs) {
        double deltaSeconds = periodMs / 1000.0;
        return scheduleAtFixedRate(name, () -> consumer.tick(deltaSeconds), periodMs, periodMs);
    }

    public boolean cancel(String name) {
        ScheduledFuture<?> f = tasks.remove(name);
        if (f == null) return false;
        return f.cancel(false);
    }

    public boolean isScheduled(String name) {
        return tasks.containsKey(name);
    }

    public void shutdown() {
        for (ScheduledFuture<?> f : tasks.values()) {
            f.cancel(false);
        }
        tasks.clear();
        scheduler.shutdownNow();
        logger.info("Tick service stopped");
    }

    /** Something advanced by elapsed seconds. */
    @FunctionalInterface
    public interface TickConsumer {
        void tick(double deltaSeconds);
    }
}
