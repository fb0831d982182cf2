package com.streamfirst.dbsync.application;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background task repeated on its own thread with a fixed delay between cycles. Stopping
 * interrupts a daemon that is sleeping between cycles right away and gives an in-flight cycle a
 * bounded time to finish.
 */
@Slf4j
public abstract class ScheduledDaemon implements AutoCloseable {

    private final String name;
    private final Duration interval;
    private final Duration shutdownTimeout;
    private final AtomicLong completedCycles = new AtomicLong();
    private ScheduledExecutorService executor;

    protected ScheduledDaemon(String name, Duration interval, Duration shutdownTimeout) {
        this.name = name;
        this.interval = interval;
        this.shutdownTimeout = shutdownTimeout;
    }

    /** One unit of work. Failures it does not handle itself are logged and the schedule goes on. */
    protected abstract void runCycle();

    /** Delay before the first cycle; one interval unless overridden. */
    protected Duration initialDelay() {
        return interval;
    }

    public String getName() {
        return name;
    }

    public long getCompletedCycles() {
        return completedCycles.get();
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * @throws IllegalStateException if the daemon was already started
     */
    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Daemon " + name + " was already started");
        }
        executor =
                Executors.newSingleThreadScheduledExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, name);
                            thread.setDaemon(true);
                            return thread;
                        });
        executor.scheduleWithFixedDelay(
                this::tick, initialDelay().toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Started {} daemon with interval {}", name, interval);
    }

    /**
     * Stops the schedule. Returns once the daemon thread has exited or the shutdown timeout
     * elapsed. Stopping a daemon that never started is a no-op.
     */
    public synchronized void stop() {
        if (executor == null || executor.isShutdown()) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} daemon did not finish its cycle within {}", name, shutdownTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while stopping {} daemon", name);
        }
        log.info("Stopped {} daemon after {} cycles", name, completedCycles.get());
    }

    @Override
    public void close() {
        stop();
    }

    private void tick() {
        try {
            runCycle();
            completedCycles.incrementAndGet();
        } catch (RuntimeException e) {
            // an exception escaping here would cancel every later cycle
            log.error("{} cycle failed", name, e);
        }
    }
}
