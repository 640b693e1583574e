package com.questrail.alpaca.time;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Design</h2>
 * <p>Monotonic deadlines are turned into relative delays at scheduling time
 * and handed to the executor.</p>
 *
 * <h2>Clock consistency</h2>
 * <p>Callers must compute deadlines with the same {@link MonotonicClock} passed
 * here, usually {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <h2>Executor ownership</h2>
 * <p>The executor is owned by the caller; this class never shuts it down. The
 * reflector runtime owns the single health-check thread and stops it on
 * shutdown.</p>
 *
 * <h2>Precision</h2>
 * <p>A task may run somewhat after its deadline under load, never before.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    /**
     * @param executor executor that runs the tasks
     * @param clock    clock the callers' deadlines are measured against
     */
    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Past deadlines run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        // A round already running is left to finish.
        return () -> future.cancel(false);
    }
}
