package com.questrail.alpaca.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Scheduler surface used by the device pool health ticker.
 *
 * <h2>Binding invariant</h2>
 * Deadlines are expressed in monotonic nanoseconds or durations. They MUST NOT
 * be expressed in wall-clock instants ({@code Instant}, local time, time zones),
 * so a clock adjustment on the host never skips or bunches health rounds.
 *
 * <h2>One-shot tasks</h2>
 * Every task runs at most once. The ticker reschedules itself after each round,
 * which keeps a slow round from overlapping the next one.
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline from {@link MonotonicClock#nowNanos()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule after a delay measured against {@code clock}.
     *
     * <p>
     * Defined here so every implementation converts a delay to a deadline the
     * same way.
     * </p>
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
