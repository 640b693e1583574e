package com.questrail.alpaca.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for health-check cadence and backend latency measurement.
 *
 * <h2>Binding invariant</h2>
 * Intervals, probe deadlines, request latencies and retry spacing MUST use a
 * monotonic source. Wall-clock time ({@link WallClock}) is only for timestamps
 * that end up in health reports, metrics and logs.
 *
 * <p>
 * Production code uses {@link SystemMonotonicClock}, backed by
 * {@link System#nanoTime()}; tests advance a manual clock by hand so health
 * rounds run exactly when the test asks for them.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Only differences between two values are meaningful; the origin is
     * arbitrary and differs between JVMs.
     * </p>
     */
    long nowNanos();
}
