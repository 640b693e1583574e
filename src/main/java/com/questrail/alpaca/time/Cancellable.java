package com.questrail.alpaca.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a task handed to a {@link MonotonicScheduler}.
 *
 * <p>
 * Kept to a single method so it can be implemented by:
 * <ul>
 *   <li>the deterministic scheduler used by device pool tests</li>
 *   <li>a {@code ScheduledExecutorService}-backed scheduler in production</li>
 * </ul>
 * The device pool holds one handle for the next health round and cancels it
 * when the engine stops.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
