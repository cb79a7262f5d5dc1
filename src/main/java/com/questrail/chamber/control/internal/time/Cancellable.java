package com.questrail.chamber.control.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled task or a running {@link Ticker}.
 *
 * <p>Kept tiny so that both the production executor-backed scheduler and the
 * deterministic test scheduler can implement it.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel.
     *
     * @return {@code true} if this call cancelled the task; {@code false} if it
     *         had already run or was already cancelled.
     */
    boolean cancel();
}
