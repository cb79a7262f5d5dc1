package com.questrail.chamber.status;

import com.questrail.chamber.api.StatusSnapshot;

/**
 * Outbound port for status snapshots.
 *
 * <p>Delivery is best effort and may reorder; observers apply
 * {@link SequencedStatusFilter}. Implementations must not block the caller,
 * which holds the controller lock.</p>
 */
@FunctionalInterface
public interface StatusBroadcaster
{
    void broadcast(StatusSnapshot snapshot);

    static StatusBroadcaster none() {
        return snapshot -> { };
    }
}
