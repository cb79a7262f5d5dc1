package com.questrail.chamber.status;

import com.questrail.chamber.api.StatusSnapshot;

import java.util.Objects;

/**
 * SequencedStatusFilter
 * -----------------------------------------------------------------------------
 * Observer-side acceptance rule for snapshots delivered over an unordered,
 * lossy channel.
 *
 * <p>Keeps the highest sequence number accepted so far and rejects any
 * snapshot whose number is not above it, so a late or duplicated datagram
 * never rolls the observer's view backwards. Whatever the arrival order, the
 * observer ends on the snapshot with the highest number it received.</p>
 */
public final class SequencedStatusFilter
{
    private long lastAccepted;
    private StatusSnapshot latest;

    /**
     * @return {@code true} if the snapshot is newer than anything accepted
     *         before and has become {@link #latest()}
     */
    public synchronized boolean accept(StatusSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.sequenceNumber() <= lastAccepted) {
            return false;
        }
        lastAccepted = snapshot.sequenceNumber();
        latest = snapshot;
        return true;
    }

    public synchronized long lastAcceptedSequence() {
        return lastAccepted;
    }

    /**
     * The most recent accepted snapshot, or {@code null} before the first one.
     */
    public synchronized StatusSnapshot latest() {
        return latest;
    }
}
