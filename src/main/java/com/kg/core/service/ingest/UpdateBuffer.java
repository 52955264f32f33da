package com.kg.core.service.ingest;

import com.kg.core.service.bus.CancellationSignal;

import java.util.Optional;

/**
 * Bounded hand-off between the event subscriber and the batch committer.
 */
public interface UpdateBuffer {

    /**
     * Adds a record, blocking while the buffer is full.
     *
     * @param record       the record to add
     * @param cancellation stops the wait when cancelled
     * @return true if added, false if cancelled before space became free
     */
    boolean put(UpdateRecord record, CancellationSignal cancellation);

    /**
     * Takes the oldest record, waiting up to the timeout.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the record if one arrived in time
     */
    Optional<UpdateRecord> poll(long timeoutMs);

    int size();

    int getCapacity();

    /**
     * Gets the buffer utilization as a percentage.
     *
     * @return utilization percentage (0-100)
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }

    default boolean isFull() {
        return size() >= getCapacity();
    }
}
