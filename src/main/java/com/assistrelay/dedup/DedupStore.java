package com.assistrelay.dedup;

/**
 * Remembers which inbound event ids have been handled. Implementations persist the set so an id
 * is never processed twice, even across restarts.
 */
public interface DedupStore {

    boolean contains(String eventId);

    /**
     * Atomically adds {@code eventId} and persists it.
     *
     * @return true if this call made the first claim, false if the id was already present
     */
    boolean tryClaim(String eventId);

    /**
     * Adds {@code eventId} and persists it before returning.
     *
     * @throws com.assistrelay.shared.error.PersistenceException if the write fails; the in-memory
     *         add is kept
     */
    void record(String eventId);

    int size();
}
