package com.assistrelay.dedup;

import com.assistrelay.shared.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the processed set in memory and guards it together with its file under one lock, so
 * "add" and "persist" are seen as a single step by concurrent callers.
 */
abstract class FileBackedDedupStore implements DedupStore {

    private static final Logger log = LoggerFactory.getLogger(FileBackedDedupStore.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> processed;

    protected FileBackedDedupStore(Collection<String> initial) {
        this.processed = new LinkedHashSet<>(initial);
    }

    @Override
    public boolean contains(String eventId) {
        lock.lock();
        try {
            return processed.contains(eventId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean tryClaim(String eventId) {
        lock.lock();
        try {
            if (!processed.add(eventId)) {
                return false;
            }
            try {
                persist(eventId, processed);
            } catch (PersistenceException e) {
                // the claim stays in memory for the lifetime of the process
                log.error("Failed to persist claim for event {}", eventId, e);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void record(String eventId) {
        lock.lock();
        try {
            if (processed.add(eventId)) {
                persist(eventId, processed);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return processed.size();
        } finally {
            lock.unlock();
        }
    }

    /** Called with the lock held, after {@code added} has joined {@code all}. */
    protected abstract void persist(String added, Set<String> all);
}
