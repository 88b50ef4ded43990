package com.civics.ingest.lock;

import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for the merge-and-write step of one canonical entity.
 * Unrelated keys never contend.
 */
public interface EntityLock {

    /**
     * Acquires the lock for {@code key}, waiting at most the configured timeout.
     *
     * @throws LockAcquisitionException if the lock is not acquired in time
     */
    void lock(String key);

    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock for {@code key}.
     */
    default <T> T withLock(String key, Supplier<T> action) {
        lock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
