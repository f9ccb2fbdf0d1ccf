package com.libran.dictionary.lock;

/**
 * Lock that serializes pipeline runs over the same fragment source.
 * Lifecycle state is not safe under concurrent runs, so every run holds this lock.
 */
public interface RunLock {

    /**
     * Acquires the lock on the given key.
     *
     * @param key the lock key (typically the fragment store location)
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock cannot be acquired within the configured limits
     */
    boolean tryLock(String key);

    /**
     * Releases the lock on the given key.
     */
    void unlock(String key);
}
