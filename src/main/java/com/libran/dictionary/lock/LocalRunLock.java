package com.libran.dictionary.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-process run lock, the default. Holds are tracked in a registry shared by every
 * instance in the JVM, so two pipelines built over the same fragment root exclude each
 * other even when each was given its own {@code LocalRunLock}.
 *
 * <p>A hold is not reentrant: a second {@link #tryLock(String)} on a held key fails after
 * the timeout, whichever thread asks. Only the thread that acquired a key can release it.</p>
 */
public class LocalRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(LocalRunLock.class);

    // one permit per key for the lifetime of the JVM
    private static final Map<String, Semaphore> PERMITS = new ConcurrentHashMap<>();
    private static final Map<String, Hold> HOLDS = new ConcurrentHashMap<>();

    private final LockConfig config;

    public LocalRunLock() {
        this(LockConfig.defaults());
    }

    public LocalRunLock(LockConfig config) {
        this.config = config != null ? config : LockConfig.defaults();
    }

    @Override
    public boolean tryLock(String key) {
        Semaphore permit = PERMITS.computeIfAbsent(key, k -> new Semaphore(1, true));
        boolean acquired;
        try {
            acquired = permit.tryAcquire(config.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for the run lock on " + key, e);
        }
        if (!acquired) {
            Hold holder = HOLDS.get(key);
            throw new LockAcquisitionException("Run lock on " + key + " is held"
                    + (holder != null ? " by " + holder.thread() + " since " + holder.since() : "")
                    + "; waited " + config.timeoutMs() + "ms");
        }
        HOLDS.put(key, new Hold(Thread.currentThread().getName(), Thread.currentThread().getId(), Instant.now()));
        log.debug("lock.acquired key={}", key);
        return true;
    }

    @Override
    public void unlock(String key) {
        Hold hold = HOLDS.get(key);
        if (hold == null || hold.threadId() != Thread.currentThread().getId()) {
            log.debug("lock.notHeld key={}", key);
            return;
        }
        HOLDS.remove(key);
        PERMITS.get(key).release();
        log.debug("lock.released key={}", key);
    }

    /**
     * Whether some run in this JVM currently holds the key.
     */
    public static boolean isHeld(String key) {
        return HOLDS.containsKey(key);
    }

    private record Hold(String thread, long threadId, Instant since) {}
}
