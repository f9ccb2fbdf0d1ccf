package com.libran.dictionary.lock;

/**
 * Configuration for run lock implementations.
 *
 * @param timeoutMs    maximum time to wait for an in-process lock
 * @param maxRetries   retry attempts for a lock file held by another process
 * @param retryDelayMs delay between retry attempts in milliseconds
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
    }

    /**
     * Default configuration: 5s timeout, 3 retries, 200ms delay.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000, 3, 200);
    }
}
