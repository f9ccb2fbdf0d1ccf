package com.libran.dictionary.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cross-process run lock backed by an OS file lock on {@code <key>/.pipeline.lock}.
 * The key is the fragment directory. Retries per {@link LockConfig} before giving up.
 */
public class FileRunLock implements RunLock {
    private static final Logger log = LoggerFactory.getLogger(FileRunLock.class);

    public static final String LOCK_FILE = ".pipeline.lock";

    private final LockConfig config;
    private final Map<String, Held> held = new ConcurrentHashMap<>();

    public FileRunLock() {
        this(LockConfig.defaults());
    }

    public FileRunLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        Path lockFile = Path.of(key).resolve(LOCK_FILE);
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (attemptLock(key, lockFile)) {
                log.debug("lock.acquired file={} attempt={}", lockFile, attempt + 1);
                return true;
            }

            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException("Interrupted while acquiring run lock for: " + key, e);
                }
            }
        }

        throw new LockAcquisitionException(
                "Another run holds '" + lockFile + "' after " + (config.maxRetries() + 1) + " attempts");
    }

    @Override
    public void unlock(String key) {
        Held lock = held.remove(key);
        if (lock == null) {
            return;
        }
        try {
            lock.fileLock().release();
            lock.channel().close();
            log.debug("lock.released key={}", key);
        } catch (IOException e) {
            log.warn("lock.releaseFailed key={} error={}", key, e.getMessage());
        }
    }

    private boolean attemptLock(String key, Path lockFile) {
        if (held.containsKey(key)) {
            return false;
        }
        FileChannel channel = null;
        try {
            Files.createDirectories(lockFile.getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                channel.close();
                return false;
            }
            held.put(key, new Held(channel, fileLock));
            return true;
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            return false;
        } catch (IOException e) {
            closeQuietly(channel);
            log.warn("lock.attemptFailed file={} error={}", lockFile, e.getMessage());
            return false;
        }
    }

    private void closeQuietly(FileChannel channel) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("lock.channelCloseFailed error={}", e.getMessage());
        }
    }

    private record Held(FileChannel channel, FileLock fileLock) {}
}
