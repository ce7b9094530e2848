package io.fullerstack.csms.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs idempotent store reads with a single retry after a fixed backoff.
 */
public final class StorageReads {
    private static final Logger logger = LoggerFactory.getLogger(StorageReads.class);

    private final Duration backoff;

    public StorageReads(Duration backoff) {
        if (backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative, got: " + backoff);
        }
        this.backoff = backoff;
    }

    /**
     * Executes the read, retrying once if it fails with {@link StorageException}.
     *
     * @param description what is being read, for logging
     * @param read        the read operation, must be idempotent
     * @return the value returned by the first successful attempt
     * @throws StorageException if the retry fails too
     */
    public <T> T read(String description, Supplier<T> read) {
        try {
            return read.get();
        } catch (StorageException first) {
            logger.warn("Storage read failed ({}), retrying in {} ms: {}",
                description, backoff.toMillis(), first.getMessage());
            sleepBackoff(first);
            try {
                return read.get();
            } catch (StorageException second) {
                second.addSuppressed(first);
                logger.error("Storage read failed again ({}): {}", description, second.getMessage());
                throw second;
            }
        }
    }

    private void sleepBackoff(StorageException cause) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while backing off storage retry", cause);
        }
    }
}
