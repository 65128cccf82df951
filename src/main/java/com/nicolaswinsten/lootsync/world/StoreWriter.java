package com.nicolaswinsten.lootsync.world;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import com.nicolaswinsten.lootsync.config.LootSyncProperties;
import com.nicolaswinsten.lootsync.error.StorageBusyException;

/**
 * The single logical writer in front of the database.
 *
 * <p>Every mutating store call goes through {@link #write}: callers queue on one fair lock,
 * the work runs in its own transaction, and failures the database reports as transient
 * (lock timeouts, busy) are retried with exponential backoff. The lock is released between
 * attempts so a backing-off writer does not hold up the others. Readers never touch the lock.
 *
 * <p>When retries run out, or a writer waits longer than the configured write timeout for its
 * turn, the caller gets a {@link StorageBusyException} instead of hanging.
 */
@Component
public class StoreWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(StoreWriter.class);

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final RetryTemplate retryTemplate;
    private final TransactionTemplate transactionTemplate;
    private final long writeTimeoutMillis;

    public StoreWriter(RetryTemplate storeRetryTemplate,
                       TransactionTemplate storeTransactionTemplate,
                       LootSyncProperties properties) {
        this.retryTemplate = storeRetryTemplate;
        this.transactionTemplate = storeTransactionTemplate;
        this.writeTimeoutMillis = properties.store().writeTimeout().toMillis();
    }

    /**
     * Runs {@code work} as one committed transaction. Exceptions other than transient data access
     * failures (not found, conflict, validation) are rethrown unchanged on the first attempt.
     *
     * @param operation short name used in log lines
     */
    public <T> T write(String operation, Supplier<T> work) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    LOGGER.warn("Store busy, retrying {} (attempt {})", operation, context.getRetryCount() + 1);
                }
                return runExclusively(operation, work);
            });
        } catch (TransientDataAccessException e) {
            LOGGER.warn("Giving up on {} after repeated busy errors: {}", operation, e.getMessage());
            throw new StorageBusyException("Store is busy, " + operation + " was not applied", e);
        }
    }

    /** Convenience for writes with nothing to return. */
    public void run(String operation, Runnable work) {
        write(operation, () -> {
            work.run();
            return null;
        });
    }

    private <T> T runExclusively(String operation, Supplier<T> work) {
        boolean acquired;
        try {
            acquired = writeLock.tryLock(writeTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageBusyException("Interrupted while waiting to " + operation, e);
        }
        if (!acquired) {
            throw new StorageBusyException("Timed out waiting for the store writer to " + operation);
        }
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            writeLock.unlock();
        }
    }
}
