package com.nicolaswinsten.lootsync.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the pieces the single store writer is built from.
 */
@Configuration
public class StorageConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Retries writes the database reported as transiently busy (lock timeouts and the like),
     * backing off exponentially between attempts.
     */
    @Bean
    public RetryTemplate storeRetryTemplate(LootSyncProperties properties) {
        LootSyncProperties.Store store = properties.store();
        return RetryTemplate.builder()
            .maxAttempts(store.maxAttempts())
            .exponentialBackoff(
                store.initialBackoff().toMillis(),
                store.backoffMultiplier(),
                store.maxBackoff().toMillis())
            .retryOn(TransientDataAccessException.class)
            .traversingCauses()
            .build();
    }

    @Bean
    public TransactionTemplate storeTransactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
