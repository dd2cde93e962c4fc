package com.flagship.reconciliation_engine.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor that ledger queries run on, so callers can bound them with a timeout.
 */
@Configuration
public class LedgerConfig {

    @Bean(name = "ledgerExecutor")
    public ThreadPoolTaskExecutor ledgerExecutor(@Value("${engine.ledger.pool-size:4}") int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ledger-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
