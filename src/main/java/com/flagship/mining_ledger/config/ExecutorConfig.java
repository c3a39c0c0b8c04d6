package com.flagship.mining_ledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for calls to the payment verification collaborator.
 *
 * Bounded queue: when verification backs up, new purchases fail fast with a
 * rejected task instead of piling up behind a slow collaborator.
 */
@Configuration
public class ExecutorConfig {

    public static final String PAYMENT_VERIFICATION_EXECUTOR = "paymentVerificationExecutor";

    @Bean(name = PAYMENT_VERIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor paymentVerificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("payment-verify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
