package com.tradezzz.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared infrastructure beans: the clock every time-windowed component reads, and the pool
 * guarded exchange calls run on while the caller waits with a timeout.
 */
@Configuration
public class ExecutionConfig {

    @Value("${tradezzz.async.core-pool-size:8}")
    private int corePoolSize;

    @Value("${tradezzz.async.max-pool-size:32}")
    private int maxPoolSize;

    @Value("${tradezzz.async.queue-capacity:200}")
    private int queueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs calls guarded by a circuit breaker. CallerRunsPolicy keeps calls flowing when the pool is
     * saturated; those calls then run without the timeout race being able to abandon them early.
     */
    @Bean("circuitBreakerExecutor")
    public ThreadPoolTaskExecutor circuitBreakerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("guarded-call-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
