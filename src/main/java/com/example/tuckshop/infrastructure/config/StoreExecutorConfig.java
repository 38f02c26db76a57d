package com.example.tuckshop.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for blocking JPA work, kept off the Netty event loop.
 */
@Configuration
public class StoreExecutorConfig {

    @Value("${store.executor.core-pool-size:8}")
    private int corePoolSize;

    @Value("${store.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${store.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean(name = "storeExecutor")
    public ThreadPoolTaskExecutor storeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("store-");
        // Saturation pushes work back onto the submitting thread instead of failing the request
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
