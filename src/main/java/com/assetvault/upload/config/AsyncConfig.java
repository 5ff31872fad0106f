package com.assetvault.upload.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Executor for batch initiation. Each file of a batch runs its own unit of work here.
     * When the pool and queue are full the submitting request thread runs the file itself.
     */
    @Bean
    public ThreadPoolTaskExecutor uploadBatchExecutor(UploadProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.batchParallelism());
        executor.setMaxPoolSize(properties.batchParallelism());
        executor.setQueueCapacity(properties.maxBatchSize() * 4);
        executor.setThreadNamePrefix("upload-batch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
