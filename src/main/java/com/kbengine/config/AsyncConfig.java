package com.kbengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /**
     * Runs the vector and graph legs of a hybrid search side by side.
     */
    @Bean(name = "retrievalTaskExecutor")
    public Executor retrievalTaskExecutor() {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("retrieval-");
        executor.setConcurrencyLimit(10);
        return executor;
    }
}
