package com.talentscope.search.execution;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:16}") int poolSize) {
        return Executors.newFixedThreadPool(Math.max(2, poolSize), new CustomizableThreadFactory("search-exec-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService cacheExecutor(
        @Value("${search.execution.cache-threads:2}") int threads,
        @Value("${search.execution.cache-queue-size:1000}") int queueSize
    ) {
        int poolSize = Math.max(1, threads);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
            poolSize,
            poolSize,
            30,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(Math.max(1, queueSize)),
            new CustomizableThreadFactory("search-cache-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    @Bean
    public ParallelTaskGroup parallelTaskGroup(@Qualifier("searchExecutor") ExecutorService searchExecutor) {
        return new ParallelTaskGroup(searchExecutor);
    }
}
