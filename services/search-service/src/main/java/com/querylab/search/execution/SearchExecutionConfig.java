package com.querylab.search.execution;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Shared worker pool for pipeline stages that run under a deadline (intent classification, cache I/O).
 */
@Configuration
public class SearchExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService searchExecutor(@Value("${search.execution.pool-size:6}") int poolSize) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("query-pipeline-");
        threadFactory.setDaemon(true);
        return Executors.newFixedThreadPool(Math.max(2, poolSize), threadFactory);
    }

    @Bean
    public Clock searchClock() {
        return Clock.systemUTC();
    }
}
