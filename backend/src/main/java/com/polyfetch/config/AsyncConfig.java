package com.polyfetch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Named pools for backend fetches: one worker per backend, plus a single thread that fires fetch timeouts.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";
    public static final String FETCH_TIMEOUT_SCHEDULER = "fetch-timeout-scheduler";

    @Bean(name = FETCH_EXECUTOR)
    public Executor fetchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(3);
        e.setMaxPoolSize(3);
        e.setThreadNamePrefix("fetch-");
        e.initialize();
        return e;
    }

    @Bean(name = FETCH_TIMEOUT_SCHEDULER)
    public ThreadPoolTaskScheduler fetchTimeoutScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("fetch-timeout-");
        s.initialize();
        return s;
    }
}
