package com.nodewatch.rpcextractor.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler for base ticks, so per-method due counters are only ever touched by one thread.
 */
@Configuration
public class SchedulerConfig {

    public static final String TICK_SCHEDULER = "tick-scheduler";

    @Bean(name = TICK_SCHEDULER)
    public ThreadPoolTaskScheduler tickScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("tick-");
        s.initialize();
        return s;
    }
}
