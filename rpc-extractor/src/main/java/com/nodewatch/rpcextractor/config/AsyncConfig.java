package com.nodewatch.rpcextractor.config;

import com.nodewatch.rpcextractor.catalog.MethodCatalog;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Named pool for RPC fetches. One thread per catalog method: methods never overlap with themselves,
 * so this is the maximum number of concurrent fetches.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "rpc-fetch-executor";

    @Bean(name = FETCH_EXECUTOR)
    public ThreadPoolTaskExecutor rpcFetchExecutor(MethodCatalog methodCatalog, ExtractorProperties properties) {
        int threads = Math.max(1, methodCatalog.size());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("rpc-fetch-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationMillis(properties.getRpcTimeout().plus(properties.getShutdownGrace()).toMillis());
        e.initialize();
        return e;
    }
}
