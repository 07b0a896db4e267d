package com.chainrouter.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: rpc-dispatch-executor runs calls released by the dispatch tick,
 * rpc-batch-executor runs the members of a batch call.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RPC_DISPATCH_EXECUTOR = "rpc-dispatch-executor";
    public static final String RPC_BATCH_EXECUTOR = "rpc-batch-executor";

    @Bean(name = RPC_DISPATCH_EXECUTOR)
    public Executor rpcDispatchExecutor(@Value("${chainrouter.dispatch.executor-threads:8}") int executorThreads) {
        int threads = Math.max(1, executorThreads);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(threads);
        e.setMaxPoolSize(threads);
        e.setThreadNamePrefix("rpc-dispatch-");
        e.initialize();
        return e;
    }

    @Bean(name = RPC_BATCH_EXECUTOR)
    public Executor rpcBatchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(16);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("rpc-batch-");
        e.initialize();
        return e;
    }
}
