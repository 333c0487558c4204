package com.gladlabs.orchestrator.core.engine;

import com.gladlabs.orchestrator.core.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and timing beans for the engine.
 * <p>
 * Executions run one per worker on a fixed pool. Provider calls run on a separate
 * cached pool so a worker can stop waiting on an attempt without interrupting it.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor(OrchestratorProperties properties) {
        int workers = Math.max(1, properties.getEngine().getMaxConcurrentExecutions());
        log.info("Starting orchestration pool with {} worker(s)", workers);
        return Executors.newFixedThreadPool(workers, daemonThreads("orchestrator-worker-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService providerCallExecutor() {
        return Executors.newCachedThreadPool(daemonThreads("provider-call-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryBackoff retryBackoff(OrchestratorProperties properties) {
        var retry = properties.getRetry();
        return new RetryBackoff(retry.getBaseDelay(), retry.getMaxDelay(), retry.getJitter());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
