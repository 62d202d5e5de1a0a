package com.proposalmind.config;

import com.proposalmind.core.scheduler.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wiring for the pipeline: the agent dependency graph and the bounded worker
 * pool that every level dispatch shares.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public DependencyGraph dependencyGraph() {
        return DependencyGraph.standard();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentExecutor(ProposalmindProperties properties) {
        int size = Math.max(1, properties.getMaxParallel());
        var counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "agent-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        log.info("Agent worker pool sized at {}", size);
        return new ThreadPoolExecutor(size, size, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(), factory);
    }
}
