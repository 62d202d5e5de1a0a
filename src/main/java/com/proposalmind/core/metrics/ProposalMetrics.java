package com.proposalmind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for routing and pipeline execution.
 */
@Service
public class ProposalMetrics {

    private final MeterRegistry registry;

    public ProposalMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAgentExecution(String agentId, long ms, boolean success) {
        Timer.builder("proposalmind.agent.duration")
                .tag("agent", agentId)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordLevelSize(int size) {
        DistributionSummary.builder("proposalmind.level.size")
                .description("Number of agents dispatched together in one level")
                .register(registry)
                .record(size);
    }

    public void recordPipelineResult(String kind, String outcome) {
        Counter.builder("proposalmind.pipeline.total")
                .tag("kind", kind)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * @param action the routed action
     * @param source which router branch decided: fast_path, greeting, model or fallback
     */
    public void recordRoutingDecision(String action, String source) {
        Counter.builder("proposalmind.routing.decisions")
                .tag("action", action)
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordEvent(String eventType) {
        Counter.builder("proposalmind.events")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }
}
