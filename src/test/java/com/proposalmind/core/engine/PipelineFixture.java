package com.proposalmind.core.engine;

import com.proposalmind.agents.AgentRegistry;
import com.proposalmind.agents.ProposalAgent;
import com.proposalmind.config.ProposalmindProperties;
import com.proposalmind.core.events.EventBus;
import com.proposalmind.core.graph.ProposalGraph;
import com.proposalmind.core.metrics.ProposalMetrics;
import com.proposalmind.core.nodes.DispatchLevelNode;
import com.proposalmind.core.nodes.FinishPipelineNode;
import com.proposalmind.core.nodes.ScheduleLevelNode;
import com.proposalmind.core.nodes.ValidatePrerequisitesNode;
import com.proposalmind.core.scheduler.ClosureExpander;
import com.proposalmind.core.scheduler.DependencyGraph;
import com.proposalmind.core.scheduler.LevelPlanner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * The real graph, nodes and engine wired by hand around a given set of agents.
 */
public class PipelineFixture implements AutoCloseable {

    private final ProposalmindProperties properties = new ProposalmindProperties();
    private final RunRegistry runs = new RunRegistry();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final ProposalMetrics metrics = new ProposalMetrics(meterRegistry);
    private final EventBus eventBus = new EventBus();
    private final ExecutorService executor = Executors.newFixedThreadPool(4);
    private final PipelineEngine engine;
    private final PipelineFactory factory;

    public PipelineFixture(List<ProposalAgent> agents) throws Exception {
        var registry = new AgentRegistry(agents);
        var graph = new ProposalGraph(
                new ValidatePrerequisitesNode(runs),
                new ScheduleLevelNode(runs, metrics),
                new DispatchLevelNode(registry, executor, runs, metrics),
                new FinishPipelineNode(),
                properties);
        this.engine = new PipelineEngine(graph, runs, eventBus, metrics);
        var dependencies = DependencyGraph.standard();
        this.factory = new PipelineFactory(new ClosureExpander(dependencies), new LevelPlanner(dependencies));
    }

    public PipelineEngine engine() { return engine; }

    public PipelineFactory factory() { return factory; }

    public RunRegistry runs() { return runs; }

    public EventBus eventBus() { return eventBus; }

    public SimpleMeterRegistry meterRegistry() { return meterRegistry; }

    public ProposalMetrics metrics() { return metrics; }

    public ProposalmindProperties properties() { return properties; }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
