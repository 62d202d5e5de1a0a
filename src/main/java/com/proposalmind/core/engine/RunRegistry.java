package com.proposalmind.core.engine;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Active runs by id, so that the singleton graph nodes can reach the
 * collaborators of the run whose state they are processing.
 */
@Component
public class RunRegistry {

    private final ConcurrentHashMap<String, RunContext> runs = new ConcurrentHashMap<>();

    public void open(RunContext run) {
        if (runs.putIfAbsent(run.runId(), run) != null) {
            throw new IllegalStateException("Run " + run.runId() + " is already active");
        }
    }

    public Optional<RunContext> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public RunContext require(String runId) {
        return find(runId).orElseThrow(() -> new IllegalStateException("No active run " + runId));
    }

    public void close(String runId) {
        runs.remove(runId);
    }

    public int activeCount() {
        return runs.size();
    }
}
