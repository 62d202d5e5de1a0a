package com.proposalmind.core.engine;

import com.proposalmind.core.error.ProposalmindException;
import com.proposalmind.core.events.EventBus;
import com.proposalmind.core.events.ProposalEvent;
import com.proposalmind.core.model.PipelineKind;
import com.proposalmind.core.session.ProposalSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collaborators and outcome of one pipeline run that do not belong in graph state:
 * the session, the progress observer, the prerequisite check and the first
 * failure with its original cause.
 */
public class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private final String runId;
    private final PipelineKind kind;
    private final ProposalSession session;
    private final ProgressListener listener;
    private final PrerequisiteCheck prerequisiteCheck;
    private final EventBus eventBus;
    private final AtomicReference<ProposalmindException> failure = new AtomicReference<>();

    public RunContext(String runId, PipelineKind kind, ProposalSession session,
                      ProgressListener listener, PrerequisiteCheck prerequisiteCheck, EventBus eventBus) {
        this.runId = runId;
        this.kind = kind;
        this.session = session;
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.prerequisiteCheck = prerequisiteCheck != null ? prerequisiteCheck : PrerequisiteCheck.none();
        this.eventBus = eventBus;
    }

    public String runId() { return runId; }

    public PipelineKind kind() { return kind; }

    /** The session the run writes through to, if any. */
    public Optional<ProposalSession> session() {
        return Optional.ofNullable(session);
    }

    public PrerequisiteCheck prerequisiteCheck() { return prerequisiteCheck; }

    /**
     * Notifies the listener and publishes a {@code progress.<stage>} event.
     */
    public void progress(String stage, String message) {
        try {
            listener.onProgress(stage, message);
        } catch (Exception e) {
            log.warn("Progress listener failed on {}: {}", stage, e.getMessage());
        }
        publish("progress." + stage, null, Map.of("message", message));
    }

    public void publish(String eventType, String agentId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(ProposalEvent.of(eventType, runId, agentId, payload));
        }
    }

    /** Keeps only the first failure of the run. */
    public void recordFailure(ProposalmindException error) {
        failure.compareAndSet(null, error);
    }

    public Optional<ProposalmindException> failure() {
        return Optional.ofNullable(failure.get());
    }
}
