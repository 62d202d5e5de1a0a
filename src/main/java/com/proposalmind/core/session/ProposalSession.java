package com.proposalmind.core.session;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.ConversationMessage;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.settings.SessionConstraints;

import java.util.List;
import java.util.Optional;

/**
 * The document a user is working on, as seen by the orchestrator.
 * <p>
 * Storage is the implementation's concern. The title setter and {@link #save()}
 * may be called from agent worker threads while a level is still running, so
 * implementations must tolerate concurrent callers.
 */
public interface ProposalSession {

    String getId();

    List<ConversationMessage> getConversationHistory();

    void addMessage(ConversationMessage message);

    String getInitialIdea();

    void setInitialIdea(String initialIdea);

    boolean isDocumentGenerated();

    void markGenerated();

    String getDocumentTitle();

    void setDocumentTitle(String title);

    PipelineStage getStage();

    void setStage(PipelineStage stage);

    Optional<String> getPriorTaskOutput(AgentId agentId);

    void saveTaskOutput(AgentId agentId, String content, String reason);

    /** Rates, budget and timeline remembered for this document only. */
    SessionConstraints getConstraints();

    void setConstraints(SessionConstraints constraints);

    /**
     * Persists the session. Best effort: callers log and continue on failure.
     */
    void save();
}
