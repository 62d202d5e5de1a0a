package com.proposalmind.core.session;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.ConversationMessage;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.settings.SessionConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local session. {@link #save()} only records when it was last called.
 */
public class InMemoryProposalSession implements ProposalSession {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProposalSession.class);

    /**
     * One stored section version.
     *
     * @param content the section text
     * @param reason  why it was produced (e.g. "Full proposal generation")
     * @param savedAt when it was stored
     */
    public record TaskOutput(String content, String reason, Instant savedAt) {}

    private final String id;
    private final CopyOnWriteArrayList<ConversationMessage> history = new CopyOnWriteArrayList<>();
    private final Map<AgentId, TaskOutput> outputs = new ConcurrentHashMap<>();
    private volatile String initialIdea = "";
    private volatile String documentTitle = "";
    private volatile boolean generated;
    private volatile PipelineStage stage = PipelineStage.PENDING;
    private volatile SessionConstraints constraints = SessionConstraints.EMPTY;
    private volatile Instant lastSaved;

    public InMemoryProposalSession() {
        this(UUID.randomUUID().toString());
    }

    public InMemoryProposalSession(String id) {
        this.id = id;
    }

    @Override
    public String getId() { return id; }

    @Override
    public List<ConversationMessage> getConversationHistory() {
        return List.copyOf(history);
    }

    @Override
    public void addMessage(ConversationMessage message) {
        history.add(message);
    }

    @Override
    public String getInitialIdea() { return initialIdea; }

    @Override
    public void setInitialIdea(String initialIdea) {
        this.initialIdea = initialIdea != null ? initialIdea : "";
    }

    @Override
    public boolean isDocumentGenerated() { return generated; }

    @Override
    public void markGenerated() { this.generated = true; }

    @Override
    public String getDocumentTitle() { return documentTitle; }

    @Override
    public void setDocumentTitle(String title) {
        this.documentTitle = title != null ? title : "";
    }

    @Override
    public PipelineStage getStage() { return stage; }

    @Override
    public void setStage(PipelineStage stage) { this.stage = stage; }

    @Override
    public Optional<String> getPriorTaskOutput(AgentId agentId) {
        return Optional.ofNullable(outputs.get(agentId)).map(TaskOutput::content);
    }

    @Override
    public void saveTaskOutput(AgentId agentId, String content, String reason) {
        outputs.put(agentId, new TaskOutput(content, reason, Instant.now()));
        log.debug("Stored output of {} ({} chars): {}", agentId, content.length(), reason);
    }

    public Optional<TaskOutput> taskOutput(AgentId agentId) {
        return Optional.ofNullable(outputs.get(agentId));
    }

    @Override
    public SessionConstraints getConstraints() { return constraints; }

    @Override
    public void setConstraints(SessionConstraints constraints) {
        this.constraints = constraints != null ? constraints : SessionConstraints.EMPTY;
    }

    @Override
    public void save() {
        lastSaved = Instant.now();
    }

    public Optional<Instant> lastSaved() {
        return Optional.ofNullable(lastSaved);
    }
}
