package com.proposalmind.core.state;

import com.proposalmind.core.model.AgentStatus;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineKind;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.model.ProposalSettings;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Shared project state of a proposal pipeline run.
 * <p>
 * Section keys use the plain overwrite channel: each one is owned by exactly one
 * agent. {@code agent_statuses} merges per agent and the bookkeeping lists use
 * appender channels so that every level adds to them.
 */
public class ProposalState extends AgentState {

    public static final String INITIAL_IDEA = "initial_idea";
    public static final String USER_INPUT = "user_input";
    public static final String PROPOSAL_TITLE = "proposal_title";
    public static final String SIMILAR_PRODUCTS = "similar_products";
    public static final String REFINED_SCOPE = "refined_scope";
    public static final String BUSINESS_ANALYSIS = "business_analysis";
    public static final String TECHNICAL_SPEC = "technical_spec";
    public static final String PROJECT_PLAN = "project_plan";
    public static final String RESOURCE_PLAN = "resource_plan";
    public static final String FINAL_PROPOSAL = "final_proposal";
    public static final String USER_SETTINGS = "user_settings";
    public static final String BUDGET = "budget";
    public static final String TIMELINE = "timeline";
    public static final String RUN_ID = "run_id";
    public static final String PIPELINE_KIND = "pipeline_kind";
    public static final String LEVELS = "levels";
    public static final String LEVEL_INDEX = "level_index";
    public static final String CURRENT_LEVEL = "current_level";
    public static final String STAGE = "stage";
    public static final String ERROR = "error";
    public static final String FAILURE_KIND = "failure_kind";
    public static final String FAILED_AGENT = "failed_agent";
    public static final String AGENT_STATUSES = "agent_statuses";
    public static final String COMPLETED_AGENTS = "completed_agents";
    public static final String ERRORS = "errors";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Inputs ───────────────────────────────────────────────────
        Map.entry(INITIAL_IDEA,      Channels.base(() -> "")),
        Map.entry(USER_INPUT,        Channels.base(() -> "")),
        Map.entry(USER_SETTINGS,     Channels.base((Reducer<ProposalSettings>) null)),
        Map.entry(BUDGET,            Channels.base(() -> "")),
        Map.entry(TIMELINE,          Channels.base(() -> "")),

        // ── Sections, one owner each ─────────────────────────────────
        Map.entry(PROPOSAL_TITLE,    Channels.base(() -> "")),
        Map.entry(SIMILAR_PRODUCTS,  Channels.base(() -> "")),
        Map.entry(REFINED_SCOPE,     Channels.base(() -> "")),
        Map.entry(BUSINESS_ANALYSIS, Channels.base(() -> "")),
        Map.entry(TECHNICAL_SPEC,    Channels.base(() -> "")),
        Map.entry(PROJECT_PLAN,      Channels.base(() -> "")),
        Map.entry(RESOURCE_PLAN,     Channels.base(() -> "")),
        Map.entry(FINAL_PROPOSAL,    Channels.base((Reducer<Map<String, Object>>) null)),

        // ── Run bookkeeping ──────────────────────────────────────────
        Map.entry(RUN_ID,            Channels.base(() -> "")),
        Map.entry(PIPELINE_KIND,     Channels.base(() -> PipelineKind.EDIT.name())),
        Map.entry(LEVELS,            Channels.base((Supplier<List<List<String>>>) List::of)),
        Map.entry(LEVEL_INDEX,       Channels.base(() -> 0)),
        Map.entry(CURRENT_LEVEL,     Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(STAGE,             Channels.base(() -> PipelineStage.PENDING.name())),
        Map.entry(ERROR,             Channels.base(() -> "")),
        Map.entry(FAILURE_KIND,      Channels.base(() -> FailureKind.NONE.name())),
        Map.entry(FAILED_AGENT,      Channels.base(() -> "")),
        Map.entry(AGENT_STATUSES,    Channels.base(
                (Reducer<Map<String, String>>) ProposalState::mergeStatuses,
                (Supplier<Map<String, String>>) HashMap::new)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry(COMPLETED_AGENTS,  Channels.appender(ArrayList::new)),
        Map.entry(ERRORS,            Channels.appender(ArrayList::new))
    );

    public ProposalState(Map<String, Object> initData) {
        super(initData);
    }

    private static Map<String, String> mergeStatuses(Map<String, String> current, Map<String, String> update) {
        var merged = new HashMap<String, String>();
        if (current != null) merged.putAll(current);
        if (update != null) merged.putAll(update);
        return merged;
    }

    // ── Inputs ───────────────────────────────────────────────────────

    public String initialIdea() {
        return text(INITIAL_IDEA);
    }

    public String userInput() {
        return text(USER_INPUT);
    }

    public ProposalSettings settings() {
        return this.<ProposalSettings>value(USER_SETTINGS).orElse(ProposalSettings.empty());
    }

    public String budget() {
        return text(BUDGET);
    }

    public String timeline() {
        return text(TIMELINE);
    }

    // ── Sections ─────────────────────────────────────────────────────

    public String proposalTitle() {
        return text(PROPOSAL_TITLE);
    }

    /**
     * String value of any key, or {@code ""} when absent. Non-string values are
     * rendered with {@code toString()}.
     */
    public String text(String key) {
        return value(key).map(Object::toString).orElse("");
    }

    public boolean hasContent(String key) {
        return !text(key).isBlank();
    }

    public Optional<Map<String, Object>> finalProposal() {
        return value(FINAL_PROPOSAL);
    }

    // ── Run bookkeeping ──────────────────────────────────────────────

    public String runId() {
        return text(RUN_ID);
    }

    public PipelineKind pipelineKind() {
        return PipelineKind.valueOf(this.<String>value(PIPELINE_KIND).orElse(PipelineKind.EDIT.name()));
    }

    public List<List<String>> levels() {
        return this.<List<List<String>>>value(LEVELS).orElse(List.of());
    }

    public int levelIndex() {
        return this.<Integer>value(LEVEL_INDEX).orElse(0);
    }

    public List<String> currentLevel() {
        return this.<List<String>>value(CURRENT_LEVEL).orElse(List.of());
    }

    public PipelineStage stage() {
        return PipelineStage.valueOf(this.<String>value(STAGE).orElse(PipelineStage.PENDING.name()));
    }

    public Optional<String> error() {
        return this.<String>value(ERROR).filter(e -> !e.isBlank());
    }

    public FailureKind failureKind() {
        return FailureKind.valueOf(this.<String>value(FAILURE_KIND).orElse(FailureKind.NONE.name()));
    }

    public String failedAgent() {
        return text(FAILED_AGENT);
    }

    public Map<String, AgentStatus> agentStatuses() {
        Map<String, String> raw = this.<Map<String, String>>value(AGENT_STATUSES).orElse(Map.of());
        var statuses = new HashMap<String, AgentStatus>();
        raw.forEach((agent, status) -> statuses.put(agent, AgentStatus.valueOf(status)));
        return statuses;
    }

    public List<String> completedAgents() {
        return this.<List<String>>value(COMPLETED_AGENTS).orElse(List.of());
    }

    public List<String> errors() {
        return this.<List<String>>value(ERRORS).orElse(List.of());
    }
}
