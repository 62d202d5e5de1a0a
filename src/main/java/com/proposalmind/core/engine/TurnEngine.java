package com.proposalmind.core.engine;

import com.proposalmind.config.ProposalmindProperties;
import com.proposalmind.core.error.ProposalmindException;
import com.proposalmind.core.logging.MdcContext;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.ConversationMessage;
import com.proposalmind.core.model.FailureKind;
import com.proposalmind.core.model.PipelineKind;
import com.proposalmind.core.model.PipelinePlan;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.model.ProposalSettings;
import com.proposalmind.core.model.RequestKind;
import com.proposalmind.core.model.RoutingAction;
import com.proposalmind.core.model.RoutingDecision;
import com.proposalmind.core.routing.RequestRouter;
import com.proposalmind.core.routing.RoutingContext;
import com.proposalmind.core.session.ProposalSession;
import com.proposalmind.core.settings.ConstraintPropagator;
import com.proposalmind.core.settings.SessionConstraints;
import com.proposalmind.core.settings.SettingsMerger;
import com.proposalmind.core.state.ProposalState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Handles one user turn end to end: route it, apply the settings it carries,
 * then either answer conversationally or plan and run a pipeline and store the
 * resulting sections in the session.
 */
@Service
public class TurnEngine {

    private static final Logger log = LoggerFactory.getLogger(TurnEngine.class);

    static final String EDIT_IDEA_PLACEHOLDER = "Project proposal";

    private final RequestRouter router;
    private final ConstraintPropagator propagator;
    private final SettingsMerger settingsMerger;
    private final PipelineFactory pipelineFactory;
    private final PipelineEngine pipelineEngine;
    private final ConversationResponder responder;
    private final int historyWindow;

    public TurnEngine(RequestRouter router, ConstraintPropagator propagator, SettingsMerger settingsMerger,
                      PipelineFactory pipelineFactory, PipelineEngine pipelineEngine,
                      ConversationResponder responder, ProposalmindProperties properties) {
        this.router = router;
        this.propagator = propagator;
        this.settingsMerger = settingsMerger;
        this.pipelineFactory = pipelineFactory;
        this.pipelineEngine = pipelineEngine;
        this.responder = responder;
        this.historyWindow = properties.getHistoryWindow();
    }

    /**
     * Stores {@code idea} as the session's initial idea and generates the full proposal.
     */
    public TurnResult startProposal(ProposalSession session, String idea, ProgressListener listener) {
        MdcContext.setSession(session.getId());
        try {
            session.setInitialIdea(idea);
            session.addMessage(ConversationMessage.user(idea));
            var decision = RoutingDecision.generate("New proposal from initial idea");
            return runPipeline(session, decision, "", listener);
        } finally {
            MdcContext.clear();
        }
    }

    public TurnResult handleTurn(ProposalSession session, String utterance, ProgressListener listener) {
        MdcContext.setSession(session.getId());
        try {
            log.info("Turn received ({} chars)", utterance.length());
            var history = session.getConversationHistory();
            var recent = history.subList(Math.max(0, history.size() - historyWindow), history.size());
            session.addMessage(ConversationMessage.user(utterance));

            var routed = router.route(new RoutingContext(utterance, session.isDocumentGenerated(), recent));
            var decision = propagator.propagate(routed);

            if (decision.action() == RoutingAction.CONVERSATION) {
                String reply = responder.respond(session, utterance, decision);
                return finish(session, new TurnResult(decision, List.of(), null, reply, null));
            }
            return runPipeline(session, decision, utterance, listener);
        } finally {
            MdcContext.clear();
        }
    }

    private TurnResult runPipeline(ProposalSession session, RoutingDecision decision, String utterance,
                                   ProgressListener listener) {
        var extracted = decision.extractedSettings();
        var remembered = session.getConstraints();
        ProposalSettings settings = settingsMerger.merge(remembered, extracted);
        SessionConstraints constraints = remembered.withTurn(extracted);
        if (!constraints.equals(remembered)) {
            session.setConstraints(constraints);
            log.info("Session constraints updated: rates={}, budget='{}', timeline='{}'",
                    constraints.rates().keySet(), constraints.budget(), constraints.timeline());
        }

        boolean full = decision.action() == RoutingAction.GENERATE;
        PipelinePlan plan;
        try {
            plan = full
                    ? pipelineFactory.fullProposal()
                    : pipelineFactory.edit(decision.taskIds(), RequestKind.forAction(decision.action()),
                            session.isDocumentGenerated());
        } catch (ProposalmindException e) {
            log.warn("Could not plan pipeline for {}: {}", decision.taskIds(), e.getMessage());
            String reply = "I could not complete this update: " + e.getMessage();
            return finish(session, new TurnResult(decision, List.of(), null, reply, e.getMessage()));
        }

        var input = initialState(session, utterance, settings, constraints, plan.kind());
        var check = full ? PrerequisiteCheck.requireInitialIdea() : PrerequisiteCheck.none();
        var result = pipelineEngine.execute(plan, input, check, session, listener);

        if (result.succeeded()) {
            storeSections(session, plan, result.state(), full ? "Full proposal generation" : "Edit: " + utterance);
            if (full) {
                session.markGenerated();
                session.setStage(PipelineStage.COMPLETED);
            }
            saveQuietly(session);
            return finish(session, new TurnResult(decision, plan.agents(), result, successReply(plan, result), null));
        }

        if (full) {
            session.setStage(PipelineStage.FAILED);
        }
        String reason = result.failureMessage().orElse("unknown error");
        String reply = result.failureKind() == FailureKind.INCOMPLETE
                ? "The proposal could not be compiled. " + reason
                : "I could not complete this update: " + reason;
        return finish(session, new TurnResult(decision, plan.agents(), result, reply, reason));
    }

    Map<String, Object> initialState(ProposalSession session, String utterance, ProposalSettings settings,
                                     SessionConstraints constraints, PipelineKind kind) {
        var input = new HashMap<String, Object>();
        String idea = session.getInitialIdea();
        if (idea.isBlank() && kind == PipelineKind.EDIT) {
            idea = EDIT_IDEA_PLACEHOLDER;
        }
        input.put(ProposalState.INITIAL_IDEA, idea);
        input.put(ProposalState.USER_INPUT, utterance);
        input.put(ProposalState.USER_SETTINGS, settings);
        input.put(ProposalState.BUDGET, constraints.budget());
        input.put(ProposalState.TIMELINE, constraints.timeline());
        input.put(ProposalState.PROPOSAL_TITLE, session.getDocumentTitle());
        // Agents rewrite their previous section and read upstream sections they are not rerunning
        for (var agent : AgentId.contentAgents()) {
            session.getPriorTaskOutput(agent)
                    .ifPresent(content -> input.put(agent.primaryOutputKey(), content));
        }
        return input;
    }

    private void storeSections(ProposalSession session, PipelinePlan plan, ProposalState state, String reason) {
        for (var agent : plan.agents()) {
            if (agent.isSink()) {
                continue;
            }
            String content = state.text(agent.primaryOutputKey());
            if (!content.isBlank()) {
                session.saveTaskOutput(agent, content, reason);
            }
        }
    }

    private String successReply(PipelinePlan plan, PipelineResult result) {
        if (plan.kind() == PipelineKind.FULL_PROPOSAL) {
            String title = result.state().proposalTitle();
            return "Your proposal" + (title.isBlank() ? "" : " '" + title + "'") + " is ready.";
        }
        return "Updated: " + plan.agents().stream()
                .map(AgentId::displayName)
                .collect(Collectors.joining(", ")) + ".";
    }

    private TurnResult finish(ProposalSession session, TurnResult result) {
        session.addMessage(ConversationMessage.assistant(result.reply()));
        log.info("Turn finished: action={}, agents={}, ok={}", result.action().wireName(),
                result.agentsRun(), result.succeeded());
        return result;
    }

    private void saveQuietly(ProposalSession session) {
        try {
            session.save();
        } catch (Exception e) {
            log.warn("Session save failed: {}", e.getMessage());
        }
    }
}
