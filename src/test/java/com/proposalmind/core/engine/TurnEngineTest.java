package com.proposalmind.core.engine;

import com.proposalmind.agents.StubAgent;
import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.ConversationMessage;
import com.proposalmind.core.model.ExtractedSettings;
import com.proposalmind.core.model.PipelineStage;
import com.proposalmind.core.model.ProposalSettings;
import com.proposalmind.core.model.RateSpec;
import com.proposalmind.core.model.RoutingAction;
import com.proposalmind.core.model.RoutingDecision;
import com.proposalmind.core.routing.RequestRouter;
import com.proposalmind.core.routing.RoutingContext;
import com.proposalmind.core.session.InMemoryProposalSession;
import com.proposalmind.core.settings.ConstraintPropagator;
import com.proposalmind.core.settings.SettingsMerger;
import com.proposalmind.core.state.ProposalState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Whole turns against the real pipeline, with routing and conversation mocked.
 */
class TurnEngineTest {

    private PipelineFixture fixture;
    private RequestRouter router;
    private ConversationResponder responder;
    private InMemoryProposalSession session;
    private StubAgent architect;
    private StubAgent resources;
    private StubAgent manager;

    @BeforeEach
    void setUp() throws Exception {
        architect = StubAgent.writing(AgentId.TECHNICAL_ARCHITECT, "Use Postgres");
        manager = StubAgent.writing(AgentId.PROJECT_MANAGER);
        resources = StubAgent.writing(AgentId.RESOURCE_ALLOCATION);
        fixture = new PipelineFixture(StubAgent.standardSet(architect, manager, resources));
        router = mock(RequestRouter.class);
        responder = mock(ConversationResponder.class);
        session = new InMemoryProposalSession("s-turn");
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private TurnEngine engine() {
        var properties = fixture.properties();
        return new TurnEngine(router, new ConstraintPropagator(), new SettingsMerger(properties),
                fixture.factory(), fixture.engine(), responder, properties);
    }

    private void routeTo(RoutingDecision decision) {
        when(router.route(any(RoutingContext.class))).thenReturn(decision);
    }

    @Test
    @DisplayName("Starting a proposal generates, stores every section and marks the session")
    void startProposal() {
        var result = engine().startProposal(session, "A booking app for dog walkers", null);

        assertTrue(result.succeeded());
        assertEquals(RoutingAction.GENERATE, result.action());
        assertEquals(AgentId.values().length, result.agentsRun().size());
        assertTrue(session.isDocumentGenerated());
        assertEquals(PipelineStage.COMPLETED, session.getStage());
        assertEquals("Use Postgres", session.getPriorTaskOutput(AgentId.TECHNICAL_ARCHITECT).orElseThrow());
        assertEquals("Full proposal generation",
                session.taskOutput(AgentId.BUSINESS_ANALYST).orElseThrow().reason());
        assertEquals("Your proposal 'title content' is ready.", result.reply());
        assertEquals(2, session.getConversationHistory().size());
        assertTrue(session.lastSaved().isPresent());
        verifyNoInteractions(router);
    }

    @Test
    @DisplayName("Generation without an idea fails the prerequisite and runs nothing")
    void generateWithoutIdea() {
        routeTo(RoutingDecision.generate("explicit"));

        var result = engine().handleTurn(session, "generate proposal", null);

        assertFalse(result.succeeded());
        assertTrue(result.reply().contains("An initial project idea is required"));
        assertEquals(0, architect.calls());
        assertEquals(PipelineStage.FAILED, session.getStage());
        assertFalse(session.isDocumentGenerated());
    }

    @Test
    @DisplayName("A single-section edit reruns only that section and feeds it the previous text")
    void singleEdit() {
        session.setInitialIdea("dog walking");
        session.saveTaskOutput(AgentId.TECHNICAL_ARCHITECT, "Use MySQL", "earlier");
        session.markGenerated();
        routeTo(RoutingDecision.edit(List.of("technical_architect"), "stack change", 0.9));

        var result = engine().handleTurn(session, "switch the database to Postgres", null);

        assertTrue(result.succeeded());
        assertEquals(List.of(AgentId.TECHNICAL_ARCHITECT), result.agentsRun());
        assertEquals("Updated: Technical Architect.", result.reply());
        assertEquals(0, manager.calls());
        var snapshot = architect.lastSnapshot();
        assertEquals("Use MySQL", snapshot.text(ProposalState.TECHNICAL_SPEC));
        assertEquals("switch the database to Postgres", snapshot.userInput());
        assertEquals("Edit: switch the database to Postgres",
                session.taskOutput(AgentId.TECHNICAL_ARCHITECT).orElseThrow().reason());
    }

    @Test
    @DisplayName("A budget mentioned in conversation reruns planning and costing with the budget")
    void budgetPropagation() {
        session.setInitialIdea("dog walking");
        session.markGenerated();
        routeTo(new RoutingDecision(RoutingAction.CONVERSATION, List.of(), List.of(), "budget given", 0.8,
                false, new ExtractedSettings(Map.of(), "2500", null)));

        var result = engine().handleTurn(session, "our budget is 2500", null);

        assertEquals(RoutingAction.EDIT, result.action());
        assertEquals(List.of(AgentId.PROJECT_MANAGER, AgentId.RESOURCE_ALLOCATION), result.agentsRun());
        assertEquals("2500", resources.lastSnapshot().budget());
        assertEquals("project_manager content", resources.lastSnapshot().text(ProposalState.PROJECT_PLAN));
        assertEquals("2500", session.getConstraints().budget());
        verifyNoInteractions(responder);
    }

    @Test
    @DisplayName("Rates from a turn are normalised and remembered for later turns")
    void ratesRemembered() {
        session.setInitialIdea("dog walking");
        routeTo(new RoutingDecision(RoutingAction.EDIT, List.of(), List.of(), "rates", 0.9, false,
                new ExtractedSettings(Map.of("senior_engineer", new RateSpec(4000, "week")), null, null)));

        engine().handleTurn(session, "senior engineers cost 4000 a week", null);

        ProposalSettings settings = resources.lastSnapshot().settings();
        assertEquals(100.0, settings.rates().get("senior_engineer"), 1e-9);
        assertEquals(30.0, settings.rates().get("junior_engineer"), 1e-9);
        assertEquals(100.0, session.getConstraints().rates().get("senior_engineer"), 1e-9);

        routeTo(RoutingDecision.edit(List.of("resource_allocation"), "again", 0.9));
        engine().handleTurn(session, "redo the resource plan", null);

        assertEquals(100.0, resources.lastSnapshot().settings().rates().get("senior_engineer"), 1e-9);
    }

    @Test
    @DisplayName("Conversation is answered without running a pipeline")
    void conversation() {
        var decision = RoutingDecision.conversation("question", 0.9);
        routeTo(decision);
        when(responder.respond(same(session), eq("what is ROI?"), same(decision))).thenReturn("ROI is...");

        var result = engine().handleTurn(session, "what is ROI?", null);

        assertTrue(result.succeeded());
        assertEquals("ROI is...", result.reply());
        assertTrue(result.pipelineResult().isEmpty());
        assertTrue(result.agentsRun().isEmpty());
        assertEquals("ROI is...", session.getConversationHistory().get(1).message());
    }

    @Test
    @DisplayName("An unknown section fails the turn before any agent runs")
    void unknownSection() {
        routeTo(RoutingDecision.edit(List.of("marketing"), "bad id", 0.9));

        var result = engine().handleTurn(session, "update marketing", null);

        assertFalse(result.succeeded());
        assertTrue(result.reply().startsWith("I could not complete this update: Agent 'marketing'"));
        assertEquals(0, architect.calls());
    }

    @Test
    @DisplayName("An edit before any idea uses a placeholder idea")
    void placeholderIdea() {
        routeTo(RoutingDecision.edit(List.of("technical_architect"), "stack", 0.9));

        engine().handleTurn(session, "use Kotlin", null);

        assertEquals(TurnEngine.EDIT_IDEA_PLACEHOLDER, architect.lastSnapshot().initialIdea());
    }

    @Test
    @DisplayName("The router sees earlier messages but not the current one")
    void routingHistory() {
        session.addMessage(ConversationMessage.user("first"));
        routeTo(RoutingDecision.conversation("chat", 0.5));
        when(responder.respond(any(), anyString(), any())).thenReturn("ok");

        engine().handleTurn(session, "second", null);

        var context = ArgumentCaptor.forClass(RoutingContext.class);
        verify(router).route(context.capture());
        assertEquals("second", context.getValue().utterance());
        assertEquals(1, context.getValue().recentHistory().size());
        assertEquals("first", context.getValue().recentHistory().get(0).message());
    }
}
