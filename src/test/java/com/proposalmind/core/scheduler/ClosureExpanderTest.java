package com.proposalmind.core.scheduler;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.model.RequestKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.proposalmind.core.model.AgentId.*;
import static org.junit.jupiter.api.Assertions.*;

class ClosureExpanderTest {

    private ClosureExpander expander;

    @BeforeEach
    void setUp() {
        expander = new ClosureExpander(DependencyGraph.standard());
    }

    @Nested
    @DisplayName("Single explicit edit")
    class SingleEdit {

        @Test
        @DisplayName("Every single agent is returned unchanged")
        void neverExpanded() {
            for (var agent : AgentId.values()) {
                for (boolean generated : new boolean[]{true, false}) {
                    assertEquals(List.of(agent),
                            expander.expand(List.of(agent), RequestKind.EXPLICIT_EDIT, generated),
                            agent.id());
                }
            }
        }

        @Test
        @DisplayName("{title} under edit stays [title]")
        void titleOnly() {
            assertEquals(List.of(TITLE), expander.expand(List.of(TITLE), RequestKind.EXPLICIT_EDIT, true));
        }

        @Test
        @DisplayName("A duplicated single agent counts as one")
        void duplicatedSingle() {
            assertEquals(List.of(SCOPE_REFINEMENT),
                    expander.expand(List.of(SCOPE_REFINEMENT, SCOPE_REFINEMENT), RequestKind.EXPLICIT_EDIT, true));
        }
    }

    @Nested
    @DisplayName("Forward closure")
    class Closure {

        @Test
        @DisplayName("Business analyst expands to [BA, TA, PM, RA]")
        void businessAnalystChain() {
            assertEquals(List.of(BUSINESS_ANALYST, TECHNICAL_ARCHITECT, PROJECT_MANAGER, RESOURCE_ALLOCATION),
                    expander.expand(List.of(BUSINESS_ANALYST), RequestKind.FULL_GENERATION, true));
        }

        @Test
        @DisplayName("Technical architect expands to [TA, PM, RA] without pulling in its own dependencies")
        void technicalArchitectChain() {
            assertEquals(List.of(TECHNICAL_ARCHITECT, PROJECT_MANAGER, RESOURCE_ALLOCATION),
                    expander.expand(List.of(TECHNICAL_ARCHITECT, PROJECT_MANAGER), RequestKind.EXPLICIT_EDIT, true));
        }

        @Test
        @DisplayName("Scope refinement pulls in every downstream content agent but not the sink")
        void scopeRefinement() {
            assertEquals(List.of(SCOPE_REFINEMENT, BUSINESS_ANALYST, TECHNICAL_ARCHITECT,
                            PROJECT_MANAGER, RESOURCE_ALLOCATION),
                    expander.expand(List.of(SCOPE_REFINEMENT), RequestKind.FULL_GENERATION, true));
        }

        @Test
        @DisplayName("Multi-agent edit is expanded and returned in declaration order")
        void multiEditCanonicalOrder() {
            assertEquals(List.of(BUSINESS_ANALYST, TECHNICAL_ARCHITECT, PROJECT_MANAGER, RESOURCE_ALLOCATION),
                    expander.expand(List.of(TECHNICAL_ARCHITECT, BUSINESS_ANALYST), RequestKind.EXPLICIT_EDIT, true));
        }

        @Test
        @DisplayName("Expansion applies even before the first full generation")
        void expandsWithoutPriorGeneration() {
            assertEquals(List.of(PROJECT_MANAGER, RESOURCE_ALLOCATION),
                    expander.expand(List.of(PROJECT_MANAGER, RESOURCE_ALLOCATION), RequestKind.EXPLICIT_EDIT, false));
            assertEquals(List.of(TITLE, PROJECT_MANAGER, RESOURCE_ALLOCATION),
                    expander.expand(List.of(PROJECT_MANAGER, TITLE), RequestKind.EXPLICIT_EDIT, false));
        }

        @Test
        @DisplayName("An explicitly requested sink is kept")
        void sinkKeptWhenRequested() {
            assertEquals(List.of(TITLE, FINAL_COMPILATION),
                    expander.expand(List.of(FINAL_COMPILATION, TITLE), RequestKind.FULL_GENERATION, true));
        }

        @Test
        @DisplayName("Every subset expands to a closed, duplicate-free, canonically ordered set")
        void closedForAllSubsets() {
            var graph = DependencyGraph.standard();
            var all = AgentId.values();
            for (int mask = 1; mask < (1 << all.length); mask++) {
                var requested = new ArrayList<AgentId>();
                for (int bit = 0; bit < all.length; bit++) {
                    if ((mask & (1 << bit)) != 0) requested.add(all[bit]);
                }
                var result = expander.expand(requested, RequestKind.FULL_GENERATION, true);

                assertEquals(new HashSet<>(result).size(), result.size(), "duplicates for " + requested);
                var sorted = new ArrayList<>(result);
                sorted.sort(Comparator.naturalOrder());
                assertEquals(sorted, result, "order for " + requested);
                assertTrue(result.containsAll(requested));
                Set<AgentId> included = new HashSet<>(result);
                for (var agent : result) {
                    for (var dependent : graph.dependentsOf(agent)) {
                        if (!dependent.isSink()) {
                            assertTrue(included.contains(dependent),
                                    dependent + " missing from expansion of " + requested);
                        }
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Empty request expands to nothing")
    void emptyRequest() {
        assertTrue(expander.expand(List.of(), RequestKind.FULL_GENERATION, true).isEmpty());
    }
}
