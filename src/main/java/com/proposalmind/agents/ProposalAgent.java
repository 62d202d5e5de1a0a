package com.proposalmind.agents;

import com.proposalmind.core.model.AgentId;
import com.proposalmind.core.state.ProposalState;

import java.util.List;
import java.util.Map;

/**
 * A unit of work that contributes one or more sections to a proposal.
 * <p>
 * Agents receive a private snapshot of the state taken when their level started
 * and return a partial update. They must not mutate the snapshot, and running
 * twice on the same snapshot should give an equivalent result. Empty optional
 * inputs are filled with placeholder text; an agent only throws when it cannot
 * produce anything at all.
 */
public interface ProposalAgent {

    AgentId id();

    Map<String, Object> run(ProposalState snapshot);

    default List<String> outputKeys() {
        return id().outputKeys();
    }
}
