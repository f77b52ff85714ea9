package com.factmarrow.model;

import java.util.List;

/**
 * A named agent as declared in the agent table.
 *
 * @param name        agent name (e.g. {@code fact_extractor})
 * @param model       model identifier, {@code provider/model}
 * @param instruction system instruction for the agent
 * @param subAgents   names of the agents this one coordinates
 */
public record AgentDefinition(
        String name,
        String model,
        String instruction,
        List<String> subAgents
) {
    public AgentDefinition {
        instruction = instruction != null ? instruction : "";
        subAgents = subAgents != null ? List.copyOf(subAgents) : List.of();
    }
}
