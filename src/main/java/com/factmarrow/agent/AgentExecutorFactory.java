package com.factmarrow.agent;

import com.factmarrow.model.AgentDefinition;

/**
 * Creates the executor of an agent from its definition.
 */
@FunctionalInterface
public interface AgentExecutorFactory {

    AgentExecutor create(AgentDefinition definition);
}
