package com.factmarrow.exception;

/**
 * A workflow phase needs an executor that was never initialized at startup.
 */
public class ExecutorNotConfiguredException extends FactMarrowException {

    private final String agentName;

    public ExecutorNotConfiguredException(String agentName) {
        super("No executor configured for agent '" + agentName + "'");
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
