package com.factmarrow.exception;

/**
 * An agent task failed: the model call errored, timed out, or returned output
 * that could not be decoded.
 */
public class ExecutionFailedException extends FactMarrowException {

    private final String agentName;

    public ExecutionFailedException(String agentName, String message) {
        super(message);
        this.agentName = agentName;
    }

    public ExecutionFailedException(String agentName, String message, Throwable cause) {
        super(message, cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
