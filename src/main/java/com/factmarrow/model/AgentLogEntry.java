package com.factmarrow.model;

import java.time.Instant;

/**
 * One line of an agent's audit log within an analysis.
 *
 * @param sequence  position of the entry across all agents of the analysis
 * @param timestamp when the entry was recorded
 * @param message   log message
 */
public record AgentLogEntry(long sequence, Instant timestamp, String message) {

    @Override
    public String toString() {
        return "[" + timestamp + "] " + message;
    }
}
