package com.factmarrow.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The six agent roles of the pipeline. The id is the agent name used in the
 * agent table and in the per-agent audit log.
 */
public enum AgentRole {
    ROOT_COORDINATOR("root"),
    DOCUMENT_PROCESSOR("document_processor"),
    FACT_EXTRACTOR("fact_extractor"),
    VERIFICATION_SPECIALIST("verification_specialist"),
    REPORT_WRITER("report_writer"),
    QUALITY_REVIEWER("quality_reviewer");

    private final String id;

    AgentRole(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<AgentRole> fromId(String id) {
        return Arrays.stream(values())
                .filter(role -> role.id.equals(id))
                .findFirst();
    }
}
