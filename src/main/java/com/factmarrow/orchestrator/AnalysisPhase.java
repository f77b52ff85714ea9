package com.factmarrow.orchestrator;

import com.factmarrow.model.AgentRole;
import com.factmarrow.model.AnalysisStatus;

/**
 * The five pipeline phases, in execution order.
 */
public enum AnalysisPhase {
    DOCUMENT_PROCESSING("Document processing", AnalysisStatus.DOCUMENT_PARSING, AgentRole.DOCUMENT_PROCESSOR),
    CLAIM_EXTRACTION("Fact extraction", AnalysisStatus.CLAIM_EXTRACTION, AgentRole.FACT_EXTRACTOR),
    VERIFICATION("Verification", AnalysisStatus.VERIFICATION, AgentRole.VERIFICATION_SPECIALIST),
    REPORT_GENERATION("Report generation", AnalysisStatus.REPORT_GENERATION, AgentRole.REPORT_WRITER),
    QUALITY_REVIEW("Quality review", AnalysisStatus.QUALITY_REVIEW, AgentRole.QUALITY_REVIEWER);

    private final String label;
    private final AnalysisStatus status;
    private final AgentRole role;

    AnalysisPhase(String label, AnalysisStatus status, AgentRole role) {
        this.label = label;
        this.status = status;
        this.role = role;
    }

    /** Human-readable name, used in log lines and error strings. */
    public String label() {
        return label;
    }

    /** Status the analysis takes when the phase starts. */
    public AnalysisStatus status() {
        return status;
    }

    public AgentRole role() {
        return role;
    }

    public String agentName() {
        return role.id();
    }

    /** 1-based position of the phase, for {@code [n/5]} log markers. */
    public int step() {
        return ordinal() + 1;
    }
}
