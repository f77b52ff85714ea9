package com.factmarrow.model;

/**
 * Progress of one analysis through the pipeline.
 * <p>
 * Declaration order is the workflow order: a status may only move to a later
 * constant, or to {@link #FAILED} from any non-terminal status.
 */
public enum AnalysisStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    DOCUMENT_PARSING("document_parsing"),
    CLAIM_EXTRACTION("claim_extraction"),
    VERIFICATION("verification"),
    REPORT_GENERATION("report_generation"),
    QUALITY_REVIEW("quality_review"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    AnalysisStatus(String value) {
        this.value = value;
    }

    /** Lower-case wire/storage value (e.g. {@code claim_extraction}). */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether the workflow may move from this status to {@code next}.
     */
    public boolean canAdvanceTo(AnalysisStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }
}
