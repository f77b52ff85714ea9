package com.factmarrow.model;

import java.time.Instant;

/**
 * Acknowledgement of a submitted document.
 *
 * @param analysisId id to track the analysis with
 * @param documentId content-derived document id
 * @param status     status at submission time
 * @param message    human-readable hint
 * @param timestamp  submission time
 */
public record AnalysisSubmission(
        String analysisId,
        String documentId,
        String status,
        String message,
        Instant timestamp
) {}
