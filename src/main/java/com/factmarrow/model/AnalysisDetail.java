package com.factmarrow.model;

import java.time.Instant;
import java.util.List;

/**
 * Detail view of one analysis.
 *
 * @param analysisId             analysis id
 * @param documentId             document id
 * @param status                 current status value
 * @param documentTitle          filename of the document, or the extracted title
 * @param claimsCount            number of extracted claims
 * @param verificationsCount     number of verification results
 * @param reportContent          generated report, if any
 * @param qaFeedback             quality reviewer feedback, if any
 * @param approvedForPublication whether the reviewer approved the report
 * @param errors                 recorded errors
 * @param createdAt              submission time
 * @param completedAt            completion time, null while running
 */
public record AnalysisDetail(
        String analysisId,
        String documentId,
        String status,
        String documentTitle,
        int claimsCount,
        int verificationsCount,
        String reportContent,
        String qaFeedback,
        boolean approvedForPublication,
        List<String> errors,
        Instant createdAt,
        Instant completedAt
) {}
