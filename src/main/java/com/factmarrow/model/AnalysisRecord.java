package com.factmarrow.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of an analysis: created when a document is submitted,
 * updated as the workflow progresses and overwritten with the final state.
 */
@Document(collection = "analyses")
public record AnalysisRecord(
        @Id String id,
        @Indexed String documentId,
        String analysisType,
        @Indexed String status,
        DocumentMetadata metadata,
        List<ExtractedClaim> claims,
        List<VerificationResult> verifications,
        String reportContent,
        String reportQuality,
        String qaFeedback,
        Double qaConfidence,
        boolean approvedForPublication,
        List<String> errors,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    public static final String FULL_ASSESSMENT = "full_assessment";
    public static final String QUALITY_DRAFT = "draft";
    public static final String QUALITY_PENDING_REVIEW = "pending_review";

    public AnalysisRecord {
        claims = claims != null ? List.copyOf(claims) : List.of();
        verifications = verifications != null ? List.copyOf(verifications) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    /** A freshly submitted analysis, status {@code queued}. */
    public static AnalysisRecord queued(String id, String documentId, Instant createdAt) {
        return new AnalysisRecord(id, documentId, FULL_ASSESSMENT, AnalysisStatus.QUEUED.value(),
                null, List.of(), List.of(), null, null, null, null, false, List.of(),
                createdAt, null, null);
    }

    /** Creates a copy with a new status. */
    public AnalysisRecord withStatus(AnalysisStatus newStatus) {
        return new AnalysisRecord(id, documentId, analysisType, newStatus.value(), metadata, claims,
                verifications, reportContent, reportQuality, qaFeedback, qaConfidence,
                approvedForPublication, errors, createdAt, startedAt, completedAt);
    }

    /** Creates a copy marked failed with an additional error. */
    public AnalysisRecord withFailure(String error, Instant failedAt) {
        List<String> allErrors = new ArrayList<>(errors);
        allErrors.add(error);
        return new AnalysisRecord(id, documentId, analysisType, AnalysisStatus.FAILED.value(), metadata, claims,
                verifications, reportContent, reportQuality, qaFeedback, qaConfidence,
                approvedForPublication, allErrors, createdAt, startedAt,
                completedAt != null ? completedAt : failedAt);
    }

    /** Creates a copy holding everything the finished workflow produced. */
    public AnalysisRecord withResult(AnalysisState state) {
        QualityAssessment qa = state.getQualityAssessment().orElse(null);
        String report = state.getReportContent().orElse(null);
        return new AnalysisRecord(
                id,
                documentId,
                analysisType,
                state.getStatus().value(),
                state.getDocumentMetadata().orElse(null),
                state.getExtractedClaims(),
                state.getVerifications(),
                report,
                report == null ? null
                        : state.getStatus() == AnalysisStatus.COMPLETED ? QUALITY_DRAFT : QUALITY_PENDING_REVIEW,
                qa != null ? qa.feedback() : null,
                qa != null ? qa.confidence() : null,
                qa != null && qa.approvedForPublication(),
                state.getErrors(),
                createdAt,
                state.getStartedAt(),
                state.getCompletedAt().orElse(null));
    }
}
