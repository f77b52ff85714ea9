package com.factmarrow.model;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable record of one analysis while it moves through the pipeline.
 * <p>
 * Written only by the workflow run that owns it. Readers on other threads
 * (status endpoints) go through the synchronized accessors, which return copies.
 */
public class AnalysisState {

    private final String analysisId;
    private final String documentId;
    private final Clock clock;
    private final Instant startedAt;

    private AnalysisStatus status = AnalysisStatus.QUEUED;
    private DocumentMetadata documentMetadata;
    private final List<ExtractedClaim> extractedClaims = new ArrayList<>();
    private final List<VerificationResult> verifications = new ArrayList<>();
    private String reportContent;
    private QualityAssessment qualityAssessment;
    private final List<String> errors = new ArrayList<>();
    private Instant completedAt;
    private final Map<String, List<AgentLogEntry>> agentLogs = new LinkedHashMap<>();
    private long logSequence;

    public AnalysisState(String analysisId, String documentId, Clock clock) {
        this.analysisId = analysisId;
        this.documentId = documentId;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    // ── Status ──────────────────────────────────────────────────────────────

    /**
     * Moves to a later non-terminal status.
     *
     * @throws IllegalStateException if the move is backwards, terminal, or the state is already terminal
     */
    public synchronized void advanceTo(AnalysisStatus next) {
        if (next.isTerminal()) {
            throw new IllegalStateException("Use complete() or fail() to reach " + next);
        }
        requireTransition(next);
        status = next;
    }

    /** Marks the analysis completed and stamps the completion time. */
    public synchronized void complete() {
        requireTransition(AnalysisStatus.COMPLETED);
        status = AnalysisStatus.COMPLETED;
        completedAt = clock.instant();
    }

    /** Records the error, marks the analysis failed and stamps the completion time. */
    public synchronized void fail(String error) {
        requireTransition(AnalysisStatus.FAILED);
        errors.add(error);
        status = AnalysisStatus.FAILED;
        completedAt = clock.instant();
    }

    private void requireTransition(AnalysisStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException(
                    "Analysis " + analysisId + " cannot move from " + status + " to " + next);
        }
    }

    // ── Phase outputs ───────────────────────────────────────────────────────

    public synchronized void setDocumentMetadata(DocumentMetadata metadata) {
        if (documentMetadata != null) {
            throw new IllegalStateException("Document metadata already set for analysis " + analysisId);
        }
        this.documentMetadata = metadata;
    }

    public synchronized void addClaim(ExtractedClaim claim) {
        if (!verifications.isEmpty()) {
            throw new IllegalStateException("Claims cannot be added once verification has produced results");
        }
        extractedClaims.add(claim);
    }

    public synchronized void addVerification(VerificationResult verification) {
        if (verifications.size() >= extractedClaims.size()) {
            throw new IllegalStateException("More verifications than extracted claims for analysis " + analysisId);
        }
        verifications.add(verification);
    }

    public synchronized void setReportContent(String reportContent) {
        this.reportContent = reportContent;
    }

    public synchronized void setQualityAssessment(QualityAssessment qualityAssessment) {
        this.qualityAssessment = qualityAssessment;
    }

    // ── Audit trail ─────────────────────────────────────────────────────────

    public synchronized void addLog(String agent, String message) {
        agentLogs.computeIfAbsent(agent, k -> new ArrayList<>())
                .add(new AgentLogEntry(logSequence++, clock.instant(), message));
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    // ── Read ────────────────────────────────────────────────────────────────

    public String getAnalysisId() {
        return analysisId;
    }

    public String getDocumentId() {
        return documentId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized AnalysisStatus getStatus() {
        return status;
    }

    public synchronized Optional<DocumentMetadata> getDocumentMetadata() {
        return Optional.ofNullable(documentMetadata);
    }

    public synchronized List<ExtractedClaim> getExtractedClaims() {
        return List.copyOf(extractedClaims);
    }

    public synchronized List<VerificationResult> getVerifications() {
        return List.copyOf(verifications);
    }

    public synchronized Optional<String> getReportContent() {
        return Optional.ofNullable(reportContent);
    }

    public synchronized Optional<QualityAssessment> getQualityAssessment() {
        return Optional.ofNullable(qualityAssessment);
    }

    /** Convenience accessor for the reviewer's feedback text. */
    public synchronized Optional<String> getQaFeedback() {
        return Optional.ofNullable(qualityAssessment).map(QualityAssessment::feedback);
    }

    public synchronized List<String> getErrors() {
        return List.copyOf(errors);
    }

    public synchronized Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    public synchronized Map<String, List<AgentLogEntry>> getAgentLogs() {
        Map<String, List<AgentLogEntry>> copy = new LinkedHashMap<>();
        agentLogs.forEach((agent, entries) -> copy.put(agent, List.copyOf(entries)));
        return copy;
    }

    public synchronized List<AgentLogEntry> getAgentLog(String agent) {
        return List.copyOf(agentLogs.getOrDefault(agent, List.of()));
    }
}
