package com.factmarrow.service;

import com.factmarrow.model.AnalysisDetail;
import com.factmarrow.model.AnalysisRecord;
import com.factmarrow.model.AnalysisState;
import com.factmarrow.model.AnalysisStatus;
import com.factmarrow.model.AnalysisSubmission;
import com.factmarrow.model.DocumentMetadata;
import com.factmarrow.model.DocumentRecord;
import com.factmarrow.model.StoredDocument;
import com.factmarrow.orchestrator.WorkflowOrchestrator;
import com.factmarrow.repository.AnalysisRepository;
import com.factmarrow.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Accepts documents for analysis, runs the workflow in the background and
 * persists its outcome.
 * <p>
 * Flow:
 * 1. Store the document under its content id
 * 2. Create the document and analysis records (status queued)
 * 3. Run the orchestrator on the analysis executor
 * 4. Persist the returned state
 */
@Service
public class AnalysisSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisSubmissionService.class);

    private final WorkflowOrchestrator orchestrator;
    private final DocumentStorageService storageService;
    private final DocumentRepository documentRepository;
    private final AnalysisRepository analysisRepository;
    private final Executor analysisExecutor;

    public AnalysisSubmissionService(WorkflowOrchestrator orchestrator,
                                     DocumentStorageService storageService,
                                     DocumentRepository documentRepository,
                                     AnalysisRepository analysisRepository,
                                     @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.orchestrator = orchestrator;
        this.storageService = storageService;
        this.documentRepository = documentRepository;
        this.analysisRepository = analysisRepository;
        this.analysisExecutor = analysisExecutor;
    }

    /**
     * Stores the document, creates its records and schedules the analysis.
     *
     * @throws IllegalArgumentException if the filename is missing or the content is empty
     */
    public AnalysisSubmission submit(String filename, byte[] content) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("File must have a filename");
        }
        if (content == null || content.length == 0) {
            throw new IllegalArgumentException("File is empty");
        }

        log.info("Analyzing document: {} ({} bytes)", filename, content.length);
        Instant now = Instant.now();

        StoredDocument stored = storageService.store(filename, content);
        documentRepository.save(new DocumentRecord(
                stored.documentId(), stored.filename(), stored.path().toString(), stored.sizeBytes(), now));
        log.debug("Document record created: {}", stored.documentId());

        String analysisId = UUID.randomUUID().toString();
        analysisRepository.save(AnalysisRecord.queued(analysisId, stored.documentId(), now));
        log.debug("Analysis record created: {}", analysisId);

        String text = new String(content, StandardCharsets.UTF_8);
        try {
            analysisExecutor.execute(() -> run(analysisId, stored, text));
        } catch (RuntimeException e) {
            log.error("Failed to schedule analysis {}: {}", analysisId, e.getMessage(), e);
            markFailed(analysisId, "Failed to schedule analysis: " + e.getMessage());
            throw e;
        }

        return new AnalysisSubmission(
                analysisId,
                stored.documentId(),
                AnalysisStatus.QUEUED.value(),
                "Document queued for analysis. Track progress with /api/analyses/" + analysisId,
                now);
    }

    void run(String analysisId, StoredDocument document, String content) {
        try {
            AnalysisState state = orchestrator.executeAnalysis(
                    analysisId, document.documentId(), document.path().toString(), content);
            persist(state);
            log.info("Analysis {} finished with status {}", analysisId, state.getStatus().value());
        } catch (RuntimeException e) {
            log.error("Background analysis failed for {}: {}", analysisId, e.getMessage(), e);
            markFailed(analysisId, "Background analysis failed: " + e.getMessage());
        }
    }

    /** Writes the final state of an analysis over its record. */
    public void persist(AnalysisState state) {
        AnalysisRecord record = analysisRepository.findById(state.getAnalysisId())
                .orElseGet(() -> AnalysisRecord.queued(state.getAnalysisId(), state.getDocumentId(),
                        state.getStartedAt()));
        analysisRepository.save(record.withResult(state));
        log.debug("Analysis {} persisted: {} claims, {} verifications",
                state.getAnalysisId(), state.getExtractedClaims().size(), state.getVerifications().size());
    }

    private void markFailed(String analysisId, String error) {
        analysisRepository.findById(analysisId)
                .ifPresent(record -> analysisRepository.save(record.withFailure(error, Instant.now())));
    }

    public List<AnalysisRecord> listAnalyses() {
        return analysisRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Detail of an analysis. Errors come from the in-memory state while the
     * orchestrator still holds it, otherwise from the persisted record.
     */
    public Optional<AnalysisDetail> getAnalysis(String analysisId) {
        return analysisRepository.findById(analysisId).map(record -> {
            Optional<AnalysisState> live = orchestrator.getAnalysisState(analysisId);
            String title = documentRepository.findById(record.documentId())
                    .map(DocumentRecord::title)
                    .orElseGet(() -> Optional.ofNullable(record.metadata())
                            .map(DocumentMetadata::title)
                            .orElse(null));
            return new AnalysisDetail(
                    record.id(),
                    record.documentId(),
                    record.status(),
                    title,
                    record.claims().size(),
                    record.verifications().size(),
                    record.reportContent(),
                    record.qaFeedback(),
                    record.approvedForPublication(),
                    live.map(AnalysisState::getErrors).orElse(record.errors()),
                    record.createdAt(),
                    record.completedAt());
        });
    }
}
