package com.factmarrow.orchestrator;

import com.factmarrow.agent.AgentExecutor;
import com.factmarrow.agent.AgentExecutorFactory;
import com.factmarrow.agent.AgentRegistry;
import com.factmarrow.exception.ExecutorNotConfiguredException;
import com.factmarrow.model.AgentRole;
import com.factmarrow.model.AnalysisState;
import com.factmarrow.model.AnalysisStatus;
import com.factmarrow.model.DocumentMetadata;
import com.factmarrow.model.ExtractedClaim;
import com.factmarrow.model.QualityAssessment;
import com.factmarrow.model.VerificationResult;
import com.factmarrow.tool.ToolSessionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives an analysis through the five phases.
 * <p>
 * Pipeline:
 * 1. Document processing (metadata)
 * 2. Claim extraction
 * 3. Verification, one call per claim, results kept in claim order
 * 4. Report generation
 * 5. Quality review
 * <p>
 * Apart from rejecting a null analysis id, {@link #executeAnalysis} never throws:
 * a failing phase records one error string, moves the analysis to
 * {@link AnalysisStatus#FAILED} and stops the pipeline.
 * In-flight analyses cannot be cancelled.
 */
public class WorkflowOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowOrchestrator.class);

    /** Agent name used for workflow-level log entries. */
    public static final String ORCHESTRATOR_LOG = "orchestrator";

    private static final int PHASES = AnalysisPhase.values().length;

    private final AgentRegistry agentRegistry;
    private final ToolSessionProvider toolSessionProvider;
    private final Map<String, AgentExecutor> executors;
    private final ActiveAnalysisTable activeAnalyses;
    private final List<AnalysisProgressListener> listeners;
    private final AgentResultDecoder decoder;
    private final int verificationConcurrency;
    private final Clock clock;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public WorkflowOrchestrator(AgentRegistry agentRegistry,
                                ToolSessionProvider toolSessionProvider,
                                AgentExecutorFactory executorFactory,
                                ActiveAnalysisTable activeAnalyses,
                                List<AnalysisProgressListener> listeners,
                                int verificationConcurrency,
                                Clock clock) {
        this.agentRegistry = agentRegistry;
        this.toolSessionProvider = toolSessionProvider;
        this.activeAnalyses = activeAnalyses;
        this.listeners = List.copyOf(listeners);
        this.decoder = new AgentResultDecoder();
        this.verificationConcurrency = Math.max(1, verificationConcurrency);
        this.clock = clock;
        this.executors = Collections.unmodifiableMap(initializeExecutors(executorFactory));
        checkConfiguration();
    }

    private Map<String, AgentExecutor> initializeExecutors(AgentExecutorFactory executorFactory) {
        Map<String, AgentExecutor> initialized = new LinkedHashMap<>();
        for (String agentName : agentRegistry.names()) {
            try {
                initialized.put(agentName, executorFactory.create(agentRegistry.get(agentName)));
                log.info("Initialized executor for agent: {}", agentName);
            } catch (RuntimeException e) {
                log.error("Failed to initialize executor for {}: {}", agentName, e.getMessage(), e);
            }
        }
        return initialized;
    }

    private void checkConfiguration() {
        String root = AgentRole.ROOT_COORDINATOR.id();
        if (agentRegistry.contains(root)) {
            for (String subAgent : agentRegistry.subAgents(root)) {
                if (!agentRegistry.contains(subAgent)) {
                    log.warn("Root coordinator declares unknown sub-agent '{}'", subAgent);
                }
            }
        }
        for (AnalysisPhase phase : AnalysisPhase.values()) {
            if (!executors.containsKey(phase.agentName())) {
                log.warn("No executor for '{}': analyses will fail at phase '{}'",
                        phase.agentName(), phase.label());
            }
        }
    }

    // ── Entry points ────────────────────────────────────────────────────────

    /**
     * Runs the whole pipeline for one document and returns the terminal state.
     *
     * @param analysisId      id of the analysis record
     * @param documentId      id of the document record
     * @param documentPath    where the document is stored
     * @param documentContent textual content of the document
     * @return the analysis state, {@link AnalysisStatus#COMPLETED} or {@link AnalysisStatus#FAILED}
     * @throws NullPointerException if {@code analysisId} is null
     */
    public AnalysisState executeAnalysis(String analysisId, String documentId,
                                         String documentPath, String documentContent) {
        Objects.requireNonNull(analysisId, "analysisId");
        AnalysisState state = new AnalysisState(analysisId, documentId, clock);
        if (!activeAnalyses.register(state)) {
            log.error("Analysis {} is already running, rejecting duplicate run", analysisId);
            state.fail("Workflow execution failed: analysis " + analysisId + " is already running");
            return state;
        }

        try {
            log.info("═══════════════════════════════════════════════");
            log.info("Starting analysis workflow {} for document_id={}", analysisId, documentId);
            log.info("═══════════════════════════════════════════════");
            state.addLog(ORCHESTRATOR_LOG, "Analysis workflow started");
            transition(state, AnalysisStatus.PROCESSING);

            String content = documentContent != null ? documentContent : "";
            runDocumentProcessing(state, documentPath, content);
            runClaimExtraction(state, content);
            runVerification(state);
            runReportGeneration(state);
            runQualityReview(state);

            state.complete();
            notifyListeners(state, AnalysisStatus.COMPLETED);
            state.addLog(ORCHESTRATOR_LOG, "Analysis workflow completed successfully");
            log.info("Analysis {} completed: {} claims, {} verifications",
                    analysisId, state.getExtractedClaims().size(), state.getVerifications().size());

        } catch (PhaseFailedException e) {
            log.error("Analysis {}: {} (phase {}/{})", analysisId, e.getMessage(), e.phase().step(), PHASES);
            failWorkflow(state, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow execution failed for analysis {}: {}", analysisId, e.getMessage(), e);
            failWorkflow(state, "Workflow execution failed: " + e.getMessage());
        } finally {
            activeAnalyses.retire(state);
        }

        return state;
    }

    /** Live or recently finished state of an analysis. */
    public Optional<AnalysisState> getAnalysisState(String analysisId) {
        return activeAnalyses.find(analysisId);
    }

    /** Releases every tool-server session. Later calls do nothing. */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            toolSessionProvider.closeAll();
            log.info("Orchestrator closed");
        }
    }

    public Set<String> configuredAgents() {
        return executors.keySet();
    }

    public int openSessionCount() {
        return toolSessionProvider.openSessionCount();
    }

    public int runningAnalysisCount() {
        return activeAnalyses.runningCount();
    }

    // ── Phases ──────────────────────────────────────────────────────────────

    private void runDocumentProcessing(AnalysisState state, String documentPath, String content) {
        AnalysisPhase phase = AnalysisPhase.DOCUMENT_PROCESSING;
        AgentExecutor executor = executorFor(phase);
        enterPhase(state, phase, "Starting document processing");
        try {
            String result = await(executor.runTask(
                    PhasePrompts.documentProcessing(documentPath, content),
                    Map.of("path", String.valueOf(documentPath))));
            DocumentMetadata metadata = decoder.decodeMetadata(phase.agentName(), result);
            state.setDocumentMetadata(metadata);
            state.addLog(phase.agentName(), "Extracted metadata: " + metadata.title());
            log.info("[{}/{}] Metadata extracted: title='{}', {} authors",
                    phase.step(), PHASES, metadata.title(), metadata.authors().size());
        } catch (RuntimeException e) {
            throw phaseFailed(state, phase, e);
        }
    }

    private void runClaimExtraction(AnalysisState state, String content) {
        AnalysisPhase phase = AnalysisPhase.CLAIM_EXTRACTION;
        AgentExecutor executor = executorFor(phase);
        enterPhase(state, phase, "Starting fact extraction");
        try {
            Optional<DocumentMetadata> metadata = state.getDocumentMetadata();
            Map<String, Object> context = new LinkedHashMap<>();
            metadata.ifPresent(m -> context.put("metadata", m));

            String result = await(executor.runTask(PhasePrompts.claimExtraction(metadata, content), context));
            List<ExtractedClaim> claims = decoder.decodeClaims(phase.agentName(), result);
            claims.forEach(state::addClaim);

            state.addLog(phase.agentName(), "Extracted " + claims.size() + " claims");
            log.info("[{}/{}] {} claims extracted", phase.step(), PHASES, claims.size());
        } catch (RuntimeException e) {
            throw phaseFailed(state, phase, e);
        }
    }

    /**
     * Verifies claims in windows of {@code verificationConcurrency} concurrent calls.
     * Results are appended in claim order; on the first failure, results of the
     * earlier claims are kept, calls still running in the window are cancelled
     * and the rest are dropped.
     */
    private void runVerification(AnalysisState state) {
        AnalysisPhase phase = AnalysisPhase.VERIFICATION;
        AgentExecutor executor = executorFor(phase);
        enterPhase(state, phase, "Starting claim verification");
        try {
            List<ExtractedClaim> claims = state.getExtractedClaims();
            for (int start = 0; start < claims.size(); start += verificationConcurrency) {
                List<ExtractedClaim> window = claims.subList(start,
                        Math.min(start + verificationConcurrency, claims.size()));

                List<CompletableFuture<String>> pending = new ArrayList<>(window.size());
                try {
                    for (ExtractedClaim claim : window) {
                        state.addLog(phase.agentName(), "Verifying claim " + claim.id());
                        pending.add(executor.runTask(PhasePrompts.verification(claim),
                                Map.of("claim", claim.text(), "claim_id", claim.id())));
                    }

                    for (int i = 0; i < window.size(); i++) {
                        ExtractedClaim claim = window.get(i);
                        VerificationResult result = decoder.decodeVerification(
                                phase.agentName(), claim, await(pending.get(i)));
                        state.addVerification(result);
                        log.debug("  [{}] {} ({}/100)", claim.id(), result.verificationStatus(), result.confidence());
                    }
                } catch (RuntimeException e) {
                    cancelUnfinished(pending);
                    throw e;
                }
            }

            state.addLog(phase.agentName(), "Verified " + state.getVerifications().size() + " claims");
            log.info("[{}/{}] {} claims verified", phase.step(), PHASES, state.getVerifications().size());
        } catch (RuntimeException e) {
            throw phaseFailed(state, phase, e);
        }
    }

    private static void cancelUnfinished(List<CompletableFuture<String>> pending) {
        int cancelled = 0;
        for (CompletableFuture<String> future : pending) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.debug("Cancelled {} verification call(s) still in flight", cancelled);
        }
    }

    private void runReportGeneration(AnalysisState state) {
        AnalysisPhase phase = AnalysisPhase.REPORT_GENERATION;
        AgentExecutor executor = executorFor(phase);
        enterPhase(state, phase, "Starting report generation");
        try {
            Optional<DocumentMetadata> metadata = state.getDocumentMetadata();
            List<ExtractedClaim> claims = state.getExtractedClaims();
            List<VerificationResult> verifications = state.getVerifications();

            Map<String, Object> context = new LinkedHashMap<>();
            metadata.ifPresent(m -> context.put("metadata", m));
            context.put("claims", claims);
            context.put("verifications", verifications);

            String result = await(executor.runTask(
                    PhasePrompts.reportGeneration(metadata, claims, verifications), context));
            String report = decoder.decodeReport(phase.agentName(), result);
            state.setReportContent(report);

            state.addLog(phase.agentName(), "Report generation completed");
            log.info("[{}/{}] Report generated: {} characters", phase.step(), PHASES, report.length());
        } catch (RuntimeException e) {
            throw phaseFailed(state, phase, e);
        }
    }

    private void runQualityReview(AnalysisState state) {
        AnalysisPhase phase = AnalysisPhase.QUALITY_REVIEW;
        AgentExecutor executor = executorFor(phase);
        enterPhase(state, phase, "Starting quality review");
        try {
            Optional<String> report = state.getReportContent();
            Map<String, Object> context = new LinkedHashMap<>();
            report.ifPresent(r -> context.put("report", r));

            String result = await(executor.runTask(PhasePrompts.qualityReview(report), context));
            QualityAssessment assessment = decoder.decodeQualityReview(phase.agentName(), result);
            state.setQualityAssessment(assessment);

            state.addLog(phase.agentName(), "Quality review completed, confidence: " + assessment.confidence());
            log.info("[{}/{}] Quality review completed (approved: {})",
                    phase.step(), PHASES, assessment.approvedForPublication());
        } catch (RuntimeException e) {
            throw phaseFailed(state, phase, e);
        }
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private AgentExecutor executorFor(AnalysisPhase phase) {
        AgentExecutor executor = executors.get(phase.agentName());
        if (executor == null) {
            throw new ExecutorNotConfiguredException(phase.agentName());
        }
        return executor;
    }

    private void enterPhase(AnalysisState state, AnalysisPhase phase, String message) {
        transition(state, phase.status());
        state.addLog(phase.agentName(), message);
        log.info("[{}/{}] {}...", phase.step(), PHASES, phase.label());
    }

    private void transition(AnalysisState state, AnalysisStatus status) {
        state.advanceTo(status);
        notifyListeners(state, status);
    }

    private PhaseFailedException phaseFailed(AnalysisState state, AnalysisPhase phase, RuntimeException cause) {
        String message = phase.label() + " failed: " + cause.getMessage();
        state.addLog(phase.agentName(), message);
        return new PhaseFailedException(phase, message, cause);
    }

    private void failWorkflow(AnalysisState state, String error) {
        state.fail(error);
        notifyListeners(state, AnalysisStatus.FAILED);
        state.addLog(ORCHESTRATOR_LOG, "Analysis workflow failed");
    }

    private void notifyListeners(AnalysisState state, AnalysisStatus status) {
        for (AnalysisProgressListener listener : listeners) {
            try {
                listener.onStatusChange(state, status);
            } catch (RuntimeException e) {
                log.warn("Progress listener failed for analysis {} ({}): {}",
                        state.getAnalysisId(), status, e.getMessage(), e);
            }
        }
    }

    private static String await(CompletableFuture<String> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }
}
