package com.factmarrow.controller;

import com.factmarrow.model.AnalysisDetail;
import com.factmarrow.model.AnalysisRecord;
import com.factmarrow.model.AnalysisSubmission;
import com.factmarrow.orchestrator.WorkflowOrchestrator;
import com.factmarrow.service.AnalysisSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for document submission and analysis retrieval.
 */
@RestController
@RequestMapping("/api")
public class AnalysisController {

    private static final Logger log = LoggerFactory.getLogger(AnalysisController.class);

    static final String VERSION = "0.1.0-alpha";

    private final AnalysisSubmissionService submissionService;
    private final WorkflowOrchestrator orchestrator;
    private final MongoTemplate mongoTemplate;

    public AnalysisController(AnalysisSubmissionService submissionService,
                              WorkflowOrchestrator orchestrator,
                              MongoTemplate mongoTemplate) {
        this.submissionService = submissionService;
        this.orchestrator = orchestrator;
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Submits a document for multi-agent analysis. The analysis runs in the
     * background; the response carries the id to poll.
     *
     * <p>Endpoint: POST /api/analyze
     * <p>Content-Type: multipart/form-data
     * <p>Parameter: file (document to analyze)
     */
    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyze(@RequestParam("file") MultipartFile file) {
        String filename = file.getOriginalFilename();
        try {
            AnalysisSubmission submission = submissionService.submit(filename, file.getBytes());
            return ResponseEntity.ok(submission);
        } catch (IllegalArgumentException e) {
            return badRequest(e.getMessage());
        } catch (IOException e) {
            log.error("Unable to read uploaded file '{}'", filename, e);
            return badRequest("Unable to read the uploaded file: " + e.getMessage());
        } catch (Exception e) {
            log.error("Analysis submission failed for '{}'", filename, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of(
                            "error", "Analysis submission failed",
                            "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
                    ));
        }
    }

    /**
     * <p>Endpoint: GET /api/analyses
     */
    @GetMapping("/analyses")
    public ResponseEntity<?> listAnalyses() {
        try {
            List<AnalysisRecord> analyses = submissionService.listAnalyses();
            return ResponseEntity.ok(Map.of("analyses", analyses, "total", analyses.size()));
        } catch (Exception e) {
            log.error("Failed to list analyses", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to retrieve analyses"));
        }
    }

    /**
     * <p>Endpoint: GET /api/analyses/{analysisId}
     */
    @GetMapping("/analyses/{analysisId}")
    public ResponseEntity<?> getAnalysis(@PathVariable String analysisId) {
        Optional<AnalysisDetail> detail;
        try {
            detail = submissionService.getAnalysis(analysisId);
        } catch (Exception e) {
            log.error("Failed to retrieve analysis {}", analysisId, e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "Failed to retrieve analysis"));
        }
        if (detail.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "Analysis " + analysisId + " not found"));
        }
        return ResponseEntity.ok(detail.get());
    }

    /**
     * Reports {@code degraded} when the database does not answer a ping or no
     * agents are configured.
     *
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> orchestratorInfo = new LinkedHashMap<>();
        orchestratorInfo.put("agents", orchestrator.configuredAgents().size());
        orchestratorInfo.put("openSessions", orchestrator.openSessionCount());
        orchestratorInfo.put("runningAnalyses", orchestrator.runningAnalysisCount());

        Map<String, Object> services = new LinkedHashMap<>();
        boolean healthy = !orchestrator.configuredAgents().isEmpty();
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
            services.put("database", "running");
        } catch (RuntimeException e) {
            log.warn("Database ping failed: {}", e.getMessage());
            services.put("database", "error: " + e.getMessage());
            healthy = false;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? "healthy" : "degraded");
        body.put("version", VERSION);
        body.put("timestamp", Instant.now().toString());
        body.put("services", services);
        body.put("orchestrator", orchestratorInfo);
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
