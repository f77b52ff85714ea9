package com.factmarrow.orchestrator;

import com.factmarrow.model.DocumentMetadata;
import com.factmarrow.model.ExtractedClaim;
import com.factmarrow.model.VerificationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class PhasePromptsTest {

    @Test
    void shouldPreviewOnlyTheStartOfTheDocument() {
        String content = "a".repeat(PhasePrompts.PREVIEW_CHARS) + "TAIL";

        String prompt = PhasePrompts.documentProcessing("/data/doc.txt", content);

        assertThat(prompt)
                .contains("Path: /data/doc.txt")
                .contains("Content length: " + content.length() + " characters")
                .doesNotContain("TAIL");
    }

    @Test
    void shouldNameDocumentInExtractionPrompt() {
        DocumentMetadata metadata = new DocumentMetadata("Flu Season Review", null, null, null, null, null);

        assertThat(PhasePrompts.claimExtraction(Optional.of(metadata), "body"))
                .contains("Extract all claims from the document \"Flu Season Review\"")
                .contains("===BEGIN DOCUMENT===\nbody\n===END DOCUMENT===");
        assertThat(PhasePrompts.claimExtraction(Optional.empty(), "body"))
                .contains("Extract all claims from the document.");
    }

    @Test
    void shouldJoinVerificationsToClaimsById() {
        ExtractedClaim first = new ExtractedClaim("C-001", "First claim", "causal", null, 0.9, null);
        ExtractedClaim second = new ExtractedClaim("C-002", "Second claim", null, null, 0.5, null);
        VerificationResult verified = new VerificationResult("C-001", "First claim", "supported", 88,
                List.of(), List.of(), null);

        String prompt = PhasePrompts.reportGeneration(Optional.empty(), List.of(first, second), List.of(verified));

        assertThat(prompt)
                .contains("Document: Unknown")
                .contains("Claims analyzed: 2")
                .contains("Verifications completed: 1")
                .contains("[C-001] First claim (causal) → supported, confidence 88/100")
                .contains("[C-002] Second claim (unknown) → not verified");
    }

    @Test
    void shouldReviewMissingReport() {
        assertThat(PhasePrompts.qualityReview(Optional.empty())).contains("No report");
    }
}
