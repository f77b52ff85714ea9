package com.factmarrow.orchestrator;

import com.factmarrow.model.DocumentMetadata;
import com.factmarrow.model.ExtractedClaim;
import com.factmarrow.model.VerificationResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Task prompts of the five phases, rendered from the current analysis state.
 */
final class PhasePrompts {

    static final int PREVIEW_CHARS = 1000;
    static final int EXTRACTION_MAX_CHARS = 60_000;

    private PhasePrompts() {
    }

    static String documentProcessing(String documentPath, String content) {
        return """
                Parse and analyze the following document:

                Path: %s
                Content length: %d characters

                Content preview (first %d chars):
                %s
                ...

                Extract:
                1. Document metadata (title, authors, publication date, institution, abstract, keywords)
                2. Document structure (sections, subsections)
                3. Tables and their contents
                4. References and citations

                Return JSON with: metadata, structure, tables, references, quality_issues.
                The metadata object uses the keys: title, authors, publication_date, institution, abstract, keywords.
                """.formatted(documentPath, content.length(), PREVIEW_CHARS, truncate(content, PREVIEW_CHARS));
    }

    static String claimExtraction(Optional<DocumentMetadata> metadata, String content) {
        String title = metadata.map(DocumentMetadata::title).orElse(null);
        return """
                Extract all claims from the document%s.
                For each claim, identify:
                1. Claim text
                2. Type (quantitative, qualitative, causal, etc.)
                3. Location/context (which section)
                4. Supporting evidence within the document
                5. Your confidence that this is a genuine factual claim (0.0-1.0)

                Return JSON: {"claims": [{"text", "type", "location", "supporting_text", "confidence"}]}

                DOCUMENT:
                ===BEGIN DOCUMENT===
                %s
                ===END DOCUMENT===
                """.formatted(title != null ? " \"" + title + "\"" : "", truncate(content, EXTRACTION_MAX_CHARS));
    }

    static String verification(ExtractedClaim claim) {
        return """
                Verify the following claim using authoritative sources:

                Claim: %s
                Type: %s
                %s
                Search for:
                1. Supporting evidence
                2. Contradicting evidence
                3. Relevant studies or reports
                4. Expert consensus

                Return JSON with: verification_status (supported, contradicted, uncertain, unverifiable),
                supporting_sources, contradicting_sources, confidence (0-100), notes
                """.formatted(claim.text(), claim.type(),
                claim.supportingText() != null ? "Context in document: " + claim.supportingText() + "\n" : "");
    }

    static String reportGeneration(Optional<DocumentMetadata> metadata,
                                   List<ExtractedClaim> claims,
                                   List<VerificationResult> verifications) {
        Map<String, VerificationResult> byClaim = verifications.stream()
                .collect(Collectors.toMap(VerificationResult::claimId, Function.identity(), (a, b) -> a));

        String findings = claims.stream()
                .map(claim -> {
                    VerificationResult v = byClaim.get(claim.id());
                    return "- [%s] %s (%s) → %s".formatted(claim.id(), claim.text(), claim.type(),
                            v != null
                                    ? "%s, confidence %.0f/100".formatted(v.verificationStatus(), v.confidence())
                                    : "not verified");
                })
                .collect(Collectors.joining("\n"));

        return """
                Generate a comprehensive analysis report based on:

                Document: %s
                Claims analyzed: %d
                Verifications completed: %d

                Claims and verification outcomes:
                %s

                Report should include:
                1. Executive summary
                2. Document overview
                3. Claims analysis (extracted claims with verification results)
                4. Verification findings
                5. Key findings and recommendations
                6. Confidence scores

                Format as markdown with sections.
                """.formatted(
                metadata.map(DocumentMetadata::title).orElse("Unknown"),
                claims.size(),
                verifications.size(),
                findings.isEmpty() ? "(none)" : findings);
    }

    static String qualityReview(Optional<String> reportContent) {
        return """
                Review the quality and accuracy of the analysis report:

                Report preview:
                %s

                Check for:
                1. Logical consistency
                2. Evidence quality
                3. Confidence score appropriateness
                4. Citation completeness
                5. Overall report quality

                Provide feedback and confidence score (0-100).
                Return JSON with: feedback, confidence, approved_for_publication
                """.formatted(reportContent.map(r -> truncate(r, PREVIEW_CHARS)).orElse("No report"));
    }

    private static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
