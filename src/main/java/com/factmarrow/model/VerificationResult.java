package com.factmarrow.model;

import java.util.List;

/**
 * Outcome of checking one claim against external sources.
 * <p>
 * Confidence is on a 0-100 scale, unlike {@link ExtractedClaim#confidence()}.
 *
 * @param claimId              identifier of the verified claim
 * @param claimText            text of the verified claim
 * @param verificationStatus   supported, contradicted, uncertain, unverifiable, or another agent-emitted value
 * @param confidence           verification confidence in [0,100]
 * @param supportingSources    identifiers of sources supporting the claim
 * @param contradictingSources identifiers of sources contradicting the claim
 * @param notes                free-text notes from the verifier
 */
public record VerificationResult(
        String claimId,
        String claimText,
        String verificationStatus,
        double confidence,
        List<String> supportingSources,
        List<String> contradictingSources,
        String notes
) {
    public static final String DEFAULT_STATUS = "uncertain";

    public VerificationResult {
        if (verificationStatus == null || verificationStatus.isBlank()) {
            verificationStatus = DEFAULT_STATUS;
        }
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(100.0, confidence));
        supportingSources = supportingSources != null ? List.copyOf(supportingSources) : List.of();
        contradictingSources = contradictingSources != null ? List.copyOf(contradictingSources) : List.of();
    }
}
