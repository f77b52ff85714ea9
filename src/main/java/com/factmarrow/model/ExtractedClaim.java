package com.factmarrow.model;

/**
 * A factual assertion extracted from the document.
 *
 * @param id             stable identifier assigned at extraction ({@code C-001}, ...)
 * @param text           the claim as stated in the document
 * @param type           claim category as emitted by the agent (quantitative, qualitative, causal, ...)
 * @param location       section reference, if any
 * @param confidence     extraction confidence in [0,1]
 * @param supportingText excerpt supporting the claim, if any
 */
public record ExtractedClaim(
        String id,
        String text,
        String type,
        String location,
        double confidence,
        String supportingText
) {
    public static final double DEFAULT_CONFIDENCE = 0.5;
    public static final String UNKNOWN_TYPE = "unknown";

    public ExtractedClaim {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Claim text is required");
        }
        if (type == null || type.isBlank()) {
            type = UNKNOWN_TYPE;
        }
        confidence = Double.isNaN(confidence)
                ? DEFAULT_CONFIDENCE
                : Math.max(0.0, Math.min(1.0, confidence));
    }

    /** Formats the claim identifier for the given 1-based position. */
    public static String idFor(int position) {
        return "C-%03d".formatted(position);
    }
}
