package com.factmarrow.model;

/**
 * Output of the quality-review phase.
 *
 * @param feedback               reviewer feedback, null if none was given
 * @param confidence             reviewer confidence clamped to [0,100], null if not reported or not finite
 * @param approvedForPublication whether the reviewer approved the report
 */
public record QualityAssessment(
        String feedback,
        Double confidence,
        boolean approvedForPublication
) {
    public QualityAssessment {
        if (confidence != null) {
            confidence = Double.isFinite(confidence) ? Math.max(0.0, Math.min(100.0, confidence)) : null;
        }
    }
}
