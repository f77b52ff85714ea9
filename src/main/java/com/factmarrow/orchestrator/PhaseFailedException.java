package com.factmarrow.orchestrator;

import com.factmarrow.exception.FactMarrowException;

/**
 * A phase failed; the message is the error string recorded on the analysis.
 */
class PhaseFailedException extends FactMarrowException {

    private final AnalysisPhase phase;

    PhaseFailedException(AnalysisPhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    AnalysisPhase phase() {
        return phase;
    }
}
