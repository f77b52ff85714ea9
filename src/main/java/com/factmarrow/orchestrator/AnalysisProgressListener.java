package com.factmarrow.orchestrator;

import com.factmarrow.model.AnalysisState;
import com.factmarrow.model.AnalysisStatus;

/**
 * Notified after every status change of an analysis.
 * Implementations run on the workflow thread and should return quickly.
 */
@FunctionalInterface
public interface AnalysisProgressListener {

    void onStatusChange(AnalysisState state, AnalysisStatus status);
}
