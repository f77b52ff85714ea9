package com.factmarrow.service;

import com.factmarrow.model.AnalysisState;
import com.factmarrow.model.AnalysisStatus;
import com.factmarrow.orchestrator.AnalysisProgressListener;
import com.factmarrow.repository.AnalysisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mirrors intermediate status changes into the persisted analysis record.
 * Terminal states are persisted in full by {@link AnalysisSubmissionService}.
 */
@Component
public class AnalysisStatusUpdater implements AnalysisProgressListener {

    private static final Logger log = LoggerFactory.getLogger(AnalysisStatusUpdater.class);

    private final AnalysisRepository analysisRepository;

    public AnalysisStatusUpdater(AnalysisRepository analysisRepository) {
        this.analysisRepository = analysisRepository;
    }

    @Override
    public void onStatusChange(AnalysisState state, AnalysisStatus status) {
        if (status.isTerminal()) {
            return;
        }
        analysisRepository.findById(state.getAnalysisId())
                .ifPresentOrElse(
                        record -> analysisRepository.save(record.withStatus(status)),
                        () -> log.debug("No persisted record for analysis {}, status {} not stored",
                                state.getAnalysisId(), status.value()));
    }
}
