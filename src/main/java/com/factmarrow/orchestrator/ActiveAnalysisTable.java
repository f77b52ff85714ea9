package com.factmarrow.orchestrator;

import com.factmarrow.model.AnalysisState;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Index of analyses by id.
 * <p>
 * Running analyses are never evicted. Finished ones are retired into a Caffeine
 * cache bounded by age ({@code retention} after retirement) and by count.
 */
public class ActiveAnalysisTable {

    private final ConcurrentMap<String, AnalysisState> running = new ConcurrentHashMap<>();
    private final Cache<String, AnalysisState> finished;

    public ActiveAnalysisTable(Duration retention, long maxRetained) {
        this(retention, maxRetained, Ticker.systemTicker());
    }

    ActiveAnalysisTable(Duration retention, long maxRetained, Ticker ticker) {
        this.finished = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .maximumSize(maxRetained)
                .ticker(ticker)
                .build();
    }

    /**
     * Registers a running analysis.
     *
     * @return false if another analysis with the same id is still running
     */
    public boolean register(AnalysisState state) {
        if (running.putIfAbsent(state.getAnalysisId(), state) != null) {
            return false;
        }
        finished.invalidate(state.getAnalysisId());
        return true;
    }

    /** Moves a running analysis to the finished set. */
    public void retire(AnalysisState state) {
        if (running.remove(state.getAnalysisId(), state)) {
            finished.put(state.getAnalysisId(), state);
        }
    }

    public Optional<AnalysisState> find(String analysisId) {
        AnalysisState state = running.get(analysisId);
        if (state != null) {
            return Optional.of(state);
        }
        return Optional.ofNullable(finished.getIfPresent(analysisId));
    }

    /**
     * Drops a finished analysis. Running analyses are not affected.
     *
     * @return true if a finished analysis was removed
     */
    public boolean evict(String analysisId) {
        return finished.asMap().remove(analysisId) != null;
    }

    public int runningCount() {
        return running.size();
    }

    public long finishedCount() {
        finished.cleanUp();
        return finished.estimatedSize();
    }
}
