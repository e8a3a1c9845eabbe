package dev.resumescanner.service;

import dev.resumescanner.metrics.ExtractionMetrics;
import dev.resumescanner.model.CandidateRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only, thread-safe collection of extracted candidates.
 * A batch added with {@link #addAll(Collection)} becomes visible to readers all at once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidatePool {

    private final List<CandidateRecord> candidates = new CopyOnWriteArrayList<>();
    private final ExtractionMetrics metrics;

    public void add(CandidateRecord candidate) {
        if (candidate != null) {
            candidates.add(candidate);
            metrics.updatePoolSize(candidates.size());
        }
    }

    public void addAll(Collection<CandidateRecord> batch) {
        if (batch == null || batch.isEmpty()) {
            return;
        }
        candidates.addAll(batch);
        metrics.updatePoolSize(candidates.size());
        log.debug("Added {} candidates, pool size {}", batch.size(), candidates.size());
    }

    /**
     * Immutable copy of the pool at this instant.
     */
    public List<CandidateRecord> snapshot() {
        return List.copyOf(candidates);
    }

    public int size() {
        return candidates.size();
    }

    public void clear() {
        candidates.clear();
        metrics.updatePoolSize(0);
    }
}
