package dev.resumescanner.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for resume extraction and scoring.
 */
@Component
public class ExtractionMetrics {

    private final MeterRegistry registry;

    private final Counter documentsExtractedCounter;
    private final Counter extractionFailuresCounter;
    private final Counter needsReviewCounter;
    private final Counter rankingsCounter;
    private final Timer extractionTimer;

    private final AtomicInteger poolSize = new AtomicInteger(0);
    private final AtomicInteger lastRunCandidates = new AtomicInteger(0);

    public ExtractionMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.documentsExtractedCounter = Counter.builder("resume_scanner_documents_extracted_total")
                .description("Resumes turned into candidate records")
                .register(registry);

        this.extractionFailuresCounter = Counter.builder("resume_scanner_extraction_failures_total")
                .description("Resumes skipped because extraction failed")
                .register(registry);

        this.needsReviewCounter = Counter.builder("resume_scanner_needs_review_total")
                .description("Candidate records below the completeness threshold")
                .register(registry);

        this.rankingsCounter = Counter.builder("resume_scanner_rankings_total")
                .description("Relevance rankings computed")
                .register(registry);

        this.extractionTimer = Timer.builder("resume_scanner_extraction_duration")
                .description("Time to extract one resume")
                .register(registry);

        Gauge.builder("resume_scanner_pool_size", poolSize, AtomicInteger::get)
                .description("Candidates currently held in the pool")
                .register(registry);

        Gauge.builder("resume_scanner_last_run_candidates", lastRunCandidates, AtomicInteger::get)
                .description("Candidates extracted in the last run")
                .register(registry);
    }

    public void recordExtracted() {
        documentsExtractedCounter.increment();
    }

    /**
     * Record a failed document, tagged by the exception type.
     */
    public void recordFailure(String reason) {
        extractionFailuresCounter.increment();
        Counter.builder("resume_scanner_extraction_failures_by_reason_total")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordNeedsReview(int count) {
        needsReviewCounter.increment(count);
    }

    public void recordRanking() {
        rankingsCounter.increment();
    }

    public void recordExtractionTime(Duration duration) {
        extractionTimer.record(duration);
    }

    public void updatePoolSize(int size) {
        poolSize.set(size);
    }

    public void updateLastRunStats(int candidates) {
        lastRunCandidates.set(candidates);
    }
}
