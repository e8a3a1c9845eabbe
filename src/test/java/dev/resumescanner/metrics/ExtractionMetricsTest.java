package dev.resumescanner.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractionMetricsTest {

    private MeterRegistry meterRegistry;
    private ExtractionMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new ExtractionMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Counters")
    class CounterTests {

        @Test
        @DisplayName("Should record extracted documents")
        void shouldRecordExtracted() {
            metrics.recordExtracted();
            metrics.recordExtracted();

            assertThat(meterRegistry.counter("resume_scanner_documents_extracted_total").count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should record failures in total and by reason")
        void shouldRecordFailures() {
            metrics.recordFailure("InvalidInputException");
            metrics.recordFailure("InvalidInputException");
            metrics.recordFailure("IllegalStateException");

            assertThat(meterRegistry.counter("resume_scanner_extraction_failures_total").count()).isEqualTo(3.0);
            assertThat(meterRegistry.counter("resume_scanner_extraction_failures_by_reason_total",
                    "reason", "InvalidInputException").count()).isEqualTo(2.0);
            assertThat(meterRegistry.counter("resume_scanner_extraction_failures_by_reason_total",
                    "reason", "IllegalStateException").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should record records needing review")
        void shouldRecordNeedsReview() {
            metrics.recordNeedsReview(4);

            assertThat(meterRegistry.counter("resume_scanner_needs_review_total").count()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("Should record rankings")
        void shouldRecordRankings() {
            metrics.recordRanking();

            assertThat(meterRegistry.counter("resume_scanner_rankings_total").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Timer and gauges")
    class TimerAndGaugeTests {

        @Test
        @DisplayName("Should time extractions")
        void shouldRecordExtractionTime() {
            metrics.recordExtractionTime(Duration.ofMillis(250));

            assertThat(meterRegistry.timer("resume_scanner_extraction_duration").count()).isEqualTo(1);
            assertThat(meterRegistry.timer("resume_scanner_extraction_duration").totalTime(TimeUnit.MILLISECONDS))
                    .isEqualTo(250.0);
        }

        @Test
        @DisplayName("Should expose pool size and last run gauges")
        void shouldUpdateGauges() {
            metrics.updatePoolSize(12);
            metrics.updateLastRunStats(5);

            assertThat(meterRegistry.get("resume_scanner_pool_size").gauge().value()).isEqualTo(12.0);
            assertThat(meterRegistry.get("resume_scanner_last_run_candidates").gauge().value()).isEqualTo(5.0);
        }
    }
}
