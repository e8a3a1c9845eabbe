package dev.resumescanner.service;

import dev.resumescanner.export.CandidateCsvExporter;
import dev.resumescanner.metrics.ExtractionMetrics;
import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.model.FitScore;
import dev.resumescanner.model.RankedCandidate;
import dev.resumescanner.model.ResumeDocument;
import dev.resumescanner.source.DocumentSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Main orchestration service: load resumes, extract candidates, score, rank and export.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResumeScannerService {

    private static final String SEPARATOR = "========================================";

    private final List<DocumentSource> documentSources;
    private final CandidateExtractionService extractionService;
    private final FitScoreService fitScoreService;
    private final RelevanceRankingService rankingService;
    private final CandidatePool candidatePool;
    private final CandidateCsvExporter csvExporter;
    private final ExtractionMetrics metrics;

    @Value("${scanner.query:}")
    private String query;

    @Value("${scanner.export-path:}")
    private String exportPath;

    @Value("${scanner.top-results:10}")
    private int topResults;

    /**
     * Execute the full scanning pipeline.
     *
     * @return candidates extracted in this run, in document order
     */
    public Mono<List<CandidateRecord>> runPipeline() {
        log.info(SEPARATOR);
        log.info("Resume Scanner Pipeline Starting");
        log.info(SEPARATOR);
        log.info("Sources configured: {}", documentSources.size());

        return fetchAllDocuments()
                .collectList()
                .flatMap(documents -> {
                    log.info("Total resumes loaded: {}", documents.size());
                    if (documents.isEmpty()) {
                        log.info("No resumes to process");
                        metrics.updateLastRunStats(0);
                        return Mono.just(List.<CandidateRecord>of());
                    }
                    return extractionService.extractAll(documents);
                })
                .flatMap(candidates -> Mono.fromCallable(() -> publish(candidates))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    private Flux<ResumeDocument> fetchAllDocuments() {
        return Flux.fromIterable(documentSources)
                .filter(DocumentSource::isEnabled)
                .concatMap(source -> {
                    log.info("Loading from source: {}", source.getName());
                    return source.fetchDocuments();
                });
    }

    private List<CandidateRecord> publish(List<CandidateRecord> candidates) throws IOException {
        if (candidates.isEmpty()) {
            return candidates;
        }
        candidatePool.addAll(candidates);
        logFitScores(candidates);

        if (query != null && !query.isBlank()) {
            logRanking(rankingService.rank(candidatePool, query));
        }
        if (exportPath != null && !exportPath.isBlank()) {
            csvExporter.export(candidatePool.snapshot(), Path.of(exportPath));
        }
        return candidates;
    }

    private void logFitScores(List<CandidateRecord> candidates) {
        int needsReview = 0;
        for (CandidateRecord candidate : candidates) {
            FitScore fit = fitScoreService.calculate(candidate);
            if (fit.needsReview()) {
                needsReview++;
                log.warn("  - {} fit {} (low completeness, review manually)", candidate.displayName(), fit.total());
            } else {
                log.info("  - {} fit {}", candidate.displayName(), fit.total());
            }
        }
        metrics.recordNeedsReview(needsReview);
    }

    private void logRanking(List<RankedCandidate> ranked) {
        log.info(SEPARATOR);
        log.info("Top candidates for query '{}':", query);
        ranked.stream()
                .limit(topResults)
                .forEach(entry -> log.info("  {} ({}) score {}", entry.candidate().displayName(),
                        entry.candidate().getSourceId(), String.format("%.1f", entry.score())));
        log.info(SEPARATOR);
    }
}
