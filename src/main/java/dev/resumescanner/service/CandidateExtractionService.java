package dev.resumescanner.service;

import dev.resumescanner.extract.CertificationExtractor;
import dev.resumescanner.extract.ContactExtractor;
import dev.resumescanner.extract.EducationLevelExtractor;
import dev.resumescanner.extract.EmploymentExtractor;
import dev.resumescanner.extract.ExperienceDateResolver;
import dev.resumescanner.extract.InvalidInputException;
import dev.resumescanner.extract.NameExtractor;
import dev.resumescanner.extract.SkillExtractor;
import dev.resumescanner.extract.TextNormalizer;
import dev.resumescanner.metrics.ExtractionMetrics;
import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.model.ResumeDocument;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;

/**
 * Assembles a {@link CandidateRecord} from resume text by running every field extractor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateExtractionService {

    private final PatternRegistry registry;
    private final NameExtractor nameExtractor;
    private final ContactExtractor contactExtractor;
    private final SkillExtractor skillExtractor;
    private final EducationLevelExtractor educationLevelExtractor;
    private final CertificationExtractor certificationExtractor;
    private final EmploymentExtractor employmentExtractor;
    private final ExperienceDateResolver experienceDateResolver;
    private final ExtractionMetrics metrics;

    /**
     * Extract a candidate using the application's pattern registry.
     *
     * @param text     plain resume text
     * @param sourceId source filename, used for the name fallback
     * @throws InvalidInputException when text or sourceId is null
     */
    public CandidateRecord extract(String text, String sourceId) {
        return extract(text, sourceId, registry);
    }

    public CandidateRecord extract(ResumeDocument document) {
        if (document == null) {
            throw new InvalidInputException("Resume document must not be null");
        }
        return extract(document.text(), document.sourceId());
    }

    /**
     * Extract a candidate against an alternative vocabulary.
     */
    public CandidateRecord extract(String text, String sourceId, PatternRegistry patternRegistry) {
        if (text == null) {
            throw new InvalidInputException("Resume text must not be null");
        }
        if (sourceId == null) {
            throw new InvalidInputException("Source id must not be null");
        }

        long started = System.nanoTime();
        String normalized = TextNormalizer.normalize(text);

        CandidateRecord candidate = CandidateRecord.builder()
                .name(nameExtractor.extract(normalized, sourceId, patternRegistry))
                .email(contactExtractor.extractEmail(normalized))
                .phone(contactExtractor.extractPhone(normalized, patternRegistry))
                .location(contactExtractor.extractLocation(normalized, patternRegistry))
                .skills(skillExtractor.extract(normalized, patternRegistry))
                .companies(employmentExtractor.extractCompanies(normalized, patternRegistry))
                .jobTitles(employmentExtractor.extractJobTitles(normalized, patternRegistry))
                .educationLevel(educationLevelExtractor.extract(normalized, patternRegistry))
                .certifications(certificationExtractor.extract(normalized, patternRegistry))
                .yearsExperience(experienceDateResolver.totalYears(normalized, patternRegistry))
                .sourceId(sourceId)
                .build();

        metrics.recordExtracted();
        metrics.recordExtractionTime(Duration.ofNanos(System.nanoTime() - started));
        log.debug("Extracted '{}' from {}: {} skills, {} certifications, {} years",
                candidate.getName(), sourceId, candidate.getSkills().size(),
                candidate.getCertifications().size(), candidate.getYearsExperience());
        return candidate;
    }

    /**
     * Extract a batch in parallel. Results keep the input order; a document that fails is
     * logged, counted and left out.
     */
    public Mono<List<CandidateRecord>> extractAll(List<ResumeDocument> documents) {
        if (documents == null) {
            return Mono.error(new InvalidInputException("Document list must not be null"));
        }
        log.info("Extracting {} resumes", documents.size());

        return Flux.fromIterable(documents)
                .flatMapSequential(document -> Mono.fromCallable(() -> extract(document))
                        .subscribeOn(Schedulers.parallel())
                        .onErrorResume(e -> {
                            log.warn("Skipping {}: {}", document.sourceId(), e.getMessage());
                            metrics.recordFailure(e.getClass().getSimpleName());
                            return Mono.empty();
                        }))
                .collectList()
                .doOnNext(candidates -> {
                    metrics.updateLastRunStats(candidates.size());
                    log.info("Extracted {} of {} resumes", candidates.size(), documents.size());
                });
    }
}
