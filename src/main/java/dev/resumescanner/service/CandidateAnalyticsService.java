package dev.resumescanner.service;

import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.model.EducationLevel;
import dev.resumescanner.model.ExperienceLevel;
import dev.resumescanner.model.FitScore;
import dev.resumescanner.model.PoolAnalytics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distributions and averages over a set of candidates, as shown on a recruiting dashboard.
 */
@Service
@RequiredArgsConstructor
public class CandidateAnalyticsService {

    private final FitScoreService fitScoreService;

    public PoolAnalytics analyze(List<CandidateRecord> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return new PoolAnalytics(0, 0, 0, 0, 0, Map.of(), Map.of(),
                    Collections.unmodifiableMap(emptyExperienceLevels()), 0, 0, 0);
        }

        int total = candidates.size();
        List<FitScore> scores = candidates.stream().map(fitScoreService::calculate).toList();
        Map<String, Integer> skills = skillsDistribution(candidates);

        return new PoolAnalytics(
                total,
                candidates.stream().mapToInt(c -> c.getSkills().size()).average().orElse(0),
                (int) candidates.stream().filter(CandidateRecord::hasEmail).count(),
                (int) candidates.stream().filter(CandidateRecord::hasPhone).count(),
                skills.size(),
                skills,
                educationDistribution(candidates),
                experienceLevels(candidates),
                candidates.stream().mapToDouble(CandidateRecord::getYearsExperience).average().orElse(0),
                scores.stream().mapToDouble(FitScore::total).average().orElse(0),
                (int) scores.stream().filter(FitScore::needsReview).count());
    }

    /**
     * Skill counts, most common first, ties by name.
     */
    Map<String, Integer> skillsDistribution(List<CandidateRecord> candidates) {
        Map<String, Integer> counts = new HashMap<>();
        candidates.forEach(candidate -> candidate.getSkills().forEach(skill -> counts.merge(skill, 1, Integer::sum)));

        Map<String, Integer> sorted = new LinkedHashMap<>();
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(entry -> sorted.put(entry.getKey(), entry.getValue()));
        return Collections.unmodifiableMap(sorted);
    }

    private static Map<EducationLevel, Integer> educationDistribution(List<CandidateRecord> candidates) {
        Map<EducationLevel, Integer> distribution = new EnumMap<>(EducationLevel.class);
        candidates.forEach(candidate -> distribution.merge(candidate.getEducationLevel(), 1, Integer::sum));
        return Collections.unmodifiableMap(distribution);
    }

    private static Map<ExperienceLevel, Integer> experienceLevels(List<CandidateRecord> candidates) {
        Map<ExperienceLevel, Integer> levels = new EnumMap<>(emptyExperienceLevels());
        candidates.forEach(candidate ->
                levels.merge(ExperienceLevel.of(candidate.getYearsExperience()), 1, Integer::sum));
        return Collections.unmodifiableMap(levels);
    }

    private static Map<ExperienceLevel, Integer> emptyExperienceLevels() {
        Map<ExperienceLevel, Integer> levels = new EnumMap<>(ExperienceLevel.class);
        for (ExperienceLevel level : ExperienceLevel.values()) {
            levels.put(level, 0);
        }
        return levels;
    }
}
