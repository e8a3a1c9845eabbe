package dev.resumescanner.model;

import java.util.Map;

/**
 * Aggregated view over a set of candidates.
 */
public record PoolAnalytics(
        int totalCandidates,
        double averageSkills,
        int withEmail,
        int withPhone,
        int uniqueSkills,
        Map<String, Integer> skillsDistribution,
        Map<EducationLevel, Integer> educationDistribution,
        Map<ExperienceLevel, Integer> experienceLevels,
        double averageExperience,
        double averageFitScore,
        int needingReview) {
}
