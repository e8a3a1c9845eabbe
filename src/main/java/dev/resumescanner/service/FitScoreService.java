package dev.resumescanner.service;

import dev.resumescanner.config.ScoringConfig;
import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.model.FitScore;
import dev.resumescanner.registry.KeywordSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Profile-completeness score in [0, 100].
 * <p>
 * Each category is capped on its own before summing:
 * name, email and phone 10 each, skills 2 per skill up to 20, experience 2.5 per year up to 25,
 * any education level 15, certifications 2 each up to 10.
 */
@Slf4j
@Service
public class FitScoreService {

    private final ScoringConfig scoringConfig;
    private final KeywordSet invalidNameWords;

    public FitScoreService(ScoringConfig scoringConfig) {
        this.scoringConfig = scoringConfig;
        this.invalidNameWords = KeywordSet.of(scoringConfig.getFit().getInvalidNameWords());
    }

    public FitScore calculate(CandidateRecord candidate) {
        if (candidate == null) {
            return new FitScore(0, Map.of(), true);
        }
        ScoringConfig.Fit fit = scoringConfig.getFit();
        Map<String, Double> breakdown = new LinkedHashMap<>();

        breakdown.put("name", isValidName(candidate.getName()) ? fit.getNamePoints() : 0);
        breakdown.put("email", candidate.hasEmail() ? fit.getEmailPoints() : 0);
        breakdown.put("phone", candidate.hasPhone() ? fit.getPhonePoints() : 0);
        breakdown.put("skills", Math.min(fit.getSkillsCap(),
                candidate.getSkills().size() * fit.getPointsPerSkill()));
        breakdown.put("experience", Math.min(fit.getExperienceCap(),
                candidate.getYearsExperience() * fit.getPointsPerYear()));
        breakdown.put("education", candidate.getEducationLevel().isSpecified() ? fit.getEducationPoints() : 0);
        breakdown.put("certifications", Math.min(fit.getCertificationsCap(),
                candidate.getCertifications().size() * fit.getPointsPerCertification()));

        double total = breakdown.values().stream().mapToDouble(Double::doubleValue).sum();
        boolean needsReview = total < fit.getReviewThreshold();

        log.debug("Fit score for '{}': {} {}", candidate.displayName(), total, breakdown);
        return new FitScore(total, Collections.unmodifiableMap(breakdown), needsReview);
    }

    /**
     * A name counts when it has at least the minimum length and contains no word
     * that marks it as a document title, such as "Resume" or "Certificate".
     */
    public boolean isValidName(String name) {
        if (name == null || name.isBlank()) {
            return false;
        }
        if (name.trim().length() < scoringConfig.getFit().getMinNameLength()) {
            return false;
        }
        return !invalidNameWords.containsAny(name);
    }
}
