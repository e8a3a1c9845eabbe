package dev.resumescanner.service;

import dev.resumescanner.config.ScoringConfig;
import dev.resumescanner.metrics.ExtractionMetrics;
import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.model.RankedCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Orders candidates by how well they match a free-text query.
 * <p>
 * A query term found in the name adds 10, in the email 5, and in any skill 3 (times the
 * skill's configured weight). A completeness bonus of up to 3.5 points breaks ties between
 * otherwise equal matches. Equal scores keep their input order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelevanceRankingService {

    private static final Pattern TERM_SEPARATORS = Pattern.compile("[\\s,;]+");

    private final ScoringConfig scoringConfig;
    private final ExtractionMetrics metrics;

    public List<RankedCandidate> rank(List<CandidateRecord> candidates, String query) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<String> terms = queryTerms(query);
        log.debug("Ranking {} candidates for terms {}", candidates.size(), terms);
        metrics.recordRanking();

        return candidates.stream()
                .map(candidate -> new RankedCandidate(candidate, score(candidate, terms)))
                .sorted(Comparator.comparingDouble(RankedCandidate::score).reversed())
                .toList();
    }

    /**
     * Ranks a consistent snapshot of the pool, so a batch being added concurrently is either fully in or out.
     */
    public List<RankedCandidate> rank(CandidatePool pool, String query) {
        return rank(pool.snapshot(), query);
    }

    /**
     * Lower-cased, de-duplicated query terms at least the configured minimum length.
     */
    public List<String> queryTerms(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int minLength = scoringConfig.getRelevance().getMinTermLength();
        return Arrays.stream(TERM_SEPARATORS.split(query.trim()))
                .map(term -> term.toLowerCase(Locale.ROOT))
                .filter(term -> term.length() >= minLength)
                .distinct()
                .toList();
    }

    double score(CandidateRecord candidate, List<String> terms) {
        ScoringConfig.Relevance relevance = scoringConfig.getRelevance();
        String name = candidate.getName().toLowerCase(Locale.ROOT);
        String email = candidate.getEmail().toLowerCase(Locale.ROOT);
        double score = 0;

        if (!name.isEmpty() && terms.stream().anyMatch(name::contains)) {
            score += relevance.getNameMatch();
        }
        if (!email.isEmpty() && terms.stream().anyMatch(email::contains)) {
            score += relevance.getEmailMatch();
        }
        for (String term : terms) {
            score += skillMatch(candidate, term, relevance);
        }
        return score + completenessBonus(candidate);
    }

    private static double skillMatch(CandidateRecord candidate, String term, ScoringConfig.Relevance relevance) {
        Map<String, Double> weights = relevance.getSkillWeights();
        return candidate.getSkills().stream()
                .map(skill -> skill.toLowerCase(Locale.ROOT))
                .filter(skill -> skill.contains(term))
                .mapToDouble(skill -> relevance.getSkillMatch() * weights.getOrDefault(skill, 1.0))
                .max()
                .orElse(0);
    }

    /**
     * 1 point each for name, email and phone plus 0.2 per skill for up to 5 skills, capped at 3.5.
     */
    double completenessBonus(CandidateRecord candidate) {
        ScoringConfig.Relevance relevance = scoringConfig.getRelevance();
        double bonus = 0;
        if (candidate.hasName()) {
            bonus += relevance.getNamePresent();
        }
        if (candidate.hasEmail()) {
            bonus += relevance.getEmailPresent();
        }
        if (candidate.hasPhone()) {
            bonus += relevance.getPhonePresent();
        }
        bonus += Math.min(candidate.getSkills().size(), relevance.getMaxBonusSkills()) * relevance.getPerSkill();
        return Math.min(relevance.getCompletenessCap(), bonus);
    }
}
