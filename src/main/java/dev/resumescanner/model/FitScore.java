package dev.resumescanner.model;

import java.util.Map;

/**
 * Result of the profile-completeness calculation.
 *
 * @param total       score in [0, 100]
 * @param breakdown   capped points per category
 * @param needsReview true when the total is below the review threshold
 */
public record FitScore(
        double total,
        Map<String, Double> breakdown,
        boolean needsReview) {
}
