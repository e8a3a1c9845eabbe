package dev.resumescanner.model;

/**
 * Experience buckets used by analytics and filtering.
 */
public enum ExperienceLevel {
    ENTRY("Entry (0-2 yrs)", 2),
    MID("Mid (3-5 yrs)", 5),
    SENIOR("Senior (6-10 yrs)", 10),
    EXPERT("Expert (10+ yrs)", Double.MAX_VALUE);

    private final String label;
    private final double upperBound;

    ExperienceLevel(String label, double upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Bucket for a number of years; upper bounds are inclusive.
     */
    public static ExperienceLevel of(double years) {
        for (ExperienceLevel level : values()) {
            if (years <= level.upperBound) {
                return level;
            }
        }
        return EXPERT;
    }
}
