package dev.resumescanner.model;

import java.util.Arrays;

/**
 * Highest education level detected in a resume, in descending rank order.
 */
public enum EducationLevel {
    PHD("PhD", 5),
    MASTERS("Master's", 4),
    BACHELORS("Bachelor's", 3),
    ASSOCIATES("Associate's", 2),
    DIPLOMA("Diploma", 1),
    NOT_SPECIFIED("Not Specified", 0);

    private final String label;
    private final int rank;

    EducationLevel(String label, int rank) {
        this.label = label;
        this.rank = rank;
    }

    public String getLabel() {
        return label;
    }

    public int getRank() {
        return rank;
    }

    public boolean isSpecified() {
        return this != NOT_SPECIFIED;
    }

    public boolean outranks(EducationLevel other) {
        return other == null || rank > other.rank;
    }

    /**
     * Resolve a level from its display label or enum name, case-insensitively.
     *
     * @param value label such as "Master's" or name such as "MASTERS"
     * @return matching level, or NOT_SPECIFIED when nothing matches
     */
    public static EducationLevel fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return NOT_SPECIFIED;
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(level -> level.label.equalsIgnoreCase(trimmed) || level.name().equalsIgnoreCase(trimmed))
                .findFirst()
                .orElse(NOT_SPECIFIED);
    }
}
