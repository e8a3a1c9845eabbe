package dev.resumescanner.model;

/**
 * Classification of the text surrounding a date range.
 * Only WORK ranges contribute to years of experience.
 */
public enum DateContext {
    WORK,
    EDUCATION,
    AMBIGUOUS
}
