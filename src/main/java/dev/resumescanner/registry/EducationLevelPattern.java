package dev.resumescanner.registry;

import dev.resumescanner.model.EducationLevel;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword patterns for one education level.
 *
 * @param level         the level these patterns indicate
 * @param patterns      unambiguous phrasings ("PhD", "Bachelor's")
 * @param abbreviations short forms ("BS", "MSc") that need degree context nearby
 */
public record EducationLevelPattern(
        EducationLevel level,
        List<Pattern> patterns,
        List<Pattern> abbreviations) {
}
