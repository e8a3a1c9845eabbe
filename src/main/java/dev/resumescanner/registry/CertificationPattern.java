package dev.resumescanner.registry;

import java.util.List;
import java.util.regex.Pattern;

/**
 * One row of the certification table.
 *
 * @param canonicalName    name reported for any hit, e.g. "AWS Certified"
 * @param patterns         alternative phrasings, compiled case-insensitively
 * @param requiredContext  when non-empty, at least one keyword must occur near the hit
 * @param forbiddenContext no keyword may occur near the hit
 */
public record CertificationPattern(
        String canonicalName,
        List<Pattern> patterns,
        KeywordSet requiredContext,
        KeywordSet forbiddenContext) {
}
