package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.model.EducationLevel;
import dev.resumescanner.registry.EducationLevelPattern;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects the single highest education level mentioned in a resume.
 * <p>
 * Unambiguous forms such as "Master's degree" count unless a non-degree phrase like
 * "MS Office" sits nearby. Short abbreviations such as "BS" or "MA" additionally need
 * a degree keyword close by and are also vetoed by state names and manager titles.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EducationLevelExtractor {

    private final ExtractionConfig config;

    public EducationLevel extract(String text, PatternRegistry registry) {
        for (EducationLevelPattern level : registry.getEducationLevels()) {
            if (hasClearMention(text, level, registry) || hasAbbreviation(text, level, registry)) {
                return level.level();
            }
        }
        return EducationLevel.NOT_SPECIFIED;
    }

    private boolean hasClearMention(String text, EducationLevelPattern level, PatternRegistry registry) {
        for (Pattern pattern : level.patterns()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String window = TextWindows.around(text, matcher.start(), matcher.end(),
                        config.getNonDegreeContextWindow());
                if (!registry.getNonDegreeContext().containsAny(window)) {
                    return true;
                }
                log.debug("Ignoring '{}' next to non-degree context", matcher.group());
            }
        }
        return false;
    }

    private boolean hasAbbreviation(String text, EducationLevelPattern level, PatternRegistry registry) {
        for (Pattern pattern : level.abbreviations()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String window = TextWindows.around(text, matcher.start(), matcher.end(),
                        config.getDegreeContextWindow());
                if (registry.getDegreeContext().containsAny(window)
                        && !registry.getNonDegreeContext().containsAny(window)
                        && !registry.getAbbreviationNonDegreeContext().containsAny(window)) {
                    return true;
                }
            }
        }
        return false;
    }
}
