package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import dev.resumescanner.registry.SkillPattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Matches the registry skill vocabulary against resume text.
 * <p>
 * Skills are tried longest first and every occurrence claims its span, so "Spring Boot"
 * consumes the text that would otherwise also count as "Spring". Results follow the order
 * of first occurrence in the text.
 */
@Component
@RequiredArgsConstructor
public class SkillExtractor {

    private final ExtractionConfig config;

    public List<String> extract(String text, PatternRegistry registry) {
        List<int[]> claimed = new ArrayList<>();
        Map<String, Integer> firstOccurrence = new LinkedHashMap<>();

        for (SkillPattern skill : registry.getSkills()) {
            Matcher matcher = skill.pattern().matcher(text);
            while (matcher.find()) {
                if (TextWindows.overlapsAny(matcher.start(), matcher.end(), claimed)) {
                    continue;
                }
                claimed.add(new int[] {matcher.start(), matcher.end()});
                firstOccurrence.merge(skill.name(), matcher.start(), Math::min);
            }
        }

        return firstOccurrence.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .limit(config.getMaxSkills())
                .map(Map.Entry::getKey)
                .toList();
    }
}
