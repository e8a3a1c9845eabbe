package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.CertificationPattern;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Certification extraction in two passes.
 * <p>
 * The named pass runs every entry of the registry's certification table through one generic
 * matcher that honours required and forbidden context. The generic pass then looks inside
 * Certifications/Credentials sections for lines shaped like "Name - Issuer" or "Name (CODE)"
 * that no table entry recognised, and keeps them verbatim.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CertificationExtractor {

    private static final Pattern BULLET = Pattern.compile("^[\\s\\u2022\\u25AA\\u25CF\\u25E6\\u00B7*>-]+");
    private static final Pattern ISSUER_LINE = Pattern.compile(
            "^\\p{L}[^()\\n]{2,80}?\\s+[-\\u2013\\u2014|]\\s+\\p{L}[^\\n]{1,60}$");
    private static final Pattern CODE_LINE = Pattern.compile(
            "^\\p{L}[^()\\n]{2,80}\\s*\\([A-Z0-9][A-Z0-9-]{1,11}\\)$");

    private final ExtractionConfig config;

    public List<String> extract(String text, PatternRegistry registry) {
        Map<String, String> found = new LinkedHashMap<>();
        for (String name : namedCertifications(text, registry)) {
            found.putIfAbsent(name.toLowerCase(Locale.ROOT), name);
        }
        for (String line : sectionCertifications(text, registry)) {
            found.putIfAbsent(line.toLowerCase(Locale.ROOT), line);
        }
        return found.values().stream()
                .limit(config.getMaxCertifications())
                .toList();
    }

    /**
     * Canonical names of table entries with at least one accepted match, in order of first accepted match.
     */
    List<String> namedCertifications(String text, PatternRegistry registry) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        for (CertificationPattern certification : registry.getCertifications()) {
            firstAcceptedMatch(text, certification, registry)
                    .ifPresent(position -> positions.merge(certification.canonicalName(), position, Math::min));
        }
        return positions.entrySet().stream()
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .map(Map.Entry::getKey)
                .toList();
    }

    private OptionalInt firstAcceptedMatch(String text, CertificationPattern certification, PatternRegistry registry) {
        int best = Integer.MAX_VALUE;
        for (Pattern pattern : certification.patterns()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (matcher.start() >= best) {
                    break;
                }
                if (isAccepted(text, matcher, certification, registry)) {
                    best = matcher.start();
                    break;
                }
            }
        }
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    private boolean isAccepted(String text, Matcher matcher, CertificationPattern certification,
                               PatternRegistry registry) {
        String window = TextWindows.around(text, matcher.start(), matcher.end(),
                config.getCertificationContextWindow());

        if (!certification.requiredContext().isEmpty() && !certification.requiredContext().containsAny(window)) {
            return false;
        }
        if (certification.forbiddenContext().containsAny(window)) {
            return false;
        }
        // "experience with CKA-style clusters" is a skill mention unless certification wording is close by
        if (registry.getSkillMentionPhrases().containsAny(window)) {
            String nearbyLines = TextWindows.linesAround(text, matcher.start(), config.getCertificationContextLines());
            if (!registry.getCertificationContext().containsAny(nearbyLines)) {
                log.debug("Treating '{}' as a skill mention, not a certification", matcher.group());
                return false;
            }
        }
        return true;
    }

    /**
     * Lines inside certification sections that look like a credential but match no table entry.
     */
    List<String> sectionCertifications(String text, PatternRegistry registry) {
        List<String> results = new ArrayList<>();
        boolean inSection = false;
        for (String rawLine : text.split("\n")) {
            String line = rawLine.trim();
            String heading = line.endsWith(":") ? line.substring(0, line.length() - 1).trim() : line;

            if (registry.getCertificationSectionHeaders().matchesExactly(heading)) {
                inSection = true;
                continue;
            }
            if (registry.getSectionHeadings().matchesExactly(heading)) {
                inSection = false;
                continue;
            }
            if (!inSection || line.isEmpty()) {
                continue;
            }

            String entry = BULLET.matcher(line).replaceFirst("").trim();
            if (looksLikeCredential(entry) && !matchesAnyNamedPattern(entry, registry)) {
                results.add(entry);
            }
        }
        return results;
    }

    private static boolean looksLikeCredential(String entry) {
        return ISSUER_LINE.matcher(entry).matches() || CODE_LINE.matcher(entry).matches();
    }

    private static boolean matchesAnyNamedPattern(String entry, PatternRegistry registry) {
        return registry.getCertifications().stream()
                .flatMap(certification -> certification.patterns().stream())
                .anyMatch(pattern -> pattern.matcher(entry).find());
    }
}
