package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds the candidate's name in the resume header, falling back to the source filename.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NameExtractor {

    private static final Pattern NAME_TOKEN = Pattern.compile("\\p{L}[\\p{L}.'-]*");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}$");
    private static final Pattern FILENAME_SEPARATORS = Pattern.compile("[-_.]+");
    private static final Pattern NON_LETTERS = Pattern.compile("[^\\p{L}']");

    private final ExtractionConfig config;

    /**
     * @param text     normalized resume text
     * @param sourceId source filename or path, used when the header yields nothing
     * @return the name, or "" when neither the header nor the filename gives one
     */
    public String extract(String text, String sourceId, PatternRegistry registry) {
        String fromHeader = fromHeader(text, registry);
        if (!fromHeader.isEmpty()) {
            return fromHeader;
        }
        String fromFilename = fromFilename(sourceId, registry);
        if (!fromFilename.isEmpty()) {
            log.debug("Name for {} taken from filename: {}", sourceId, fromFilename);
        }
        return fromFilename;
    }

    String fromHeader(String text, PatternRegistry registry) {
        String[] lines = text.split("\n", -1);
        int limit = Math.min(lines.length, config.getHeaderLines());
        for (int i = 0; i < limit; i++) {
            String line = lines[i].trim().replaceAll("\\s+", " ");
            if (isNameLine(line, registry)) {
                return line;
            }
        }
        return "";
    }

    private boolean isNameLine(String line, PatternRegistry registry) {
        if (line.length() < 3 || line.length() > config.getMaxNameLineLength()) {
            return false;
        }
        if (line.indexOf('@') >= 0 || DIGIT.matcher(line).find()) {
            return false;
        }
        if (registry.getNameBlocklist().matchesExactly(line)) {
            return false;
        }
        String[] tokens = line.split(" ");
        if (tokens.length > 4) {
            return false;
        }
        return Arrays.stream(tokens).allMatch(token -> NAME_TOKEN.matcher(token).matches());
    }

    String fromFilename(String sourceId, PatternRegistry registry) {
        if (sourceId == null || sourceId.isBlank()) {
            return "";
        }
        String filename = sourceId.replace('\\', '/');
        filename = filename.substring(filename.lastIndexOf('/') + 1);
        filename = EXTENSION.matcher(filename).replaceFirst("");

        String cleaned = Arrays.stream(FILENAME_SEPARATORS.matcher(filename).replaceAll(" ").split("\\s+"))
                .filter(word -> !registry.getFilenameNoiseWords().matchesExactly(word))
                .map(word -> NON_LETTERS.matcher(word).replaceAll(""))
                .filter(word -> !word.isEmpty())
                .map(NameExtractor::capitalize)
                .collect(Collectors.joining(" "));
        return cleaned.length() >= 2 ? cleaned : "";
    }

    private static String capitalize(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        return Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
    }
}
