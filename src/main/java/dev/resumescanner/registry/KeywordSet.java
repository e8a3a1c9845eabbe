package dev.resumescanner.registry;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Immutable set of keywords matched case-insensitively as whole words.
 * "ms" matches "MS in Physics" but never "systems".
 */
public final class KeywordSet {

    private static final KeywordSet EMPTY = new KeywordSet(List.of());

    private final List<String> keywords;
    private final Set<String> lookup;
    private final Pattern pattern;

    private KeywordSet(Collection<String> source) {
        LinkedHashSet<String> normalized = source.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
        this.keywords = List.copyOf(normalized);
        this.lookup = Set.copyOf(normalized);
        this.pattern = normalized.isEmpty() ? null : compile(normalized);
    }

    public static KeywordSet of(Collection<String> keywords) {
        if (keywords == null || keywords.isEmpty()) {
            return EMPTY;
        }
        return new KeywordSet(keywords);
    }

    public static KeywordSet empty() {
        return EMPTY;
    }

    private static Pattern compile(Collection<String> keywords) {
        // Longest first so that "work experience" wins over "work" in the alternation
        String alternation = keywords.stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("(?<!\\w)(?:" + alternation + ")(?!\\w)",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    public List<String> keywords() {
        return keywords;
    }

    public boolean isEmpty() {
        return keywords.isEmpty();
    }

    /**
     * Whether the given value equals one of the keywords (ignoring case and surrounding blanks).
     */
    public boolean matchesExactly(String value) {
        return value != null && lookup.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Whether any keyword occurs in the text as a whole word.
     */
    public boolean containsAny(CharSequence text) {
        return pattern != null && text != null && pattern.matcher(text).find();
    }

    /**
     * Number of keyword occurrences in the text.
     */
    public int count(CharSequence text) {
        if (pattern == null || text == null) {
            return 0;
        }
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
