package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Email, phone and location extraction. Each method returns "" when nothing plausible is found.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ContactExtractor {

    private static final Pattern EMAIL = Pattern.compile(
            "\\b([A-Za-z0-9._%+-]+)@([A-Za-z0-9.-]+\\.[A-Za-z]{2,})\\b");

    // Most specific first; the first valid match wins. Separators never cross a line break
    private static final List<Pattern> PHONE_PATTERNS = List.of(
            Pattern.compile("\\+\\d{1,3}[ \\t.-]?\\(?\\d{1,4}\\)?(?:[ \\t.-]?\\d{2,4}){2,4}"),
            Pattern.compile("(?<![\\d+])\\(?\\d{3}\\)?[ \\t.-]?\\d{3}[ \\t.-]?\\d{4}(?!\\d)"),
            Pattern.compile("(?<![\\d+])\\d{3,5}[ \\t.-]\\d{3,5}[ \\t.-]\\d{3,5}(?!\\d)"),
            Pattern.compile("\\b\\d{10,11}\\b"));

    private static final Pattern BARE_YEAR = Pattern.compile("\\d{4}");

    private static final List<Pattern> LOCATION_PATTERNS = List.of(
            Pattern.compile("\\b([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)*),[ \\t]*([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)*)"),
            Pattern.compile("\\b([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+)*),[ \\t]*([A-Z]{2})\\b"));

    private final ExtractionConfig config;

    public String extractEmail(String text) {
        Matcher matcher = EMAIL.matcher(text);
        if (!matcher.find()) {
            return "";
        }
        return matcher.group(1) + "@" + matcher.group(2).toLowerCase(Locale.ROOT);
    }

    /**
     * First phone-shaped run with enough digits that is not part of a date range.
     */
    public String extractPhone(String text, PatternRegistry registry) {
        List<int[]> dateSpans = dateSpans(text, registry);
        for (Pattern pattern : PHONE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = matcher.group().trim();
                if (BARE_YEAR.matcher(candidate).matches()) {
                    continue;
                }
                if (TextWindows.overlapsAny(matcher.start(), matcher.end(), dateSpans)) {
                    log.debug("Skipping phone candidate inside a date range: {}", candidate);
                    continue;
                }
                if (digitCount(candidate) < config.getMinPhoneDigits()) {
                    continue;
                }
                return candidate;
            }
        }
        return "";
    }

    /**
     * "City, Region" or "City, XX" in the resume header, rejecting tech-term lookalikes such as "Java, Python".
     */
    public String extractLocation(String text, PatternRegistry registry) {
        String header = text.substring(0, Math.min(text.length(), config.getLocationHeaderChars()));
        for (Pattern pattern : LOCATION_PATTERNS) {
            Matcher matcher = pattern.matcher(header);
            while (matcher.find()) {
                String city = matcher.group(1);
                String region = matcher.group(2);
                if (isPlausibleLocation(header, matcher, city, region, registry)) {
                    return city + ", " + region;
                }
            }
        }
        return "";
    }

    private boolean isPlausibleLocation(String header, Matcher matcher, String city, String region,
                                        PatternRegistry registry) {
        if (registry.getTechTerms().containsAny(city) || registry.getTechTerms().containsAny(region)) {
            return false;
        }
        // "Software Engineer, Google" has the right shape but is a job line
        if (registry.getWorkContext().containsAny(matcher.group())) {
            return false;
        }
        String window = TextWindows.around(header, matcher.start(), matcher.end(), config.getLocationContextWindow());
        return !registry.getTechTerms().containsAny(window) && !registry.getTechContext().containsAny(window);
    }

    private static List<int[]> dateSpans(String text, PatternRegistry registry) {
        List<int[]> spans = new ArrayList<>();
        for (Pattern pattern : registry.getDateRangePatterns()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                spans.add(new int[] {matcher.start(), matcher.end()});
            }
        }
        return spans;
    }

    private static int digitCount(String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (Character.isDigit(value.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}
