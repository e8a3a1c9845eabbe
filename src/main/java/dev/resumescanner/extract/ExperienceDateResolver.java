package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.model.DateContext;
import dev.resumescanner.model.DateRangeMatch;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns date ranges in resume text into years of work experience.
 * <p>
 * Every range is classified from the text around it: education wording wins over work
 * wording, and a range with neither is left out. Included durations are summed without
 * merging overlapping positions, so two concurrent jobs count twice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExperienceDateResolver {

    private static final Pattern YEAR = Pattern.compile("\\d{4}");

    private final ExtractionConfig config;
    private final Clock clock;

    /**
     * All date ranges in text order, each tagged with its context and counted duration.
     */
    public List<DateRangeMatch> resolve(String text, PatternRegistry registry) {
        int currentYear = Year.now(clock).getValue();
        List<int[]> claimed = new ArrayList<>();
        List<DateRangeMatch> matches = new ArrayList<>();

        for (Pattern pattern : registry.getDateRangePatterns()) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                if (TextWindows.overlapsAny(matcher.start(), matcher.end(), claimed)) {
                    continue;
                }
                claimed.add(new int[] {matcher.start(), matcher.end()});
                matches.add(toMatch(text, matcher, currentYear, registry));
            }
        }

        matches.sort(Comparator.comparingInt(DateRangeMatch::start));
        return List.copyOf(matches);
    }

    /**
     * Sum of included durations, clamped to [0, max years].
     */
    public double totalYears(List<DateRangeMatch> matches) {
        int total = matches.stream()
                .filter(DateRangeMatch::included)
                .mapToInt(DateRangeMatch::durationYears)
                .sum();
        return Math.max(0, Math.min(config.getMaxYearsExperience(), total));
    }

    public double totalYears(String text, PatternRegistry registry) {
        return totalYears(resolve(text, registry));
    }

    DateContext classify(String text, int start, int end, PatternRegistry registry) {
        String window = TextWindows.around(text, start, end, config.getDateContextWindow());
        if (registry.getEducationContext().containsAny(window)) {
            return DateContext.EDUCATION;
        }
        if (registry.getWorkContext().containsAny(window)) {
            return DateContext.WORK;
        }
        return DateContext.AMBIGUOUS;
    }

    private DateRangeMatch toMatch(String text, Matcher matcher, int currentYear, PatternRegistry registry) {
        String endToken = matcher.group("end").trim();
        int startYear = parseYear(matcher.group("start"));
        boolean openEnded = registry.isOpenEnd(endToken);
        int endYear = openEnded ? currentYear : parseYear(endToken);
        DateContext context = classify(text, matcher.start(), matcher.end(), registry);

        int duration = endYear - startYear;
        boolean included = context == DateContext.WORK
                && startYear >= config.getMinWorkYear()
                && duration > 0;

        if (log.isDebugEnabled()) {
            log.debug("Date range '{}' -> {} ({} years, {})", matcher.group(), context, duration,
                    included ? "counted" : "ignored");
        }
        return new DateRangeMatch(matcher.group(), matcher.start(), matcher.end(), startYear, endYear,
                openEnded, context, included, included ? duration : 0);
    }

    private static int parseYear(String token) {
        Matcher matcher = YEAR.matcher(token);
        int year = 0;
        while (matcher.find()) {
            year = Integer.parseInt(matcher.group());
        }
        return year;
    }
}
