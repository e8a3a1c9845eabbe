package dev.resumescanner.extract;

import dev.resumescanner.config.ExtractionConfig;
import dev.resumescanner.registry.PatternRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Company names and job titles from work-history text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EmploymentExtractor {

    private static final String COMPANY = "(?<company>" + PatternRegistry.CAPITALIZED_WORD
            + "(?:[ \\t]+" + PatternRegistry.CAPITALIZED_WORD + "){0,4})";

    private static final Pattern AT_COMPANY = Pattern.compile("(?:\\b[Aa]t|@)[ \\t]+" + COMPANY);
    private static final Pattern WORKED_AT = Pattern.compile(
            "\\b(?i:worked|working|employed)[ \\t]+(?i:at|for|with)[ \\t]+" + COMPANY);
    private static final Pattern PIPE_LINE = Pattern.compile("^[^|\\n]+(?:\\|[^|\\n]+)+$", Pattern.MULTILINE);

    private static final Pattern TRAILING_DATE = Pattern.compile("\\s*[|,\\u2013\\u2014-]?\\s*\\d{4}.*$");
    private static final Pattern PARENTHETICAL = Pattern.compile("\\s*\\([^)]*\\)");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s,;:|-]+$");
    private static final Pattern YEAR = Pattern.compile("\\b\\d{4}\\b");

    private final ExtractionConfig config;

    private record Candidate(int position, String value) {
    }

    public List<String> extractCompanies(String text, PatternRegistry registry) {
        List<Candidate> candidates = new ArrayList<>();
        collect(text, AT_COMPANY, candidates);
        collect(text, WORKED_AT, candidates);
        if (registry.getCompanySuffixPattern() != null) {
            collect(text, registry.getCompanySuffixPattern(), candidates);
        }
        collectPipeLines(text, registry, candidates);

        Map<String, String> companies = new LinkedHashMap<>();
        candidates.stream()
                .sorted(Comparator.comparingInt(Candidate::position))
                .filter(candidate -> hasWorkContext(text, candidate.position(), registry))
                .map(candidate -> clean(candidate.value()))
                .filter(company -> isValidCompany(company, registry))
                .forEach(company -> companies.putIfAbsent(company.toLowerCase(Locale.ROOT), company));

        return companies.values().stream()
                .limit(config.getMaxCompanies())
                .toList();
    }

    public List<String> extractJobTitles(String text, PatternRegistry registry) {
        Pattern titlePattern = registry.getJobTitlePattern();
        if (titlePattern == null) {
            return List.of();
        }
        LinkedHashSet<String> titles = new LinkedHashSet<>();
        Matcher matcher = titlePattern.matcher(text);
        while (matcher.find() && titles.size() < config.getMaxJobTitles()) {
            String title = matcher.group().trim().replaceAll("\\s+", " ");
            if (registry.getExcludedJobTitles().containsAny(title)) {
                continue;
            }
            String window = TextWindows.around(text, matcher.start(), matcher.end(), config.getJobTitleContextWindow());
            String line = TextWindows.lineAt(text, matcher.start());
            if (registry.getJobContext().containsAny(window) || registry.getJobContext().containsAny(line)) {
                titles.add(title);
            }
        }
        return List.copyOf(titles);
    }

    private static void collect(String text, Pattern pattern, List<Candidate> candidates) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            candidates.add(new Candidate(matcher.start("company"), matcher.group("company")));
        }
    }

    /**
     * "Title | Company | 2019 - 2021" and "Company | Title" lines: the field next to the one naming a role.
     */
    private static void collectPipeLines(String text, PatternRegistry registry, List<Candidate> candidates) {
        Pattern titlePattern = registry.getJobRolePattern();
        if (titlePattern == null) {
            return;
        }
        Matcher lines = PIPE_LINE.matcher(text);
        while (lines.find()) {
            String[] fields = lines.group().split("\\|");
            for (int i = 0; i < fields.length; i++) {
                if (!titlePattern.matcher(fields[i]).find()) {
                    continue;
                }
                int companyIndex = i + 1 < fields.length && !YEAR.matcher(fields[i + 1]).find() ? i + 1 : i - 1;
                if (companyIndex >= 0 && !titlePattern.matcher(fields[companyIndex]).find()) {
                    int offset = lines.start() + offsetOf(fields, companyIndex);
                    candidates.add(new Candidate(offset, fields[companyIndex].trim()));
                }
                break;
            }
        }
    }

    private static int offsetOf(String[] fields, int index) {
        int offset = 0;
        for (int i = 0; i < index; i++) {
            offset += fields[i].length() + 1;
        }
        return offset;
    }

    private boolean hasWorkContext(String text, int position, PatternRegistry registry) {
        String window = TextWindows.around(text, position, position, config.getCompanyContextWindow());
        return registry.getWorkContext().containsAny(window)
                || registry.getWorkContext().containsAny(TextWindows.lineAt(text, position));
    }

    static String clean(String raw) {
        String company = raw;
        int newline = company.indexOf('\n');
        if (newline >= 0) {
            company = company.substring(0, newline);
        }
        company = TRAILING_DATE.matcher(company).replaceFirst("");
        company = PARENTHETICAL.matcher(company).replaceAll("");
        company = TRAILING_PUNCTUATION.matcher(company).replaceFirst("");
        return company.trim().replaceAll("\\s+", " ");
    }

    private static boolean isValidCompany(String company, PatternRegistry registry) {
        if (company.length() < 3 || company.length() > 50) {
            return false;
        }
        String[] words = company.split(" ");
        if (registry.getCompanyStopWords().matchesExactly(words[0])) {
            return false;
        }
        for (String word : words) {
            if (registry.getSectionHeadings().matchesExactly(word)
                    || registry.getNameBlocklist().matchesExactly(word)) {
                return false;
            }
        }
        if (registry.getTechTerms().matchesExactly(company)
                || registry.skillNames().stream().anyMatch(company::equalsIgnoreCase)) {
            return false;
        }
        // "at Stanford University" is a school and "AWS Certified Solutions" a credential, not employers
        return !registry.getEducationContext().containsAny(company)
                && !registry.getCertificationContext().containsAny(company);
    }
}
