package dev.resumescanner.registry;

import dev.resumescanner.model.EducationLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Immutable vocabulary shared by every extractor: skills, certification table,
 * education keywords, context keyword sets and date-range expressions.
 * <p>
 * Instances are built from a {@link RegistryDocument} and passed by reference into
 * each extractor call, so alternative vocabularies can be swapped in without
 * touching extractor code.
 */
@Getter
public final class PatternRegistry {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** A capitalized word inside an organization name, such as "Acme" or "AT&amp;T". */
    public static final String CAPITALIZED_WORD = "[A-Z][\\w&.'-]*";

    private final String version;
    private final List<SkillPattern> skills;
    private final List<CertificationPattern> certifications;
    private final KeywordSet certificationContext;
    private final KeywordSet skillMentionPhrases;
    private final KeywordSet certificationSectionHeaders;
    private final KeywordSet sectionHeadings;
    private final List<EducationLevelPattern> educationLevels;
    private final KeywordSet degreeContext;
    private final KeywordSet nonDegreeContext;
    private final KeywordSet abbreviationNonDegreeContext;
    private final KeywordSet workContext;
    private final KeywordSet educationContext;
    private final List<Pattern> dateRangePatterns;
    private final KeywordSet openEndTokens;
    private final KeywordSet nameBlocklist;
    private final KeywordSet filenameNoiseWords;
    private final KeywordSet techTerms;
    private final KeywordSet techContext;
    private final List<String> companySuffixes;
    private final KeywordSet companyStopWords;
    private final Pattern companySuffixPattern;
    private final Pattern jobTitlePattern;
    private final Pattern jobRolePattern;
    private final KeywordSet jobContext;
    private final KeywordSet excludedJobTitles;

    private PatternRegistry(RegistryDocument document) {
        this.version = document.getVersion();
        this.skills = compileSkills(document.getSkills());
        this.certifications = document.getCertifications().stream()
                .map(PatternRegistry::compileCertification)
                .toList();
        this.certificationContext = KeywordSet.of(document.getCertificationContext());
        this.skillMentionPhrases = KeywordSet.of(document.getSkillMentionPhrases());
        this.certificationSectionHeaders = KeywordSet.of(document.getCertificationSectionHeaders());
        this.sectionHeadings = KeywordSet.of(document.getSectionHeadings());
        this.educationLevels = compileEducationLevels(document.getEducationLevels());
        this.degreeContext = KeywordSet.of(document.getDegreeContext());
        this.nonDegreeContext = KeywordSet.of(document.getNonDegreeContext());
        this.abbreviationNonDegreeContext = KeywordSet.of(document.getAbbreviationNonDegreeContext());
        this.workContext = KeywordSet.of(document.getWorkContext());
        this.educationContext = KeywordSet.of(document.getEducationContext());
        this.dateRangePatterns = compileDateRangePatterns(document.getDateRangePatterns());
        this.openEndTokens = KeywordSet.of(document.getOpenEndTokens());
        this.nameBlocklist = KeywordSet.of(document.getNameBlocklist());
        this.filenameNoiseWords = KeywordSet.of(document.getFilenameNoiseWords());
        this.techTerms = KeywordSet.of(document.getTechTerms());
        this.techContext = KeywordSet.of(document.getTechContext());
        this.companySuffixes = List.copyOf(document.getCompanySuffixes());
        this.companyStopWords = KeywordSet.of(document.getCompanyStopWords());
        this.companySuffixPattern = compileCompanySuffixPattern(companySuffixes);
        this.jobTitlePattern = compileJobTitlePattern(document);
        this.jobRolePattern = document.getJobTitleRoles().isEmpty()
                ? null
                : compile("\\b(?:" + String.join("|", document.getJobTitleRoles()) + ")s?\\b");
        this.jobContext = KeywordSet.of(document.getJobContext());
        this.excludedJobTitles = KeywordSet.of(document.getExcludedJobTitles());

        Set<String> overlap = new LinkedHashSet<>(workContext.keywords());
        overlap.retainAll(educationContext.keywords());
        if (!overlap.isEmpty()) {
            throw new IllegalArgumentException("Work and education context keywords must be disjoint: " + overlap);
        }
    }

    /**
     * Compile a registry from its document form.
     *
     * @throws IllegalArgumentException when a pattern does not compile or the context sets overlap
     */
    public static PatternRegistry from(RegistryDocument document) {
        return new PatternRegistry(document);
    }

    /**
     * Append extra skills to a document's vocabulary, skipping case-insensitive duplicates.
     *
     * @return the same document, for chaining into {@link #from(RegistryDocument)}
     */
    public static RegistryDocument withAdditionalSkills(RegistryDocument document, Collection<String> extraSkills) {
        if (extraSkills == null || extraSkills.isEmpty()) {
            return document;
        }
        LinkedHashSet<String> merged = new LinkedHashSet<>(document.getSkills());
        extraSkills.stream()
                .filter(skill -> skill != null && !skill.isBlank())
                .map(String::trim)
                .filter(skill -> merged.stream().noneMatch(existing -> existing.equalsIgnoreCase(skill)))
                .forEach(merged::add);
        document.setSkills(new ArrayList<>(merged));
        return document;
    }

    public List<String> skillNames() {
        return skills.stream().map(SkillPattern::name).toList();
    }

    public boolean isOpenEnd(String token) {
        return openEndTokens.matchesExactly(token);
    }

    private static List<SkillPattern> compileSkills(List<String> names) {
        // Longer entries first so that "Machine Learning" claims its span before shorter overlaps
        return names.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .stream()
                .sorted(Comparator.comparingInt(String::length).reversed())
                .map(SkillPattern::of)
                .toList();
    }

    private static CertificationPattern compileCertification(RegistryDocument.CertificationEntry entry) {
        if (entry.getName() == null || entry.getName().isBlank()) {
            throw new IllegalArgumentException("Certification entry without a name");
        }
        return new CertificationPattern(
                entry.getName().trim(),
                compileAll(entry.getPatterns()),
                KeywordSet.of(entry.getRequiredContext()),
                KeywordSet.of(entry.getForbiddenContext()));
    }

    private static List<EducationLevelPattern> compileEducationLevels(List<RegistryDocument.EducationEntry> entries) {
        return entries.stream()
                .map(entry -> new EducationLevelPattern(
                        EducationLevel.fromLabel(entry.getLevel()),
                        compileAll(entry.getPatterns()),
                        compileAll(entry.getAbbreviations())))
                .filter(pattern -> pattern.level().isSpecified())
                .sorted(Comparator.comparingInt((EducationLevelPattern p) -> p.level().getRank()).reversed())
                .toList();
    }

    private static List<Pattern> compileDateRangePatterns(List<String> regexes) {
        List<Pattern> patterns = compileAll(regexes);
        for (Pattern pattern : patterns) {
            if (!pattern.pattern().contains("(?<start>") || !pattern.pattern().contains("(?<end>")) {
                throw new IllegalArgumentException("Date range pattern needs 'start' and 'end' groups: " + pattern);
            }
        }
        return patterns;
    }

    private static Pattern compileJobTitlePattern(RegistryDocument document) {
        if (document.getJobTitleDomains().isEmpty() || document.getJobTitleRoles().isEmpty()) {
            return null;
        }
        String seniority = String.join("|", document.getJobTitleSeniority());
        String domains = String.join("|", document.getJobTitleDomains());
        String roles = String.join("|", document.getJobTitleRoles());
        String regex = "\\b(?:(?:" + seniority + ")\\s+)?(?:" + domains + ")\\s+(?:" + roles + ")s?\\b";
        return compile(regex);
    }

    /**
     * Up to five capitalized words ending in a suffix such as "Inc" or "Technologies", not followed
     * by another capitalized word. Case-sensitive, since capitalization is the signal.
     */
    private static Pattern compileCompanySuffixPattern(List<String> suffixes) {
        if (suffixes.isEmpty()) {
            return null;
        }
        String alternation = suffixes.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?<company>" + CAPITALIZED_WORD + "(?:[ \\t]+" + CAPITALIZED_WORD + "){0,4}"
                + "[ \\t]+(?:" + alternation + ")\\.?)(?!\\w)(?![ \\t]+[A-Z])");
    }

    private static List<Pattern> compileAll(List<String> regexes) {
        if (regexes == null) {
            return List.of();
        }
        return regexes.stream().map(PatternRegistry::compile).toList();
    }

    private static Pattern compile(String regex) {
        try {
            return Pattern.compile(regex, FLAGS);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid registry pattern: " + regex, e);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "PatternRegistry[version=%s, skills=%d, certifications=%d]",
                version, skills.size(), certifications.size());
    }
}
