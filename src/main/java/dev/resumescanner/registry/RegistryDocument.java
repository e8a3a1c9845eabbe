package dev.resumescanner.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of the pattern registry resource.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryDocument {
    private String version = "unversioned";
    private List<String> skills = new ArrayList<>();
    private List<CertificationEntry> certifications = new ArrayList<>();
    private List<String> certificationContext = new ArrayList<>();
    private List<String> skillMentionPhrases = new ArrayList<>();
    private List<String> certificationSectionHeaders = new ArrayList<>();
    private List<String> sectionHeadings = new ArrayList<>();
    private List<EducationEntry> educationLevels = new ArrayList<>();
    private List<String> degreeContext = new ArrayList<>();
    private List<String> nonDegreeContext = new ArrayList<>();
    private List<String> abbreviationNonDegreeContext = new ArrayList<>();
    private List<String> workContext = new ArrayList<>();
    private List<String> educationContext = new ArrayList<>();
    private List<String> dateRangePatterns = new ArrayList<>();
    private List<String> openEndTokens = new ArrayList<>();
    private List<String> nameBlocklist = new ArrayList<>();
    private List<String> filenameNoiseWords = new ArrayList<>();
    private List<String> techTerms = new ArrayList<>();
    private List<String> techContext = new ArrayList<>();
    private List<String> companySuffixes = new ArrayList<>();
    private List<String> companyStopWords = new ArrayList<>();
    private List<String> jobTitleSeniority = new ArrayList<>();
    private List<String> jobTitleDomains = new ArrayList<>();
    private List<String> jobTitleRoles = new ArrayList<>();
    private List<String> jobContext = new ArrayList<>();
    private List<String> excludedJobTitles = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CertificationEntry {
        private String name;
        private List<String> patterns = new ArrayList<>();
        private List<String> requiredContext = new ArrayList<>();
        private List<String> forbiddenContext = new ArrayList<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EducationEntry {
        private String level;
        private List<String> patterns = new ArrayList<>();
        private List<String> abbreviations = new ArrayList<>();
    }
}
