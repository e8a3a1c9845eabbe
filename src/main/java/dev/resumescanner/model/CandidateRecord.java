package dev.resumescanner.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Structured candidate data extracted from one resume. Immutable once built.
 * Missing strings become empty, missing lists become empty lists.
 */
@Value
public class CandidateRecord {

    String name;

    String email;

    String phone;

    String location;

    List<String> skills;

    List<String> companies;

    List<String> jobTitles;

    EducationLevel educationLevel;

    List<String> certifications;

    double yearsExperience;

    String sourceId;

    @Builder(toBuilder = true)
    private CandidateRecord(String name, String email, String phone, String location,
                            List<String> skills, List<String> companies, List<String> jobTitles,
                            EducationLevel educationLevel, List<String> certifications,
                            double yearsExperience, String sourceId) {
        this.name = orEmpty(name);
        this.email = orEmpty(email);
        this.phone = orEmpty(phone);
        this.location = orEmpty(location);
        this.skills = copyOf(skills);
        this.companies = copyOf(companies);
        this.jobTitles = copyOf(jobTitles);
        this.educationLevel = educationLevel == null ? EducationLevel.NOT_SPECIFIED : educationLevel;
        this.certifications = copyOf(certifications);
        this.yearsExperience = yearsExperience;
        this.sourceId = orEmpty(sourceId);
    }

    public boolean hasName() {
        return !name.isBlank();
    }

    public boolean hasEmail() {
        return !email.isBlank();
    }

    public boolean hasPhone() {
        return !phone.isBlank();
    }

    /**
     * Name for display, falling back to the source document identifier.
     */
    public String displayName() {
        return hasName() ? name : sourceId;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
