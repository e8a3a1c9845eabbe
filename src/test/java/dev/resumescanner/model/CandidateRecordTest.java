package dev.resumescanner.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateRecordTest {

    @Test
    @DisplayName("Should not see later changes to the caller's lists")
    void copiesCallerLists() {
        List<String> skills = new ArrayList<>(List.of("Java", "Kafka"));
        List<String> companies = new ArrayList<>(List.of("Globex"));

        CandidateRecord candidate = CandidateRecord.builder()
                .skills(skills)
                .companies(companies)
                .build();
        skills.add("Cobol");
        companies.clear();

        assertThat(candidate.getSkills()).containsExactly("Java", "Kafka");
        assertThat(candidate.getCompanies()).containsExactly("Globex");
    }

    @Test
    @DisplayName("Should expose read-only lists")
    void listsAreReadOnly() {
        CandidateRecord candidate = CandidateRecord.builder()
                .jobTitles(new ArrayList<>(List.of("Software Engineer")))
                .build();

        assertThatThrownBy(() -> candidate.getJobTitles().add("Manager"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> candidate.getCertifications().add("AWS Certified"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should replace null fields with empty values")
    void nullsBecomeEmpty() {
        CandidateRecord candidate = CandidateRecord.builder()
                .name(null)
                .email(null)
                .skills(null)
                .certifications(null)
                .educationLevel(null)
                .build();

        assertThat(candidate.getName()).isEmpty();
        assertThat(candidate.getEmail()).isEmpty();
        assertThat(candidate.getPhone()).isEmpty();
        assertThat(candidate.getSkills()).isEmpty();
        assertThat(candidate.getCertifications()).isEmpty();
        assertThat(candidate.getEducationLevel()).isEqualTo(EducationLevel.NOT_SPECIFIED);
        assertThat(candidate.hasName()).isFalse();
    }

    @Test
    @DisplayName("Should keep values when copied with toBuilder")
    void toBuilderKeepsValues() {
        CandidateRecord original = CandidateRecord.builder()
                .name("Jane Doe")
                .skills(List.of("Java"))
                .educationLevel(EducationLevel.MASTERS)
                .yearsExperience(6.5)
                .sourceId("jane.txt")
                .build();

        CandidateRecord copy = original.toBuilder().phone("(555) 123-4567").build();

        assertThat(copy.getName()).isEqualTo("Jane Doe");
        assertThat(copy.getSkills()).containsExactly("Java");
        assertThat(copy.getEducationLevel()).isEqualTo(EducationLevel.MASTERS);
        assertThat(copy.getYearsExperience()).isEqualTo(6.5);
        assertThat(copy.getPhone()).isEqualTo("(555) 123-4567");
        assertThat(original.getPhone()).isEmpty();
    }
}
