package dev.resumescanner.model;

import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for narrowing a candidate list. Null fields are ignored.
 */
@Value
@Builder
public class CandidateFilter {
    String nameContains;
    String skillContains;
    ExperienceLevel experienceLevel;
    EducationLevel educationLevel;

    public static CandidateFilter none() {
        return CandidateFilter.builder().build();
    }
}
