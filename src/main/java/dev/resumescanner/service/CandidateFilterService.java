package dev.resumescanner.service;

import dev.resumescanner.model.CandidateFilter;
import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.model.ExperienceLevel;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Narrows a candidate list by name, skill, experience level and education level.
 */
@Service
public class CandidateFilterService {

    public List<CandidateRecord> filter(List<CandidateRecord> candidates, CandidateFilter filter) {
        if (candidates == null) {
            return List.of();
        }
        if (filter == null) {
            return List.copyOf(candidates);
        }
        return candidates.stream()
                .filter(candidate -> matches(candidate, filter))
                .toList();
    }

    public boolean matches(CandidateRecord candidate, CandidateFilter filter) {
        if (isSet(filter.getNameContains())
                && !containsIgnoreCase(candidate.getName(), filter.getNameContains())) {
            return false;
        }
        if (isSet(filter.getSkillContains())
                && candidate.getSkills().stream().noneMatch(skill -> containsIgnoreCase(skill, filter.getSkillContains()))) {
            return false;
        }
        if (filter.getExperienceLevel() != null
                && ExperienceLevel.of(candidate.getYearsExperience()) != filter.getExperienceLevel()) {
            return false;
        }
        return filter.getEducationLevel() == null || candidate.getEducationLevel() == filter.getEducationLevel();
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean containsIgnoreCase(String value, String part) {
        return value.toLowerCase(Locale.ROOT).contains(part.trim().toLowerCase(Locale.ROOT));
    }
}
