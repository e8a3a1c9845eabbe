package dev.resumescanner.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import dev.resumescanner.model.CandidateRecord;
import dev.resumescanner.service.FitScoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes candidate records as CSV, one row per candidate with a header line.
 * Multi-valued fields are joined with "; ".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CandidateCsvExporter {

    static final String LIST_SEPARATOR = "; ";

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(CandidateRow.class).withHeader();

    private final FitScoreService fitScoreService;

    @JsonPropertyOrder({"name", "email", "phone", "location", "skills", "companies", "job_titles",
            "education_level", "certifications", "years_experience", "fit_score", "source_id"})
    public record CandidateRow(
            @JsonProperty("name") String name,
            @JsonProperty("email") String email,
            @JsonProperty("phone") String phone,
            @JsonProperty("location") String location,
            @JsonProperty("skills") String skills,
            @JsonProperty("companies") String companies,
            @JsonProperty("job_titles") String jobTitles,
            @JsonProperty("education_level") String educationLevel,
            @JsonProperty("certifications") String certifications,
            @JsonProperty("years_experience") double yearsExperience,
            @JsonProperty("fit_score") double fitScore,
            @JsonProperty("source_id") String sourceId) {
    }

    public String toCsv(List<CandidateRecord> candidates) {
        try {
            return writer().writeValueAsString(toRows(candidates));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize candidates to CSV", e);
        }
    }

    /**
     * Write the CSV to a file, creating parent directories as needed.
     */
    public void export(List<CandidateRecord> candidates, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer().writeValue(target.toFile(), toRows(candidates));
        log.info("Exported {} candidates to {}", candidates.size(), target.toAbsolutePath());
    }

    private static ObjectWriter writer() {
        return CSV_MAPPER.writer(SCHEMA);
    }

    private List<CandidateRow> toRows(List<CandidateRecord> candidates) {
        return candidates.stream().map(this::toRow).toList();
    }

    private CandidateRow toRow(CandidateRecord candidate) {
        return new CandidateRow(
                candidate.getName(),
                candidate.getEmail(),
                candidate.getPhone(),
                candidate.getLocation(),
                String.join(LIST_SEPARATOR, candidate.getSkills()),
                String.join(LIST_SEPARATOR, candidate.getCompanies()),
                String.join(LIST_SEPARATOR, candidate.getJobTitles()),
                candidate.getEducationLevel().getLabel(),
                String.join(LIST_SEPARATOR, candidate.getCertifications()),
                candidate.getYearsExperience(),
                fitScoreService.calculate(candidate).total(),
                candidate.getSourceId());
    }
}
