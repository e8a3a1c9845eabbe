package dev.resumescanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Limits and window sizes used by the field extractors.
 * Loaded from application.yml under the 'extraction' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "extraction")
public class ExtractionConfig {

    private int headerLines = 15;
    private int maxNameLineLength = 80;
    private int locationHeaderChars = 1000;
    private int locationContextWindow = 50;
    private int dateContextWindow = 100;
    private int minWorkYear = 1950;
    private double maxYearsExperience = 50;
    private int maxSkills = 10;
    private int maxCertifications = 15;
    private int maxCompanies = 10;
    private int maxJobTitles = 5;
    private int certificationContextWindow = 80;
    private int certificationContextLines = 3;
    private int companyContextWindow = 80;
    private int jobTitleContextWindow = 100;
    private int degreeContextWindow = 50;
    private int nonDegreeContextWindow = 150;
    private int minPhoneDigits = 10;
}
