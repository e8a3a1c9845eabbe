package dev.resumescanner.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Weights and caps for the fit score and the relevance ranking.
 * Loaded from application.yml under the 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private Fit fit = new Fit();
    private Relevance relevance = new Relevance();

    @Data
    public static class Fit {
        private double namePoints = 10;
        private double emailPoints = 10;
        private double phonePoints = 10;
        private double pointsPerSkill = 2;
        private double skillsCap = 20;
        private double pointsPerYear = 2.5;
        private double experienceCap = 25;
        private double educationPoints = 15;
        private double pointsPerCertification = 2;
        private double certificationsCap = 10;
        private double reviewThreshold = 30;
        private int minNameLength = 3;
        private List<String> invalidNameWords = new ArrayList<>(
                List.of("certificate", "resume", "cv", "curriculum", "vitae", "application"));
    }

    @Data
    public static class Relevance {
        private int minTermLength = 3;
        private double nameMatch = 10;
        private double emailMatch = 5;
        private double skillMatch = 3;
        private double namePresent = 1;
        private double emailPresent = 1;
        private double phonePresent = 1;
        private double perSkill = 0.2;
        private int maxBonusSkills = 5;
        private double completenessCap = 3.5;
        private Map<String, Double> skillWeights = new HashMap<>();
    }
}
