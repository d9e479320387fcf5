package dev.shortlist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Criterion weights and recommendation thresholds.
 * Loaded from scoring.yml under 'scoring' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringConfig {

    private double profileWeight = 0.3;
    private double technicalWeight = 0.4;
    private double softSkillWeight = 0.3;

    private double stronglyRecommendedThreshold = 80;
    private double recommendedThreshold = 65;
    private double toConsiderThreshold = 50;

    // A criterion at or above this score is listed as a strength.
    private double strengthThreshold = 70;
    // A criterion below this score is listed as something to improve.
    private double improvementThreshold = 50;

    private int topCandidates = 3;
}
