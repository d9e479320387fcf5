package dev.shortlist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of an evaluation run: where résumés live and how candidates are
 * resolved and processed.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "evaluation")
public class EvaluationConfig {

    private String dataDir = "./data/cvs";
    private List<String> extensions = new ArrayList<>(List.of(".pdf", ".txt", ".md", ".html"));
    private int defaultLimit = 10;
    private int semanticOverfetch = 2;
    private int parallelism = 1;
    private Duration jobTimeout = Duration.ofMinutes(10);
    private String localLanguage = "Français";
    private int keywordCount = 10;
}
