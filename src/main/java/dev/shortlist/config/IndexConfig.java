package dev.shortlist.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Chunking of résumés for the retrieval index, in words.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "index")
public class IndexConfig {

    private int chunkSize = 200;
    private int chunkOverlap = 40;
}
