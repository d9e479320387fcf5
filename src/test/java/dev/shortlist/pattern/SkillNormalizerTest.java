package dev.shortlist.pattern;

import dev.shortlist.model.NormalizedSkill;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SkillNormalizerTest {

    private SkillNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new SkillNormalizer(new DefaultPatternLibrary());
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "Scikit-Learn, scikit learn",
            "sklearn, scikit learn",
            "PySpark, spark",
            "Apache Spark, spark",
            "k8s, kubernetes",
            "ML, machine learning",
            "Node.js, node js",
            "  Power   BI , power bi",
            "Rust, rust"
    })
    void shouldNormalizeAliasesToOneKey(String raw, String key) {
        assertThat(normalizer.normalizeSkill(raw)).isEqualTo(key);
    }

    @Test
    @DisplayName("Should derive labels from the key")
    void shouldDeriveLabels() {
        assertThat(normalizer.normalize("powerbi").label()).isEqualTo("Power BI");
        assertThat(normalizer.normalize("apache beam").label()).isEqualTo("Apache Beam");
        assertThat(normalizer.isKnown("python")).isTrue();
        assertThat(normalizer.isKnown("apache beam")).isFalse();
    }

    @Test
    @DisplayName("Should find skills in order of first appearance")
    void shouldFindSkillsInOrder() {
        List<String> keys = normalizer.findSkills("Docker, then Python; Python again and scikit-learn")
                .stream()
                .map(NormalizedSkill::key)
                .toList();

        assertThat(keys).containsExactly("docker", "python", "scikit learn");
    }

    @Test
    @DisplayName("Should report offsets into the original text")
    void shouldReportOffsets() {
        String text = "Profil: Power-BI expert";
        SkillOccurrence occurrence = normalizer.findOccurrences(text).get(0);

        assertThat(text.substring(occurrence.start(), occurrence.end())).isEqualTo("Power-BI");
    }
}
