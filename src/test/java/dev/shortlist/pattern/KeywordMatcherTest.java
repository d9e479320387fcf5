package dev.shortlist.pattern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordMatcherTest {

    @Nested
    @DisplayName("Token boundaries")
    class BoundaryTests {

        @ParameterizedTest(name = "\"{1}\" in \"{0}\" -> {2}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
                "we use java daily|java|true",
                "we use javascript daily|java|false",
                "c++ and c#|c++|true",
                "c++ and c#|c|false",
                "j'ai travaillé en équipe|ai|false",
                "notions d'ai et de ml|ai|false",
                "ai and ml|ai|true",
                "apache   spark jobs|apache spark|true",
                "PYTHON 3|python|true"
        })
        void shouldRespectTokenBoundaries(String text, String keyword, boolean expected) {
            assertThat(KeywordMatcher.containsWord(text, keyword)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should count every bounded occurrence")
        void shouldCountOccurrences() {
            assertThat(KeywordMatcher.countWord("sql, nosql, SQL server", "sql")).isEqualTo(2);
        }

        @Test
        @DisplayName("Should return false for blank keyword")
        void shouldReturnFalseForBlankKeyword() {
            assertThat(KeywordMatcher.containsWord("anything", " ")).isFalse();
            assertThat(KeywordMatcher.countWord(null, "java")).isZero();
        }
    }

    @Nested
    @DisplayName("Normalization")
    class NormalizationTests {

        @Test
        @DisplayName("Should keep offsets aligned with the input")
        void shouldKeepOffsetsAligned() {
            String text = "Scikit-Learn_et Node.JS";
            String normalized = KeywordMatcher.normalizeForMatching(text);

            assertThat(normalized).isEqualTo("scikit learn et node js");
            assertThat(normalized).hasSameSizeAs(text);
        }

        @Test
        @DisplayName("Should lowercase accented capitals")
        void shouldLowercaseAccentedCapitals() {
            assertThat(KeywordMatcher.lowerCase("EXPÉRIENCE")).isEqualTo("expérience");
            assertThat(KeywordMatcher.lowerCase(null)).isEmpty();
        }
    }

    @Test
    @DisplayName("Substring helpers should match word stems")
    void substringHelpersShouldMatchStems() {
        String text = "très motivé et collaboratif";

        assertThat(KeywordMatcher.containsAny(text, List.of("collabor"))).isTrue();
        assertThat(KeywordMatcher.countPresent(text, List.of("motiv", "collabor", "absent"))).isEqualTo(2);
    }
}
