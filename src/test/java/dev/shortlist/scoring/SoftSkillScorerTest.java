package dev.shortlist.scoring;

import dev.shortlist.TestFixtures;
import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.Experience;
import dev.shortlist.model.SoftSkillAssessment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SoftSkillScorerTest {

    private SoftSkillScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new SoftSkillScorer(TestFixtures.patternLibrary());
    }

    private static CandidateProfile candidate(String rawText, String coverLetter) {
        return CandidateProfile.builder()
                .id("candidate")
                .name("Hugo Bernard")
                .rawText(rawText)
                .coverLetter(coverLetter)
                .build();
    }

    @Test
    @DisplayName("Should fall back to base values for an empty profile")
    void shouldUseBaseValuesForEmptyProfile() {
        SoftSkillAssessment assessment = scorer.assess(candidate("", ""));

        assertThat(assessment.motivation()).isEqualTo(30.0);
        assertThat(assessment.communication()).isEqualTo(50.0);
        assertThat(assessment.leadership()).isEqualTo(30.0);
        assertThat(assessment.tags()).isEmpty();
        assertThat(assessment.score().score()).isCloseTo(33.0, within(1e-9));
        assertThat(assessment.score().rationale()).startsWith("Soft skills to develop");
    }

    @Nested
    @DisplayName("Cover letter")
    class CoverLetterTests {

        @Test
        @DisplayName("Should reward a motivated, well formed letter")
        void shouldRewardMotivatedLetter() {
            SoftSkillAssessment assessment = scorer.assess(candidate(TestFixtures.RESUME, TestFixtures.COVER_LETTER));

            assertThat(assessment.motivation()).isEqualTo(90.0);
            assertThat(assessment.communication()).isEqualTo(100.0);
            assertThat(assessment.tags()).contains("communication", "motivation");
        }

        @Test
        @DisplayName("Should penalise a short, negative letter")
        void shouldPenaliseNegativeLetter() {
            String letter = "Je cherche un emploi, disponible immédiatement, urgent. N'importe quel poste.";

            SoftSkillAssessment assessment = scorer.assess(candidate("", letter));

            assertThat(assessment.motivation()).isEqualTo(10.0);
            assertThat(assessment.communication()).isEqualTo(30.0);
        }
    }

    @Nested
    @DisplayName("Résumé")
    class ResumeTests {

        @Test
        @DisplayName("Should read leadership from keywords and titles")
        void shouldReadLeadership() {
            CandidateProfile profile = candidate(
                    "Responsable d'équipe, j'ai encadré 5 personnes et piloté des projets.", "")
                    .toBuilder()
                    .experiences(List.of(new Experience("Chef de projet data", 2019, 2023, false)))
                    .build();

            assertThat(scorer.assess(profile).leadership()).isEqualTo(50.0);
        }

        @Test
        @DisplayName("Should detect soft-skill tags in group order")
        void shouldDetectTags() {
            SoftSkillAssessment assessment = scorer.assess(candidate("Profil autonome et flexible.", ""));

            assertThat(assessment.tags()).containsExactly("autonomy", "adaptability");
            assertThat(assessment.score().rationale()).contains("Detected: autonomy, adaptability");
        }
    }

    @Test
    @DisplayName("Should keep every component within bounds")
    void shouldStayWithinBounds() {
        SoftSkillAssessment assessment = scorer.assess(candidate(TestFixtures.RESUME, TestFixtures.COVER_LETTER));

        assertThat(assessment.score().score()).isBetween(0.0, 100.0);
        assertThat(assessment.leadership()).isBetween(0.0, 100.0);
    }
}
