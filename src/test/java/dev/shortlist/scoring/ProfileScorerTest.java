package dev.shortlist.scoring;

import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.Education;
import dev.shortlist.model.JobRequirement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Set;

import static dev.shortlist.TestFixtures.profile;
import static dev.shortlist.TestFixtures.requirement;
import static dev.shortlist.TestFixtures.skills;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProfileScorerTest {

    private ProfileScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new ProfileScorer();
    }

    @Nested
    @DisplayName("Without a requirement")
    class StandaloneTests {

        @Test
        @DisplayName("Should score years, skills and education on their own")
        void shouldScoreStandalone() {
            CandidateProfile candidate = profile("Ana Lima", 2, skills("Python", "SQL", "Docker", "Git", "Java"))
                    .toBuilder()
                    .education(List.of(new Education("Master en Informatique")))
                    .build();

            CriterionScore score = scorer.score(candidate, null);

            assertThat(score.score()).isEqualTo(40.0);
            assertThat(score.rationale()).startsWith("Experience: 2.0 years | Skills: 5");
        }

        @Test
        @DisplayName("Should cap each standalone component")
        void shouldCapComponents() {
            CandidateProfile candidate = profile("Ana Lima", 12, Set.of())
                    .toBuilder()
                    .education(List.of(new Education("Licence"), new Education("Master"),
                            new Education("Doctorat"), new Education("MBA")))
                    .build();

            assertThat(scorer.score(candidate, null).score()).isEqualTo(60.0);
        }
    }

    @Nested
    @DisplayName("Against a requirement")
    class RequirementTests {

        @Test
        @DisplayName("Should add experience, required and optional skill points")
        void shouldCombineComponents() {
            JobRequirement job = requirement(skills("Python", "SQL"), skills("Docker", "Power BI"));
            CandidateProfile candidate = profile("Ana Lima", 4, skills("Python", "SQL", "Docker"));

            CriterionScore score = scorer.score(candidate, job);

            assertThat(score.score()).isCloseTo(75.5, within(1e-9));
            assertThat(score.rationale())
                    .contains("Experience: 4.0 years (minimum 3)")
                    .contains("required skills 2/2, optional 1/2")
                    .contains("Education: 0 entries");
        }

        @ParameterizedTest(name = "{0} years for a minimum of 3 -> total {1}")
        @CsvSource({
                "3, 30",
                "5, 30",
                "2.5, 20",
                "2, 10",
                "1.5, 10",
                "1.4, 0",
                "0, 0"
        })
        void shouldGradeExperienceAgainstMinimum(double years, double expected) {
            JobRequirement job = requirement(Set.of(), Set.of());
            CandidateProfile candidate = profile("Ana Lima", years, Set.of());

            assertThat(scorer.score(candidate, job).score()).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should use the skill count when no skill is required")
        void shouldUseSkillCountWithoutRequiredSkills() {
            JobRequirement job = requirement(Set.of(), Set.of());
            CandidateProfile candidate = profile("Ana Lima", 3, skills("Python", "SQL", "Docker"))
                    .toBuilder()
                    .education(List.of(new Education("Master")))
                    .build();

            assertThat(scorer.score(candidate, job).score()).isEqualTo(30 + 6 + 20);
        }

        @Test
        @DisplayName("Should never exceed 100")
        void shouldCapTotal() {
            JobRequirement job = requirement(skills("Python"), skills("Docker"));
            CandidateProfile candidate = profile("Ana Lima", 10, skills("Python", "Docker"))
                    .toBuilder()
                    .education(List.of(new Education("Master")))
                    .build();

            assertThat(scorer.score(candidate, job).score()).isEqualTo(100.0);
        }
    }
}
