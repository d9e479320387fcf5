package dev.shortlist.service;

import dev.shortlist.TestFixtures;
import dev.shortlist.model.CandidateProfile;
import dev.shortlist.model.Education;
import dev.shortlist.model.Experience;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.NormalizedSkill;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ProfileExtractorTest {

    private ProfileExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = TestFixtures.profileExtractor();
    }

    @Nested
    @DisplayName("Sample résumé")
    class SampleResumeTests {

        private CandidateProfile profile;

        @BeforeEach
        void setUp() {
            profile = extractor.extract(TestFixtures.RESUME);
        }

        @Test
        @DisplayName("Should read identity fields")
        void shouldReadIdentity() {
            assertThat(profile.name()).isEqualTo("Jean Dupont");
            assertThat(profile.email()).isEqualTo("jean.dupont@example.com");
            assertThat(profile.phone()).isEqualTo("06 12 34 56 78");
            assertThat(profile.id()).isEqualTo("jean.dupont");
        }

        @Test
        @DisplayName("Should read dated experiences and total years")
        void shouldReadExperiences() {
            assertThat(profile.experiences()).containsExactly(
                    new Experience("Data Scientist chez Acme", 2020, null, true),
                    new Experience("Analyste de données junior", 2018, 2020, false));
            assertThat(profile.yearsExperience()).isEqualTo(8.0);
        }

        @Test
        @DisplayName("Should read education, skills and languages")
        void shouldReadEducationSkillsAndLanguages() {
            assertThat(profile.education()).containsExactly(new Education("Master en Data Science - 2018"));
            assertThat(profile.skills()).extracting(NormalizedSkill::key)
                    .containsExactly("python", "sql", "scikit learn", "docker", "git");
            assertThat(profile.languages()).containsExactly("Français", "Anglais");
        }

        @Test
        @DisplayName("Should give the same profile for the same text")
        void shouldBeIdempotent() {
            assertThat(extractor.extract(TestFixtures.RESUME)).isEqualTo(profile);
        }
    }

    @Test
    @DisplayName("Should keep the cover letter alongside the résumé")
    void shouldKeepCoverLetter() {
        CandidateProfile profile = extractor.extract(TestFixtures.RESUME, TestFixtures.COVER_LETTER, null);

        assertThat(profile.hasCoverLetter()).isTrue();
        assertThat(profile.coverLetter()).isEqualTo(TestFixtures.COVER_LETTER);
    }

    @Test
    @DisplayName("Should look for requirement skills outside the vocabulary")
    void shouldFindRequirementSkillsOutsideVocabulary() {
        JobRequirement requirement = TestFixtures.requirement(
                Set.of(new NormalizedSkill("dataiku", "Dataiku")), Set.of());

        CandidateProfile profile = extractor.extract(TestFixtures.RESUME + "\nOutils : Dataiku\n", "", requirement);

        assertThat(profile.skills()).extracting(NormalizedSkill::key).contains("dataiku");
    }

    @Test
    @DisplayName("Should floor only the total when an experience span is inverted")
    void shouldFloorOnlyTheTotalYears() {
        CandidateProfile profile = extractor.extract("""
                Paul Martin
                paul.martin@example.com

                EXPÉRIENCE PROFESSIONNELLE
                Data Engineer chez Foo (2021 - 2018)
                Data Scientist chez Bar (2015 - 2020)
                """);

        assertThat(profile.experiences()).hasSize(2);
        assertThat(profile.yearsExperience()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should never report negative years of experience")
    void shouldNeverReportNegativeYears() {
        CandidateProfile profile = extractor.extract("""
                Paul Martin

                EXPÉRIENCE PROFESSIONNELLE
                Data Engineer chez Foo (2021 - 2018)
                """);

        assertThat(profile.experiences()).hasSize(1);
        assertThat(profile.yearsExperience()).isZero();
    }

    @Test
    @DisplayName("Should fall back to the email for the name")
    void shouldFallBackToEmailForName() {
        CandidateProfile profile = extractor.extract("contact : marie.curie@example.org\nPython, SQL");

        assertThat(profile.name()).isEqualTo("Marie Curie");
        assertThat(profile.id()).isEqualTo("marie.curie");
    }

    @Test
    @DisplayName("Should degrade to sentinels for empty text")
    void shouldDegradeForEmptyText() {
        CandidateProfile profile = extractor.extract("");

        assertThat(profile.name()).isEqualTo(CandidateProfile.NAME_NOT_FOUND);
        assertThat(profile.email()).isEmpty();
        assertThat(profile.experiences()).isEmpty();
        assertThat(profile.yearsExperience()).isZero();
        assertThat(profile.languages()).containsExactly("Français");
    }
}
