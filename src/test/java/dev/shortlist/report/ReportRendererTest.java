package dev.shortlist.report;

import dev.shortlist.TestFixtures;
import dev.shortlist.model.CandidateEvaluation;
import dev.shortlist.model.CriterionScore;
import dev.shortlist.model.EvaluationResult;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.RankedEvaluation;
import dev.shortlist.model.ResolutionTier;
import dev.shortlist.service.DecisionAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.context.IContext;
import org.thymeleaf.spring6.SpringTemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReportRendererTest {

    private static EvaluationResult result() {
        DecisionAggregator aggregator = new DecisionAggregator(TestFixtures.scoringConfig());
        JobRequirement requirement = TestFixtures.requirement(
                TestFixtures.skills("Python", "SQL"), TestFixtures.skills("Power BI"));
        List<RankedEvaluation> ranking = aggregator.rank(List.of(
                evaluation(aggregator, "Jean Dupont", 85),
                evaluation(aggregator, "Paul Martin", 42)));
        return new EvaluationResult(requirement, ranking, aggregator.report(ranking, requirement),
                ResolutionTier.EXPLICIT_IDS, List.of("zoe"));
    }

    private static CandidateEvaluation evaluation(DecisionAggregator aggregator, String name, double score) {
        return new CandidateEvaluation(TestFixtures.profile(name, 3, Set.of()),
                aggregator.breakdown(CriterionScore.of(score, "profile"), CriterionScore.of(score, "technical"),
                        CriterionScore.of(score, "soft skills")),
                null, null, name.split(" ")[0].toLowerCase() + ".txt", 1.0);
    }

    @Nested
    @DisplayName("Template variables")
    @ExtendWith(MockitoExtension.class)
    class VariableTests {

        @Mock
        private TemplateEngine templateEngine;

        @Test
        @DisplayName("Should pass the result and the run date to the template")
        void shouldPopulateContext() {
            when(templateEngine.process(eq(ReportRenderer.TEMPLATE), any(IContext.class))).thenReturn("<html/>");
            ReportRenderer renderer = new ReportRenderer(templateEngine, TestFixtures.CLOCK);
            EvaluationResult result = result();

            assertThat(renderer.render(result)).isEqualTo("<html/>");

            ArgumentCaptor<Context> context = ArgumentCaptor.forClass(Context.class);
            verify(templateEngine).process(eq(ReportRenderer.TEMPLATE), context.capture());
            assertThat(context.getValue().getVariable("ranking")).isEqualTo(result.ranking());
            assertThat(context.getValue().getVariable("requirement")).isEqualTo(result.requirement());
            assertThat(context.getValue().getVariable("tier")).isEqualTo(ResolutionTier.EXPLICIT_IDS);
            assertThat(context.getValue().getVariable("date")).isEqualTo("June 1, 2026");
        }
    }

    @Nested
    @DisplayName("HTML page")
    class PageTests {

        private ReportRenderer renderer;

        @BeforeEach
        void setUp() {
            ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
            resolver.setPrefix("templates/");
            resolver.setSuffix(".html");
            resolver.setTemplateMode(TemplateMode.HTML);
            resolver.setCharacterEncoding("UTF-8");
            SpringTemplateEngine engine = new SpringTemplateEngine();
            engine.setTemplateResolver(resolver);
            renderer = new ReportRenderer(engine, TestFixtures.CLOCK);
        }

        @Test
        @DisplayName("Should render the ranking table")
        void shouldRenderRanking() {
            String html = renderer.render(result());

            assertThat(html)
                    .contains("Data Scientist")
                    .contains("Jean Dupont")
                    .contains("Paul Martin")
                    .contains("85.00")
                    .contains("Strongly recommended")
                    .contains("Not found: <span>zoe</span>")
                    .contains("Profile mean <span>63.5</span> (min <span>42.0</span>, max <span>85.0</span>)");
            assertThat(html.indexOf("Jean Dupont")).isLessThan(html.indexOf("Paul Martin"));
        }

        @Test
        @DisplayName("Should write the page, creating directories")
        void shouldWriteReport(@TempDir Path tempDir) throws IOException {
            Path output = tempDir.resolve("reports/shortlist.html");

            renderer.write(result(), output);

            assertThat(output).exists();
            assertThat(Files.readString(output)).contains("Jean Dupont");
        }
    }
}
