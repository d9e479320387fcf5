package dev.shortlist.report;

import dev.shortlist.model.EvaluationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders an evaluation result as a standalone HTML page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportRenderer {

    static final String TEMPLATE = "report/shortlist";

    private final TemplateEngine templateEngine;
    private final Clock clock;

    public String render(EvaluationResult result) {
        Context context = new Context(Locale.ENGLISH);
        context.setVariable("requirement", result.requirement());
        context.setVariable("ranking", result.ranking());
        context.setVariable("report", result.report());
        context.setVariable("statistics", result.report().statistics());
        context.setVariable("tier", result.tier());
        context.setVariable("unmatchedIds", result.unmatchedIds());
        context.setVariable("date", LocalDate.now(clock).format(DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH)));

        return templateEngine.process(TEMPLATE, context);
    }

    public Path write(EvaluationResult result, Path output) throws IOException {
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, render(result), StandardCharsets.UTF_8);
        log.info("Report written to {}", output.toAbsolutePath());
        return output;
    }
}
