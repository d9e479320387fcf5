package dev.shortlist.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.shortlist.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * AnswerProvider backed by the Google AI Studio (Gemini) REST API.
 * Uses simple API key authentication - no service account required.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "shortlist.ai.gemini.enabled", havingValue = "true")
public class GeminiAnswerProvider implements AnswerProvider {

    static final String NAME = "gemini";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;
    private final String geminiPath;

    public GeminiAnswerProvider(
            @Value("${shortlist.ai.gemini.api-key:}") String apiKey,
            @Value("${shortlist.ai.gemini.model:gemini-2.0-flash}") String model,
            @Value("${shortlist.ai.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${shortlist.ai.gemini.path:/v1beta/models/%s:generateContent}") String geminiPath) {
        this.apiKey = apiKey;
        this.model = model;
        this.geminiPath = Objects.requireNonNull(geminiPath);

        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Gemini API Key is missing! Gemini answers are disabled.");
        } else {
            log.info("Gemini answers enabled with model: {} (Key present)", this.model);
        }
    }

    @Override
    public Mono<String> answer(String context, String question) {
        if (!isEnabled()) {
            return Mono.error(new CollaboratorUnavailableException("Gemini API key is not configured"));
        }

        GeminiRequest request = new GeminiRequest(
                List.of(new GeminiRequest.Content(List.of(new GeminiRequest.Part(AnswerPrompts.build(context, question))))),
                new GeminiRequest.GenerationConfig(0.2, 1024));
        String uri = String.format(geminiPath, model) + "?key=" + apiKey;

        return webClient.post()
                .uri(uri)
                .contentType(Objects.requireNonNull(MediaType.APPLICATION_JSON))
                .bodyValue(request)
                .retrieve()
                .bodyToMono(GeminiResponse.class)
                .timeout(Duration.ofSeconds(60))
                .retryWhen(Retry.backoff(3, Duration.ofSeconds(2))
                        .filter(AnswerPrompts::isRetryableError)
                        .doBeforeRetry(retrySignal -> log.info("Retrying Gemini answer (Attempt {})",
                                retrySignal.totalRetries() + 1)))
                .flatMap(response -> {
                    String content = extractContent(response);
                    return content == null || content.isBlank()
                            ? Mono.error(new CollaboratorUnavailableException("Gemini returned an empty answer"))
                            : Mono.just(content.trim());
                })
                .doOnError(e -> log.warn("Gemini answer failed: {}", e.getMessage()));
    }

    private String extractContent(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            return null;
        }
        GeminiResponse.Candidate.Content content = response.candidates().get(0).content();
        if (content == null || content.parts() == null || content.parts().isEmpty()) {
            return null;
        }
        return content.parts().get(0).text();
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String name() {
        return NAME;
    }

    // DTOs
    record GeminiRequest(
            List<Content> contents,
            @JsonProperty("generationConfig") GenerationConfig generationConfig) {
        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }

        record GenerationConfig(double temperature, int maxOutputTokens) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content) {
            @JsonIgnoreProperties(ignoreUnknown = true)
            record Content(List<Part> parts) {
                @JsonIgnoreProperties(ignoreUnknown = true)
                record Part(String text) {
                }
            }
        }
    }
}
