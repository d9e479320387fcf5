package dev.shortlist.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.shortlist.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * AnswerProvider backed by the Groq Cloud chat completions API (Llama models).
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "shortlist.ai.groq.enabled", havingValue = "true")
public class GroqAnswerProvider implements AnswerProvider {

  static final String NAME = "groq";
  private static final String CHAT_PATH = "/chat/completions";

  private final WebClient webClient;
  private final String apiKey;
  private final String model;

  public GroqAnswerProvider(
      @Value("${shortlist.ai.groq.api-key:}") String apiKey,
      @Value("${shortlist.ai.groq.model:llama-3.3-70b-versatile}") String model,
      @Value("${shortlist.ai.groq.base-url:https://api.groq.com/openai/v1}") String baseUrl) {

    this.apiKey = apiKey;
    this.model = model;
    this.webClient = WebClient.builder()
        .baseUrl(Objects.requireNonNull(baseUrl))
        .defaultHeader("Authorization", "Bearer " + apiKey)
        .defaultHeader("Content-Type", "application/json")
        .build();

    if (apiKey == null || apiKey.isBlank()) {
      log.warn("Groq API Key is missing! Groq answers are disabled.");
    } else {
      log.info("Groq answers enabled with model: {}", this.model);
    }
  }

  @Override
  public Mono<String> answer(String context, String question) {
    if (!isEnabled()) {
      return Mono.error(new CollaboratorUnavailableException("Groq API key is not configured"));
    }

    GroqRequest request = new GroqRequest(model,
        List.of(new GroqRequest.Message("user", AnswerPrompts.build(context, question))), 0.2, 1024);

    return webClient.post()
        .uri(CHAT_PATH)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(GroqResponse.class)
        .timeout(Duration.ofSeconds(30))
        .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(AnswerPrompts::isRetryableError))
        .flatMap(response -> {
          String content = extractContent(response);
          return content == null || content.isBlank()
              ? Mono.error(new CollaboratorUnavailableException("Groq returned an empty answer"))
              : Mono.just(content.trim());
        })
        .doOnError(e -> log.warn("Groq answer failed: {}", e.getMessage()));
  }

  private String extractContent(GroqResponse response) {
    if (response != null && response.choices() != null && !response.choices().isEmpty()) {
      return response.choices().get(0).message().content();
    }
    return null;
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
  record GroqRequest(String model, List<Message> messages, double temperature,
                     @JsonProperty("max_tokens") int maxTokens) {
    record Message(String role, String content) {
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record GroqResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
      @JsonIgnoreProperties(ignoreUnknown = true)
      record Message(String content) {
      }
    }
  }
}
