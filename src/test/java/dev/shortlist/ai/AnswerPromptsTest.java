package dev.shortlist.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class AnswerPromptsTest {

    @Test
    @DisplayName("Should include context and question in the prompt")
    void shouldBuildPrompt() {
        String prompt = AnswerPrompts.build("[jean.txt]\nPython", "Qui connaît Python ?");

        assertThat(prompt)
                .contains("[jean.txt]\nPython")
                .contains("Question: Qui connaît Python ?");
    }

    @Test
    @DisplayName("Should truncate long context")
    void shouldTruncateLongContext() {
        String prompt = AnswerPrompts.build("a".repeat(AnswerPrompts.MAX_CONTEXT_LENGTH + 500), "Question ?");

        assertThat(prompt)
                .contains("a".repeat(AnswerPrompts.MAX_CONTEXT_LENGTH) + "...")
                .doesNotContain("a".repeat(AnswerPrompts.MAX_CONTEXT_LENGTH + 1));
    }

    @Test
    @DisplayName("Should retry only rate limits and server unavailability")
    void shouldClassifyRetryableErrors() {
        assertThat(AnswerPrompts.isRetryableError(httpError(HttpStatus.TOO_MANY_REQUESTS))).isTrue();
        assertThat(AnswerPrompts.isRetryableError(httpError(HttpStatus.SERVICE_UNAVAILABLE))).isTrue();
        assertThat(AnswerPrompts.isRetryableError(httpError(HttpStatus.UNAUTHORIZED))).isFalse();
        assertThat(AnswerPrompts.isRetryableError(new TimeoutException())).isFalse();
    }

    private static WebClientResponseException httpError(HttpStatus status) {
        return WebClientResponseException.create(status.value(), status.getReasonPhrase(),
                new HttpHeaders(), new byte[0], StandardCharsets.UTF_8);
    }
}
