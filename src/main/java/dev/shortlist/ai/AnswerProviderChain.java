package dev.shortlist.ai;

import dev.shortlist.exception.CollaboratorUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Tries the enabled providers in the configured order; the first answer wins.
 */
@Slf4j
@Component
public class AnswerProviderChain {

    private final List<AnswerProvider> providers;

    @Autowired
    public AnswerProviderChain(
            ObjectProvider<AnswerProvider> available,
            @Value("${shortlist.ai.providers:groq,gemini}") List<String> order) {
        this(available.stream().toList(), order);
    }

    AnswerProviderChain(List<AnswerProvider> available, List<String> order) {
        List<String> normalizedOrder = order.stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .toList();
        List<AnswerProvider> ordered = new ArrayList<>();
        for (AnswerProvider provider : available) {
            if (normalizedOrder.contains(provider.name()) && provider.isEnabled()) {
                ordered.add(provider);
            }
        }
        ordered.sort(Comparator.comparingInt(provider -> normalizedOrder.indexOf(provider.name())));
        this.providers = List.copyOf(ordered);
        log.info("Answer providers: {}", providers.isEmpty()
                ? "none (retrieval-only)"
                : providers.stream().map(AnswerProvider::name).toList());
    }

    public boolean isAvailable() {
        return !providers.isEmpty();
    }

    /**
     * Answer with the first provider that succeeds.
     *
     * @return Mono with the provider name and answer; errors with
     * {@link CollaboratorUnavailableException} once every provider has failed
     */
    public Mono<ProviderAnswer> answer(String context, String question) {
        if (providers.isEmpty()) {
            return Mono.error(new CollaboratorUnavailableException("No answer provider is enabled"));
        }
        return Flux.fromIterable(providers)
                .concatMap(provider -> provider.answer(context, question)
                        .map(text -> new ProviderAnswer(provider.name(), text))
                        .onErrorResume(e -> {
                            log.warn("Provider {} failed, trying next: {}", provider.name(), e.getMessage());
                            return Mono.empty();
                        }))
                .next()
                .switchIfEmpty(Mono.error(new CollaboratorUnavailableException("Every answer provider failed")));
    }

    public record ProviderAnswer(String provider, String text) {
    }
}
