package dev.shortlist.service;

import dev.shortlist.config.EvaluationConfig;
import dev.shortlist.exception.CollaboratorUnavailableException;
import dev.shortlist.exception.ValidationException;
import dev.shortlist.model.CandidateResolution;
import dev.shortlist.model.JobRequirement;
import dev.shortlist.model.NormalizedSkill;
import dev.shortlist.model.RawDocument;
import dev.shortlist.model.ResolutionTier;
import dev.shortlist.model.RetrievalMode;
import dev.shortlist.pattern.PatternLibrary;
import dev.shortlist.retrieval.DocumentStore;
import dev.shortlist.retrieval.RetrievalHit;
import dev.shortlist.retrieval.RetrievalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Decides which documents are evaluated. Three tiers are tried in order and
 * the first that yields documents wins: explicit candidate ids, semantic
 * retrieval, then plain enumeration of the store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CandidateResolver {

    static final String DEFAULT_QUERY = "candidate resume";
    private static final int QUERY_SKILLS = 3;
    private static final double FULL_RELEVANCE = 1.0;

    private final DocumentStore documentStore;
    private final RetrievalService retrievalService;
    private final PatternLibrary patternLibrary;
    private final EvaluationConfig evaluationConfig;

    /**
     * @param requirement the job, used to build the semantic query
     * @param mode        whether the semantic tier may be used
     * @param explicitIds candidate ids to look up first; may be empty
     * @param limit       maximum number of documents, must be positive
     * @throws ValidationException if {@code limit} is not positive
     */
    public CandidateResolution resolve(JobRequirement requirement, RetrievalMode mode,
                                       List<String> explicitIds, int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be positive, got " + limit);
        }
        List<String> unmatched = List.of();

        if (explicitIds != null && !explicitIds.isEmpty()) {
            ExplicitMatch match = resolveExplicit(explicitIds);
            unmatched = match.unmatched();
            if (!unmatched.isEmpty()) {
                log.warn("No document found for candidate ids: {}", unmatched);
            }
            if (!match.documents().isEmpty()) {
                log.info("Resolved {} candidates from explicit ids", match.documents().size());
                return new CandidateResolution(match.documents(), ResolutionTier.EXPLICIT_IDS, unmatched);
            }
        }

        if (mode == RetrievalMode.SEMANTIC) {
            List<RawDocument> documents = resolveSemantic(requirement, limit);
            if (!documents.isEmpty()) {
                log.info("Resolved {} candidates by semantic retrieval", documents.size());
                return new CandidateResolution(documents, ResolutionTier.SEMANTIC, unmatched);
            }
        }

        List<RawDocument> documents = enumerate(limit);
        log.info("Resolved {} candidates by enumerating the store", documents.size());
        return new CandidateResolution(documents, ResolutionTier.ENUMERATION, unmatched);
    }

    private ExplicitMatch resolveExplicit(List<String> ids) {
        List<String> names = documentStore.list(evaluationConfig.getExtensions());
        Map<String, RawDocument> resolved = new LinkedHashMap<>();
        Map<String, String> textCache = new LinkedHashMap<>();
        List<String> unmatched = new ArrayList<>();

        for (String rawId : ids) {
            String id = rawId == null ? "" : rawId.trim();
            if (id.isEmpty()) {
                continue;
            }
            Optional<String> name = byExactStem(names, id)
                    .or(() -> byNameOrPrefix(names, id))
                    .or(() -> byEmail(names, id, textCache));
            if (name.isEmpty()) {
                unmatched.add(id);
                continue;
            }
            if (resolved.containsKey(name.get())) {
                continue;
            }
            String text = textCache.computeIfAbsent(name.get(), this::readQuietly);
            if (text != null) {
                resolved.put(name.get(), new RawDocument(name.get(), text, FULL_RELEVANCE));
            }
        }
        return new ExplicitMatch(List.copyOf(resolved.values()), unmatched);
    }

    // Uploaded documents are stored under a generated id, so an exact stem is the strongest match.
    private static Optional<String> byExactStem(List<String> names, String id) {
        return names.stream().filter(name -> stem(name).equals(id)).findFirst();
    }

    private static Optional<String> byNameOrPrefix(List<String> names, String id) {
        String lowerId = id.toLowerCase(Locale.ROOT);
        Optional<String> exact = names.stream()
                .filter(name -> name.equalsIgnoreCase(id) || stem(name).equalsIgnoreCase(id))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return names.stream()
                .filter(name -> name.toLowerCase(Locale.ROOT).startsWith(lowerId))
                .findFirst();
    }

    private Optional<String> byEmail(List<String> names, String id, Map<String, String> textCache) {
        String lowerId = id.toLowerCase(Locale.ROOT);
        for (String name : names) {
            String text = textCache.computeIfAbsent(name, this::readQuietly);
            if (text == null) {
                continue;
            }
            Matcher matcher = patternLibrary.resume().email().matcher(text);
            while (matcher.find()) {
                String email = matcher.group().toLowerCase(Locale.ROOT);
                String localPart = email.substring(0, email.indexOf('@'));
                if (localPart.contains(lowerId)) {
                    return Optional.of(name);
                }
            }
        }
        return Optional.empty();
    }

    private List<RawDocument> resolveSemantic(JobRequirement requirement, int limit) {
        if (!retrievalService.isReady()) {
            log.debug("Retrieval index not ready, skipping semantic tier");
            return List.of();
        }
        String query = buildQuery(requirement);
        List<RetrievalHit> hits;
        try {
            hits = retrievalService.search(query, evaluationConfig.getSemanticOverfetch() * limit);
        } catch (CollaboratorUnavailableException e) {
            log.warn("Retrieval unavailable, falling back to enumeration: {}", e.getMessage());
            return List.of();
        } catch (RuntimeException e) {
            log.warn("Retrieval failed, falling back to enumeration: {}", e.getMessage(), e);
            return List.of();
        }

        Map<String, Double> bestBySource = new LinkedHashMap<>();
        for (RetrievalHit hit : hits) {
            bestBySource.putIfAbsent(basename(hit.source()), hit.similarity());
        }
        List<RawDocument> documents = new ArrayList<>();
        for (Map.Entry<String, Double> entry : bestBySource.entrySet()) {
            if (documents.size() >= limit) {
                break;
            }
            String text = readQuietly(entry.getKey());
            if (text != null) {
                documents.add(new RawDocument(entry.getKey(), text, entry.getValue()));
            }
        }
        return documents;
    }

    /**
     * Job title followed by the first required skills.
     */
    static String buildQuery(JobRequirement requirement) {
        Set<String> parts = new LinkedHashSet<>();
        if (requirement != null) {
            if (!JobRequirement.UNSPECIFIED.equals(requirement.title()) && !requirement.title().isBlank()) {
                parts.add(requirement.title());
            }
            requirement.requiredSkills().stream()
                    .limit(QUERY_SKILLS)
                    .map(NormalizedSkill::label)
                    .forEach(parts::add);
        }
        return parts.isEmpty() ? DEFAULT_QUERY : String.join(" ", parts);
    }

    private List<RawDocument> enumerate(int limit) {
        List<RawDocument> documents = new ArrayList<>();
        for (String name : documentStore.list(evaluationConfig.getExtensions())) {
            if (documents.size() >= limit) {
                break;
            }
            String text = readQuietly(name);
            if (text != null) {
                documents.add(new RawDocument(name, text, FULL_RELEVANCE));
            }
        }
        return documents;
    }

    private String readQuietly(String name) {
        try {
            return documentStore.read(name);
        } catch (IOException | RuntimeException e) {
            log.warn("Skipping unreadable document {}: {}", name, e.getMessage());
            return null;
        }
    }

    static String basename(String source) {
        int slash = Math.max(source.lastIndexOf('/'), source.lastIndexOf('\\'));
        return slash >= 0 ? source.substring(slash + 1) : source;
    }

    private static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private record ExplicitMatch(List<RawDocument> documents, List<String> unmatched) {
    }
}
