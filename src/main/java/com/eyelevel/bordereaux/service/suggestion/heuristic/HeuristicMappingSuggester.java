package com.eyelevel.bordereaux.service.suggestion.heuristic;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.model.ProposalSource;
import com.eyelevel.bordereaux.model.canonical.CanonicalField;
import com.eyelevel.bordereaux.service.matching.HeaderNormalizer;
import com.eyelevel.bordereaux.service.suggestion.FieldSuggestion;
import com.eyelevel.bordereaux.service.suggestion.MappingSuggestion;
import com.eyelevel.bordereaux.service.suggestion.SuggestionContext;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.text.similarity.LevenshteinDistance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Name-similarity mapping used when the AI path is unavailable. Never fails: at worst every field is unmapped.
 * <p>
 * A (field, header) pair scores the better of normalized Levenshtein similarity and token Jaccard similarity,
 * plus 0.5 (capped at 1) when the header is a known synonym of the field. Pairs at or above the threshold are
 * assigned greedily, best score first, each field and header at most once.
 */
@Slf4j
@Component
public class HeuristicMappingSuggester {

    private static final double SYNONYM_BONUS = 0.5;
    private static final LevenshteinDistance LEVENSHTEIN = LevenshteinDistance.getDefaultInstance();
    private static final Comparator<Candidate> ASSIGNMENT_ORDER = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparingInt(candidate -> candidate.field().ordinal())
            .thenComparingInt(Candidate::headerIndex);

    private final double threshold;

    @Autowired
    public HeuristicMappingSuggester(final BordereauxProcessingConfig config) {
        this(config.getSuggestion().getHeuristicThreshold());
    }

    HeuristicMappingSuggester(final double threshold) {
        this.threshold = threshold;
    }

    public MappingSuggestion suggest(final SuggestionContext context) {
        final List<String> headers = context.headers();
        final List<Candidate> candidates = new ArrayList<>();
        for (int index = 0; index < headers.size(); index++) {
            final String normalized = HeaderNormalizer.normalize(headers.get(index));
            if (normalized.isEmpty()) {
                continue;
            }
            for (CanonicalField field : CanonicalField.values()) {
                final double score = score(field, normalized);
                if (score >= threshold) {
                    candidates.add(new Candidate(field, index, score));
                }
            }
        }
        candidates.sort(ASSIGNMENT_ORDER);

        final Map<CanonicalField, FieldSuggestion> assigned = new EnumMap<>(CanonicalField.class);
        final Set<Integer> usedHeaders = new HashSet<>();
        for (Candidate candidate : candidates) {
            if (assigned.containsKey(candidate.field()) || usedHeaders.contains(candidate.headerIndex())) {
                continue;
            }
            assigned.put(candidate.field(),
                         new FieldSuggestion(candidate.field(), headers.get(candidate.headerIndex()),
                                             candidate.score()));
            usedHeaders.add(candidate.headerIndex());
        }

        log.debug("Heuristic mapping assigned {} of {} fields from {} headers.", assigned.size(),
                  CanonicalField.values().length, headers.size());
        return MappingSuggestion.of(assigned, ProposalSource.HEURISTIC, null);
    }

    /**
     * Similarity in [0, 1] between a canonical field and an already normalized header.
     */
    static double score(final CanonicalField field, final String normalizedHeader) {
        final String fieldName = field.getFieldName();
        final double similarity = Math.max(levenshteinSimilarity(fieldName, normalizedHeader),
                                           jaccard(fieldName, normalizedHeader));
        final double bonus = FieldSynonyms.isSynonym(field, normalizedHeader) ? SYNONYM_BONUS : 0.0;
        return Math.min(1.0, similarity + bonus);
    }

    static double levenshteinSimilarity(final String left, final String right) {
        final int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 0.0;
        }
        return 1.0 - (double) LEVENSHTEIN.apply(left, right) / longest;
    }

    static double jaccard(final String left, final String right) {
        final Set<String> leftTokens = tokens(left);
        final Set<String> rightTokens = tokens(right);
        if (leftTokens.isEmpty() || rightTokens.isEmpty()) {
            return 0.0;
        }
        final Set<String> intersection = new HashSet<>(leftTokens);
        intersection.retainAll(rightTokens);
        final Set<String> union = new HashSet<>(leftTokens);
        union.addAll(rightTokens);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> tokens(final String normalized) {
        return Arrays.stream(normalized.split("_")).filter(token -> !token.isEmpty()).collect(Collectors.toSet());
    }

    private record Candidate(CanonicalField field, int headerIndex, double score) {
    }
}
