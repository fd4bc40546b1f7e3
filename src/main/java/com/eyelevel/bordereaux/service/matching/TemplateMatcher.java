package com.eyelevel.bordereaux.service.matching;

import com.eyelevel.bordereaux.config.BordereauxProcessingConfig;
import com.eyelevel.bordereaux.model.FileType;
import com.eyelevel.bordereaux.model.Template;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores a file's headers against the template catalog. Pure: same headers and catalog, same answer.
 * <p>
 * Score = template header keys present in the file / template header keys, both sides normalized with
 * {@link HeaderNormalizer}. Among templates at or above the threshold the highest score wins; ties go to the
 * template with more mappings, then to the lexicographically smallest identifier.
 */
@Slf4j
@Component
public class TemplateMatcher {

    private static final Comparator<Candidate> RANKING = Comparator
            .comparingDouble(Candidate::score).reversed()
            .thenComparing(Comparator.comparingInt(Candidate::keyCount).reversed())
            .thenComparing(candidate -> candidate.template().getTemplateId());

    private final double threshold;

    @Autowired
    public TemplateMatcher(final BordereauxProcessingConfig config) {
        this(config.getMatching().getThreshold());
    }

    TemplateMatcher(final double threshold) {
        this.threshold = threshold;
    }

    public MatchResult match(final Collection<String> fileHeaders, final Optional<FileType> fileTypeHint,
                             final List<Template> catalog) {
        final Set<String> normalizedHeaders = fileHeaders.stream()
                .map(HeaderNormalizer::normalize)
                .filter(header -> !header.isEmpty())
                .collect(Collectors.toSet());

        final List<Candidate> candidates = catalog.stream()
                .filter(Template::isActive)
                .filter(template -> fileTypeHint.map(hint -> hint == template.getFileType()).orElse(true))
                .map(template -> score(template, normalizedHeaders))
                .flatMap(Optional::stream)
                .sorted(RANKING)
                .toList();

        if (candidates.isEmpty()) {
            log.debug("No candidate templates for hint {} among {} catalog entries.", fileTypeHint.orElse(null),
                      catalog.size());
            return MatchResult.noMatch(0.0);
        }

        final Candidate best = candidates.get(0);
        if (best.score() < threshold) {
            log.debug("Best template '{}' scored {} which is below the threshold {}.",
                      best.template().getTemplateId(), best.score(), threshold);
            return MatchResult.noMatch(best.score());
        }
        return new MatchResult(best.template(), best.score());
    }

    private Optional<Candidate> score(final Template template, final Set<String> normalizedHeaders) {
        if (template.getColumnMappings() == null || template.getColumnMappings().isEmpty()) {
            return Optional.empty();
        }
        final Set<String> keys = template.getColumnMappings().keySet().stream()
                .map(HeaderNormalizer::normalize)
                .filter(key -> !key.isEmpty())
                .collect(Collectors.toSet());
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        final long present = keys.stream().filter(normalizedHeaders::contains).count();
        return Optional.of(new Candidate(template, (double) present / keys.size(), keys.size()));
    }

    private record Candidate(Template template, double score, int keyCount) {
    }
}
