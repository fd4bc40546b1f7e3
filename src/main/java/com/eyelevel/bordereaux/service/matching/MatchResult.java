package com.eyelevel.bordereaux.service.matching;

import com.eyelevel.bordereaux.model.Template;

import java.util.Optional;

/**
 * Outcome of template matching. {@code score} is the best score seen even when no template qualified, for
 * logging.
 */
public record MatchResult(Template template, double score) {

    public static MatchResult noMatch(double bestScore) {
        return new MatchResult(null, bestScore);
    }

    public Optional<Template> matchedTemplate() {
        return Optional.ofNullable(template);
    }

    public boolean isMatch() {
        return template != null;
    }
}
