package com.eyelevel.bordereaux.service.pipeline;

import java.util.List;

/**
 * Counts of how the files of one batch run ended.
 */
public record BatchRunSummary(int processed, int partiallyProcessed, int needsTemplate, int failed, int skipped) {

    public static BatchRunSummary empty() {
        return new BatchRunSummary(0, 0, 0, 0, 0);
    }

    public static BatchRunSummary of(final List<ProcessingOutcome> outcomes) {
        int processed = 0;
        int partial = 0;
        int needsTemplate = 0;
        int failed = 0;
        int skipped = 0;
        for (ProcessingOutcome outcome : outcomes) {
            if (outcome.isSkipped()) {
                skipped++;
                continue;
            }
            switch (outcome.status()) {
                case PROCESSED -> processed++;
                case PARTIALLY_PROCESSED -> partial++;
                case NEEDS_TEMPLATE -> needsTemplate++;
                default -> failed++;
            }
        }
        return new BatchRunSummary(processed, partial, needsTemplate, failed, skipped);
    }

    public int total() {
        return processed + partiallyProcessed + needsTemplate + failed + skipped;
    }
}
