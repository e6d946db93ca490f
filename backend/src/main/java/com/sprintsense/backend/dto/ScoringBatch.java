package com.sprintsense.backend.dto;

import java.util.List;

/**
 * Ranked scoring output plus the items that failed to score.
 */
public record ScoringBatch(List<ScoredWorkItem> scoredItems, List<SkippedWorkItem> skippedItems) {

    public static ScoringBatch empty() {
        return new ScoringBatch(List.of(), List.of());
    }
}
