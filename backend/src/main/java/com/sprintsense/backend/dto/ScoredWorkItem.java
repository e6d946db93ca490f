package com.sprintsense.backend.dto;

import com.sprintsense.backend.model.ConfidenceLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A work item with its AI alignment score and suggested rank.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredWorkItem {

    private String workItemId;
    private String title;
    private double currentPriority;

    /**
     * Always between 0.0 and 10.0.
     */
    private double aiScore;

    /**
     * Dense 1..N within a response. Assigned after sorting.
     */
    private int suggestedRank;

    private ConfidenceLevel confidenceLevel;
    private String explanation;

    /**
     * Present only when metadata was requested.
     */
    private ScoringMetadata scoringMetadata;
}
