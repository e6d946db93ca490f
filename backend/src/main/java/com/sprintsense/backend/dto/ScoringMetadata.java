package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Detailed breakdown of how a score was computed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringMetadata {

    @Builder.Default
    private List<MatchedGoal> matchedGoals = new ArrayList<>();

    private double baseScore;
    private double priorityAdjustment;

    /**
     * Mean Jaccard similarity against all goals, 0.0 to 1.0.
     */
    private double clusteringSimilarity;
}
