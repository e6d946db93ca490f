package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Suggestions for individual work items with an analysis of their context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionResponse {

    @Builder.Default
    private List<WorkItemSuggestion> suggestions = new ArrayList<>();

    private double confidenceScore;
    private int totalContextItems;
    private double averagePriority;

    /**
     * Count of scored items per band: "high" (&gt;= 7), "medium" (&gt;= 4), "low".
     */
    private Map<String, Integer> priorityDistribution;

    @Builder.Default
    private List<String> dominantGoals = new ArrayList<>();

    private String warning;
}
