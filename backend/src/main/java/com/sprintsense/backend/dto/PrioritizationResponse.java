package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ranked scoring result for a team.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrioritizationResponse {

    public static final String NO_GOALS_CONFIGURED = "no_goals_configured";

    @Builder.Default
    private List<ScoredWorkItem> scoredItems = new ArrayList<>();

    private int totalItems;
    private long generationTimeMs;
    private BusinessMetrics businessMetrics;

    /**
     * Non-fatal condition, e.g. {@link #NO_GOALS_CONFIGURED}.
     */
    private String warning;

    @Builder.Default
    private List<SkippedWorkItem> skippedItems = new ArrayList<>();
}
