package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request for prioritization suggestions over a set of context work items.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionRequest {

    public static final int MIN_SUGGESTIONS = 1;
    public static final int MAX_SUGGESTIONS = 5;

    @Builder.Default
    private List<String> contextItemIds = new ArrayList<>();

    /**
     * Between {@link #MIN_SUGGESTIONS} and {@link #MAX_SUGGESTIONS}.
     */
    @Builder.Default
    private int maxSuggestions = 1;

    @Builder.Default
    private boolean includeExplanation = true;
}
