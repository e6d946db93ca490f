package com.sprintsense.backend.dto;

import com.sprintsense.backend.model.ConfidenceLevel;

public record WorkItemSuggestion(
        String workItemId,
        double suggestedPriority,
        double currentPriority,
        ConfidenceLevel confidenceLevel,
        String reasoning,
        int rank) {
}
