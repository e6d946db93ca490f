package com.sprintsense.backend.dto;

import com.sprintsense.backend.model.ConfidenceLevel;

public record PriorityChange(
        String workItemId,
        double oldPriority,
        double newPriority,
        double priorityChange,
        ConfidenceLevel confidenceLevel,
        String explanation,
        boolean applied) {
}
