package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a batch prioritization run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPrioritizationResult {

    private String batchId;
    private int totalItems;
    private int successfullyPrioritized;
    private int failedItems;

    @Builder.Default
    private List<PriorityChange> priorityChanges = new ArrayList<>();

    private boolean changesApplied;
    private boolean requiresConfirmation;
    private String batchSummary;
}
