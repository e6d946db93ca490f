package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request to re-prioritize a batch of work items from their AI scores.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchPrioritizationRequest {

    public static final int MAX_WORK_ITEMS = 100;

    private String batchId;

    /**
     * Between 1 and {@link #MAX_WORK_ITEMS} work items.
     */
    @Builder.Default
    private List<String> workItemIds = new ArrayList<>();

    @Builder.Default
    private boolean applyChanges = false;

    @Builder.Default
    private boolean requireConfirmation = true;
}
