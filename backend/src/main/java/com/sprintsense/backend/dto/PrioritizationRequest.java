package com.sprintsense.backend.dto;

import com.sprintsense.backend.model.ScoringMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to score a team's work items against its goals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrioritizationRequest {

    public static final int MAX_WORK_ITEMS = 1000;

    /**
     * Specific work items to score. Null or empty scores every active item.
     */
    private List<String> workItemIds;

    @Builder.Default
    private boolean includeMetadata = false;

    @Builder.Default
    private ScoringMode mode = ScoringMode.FULL;
}
