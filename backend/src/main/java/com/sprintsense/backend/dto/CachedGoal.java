package com.sprintsense.backend.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Cache representation of a project goal, carrying its precomputed keywords.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CachedGoal {

    private String id;
    private String teamId;
    private String description;
    private int priorityWeight;
    private String successMetrics;
    private List<String> keywords;
}
