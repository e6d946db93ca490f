package com.sprintsense.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary statistics derived from a scored batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessMetrics {

    private double accuracyScore;
    private double coveragePercentage;
    private String algorithmVersion;
}
