package com.sprintsense.backend.service;

import com.sprintsense.backend.dto.BusinessMetrics;
import com.sprintsense.backend.dto.ScoredWorkItem;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives coverage and accuracy statistics from a scored batch.
 */
@Component
public class BusinessMetricsAggregator {

    /**
     * Bump whenever the scoring formula changes; downstream consumers compare
     * results by this tag.
     */
    public static final String ALGORITHM_VERSION = "1.0.0";

    public BusinessMetrics aggregate(List<ScoredWorkItem> scoredItems) {
        if (scoredItems == null || scoredItems.isEmpty()) {
            return empty();
        }

        long withScore = scoredItems.stream().filter(item -> item.getAiScore() > 0).count();
        double coverage = 100.0 * withScore / scoredItems.size();

        double accuracy = scoredItems.stream()
                .mapToDouble(item -> item.getConfidenceLevel().getAccuracyWeight())
                .average()
                .orElse(0.0);

        return BusinessMetrics.builder()
                .accuracyScore(accuracy)
                .coveragePercentage(coverage)
                .algorithmVersion(ALGORITHM_VERSION)
                .build();
    }

    public static BusinessMetrics empty() {
        return BusinessMetrics.builder()
                .accuracyScore(0.0)
                .coveragePercentage(0.0)
                .algorithmVersion(ALGORITHM_VERSION)
                .build();
    }
}
