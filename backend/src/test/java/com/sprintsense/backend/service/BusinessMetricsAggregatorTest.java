package com.sprintsense.backend.service;

import com.sprintsense.backend.dto.BusinessMetrics;
import com.sprintsense.backend.dto.ScoredWorkItem;
import com.sprintsense.backend.model.ConfidenceLevel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BusinessMetricsAggregatorTest {

    private final BusinessMetricsAggregator aggregator = new BusinessMetricsAggregator();

    private static ScoredWorkItem scored(double score, ConfidenceLevel confidence) {
        return ScoredWorkItem.builder()
                .aiScore(score)
                .confidenceLevel(confidence)
                .explanation("test")
                .build();
    }

    @Test
    void shouldReturnZeroMetricsForEmptyBatch() {
        BusinessMetrics metrics = aggregator.aggregate(List.of());

        assertThat(metrics.getCoveragePercentage()).isEqualTo(0.0);
        assertThat(metrics.getAccuracyScore()).isEqualTo(0.0);
        assertThat(metrics.getAlgorithmVersion()).isEqualTo(BusinessMetricsAggregator.ALGORITHM_VERSION);
    }

    @Test
    void shouldComputeCoverageAndAccuracy() {
        BusinessMetrics metrics = aggregator.aggregate(List.of(
                scored(8.0, ConfidenceLevel.HIGH),
                scored(5.0, ConfidenceLevel.MEDIUM),
                scored(0.0, ConfidenceLevel.LOW)));

        assertThat(metrics.getCoveragePercentage()).isCloseTo(200.0 / 3, within(1e-9));
        assertThat(metrics.getAccuracyScore()).isCloseTo((1.0 + 0.6 + 0.3) / 3, within(1e-9));
        assertThat(metrics.getAlgorithmVersion()).isEqualTo("1.0.0");
    }

    @Test
    void shouldReportFullCoverageWhenEveryItemScores() {
        BusinessMetrics metrics = aggregator.aggregate(List.of(
                scored(0.1, ConfidenceLevel.LOW),
                scored(0.2, ConfidenceLevel.LOW)));

        assertThat(metrics.getCoveragePercentage()).isEqualTo(100.0);
        assertThat(metrics.getAccuracyScore()).isCloseTo(0.3, within(1e-9));
    }
}
