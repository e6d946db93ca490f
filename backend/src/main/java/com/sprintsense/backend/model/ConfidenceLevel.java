package com.sprintsense.backend.model;

/**
 * Coarse classification of how much to trust an AI score.
 */
public enum ConfidenceLevel {
    HIGH(1.0, 0.9),
    MEDIUM(0.6, 0.7),
    LOW(0.3, 0.4);

    private final double accuracyWeight;
    private final double suggestionConfidence;

    ConfidenceLevel(double accuracyWeight, double suggestionConfidence) {
        this.accuracyWeight = accuracyWeight;
        this.suggestionConfidence = suggestionConfidence;
    }

    /**
     * Weight used when averaging a batch into the accuracy business metric.
     */
    public double getAccuracyWeight() {
        return accuracyWeight;
    }

    /**
     * Numeric confidence reported alongside single work item suggestions.
     */
    public double getSuggestionConfidence() {
        return suggestionConfidence;
    }
}
