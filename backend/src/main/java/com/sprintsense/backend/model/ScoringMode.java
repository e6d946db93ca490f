package com.sprintsense.backend.model;

/**
 * Scoring mode. Both modes share the same scoring math; FAST skips the
 * clustering similarity computation.
 */
public enum ScoringMode {
    FULL,
    FAST
}
