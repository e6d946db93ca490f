package com.sprintsense.backend.dto;

/**
 * A work item that could not be scored and was left out of the ranking.
 */
public record SkippedWorkItem(String workItemId, String reason) {
}
