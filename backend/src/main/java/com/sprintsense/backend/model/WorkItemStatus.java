package com.sprintsense.backend.model;

/**
 * Lifecycle status of a work item. Archived items are never scored.
 */
public enum WorkItemStatus {
    BACKLOG,
    TODO,
    IN_PROGRESS,
    DONE,
    ARCHIVED
}
