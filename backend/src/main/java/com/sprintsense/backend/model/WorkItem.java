package com.sprintsense.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Work item as consumed by the prioritization engine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "work_items")
public class WorkItem {

    @Id
    private String id;

    @Indexed
    private String teamId;

    private String title;
    private String description;

    @Builder.Default
    private double priority = 0.0;

    @Builder.Default
    private WorkItemStatus status = WorkItemStatus.BACKLOG;

    @CreatedDate
    private Instant createdAt;
}
