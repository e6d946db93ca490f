package com.sprintsense.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Set;

/**
 * A team-authored strategic objective. Work items are scored by how well they
 * align with the team's goals, weighted by {@code priorityWeight}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "project_goals")
public class ProjectGoal {

    @Id
    private String id;

    @Indexed
    private String teamId;

    /**
     * Up to 500 characters.
     */
    private String description;

    /**
     * Weight between 1 and 10.
     */
    private int priorityWeight;

    private String successMetrics;

    @CreatedDate
    private Instant createdAt;

    /**
     * Keyword set of the description. Filled in when the goal is loaded through
     * the goal cache, never persisted.
     */
    @Transient
    private Set<String> keywords;
}
