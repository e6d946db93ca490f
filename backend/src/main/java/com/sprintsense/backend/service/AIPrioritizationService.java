package com.sprintsense.backend.service;

import com.sprintsense.backend.cache.GoalCache;
import com.sprintsense.backend.dto.BusinessMetrics;
import com.sprintsense.backend.dto.PrioritizationRequest;
import com.sprintsense.backend.dto.PrioritizationResponse;
import com.sprintsense.backend.dto.ScoringBatch;
import com.sprintsense.backend.exception.InvalidPrioritizationRequestException;
import com.sprintsense.backend.exception.ServiceDegradedException;
import com.sprintsense.backend.model.ProjectGoal;
import com.sprintsense.backend.model.ScoringMode;
import com.sprintsense.backend.model.WorkItem;
import com.sprintsense.backend.model.WorkItemStatus;
import com.sprintsense.backend.repository.WorkItemRepository;
import com.sprintsense.backend.resilience.CircuitBreaker;
import com.sprintsense.backend.resilience.CircuitBreakerOpenException;
import com.sprintsense.backend.resilience.ProtectedCall;
import com.sprintsense.backend.resilience.TimedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Entry point of the AI prioritization core: loads a team's goals and work
 * items, scores and ranks the items, and derives business metrics.
 */
@Service
public class AIPrioritizationService {

    private static final Logger log = LoggerFactory.getLogger(AIPrioritizationService.class);

    private final GoalCache goalCache;
    private final WorkItemRepository workItemRepository;
    private final ScoringEngine scoringEngine;
    private final BusinessMetricsAggregator metricsAggregator;
    private final CircuitBreaker workItemSourceCircuitBreaker;
    private final Clock clock;
    private final long thresholdMs;

    public AIPrioritizationService(GoalCache goalCache,
            WorkItemRepository workItemRepository,
            ScoringEngine scoringEngine,
            BusinessMetricsAggregator metricsAggregator,
            @Qualifier("workItemSourceCircuitBreaker") CircuitBreaker workItemSourceCircuitBreaker,
            Clock clock,
            @Value("${sprintsense.ai.performance.threshold-ms:500}") long thresholdMs) {
        this.goalCache = goalCache;
        this.workItemRepository = workItemRepository;
        this.scoringEngine = scoringEngine;
        this.metricsAggregator = metricsAggregator;
        this.workItemSourceCircuitBreaker = workItemSourceCircuitBreaker;
        this.clock = clock;
        this.thresholdMs = thresholdMs;
    }

    /**
     * Score a team's active work items (or the requested subset) against the
     * team's goals.
     *
     * @throws InvalidPrioritizationRequestException if the team ID is blank or
     *                                               too many items are requested
     * @throws ServiceDegradedException              if a dependency's circuit is open
     */
    public PrioritizationResponse scoreWorkItems(String teamId, PrioritizationRequest request) {
        PrioritizationRequest effective = request != null ? request : PrioritizationRequest.builder().build();
        List<String> workItemIds = validate(teamId, effective);

        log.info("[AI-PRIORITY] Scoring work items for team: {} | Mode: {} | Requested items: {}",
                teamId, effective.getMode(), workItemIds.isEmpty() ? "all" : workItemIds.size());

        try {
            return TimedCall.of("ai_prioritization_scoring", thresholdMs,
                    () -> scoreForTeam(teamId, workItemIds, effective)).get();
        } catch (CircuitBreakerOpenException e) {
            log.error("[AI-PRIORITY] Scoring degraded for team: {} | {}", teamId, e.getMessage());
            throw new ServiceDegradedException(e.getBreakerName(), e);
        } catch (RuntimeException e) {
            log.error("[AI-PRIORITY] Scoring failed for team: {}", teamId, e);
            throw e;
        }
    }

    /**
     * Score the given work items against the given goals. Performs no I/O.
     */
    public PrioritizationResponse score(String teamId, List<WorkItem> workItems, List<ProjectGoal> goals,
            boolean includeMetadata, ScoringMode mode) {
        Instant start = clock.instant();

        if (goals == null || goals.isEmpty()) {
            log.warn("[AI-PRIORITY] No project goals configured for team: {}", teamId);
            return emptyResponse(PrioritizationResponse.NO_GOALS_CONFIGURED);
        }
        if (workItems == null || workItems.isEmpty()) {
            log.warn("[AI-PRIORITY] No work items to score for team: {}", teamId);
            return emptyResponse(null);
        }

        ScoringBatch batch = scoringEngine.scoreWorkItems(workItems, goals, includeMetadata,
                mode != null ? mode : ScoringMode.FULL);
        BusinessMetrics metrics = metricsAggregator.aggregate(batch.scoredItems());
        long elapsedMs = Math.max(0L, Duration.between(start, clock.instant()).toMillis());

        log.info("[AI-PRIORITY] Scored {} items for team: {} in {}ms ({} skipped)",
                batch.scoredItems().size(), teamId, elapsedMs, batch.skippedItems().size());

        return PrioritizationResponse.builder()
                .scoredItems(batch.scoredItems())
                .totalItems(batch.scoredItems().size())
                .generationTimeMs(elapsedMs)
                .businessMetrics(metrics)
                .skippedItems(batch.skippedItems())
                .build();
    }

    private PrioritizationResponse scoreForTeam(String teamId, List<String> workItemIds,
            PrioritizationRequest request) {
        List<ProjectGoal> goals = goalCache.getGoals(teamId);
        if (goals.isEmpty()) {
            return score(teamId, List.of(), goals, request.isIncludeMetadata(), request.getMode());
        }
        List<WorkItem> workItems = loadWorkItems(teamId, workItemIds);
        return score(teamId, workItems, goals, request.isIncludeMetadata(), request.getMode());
    }

    private List<WorkItem> loadWorkItems(String teamId, List<String> workItemIds) {
        return ProtectedCall.of(workItemSourceCircuitBreaker, () -> workItemIds.isEmpty()
                ? workItemRepository.findByTeamIdAndStatusNotOrderByPriorityDescCreatedAtAsc(
                        teamId, WorkItemStatus.ARCHIVED)
                : workItemRepository.findByTeamIdAndStatusNotAndIdInOrderByPriorityDescCreatedAtAsc(
                        teamId, WorkItemStatus.ARCHIVED, workItemIds)).get();
    }

    /**
     * @return requested work item IDs, deduplicated in order
     */
    private static List<String> validate(String teamId, PrioritizationRequest request) {
        if (teamId == null || teamId.isBlank()) {
            throw new InvalidPrioritizationRequestException("Team ID is required");
        }
        if (request.getWorkItemIds() == null) {
            return List.of();
        }
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(request.getWorkItemIds()));
        unique.removeIf(id -> id == null || id.isBlank());
        if (unique.size() > PrioritizationRequest.MAX_WORK_ITEMS) {
            throw new InvalidPrioritizationRequestException("Cannot score more than "
                    + PrioritizationRequest.MAX_WORK_ITEMS + " work items at once, got " + unique.size());
        }
        return unique;
    }

    private static PrioritizationResponse emptyResponse(String warning) {
        return PrioritizationResponse.builder()
                .totalItems(0)
                .generationTimeMs(0)
                .businessMetrics(BusinessMetricsAggregator.empty())
                .warning(warning)
                .build();
    }
}
