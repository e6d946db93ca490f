package com.sprintsense.backend.service;

import com.sprintsense.backend.BaseE2ETest;
import com.sprintsense.backend.cache.GoalCache;
import com.sprintsense.backend.dto.BatchPrioritizationRequest;
import com.sprintsense.backend.dto.BatchPrioritizationResult;
import com.sprintsense.backend.dto.PrioritizationRequest;
import com.sprintsense.backend.dto.PrioritizationResponse;
import com.sprintsense.backend.dto.ScoredWorkItem;
import com.sprintsense.backend.model.ProjectGoal;
import com.sprintsense.backend.model.WorkItem;
import com.sprintsense.backend.model.WorkItemStatus;
import com.sprintsense.backend.repository.ProjectGoalRepository;
import com.sprintsense.backend.repository.WorkItemRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class AIPrioritizationServiceE2ETest extends BaseE2ETest {

    private static final String TEAM_ID = "team-e2e";

    @Autowired
    private AIPrioritizationService aiPrioritizationService;

    @Autowired
    private PrioritizationInsightsService insightsService;

    @Autowired
    private GoalCache goalCache;

    @Autowired
    private ProjectGoalRepository projectGoalRepository;

    @Autowired
    private WorkItemRepository workItemRepository;

    @Autowired
    private StringRedisTemplate redisTemplate;

    @BeforeEach
    void setUp() {
        projectGoalRepository.deleteAll();
        workItemRepository.deleteAll();
        goalCache.evict(TEAM_ID);

        projectGoalRepository.save(ProjectGoal.builder()
                .teamId(TEAM_ID)
                .description("Improve system performance and user experience")
                .priorityWeight(8)
                .build());
        projectGoalRepository.save(ProjectGoal.builder()
                .teamId(TEAM_ID)
                .description("Strengthen authentication security for customers")
                .priorityWeight(6)
                .build());

        workItemRepository.save(WorkItem.builder().teamId(TEAM_ID).title("Update footer copy")
                .description("Change the footer wording").priority(2.0).build());
        workItemRepository.save(WorkItem.builder().teamId(TEAM_ID)
                .title("Optimize database queries for better performance")
                .description("Improve query performance and user experience").priority(5.0).build());
        workItemRepository.save(WorkItem.builder().teamId(TEAM_ID).title("Add two-factor authentication")
                .description("Improve account security with authentication codes").priority(7.0).build());
        workItemRepository.save(WorkItem.builder().teamId(TEAM_ID).title("Old performance spike")
                .description("Archived investigation").status(WorkItemStatus.ARCHIVED).build());
    }

    @Test
    void shouldScoreActiveItemsAndCacheGoals() {
        PrioritizationResponse response = aiPrioritizationService.scoreWorkItems(TEAM_ID,
                PrioritizationRequest.builder().includeMetadata(true).build());

        assertThat(response.getTotalItems()).isEqualTo(3);
        assertThat(response.getScoredItems()).extracting(ScoredWorkItem::getTitle)
                .containsExactly("Optimize database queries for better performance",
                        "Add two-factor authentication",
                        "Update footer copy");
        assertThat(response.getScoredItems().get(0).getAiScore()).isBetween(6.6, 6.7);
        assertThat(redisTemplate.hasKey(GoalCache.cacheKey(TEAM_ID))).isTrue();

        List<ProjectGoal> cached = goalCache.getGoals(TEAM_ID);
        assertThat(cached).extracting(ProjectGoal::getPriorityWeight).containsExactly(8, 6);
        assertThat(cached.get(0).getKeywords()).contains("performance", "experience");
    }

    @Test
    void shouldEvictCachedGoals() {
        goalCache.getGoals(TEAM_ID);
        assertThat(redisTemplate.hasKey(GoalCache.cacheKey(TEAM_ID))).isTrue();

        goalCache.evict(TEAM_ID);

        assertThat(redisTemplate.hasKey(GoalCache.cacheKey(TEAM_ID))).isFalse();
    }

    @Test
    void shouldWarnForTeamWithoutGoals() {
        PrioritizationResponse response = aiPrioritizationService.scoreWorkItems("team-without-goals",
                PrioritizationRequest.builder().build());

        assertThat(response.getWarning()).isEqualTo(PrioritizationResponse.NO_GOALS_CONFIGURED);
        assertThat(redisTemplate.hasKey(GoalCache.cacheKey("team-without-goals"))).isFalse();
    }

    @Test
    void shouldPersistBatchPriorities() {
        List<String> ids = workItemRepository
                .findByTeamIdAndStatusNotOrderByPriorityDescCreatedAtAsc(TEAM_ID, WorkItemStatus.ARCHIVED)
                .stream()
                .map(WorkItem::getId)
                .collect(Collectors.toList());

        BatchPrioritizationResult result = insightsService.prioritizeBatch(TEAM_ID,
                BatchPrioritizationRequest.builder()
                        .workItemIds(ids)
                        .applyChanges(true)
                        .requireConfirmation(false)
                        .build());

        assertThat(result.isChangesApplied()).isTrue();
        assertThat(result.getSuccessfullyPrioritized()).isEqualTo(3);
        result.getPriorityChanges().forEach(change ->
                assertThat(workItemRepository.findById(change.workItemId()))
                        .get()
                        .extracting(WorkItem::getPriority)
                        .isEqualTo(change.newPriority()));
    }
}
