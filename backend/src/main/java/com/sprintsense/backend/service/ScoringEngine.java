package com.sprintsense.backend.service;

import com.sprintsense.backend.dto.MatchedGoal;
import com.sprintsense.backend.dto.ScoredWorkItem;
import com.sprintsense.backend.dto.ScoringBatch;
import com.sprintsense.backend.dto.ScoringMetadata;
import com.sprintsense.backend.dto.SkippedWorkItem;
import com.sprintsense.backend.model.ConfidenceLevel;
import com.sprintsense.backend.model.ProjectGoal;
import com.sprintsense.backend.model.ScoringMode;
import com.sprintsense.backend.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scores work items by keyword alignment with weighted project goals.
 * <p>
 * Each goal whose keywords overlap a work item contributes
 * {@code min(10, matches / goalKeywords * priorityWeight)} to the base score.
 * The item's current priority adds a bounded nudge of at most 0.5, and the
 * final score is clamped to [0, 10]. Items are ranked by score, ties keeping
 * their input order.
 */
@Service
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    public static final double SCORE_MIN = 0.0;
    public static final double SCORE_MAX = 10.0;
    public static final double WORK_ITEM_PRIORITY_MAX = 10.0;
    public static final double PRIORITY_ADJUSTMENT_MAX = 0.5;

    static final int GOAL_TITLE_MAX_LENGTH = 100;

    /**
     * Score and rank a batch. Items that fail to score are reported as skipped.
     */
    public ScoringBatch scoreWorkItems(List<WorkItem> workItems, List<ProjectGoal> goals,
            boolean includeMetadata, ScoringMode mode) {
        if (workItems == null || workItems.isEmpty()) {
            return ScoringBatch.empty();
        }

        List<GoalProfile> profiles = profile(goals);
        List<ScoredWorkItem> scoredItems = new ArrayList<>();
        List<SkippedWorkItem> skippedItems = new ArrayList<>();

        for (WorkItem workItem : workItems) {
            try {
                scoredItems.add(scoreWorkItem(workItem, profiles, includeMetadata, mode));
            } catch (RuntimeException e) {
                String workItemId = workItem != null ? workItem.getId() : null;
                log.warn("[AI-PRIORITY] Failed to score work item {}, skipping: {}", workItemId, e.getMessage());
                skippedItems.add(new SkippedWorkItem(workItemId, e.getMessage()));
            }
        }

        // List.sort is stable, so equal scores keep their input order
        scoredItems.sort(Comparator.comparingDouble(ScoredWorkItem::getAiScore).reversed());
        for (int i = 0; i < scoredItems.size(); i++) {
            scoredItems.get(i).setSuggestedRank(i + 1);
        }

        return new ScoringBatch(scoredItems, skippedItems);
    }

    /**
     * Score one work item. Throws {@link IllegalArgumentException} for malformed
     * input.
     */
    ScoredWorkItem scoreWorkItem(WorkItem workItem, List<GoalProfile> profiles,
            boolean includeMetadata, ScoringMode mode) {
        validate(workItem);

        String text = workItem.getTitle() + " " + (workItem.getDescription() != null ? workItem.getDescription() : "");
        Set<String> itemKeywords = TextProcessor.extractKeywords(text);

        double baseScore = 0.0;
        List<MatchedGoal> matchedGoals = new ArrayList<>();

        for (GoalProfile profile : profiles) {
            if (profile.keywords().isEmpty()) {
                continue;
            }
            Set<String> matches = new HashSet<>(itemKeywords);
            matches.retainAll(profile.keywords());
            if (matches.isEmpty()) {
                continue;
            }

            double goalScore = Math.min(SCORE_MAX,
                    ((double) matches.size() / profile.keywords().size()) * profile.goal().getPriorityWeight());
            baseScore += goalScore;
            matchedGoals.add(new MatchedGoal(
                    profile.goal().getId(),
                    truncateTitle(profile.goal().getDescription()),
                    goalScore,
                    matches.stream().sorted().collect(Collectors.toList())));
        }

        double priorityAdjustment = Math.max(0.0, Math.min(PRIORITY_ADJUSTMENT_MAX,
                (workItem.getPriority() / WORK_ITEM_PRIORITY_MAX) * PRIORITY_ADJUSTMENT_MAX));
        double finalScore = clamp(baseScore + priorityAdjustment);

        ScoringMetadata metadata = null;
        if (includeMetadata) {
            metadata = ScoringMetadata.builder()
                    .matchedGoals(matchedGoals)
                    .baseScore(baseScore)
                    .priorityAdjustment(priorityAdjustment)
                    .clusteringSimilarity(mode == ScoringMode.FULL ? clusteringSimilarity(itemKeywords, profiles) : 0.0)
                    .build();
        }

        return ScoredWorkItem.builder()
                .workItemId(workItem.getId())
                .title(workItem.getTitle())
                .currentPriority(workItem.getPriority())
                .aiScore(finalScore)
                .suggestedRank(1)
                .confidenceLevel(confidenceLevel(finalScore, matchedGoals.size()))
                .explanation(explain(matchedGoals, finalScore))
                .scoringMetadata(metadata)
                .build();
    }

    /**
     * Extract each goal's keywords once, reusing keywords precomputed by the
     * goal cache.
     */
    List<GoalProfile> profile(List<ProjectGoal> goals) {
        if (goals == null) {
            return List.of();
        }
        List<GoalProfile> profiles = new ArrayList<>(goals.size());
        for (ProjectGoal goal : goals) {
            if (goal == null) {
                continue;
            }
            Set<String> keywords = goal.getKeywords() != null
                    ? goal.getKeywords()
                    : TextProcessor.extractKeywords(goal.getDescription());
            profiles.add(new GoalProfile(goal, keywords));
        }
        return profiles;
    }

    static ConfidenceLevel confidenceLevel(double score, int matchedGoalCount) {
        if (score >= 7.0 && matchedGoalCount >= 2) {
            return ConfidenceLevel.HIGH;
        }
        if (score >= 4.0 && matchedGoalCount >= 1) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    static String explain(List<MatchedGoal> matchedGoals, double score) {
        String prefix = String.format(Locale.ROOT, "Score %.1f/10: ", score);
        if (matchedGoals.isEmpty()) {
            return prefix + "No strong alignment with current project goals detected.";
        }

        if (matchedGoals.size() == 1) {
            MatchedGoal goal = matchedGoals.get(0);
            return prefix + "Aligns with '" + goal.goalTitle() + "' through keywords: "
                    + String.join(", ", goal.matchedKeywords().subList(0, Math.min(3, goal.matchedKeywords().size())))
                    + ".";
        }

        Set<String> topKeywords = new LinkedHashSet<>();
        for (MatchedGoal goal : matchedGoals.subList(0, 2)) {
            topKeywords.addAll(goal.matchedKeywords().subList(0, Math.min(2, goal.matchedKeywords().size())));
        }
        return prefix + "Strong alignment with " + matchedGoals.size() + " goals through keywords: "
                + String.join(", ", topKeywords) + ".";
    }

    /**
     * Mean Jaccard similarity between the item keywords and every non-empty goal
     * keyword set.
     */
    static double clusteringSimilarity(Set<String> itemKeywords, List<GoalProfile> profiles) {
        if (itemKeywords.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        int counted = 0;
        for (GoalProfile profile : profiles) {
            if (profile.keywords().isEmpty()) {
                continue;
            }
            Set<String> intersection = new HashSet<>(itemKeywords);
            intersection.retainAll(profile.keywords());
            Set<String> union = new HashSet<>(itemKeywords);
            union.addAll(profile.keywords());
            total += (double) intersection.size() / union.size();
            counted++;
        }
        return counted > 0 ? total / counted : 0.0;
    }

    private static void validate(WorkItem workItem) {
        if (workItem == null) {
            throw new IllegalArgumentException("Work item is null");
        }
        if (workItem.getTitle() == null || workItem.getTitle().isBlank()) {
            throw new IllegalArgumentException("Work item " + workItem.getId() + " has no title");
        }
        if (Double.isNaN(workItem.getPriority()) || workItem.getPriority() < 0.0) {
            throw new IllegalArgumentException("Work item " + workItem.getId()
                    + " has invalid priority " + workItem.getPriority());
        }
    }

    private static String truncateTitle(String description) {
        if (description == null) {
            return "";
        }
        return description.length() > GOAL_TITLE_MAX_LENGTH
                ? description.substring(0, GOAL_TITLE_MAX_LENGTH) + "..."
                : description;
    }

    private static double clamp(double score) {
        return Math.max(SCORE_MIN, Math.min(SCORE_MAX, score));
    }

    record GoalProfile(ProjectGoal goal, Set<String> keywords) {
    }
}
