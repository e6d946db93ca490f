package com.sprintsense.backend.service;

import com.sprintsense.backend.dto.BatchPrioritizationRequest;
import com.sprintsense.backend.dto.BatchPrioritizationResult;
import com.sprintsense.backend.dto.MatchedGoal;
import com.sprintsense.backend.dto.PrioritizationRequest;
import com.sprintsense.backend.dto.PrioritizationResponse;
import com.sprintsense.backend.dto.PriorityChange;
import com.sprintsense.backend.dto.ScoredWorkItem;
import com.sprintsense.backend.dto.SuggestionRequest;
import com.sprintsense.backend.dto.SuggestionResponse;
import com.sprintsense.backend.dto.WorkItemSuggestion;
import com.sprintsense.backend.exception.InvalidPrioritizationRequestException;
import com.sprintsense.backend.model.ScoringMode;
import com.sprintsense.backend.model.WorkItem;
import com.sprintsense.backend.repository.WorkItemRepository;
import com.sprintsense.backend.resilience.CircuitBreaker;
import com.sprintsense.backend.resilience.ProtectedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Workflows built on top of the scoring core: suggestions for individual work
 * items and batch re-prioritization.
 */
@Service
public class PrioritizationInsightsService {

    private static final Logger log = LoggerFactory.getLogger(PrioritizationInsightsService.class);

    private static final int MAX_DOMINANT_GOALS = 3;

    private final AIPrioritizationService aiPrioritizationService;
    private final WorkItemRepository workItemRepository;
    private final CircuitBreaker workItemSourceCircuitBreaker;

    public PrioritizationInsightsService(AIPrioritizationService aiPrioritizationService,
            WorkItemRepository workItemRepository,
            @Qualifier("workItemSourceCircuitBreaker") CircuitBreaker workItemSourceCircuitBreaker) {
        this.aiPrioritizationService = aiPrioritizationService;
        this.workItemRepository = workItemRepository;
        this.workItemSourceCircuitBreaker = workItemSourceCircuitBreaker;
    }

    /**
     * Suggest priorities for the top-scoring context items.
     */
    public SuggestionResponse suggest(String teamId, SuggestionRequest request) {
        int maxSuggestions = request.getMaxSuggestions();
        if (maxSuggestions < SuggestionRequest.MIN_SUGGESTIONS || maxSuggestions > SuggestionRequest.MAX_SUGGESTIONS) {
            throw new InvalidPrioritizationRequestException("maxSuggestions must be between "
                    + SuggestionRequest.MIN_SUGGESTIONS + " and " + SuggestionRequest.MAX_SUGGESTIONS
                    + ", got " + maxSuggestions);
        }
        List<String> contextItemIds = request.getContextItemIds() != null ? request.getContextItemIds() : List.of();

        log.info("[AI-PRIORITY] Suggestion request for team: {} | Context items: {}",
                teamId, contextItemIds.size());

        PrioritizationResponse scored = aiPrioritizationService.scoreWorkItems(teamId,
                PrioritizationRequest.builder()
                        .workItemIds(contextItemIds)
                        .includeMetadata(true)
                        .mode(ScoringMode.FULL)
                        .build());
        List<ScoredWorkItem> items = scored.getScoredItems();

        List<WorkItemSuggestion> suggestions = items.stream()
                .limit(maxSuggestions)
                .map(item -> new WorkItemSuggestion(
                        item.getWorkItemId(),
                        item.getAiScore(),
                        item.getCurrentPriority(),
                        item.getConfidenceLevel(),
                        request.isIncludeExplanation() ? item.getExplanation() : "AI-based prioritization",
                        item.getSuggestedRank()))
                .collect(Collectors.toList());

        double confidence = suggestions.stream()
                .mapToDouble(s -> s.confidenceLevel().getSuggestionConfidence())
                .average()
                .orElse(0.0);
        double averagePriority = items.stream()
                .mapToDouble(ScoredWorkItem::getCurrentPriority)
                .average()
                .orElse(0.0);

        return SuggestionResponse.builder()
                .suggestions(suggestions)
                .confidenceScore(confidence)
                .totalContextItems(contextItemIds.size())
                .averagePriority(averagePriority)
                .priorityDistribution(priorityDistribution(items))
                .dominantGoals(dominantGoals(items))
                .warning(scored.getWarning())
                .build();
    }

    /**
     * Compute new priorities for a batch from their AI scores, persisting them
     * when changes are applied without confirmation.
     */
    public BatchPrioritizationResult prioritizeBatch(String teamId, BatchPrioritizationRequest request) {
        List<String> workItemIds = validateBatch(request);
        String batchId = request.getBatchId() != null ? request.getBatchId() : UUID.randomUUID().toString();
        boolean apply = request.isApplyChanges() && !request.isRequireConfirmation();

        log.info("[AI-PRIORITY] Batch {} for team: {} | Items: {} | Apply: {}",
                batchId, teamId, workItemIds.size(), apply);

        PrioritizationResponse scored = aiPrioritizationService.scoreWorkItems(teamId,
                PrioritizationRequest.builder()
                        .workItemIds(workItemIds)
                        .includeMetadata(true)
                        .mode(ScoringMode.FULL)
                        .build());

        List<PriorityChange> changes = scored.getScoredItems().stream()
                .map(item -> new PriorityChange(
                        item.getWorkItemId(),
                        item.getCurrentPriority(),
                        item.getAiScore(),
                        item.getAiScore() - item.getCurrentPriority(),
                        item.getConfidenceLevel(),
                        item.getExplanation(),
                        apply))
                .collect(Collectors.toList());

        if (apply && !changes.isEmpty()) {
            applyChanges(changes);
        }

        double averageChange = changes.stream().mapToDouble(PriorityChange::priorityChange).average().orElse(0.0);
        int failed = Math.max(0, workItemIds.size() - changes.size());

        return BatchPrioritizationResult.builder()
                .batchId(batchId)
                .totalItems(workItemIds.size())
                .successfullyPrioritized(changes.size())
                .failedItems(failed)
                .priorityChanges(changes)
                .changesApplied(apply)
                .requiresConfirmation(request.isRequireConfirmation())
                .batchSummary(String.format(Locale.ROOT,
                        "Processed %d items with average priority change of %.2f", changes.size(), averageChange))
                .build();
    }

    /**
     * @return requested work item IDs, deduplicated in order
     */
    private static List<String> validateBatch(BatchPrioritizationRequest request) {
        List<String> unique = new ArrayList<>();
        if (request.getWorkItemIds() != null) {
            unique.addAll(new LinkedHashSet<>(request.getWorkItemIds()));
            unique.removeIf(id -> id == null || id.isBlank());
        }
        if (unique.isEmpty()) {
            throw new InvalidPrioritizationRequestException("A batch needs at least one work item");
        }
        if (unique.size() > BatchPrioritizationRequest.MAX_WORK_ITEMS) {
            throw new InvalidPrioritizationRequestException("Cannot prioritize more than "
                    + BatchPrioritizationRequest.MAX_WORK_ITEMS + " work items in one batch, got " + unique.size());
        }
        return unique;
    }

    private void applyChanges(List<PriorityChange> changes) {
        Map<String, Double> newPriorities = changes.stream()
                .collect(Collectors.toMap(PriorityChange::workItemId, PriorityChange::newPriority));

        ProtectedCall.of(workItemSourceCircuitBreaker, () -> {
            List<WorkItem> items = new ArrayList<>();
            workItemRepository.findAllById(newPriorities.keySet()).forEach(items::add);
            items.forEach(item -> item.setPriority(newPriorities.get(item.getId())));
            return workItemRepository.saveAll(items);
        }).get();
        log.info("[AI-PRIORITY] Applied {} priority changes", newPriorities.size());
    }

    static Map<String, Integer> priorityDistribution(List<ScoredWorkItem> items) {
        Map<String, Integer> distribution = new LinkedHashMap<>();
        distribution.put("high", 0);
        distribution.put("medium", 0);
        distribution.put("low", 0);
        for (ScoredWorkItem item : items) {
            String band = item.getAiScore() >= 7.0 ? "high" : item.getAiScore() >= 4.0 ? "medium" : "low";
            distribution.merge(band, 1, Integer::sum);
        }
        return distribution;
    }

    /**
     * Goals matched by the most items, most frequent first.
     */
    static List<String> dominantGoals(List<ScoredWorkItem> items) {
        Map<String, Long> counts = items.stream()
                .filter(item -> item.getScoringMetadata() != null)
                .flatMap(item -> item.getScoringMetadata().getMatchedGoals().stream())
                .map(MatchedGoal::goalTitle)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .limit(MAX_DOMINANT_GOALS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }
}
