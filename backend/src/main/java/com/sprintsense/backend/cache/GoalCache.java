package com.sprintsense.backend.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sprintsense.backend.dto.CachedGoal;
import com.sprintsense.backend.model.ProjectGoal;
import com.sprintsense.backend.repository.ProjectGoalRepository;
import com.sprintsense.backend.resilience.CircuitBreaker;
import com.sprintsense.backend.resilience.ProtectedCall;
import com.sprintsense.backend.service.TextProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-through cache of each team's goals, stored as JSON together with the
 * goals' precomputed keywords.
 * <p>
 * Cache failures of any kind fall back to the goal repository. Concurrent
 * misses for the same team each reload from the repository and write the same
 * entry; no refresh lock is taken.
 */
@Service
public class GoalCache {

    private static final Logger log = LoggerFactory.getLogger(GoalCache.class);

    static final String KEY_PREFIX = "ai_priority:goals:";

    private static final TypeReference<List<CachedGoal>> CACHED_GOALS = new TypeReference<>() {
    };

    private final CacheClient cacheClient;
    private final ProjectGoalRepository projectGoalRepository;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker cacheCircuitBreaker;
    private final CircuitBreaker goalSourceCircuitBreaker;
    private final Duration ttl;

    public GoalCache(CacheClient cacheClient,
            ProjectGoalRepository projectGoalRepository,
            ObjectMapper objectMapper,
            @Qualifier("cacheCircuitBreaker") CircuitBreaker cacheCircuitBreaker,
            @Qualifier("goalSourceCircuitBreaker") CircuitBreaker goalSourceCircuitBreaker,
            @Value("${sprintsense.ai.goal-cache.ttl-seconds:3600}") long ttlSeconds) {
        this.cacheClient = cacheClient;
        this.projectGoalRepository = projectGoalRepository;
        this.objectMapper = objectMapper;
        this.cacheCircuitBreaker = cacheCircuitBreaker;
        this.goalSourceCircuitBreaker = goalSourceCircuitBreaker;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public static String cacheKey(String teamId) {
        return KEY_PREFIX + teamId;
    }

    /**
     * Get a team's goals ordered by priority weight (desc) then creation time,
     * each with its keyword set filled in.
     */
    public List<ProjectGoal> getGoals(String teamId) {
        String key = cacheKey(teamId);

        List<ProjectGoal> cached = readCache(teamId, key);
        if (cached != null) {
            log.debug("[CACHE] Goal cache hit for team: {} ({} goals)", teamId, cached.size());
            return cached;
        }

        List<ProjectGoal> goals = ProtectedCall.of(goalSourceCircuitBreaker,
                () -> projectGoalRepository.findByTeamIdOrderByPriorityWeightDescCreatedAtAsc(teamId)).get();
        for (ProjectGoal goal : goals) {
            goal.setKeywords(TextProcessor.extractKeywords(goal.getDescription()));
        }
        log.debug("[CACHE] Loaded {} goals from source for team: {}", goals.size(), teamId);

        if (!goals.isEmpty()) {
            writeCache(teamId, key, goals);
        }
        return goals;
    }

    /**
     * Drop a team's cached goals, e.g. after one of them changed.
     */
    public void evict(String teamId) {
        try {
            boolean removed = ProtectedCall.of(cacheCircuitBreaker, () -> cacheClient.delete(cacheKey(teamId))).get();
            log.info("[CACHE] Evicted goals for team: {} (present: {})", teamId, removed);
        } catch (Exception e) {
            log.warn("[CACHE] Failed to evict goals for team: {}: {}", teamId, e.getMessage());
        }
    }

    private List<ProjectGoal> readCache(String teamId, String key) {
        try {
            String json = ProtectedCall.of(cacheCircuitBreaker, () -> cacheClient.get(key)).get();
            if (json == null || json.isBlank()) {
                return null;
            }
            List<CachedGoal> entries = objectMapper.readValue(json, CACHED_GOALS);
            List<ProjectGoal> goals = new ArrayList<>(entries.size());
            for (CachedGoal entry : entries) {
                goals.add(toGoal(entry));
            }
            return goals;
        } catch (Exception e) {
            log.warn("[CACHE] Failed to read goals from cache for team: {}, falling back to source: {}",
                    teamId, e.getMessage());
            return null;
        }
    }

    private void writeCache(String teamId, String key, List<ProjectGoal> goals) {
        try {
            List<CachedGoal> entries = goals.stream().map(GoalCache::toEntry).collect(Collectors.toList());
            String json = objectMapper.writeValueAsString(entries);
            ProtectedCall.of(cacheCircuitBreaker, () -> {
                cacheClient.set(key, json, ttl);
                return null;
            }).get();
        } catch (Exception e) {
            log.warn("[CACHE] Failed to cache goals for team: {}: {}", teamId, e.getMessage());
        }
    }

    private static CachedGoal toEntry(ProjectGoal goal) {
        return CachedGoal.builder()
                .id(goal.getId())
                .teamId(goal.getTeamId())
                .description(goal.getDescription())
                .priorityWeight(goal.getPriorityWeight())
                .successMetrics(goal.getSuccessMetrics())
                .keywords(new ArrayList<>(goal.getKeywords()))
                .build();
    }

    private static ProjectGoal toGoal(CachedGoal entry) {
        if (entry.getDescription() == null) {
            throw new IllegalArgumentException("Cached goal " + entry.getId() + " has no description");
        }
        return ProjectGoal.builder()
                .id(entry.getId())
                .teamId(entry.getTeamId())
                .description(entry.getDescription())
                .priorityWeight(entry.getPriorityWeight())
                .successMetrics(entry.getSuccessMetrics())
                .keywords(entry.getKeywords() != null
                        ? new LinkedHashSet<>(entry.getKeywords())
                        : TextProcessor.extractKeywords(entry.getDescription()))
                .build();
    }
}
