package com.sprintsense.backend.dto;

import java.util.List;

/**
 * A goal that shares keywords with a scored work item.
 *
 * @param goalId          the goal ID
 * @param goalTitle       goal description, truncated to 100 characters
 * @param matchStrength   contribution of this goal to the base score
 * @param matchedKeywords shared keywords, sorted
 */
public record MatchedGoal(String goalId, String goalTitle, double matchStrength, List<String> matchedKeywords) {
}
