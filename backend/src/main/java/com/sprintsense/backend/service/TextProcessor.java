package com.sprintsense.backend.service;

import org.springframework.web.util.HtmlUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text normalization and keyword extraction used to compare work items with
 * project goals. All methods are pure and accept null.
 */
public final class TextProcessor {

    /**
     * Texts shorter than this (after trimming) yield no keywords.
     */
    public static final int MIN_TEXT_LENGTH = 10;

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern WORD = Pattern.compile("\\b[a-zA-Z_][a-zA-Z0-9_]{1,}\\b");

    // Order matters: first matching suffix wins
    private static final List<String> SUFFIXES = List.of("ing", "ed", "er", "est", "ly", "s", "es");
    private static final int MIN_STEM_LENGTH = 3;

    static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "from", "as", "into", "about", "than", "then", "so", "if", "not", "no", "nor",
            "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
            "do", "does", "did", "will", "would", "should", "could", "can", "may", "might", "must", "shall",
            "this", "that", "these", "those", "there", "here", "what", "which", "who", "whom",
            "i", "me", "my", "mine", "you", "your", "yours", "he", "him", "his", "she", "her", "hers",
            "it", "its", "we", "us", "our", "ours", "they", "them", "their", "theirs");

    private TextProcessor() {
    }

    /**
     * Decode HTML entities, then drop anything that looks like a tag. Unmatched
     * angle brackets are kept as literal text.
     */
    public static String stripHtml(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String decoded = HtmlUtils.htmlUnescape(text);
        return HTML_TAG.matcher(decoded).replaceAll("");
    }

    /**
     * Strip HTML, lowercase and collapse whitespace.
     */
    public static String normalizeText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String stripped = stripHtml(text).toLowerCase(Locale.ROOT);
        return WHITESPACE.matcher(stripped.strip()).replaceAll(" ");
    }

    /**
     * Extract the stemmed, stop-word filtered keyword set of a text.
     */
    public static Set<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        if (text == null || text.strip().length() < MIN_TEXT_LENGTH) {
            return keywords;
        }

        Matcher matcher = WORD.matcher(normalizeText(text));
        while (matcher.find()) {
            String word = matcher.group().toLowerCase(Locale.ROOT);
            if (!STOP_WORDS.contains(word)) {
                keywords.add(simpleStem(word));
            }
        }
        return keywords;
    }

    /**
     * Remove at most one common English suffix, keeping at least three
     * characters.
     */
    public static String simpleStem(String word) {
        if (word == null) {
            return "";
        }
        for (String suffix : SUFFIXES) {
            if (word.endsWith(suffix) && word.length() - suffix.length() >= MIN_STEM_LENGTH) {
                return word.substring(0, word.length() - suffix.length());
            }
        }
        return word;
    }
}
