package com.sprintsense.backend.service;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TextProcessorTest {

    @Test
    void shouldStripTagsAfterDecodingEntities() {
        assertThat(TextProcessor.stripHtml("<p>Hello &amp; <b>world</b></p>")).isEqualTo("Hello & world");
        assertThat(TextProcessor.stripHtml("&lt;script&gt;alert(1)&lt;/script&gt;")).isEqualTo("alert(1)");
    }

    @Test
    void shouldKeepUnmatchedAngleBracketsLiterally() {
        assertThat(TextProcessor.stripHtml("5 < 6")).isEqualTo("5 < 6");
        assertThat(TextProcessor.stripHtml("x > y")).isEqualTo("x > y");
        assertThat(TextProcessor.stripHtml("broken <div")).isEqualTo("broken <div");
    }

    @Test
    void shouldHandleNullAndEmptyInput() {
        assertThat(TextProcessor.stripHtml(null)).isEmpty();
        assertThat(TextProcessor.normalizeText(null)).isEmpty();
        assertThat(TextProcessor.normalizeText("")).isEmpty();
        assertThat(TextProcessor.extractKeywords(null)).isEmpty();
        assertThat(TextProcessor.simpleStem(null)).isEmpty();
    }

    @Test
    void shouldNormalizeCaseAndWhitespace() {
        assertThat(TextProcessor.normalizeText("  Hello   <b>World</b>\n\tAgain  "))
                .isEqualTo("hello world again");
    }

    @Test
    void shouldExcludeStopWords() {
        Set<String> keywords = TextProcessor.extractKeywords("the quick and the dead");

        assertThat(keywords).contains("quick", "dead");
        assertThat(keywords).doesNotContain("the", "and");
    }

    @Test
    void shouldReturnNoKeywordsForShortText() {
        assertThat(TextProcessor.extractKeywords("Hi")).isEmpty();
        assertThat(TextProcessor.extractKeywords("   short   ")).isEmpty();
    }

    @Test
    void shouldStemAndSkipTokensStartingWithDigits() {
        Set<String> keywords = TextProcessor.extractKeywords("Running tests quickly on 42x <em>servers</em>");

        assertThat(keywords).containsExactlyInAnyOrder("runn", "test", "quick", "server");
    }

    @Test
    void shouldKeepUnderscoreIdentifiers() {
        assertThat(TextProcessor.extractKeywords("refactor the user_id column"))
                .contains("user_id", "column");
    }

    @Test
    void shouldStemFirstMatchingSuffixOnly() {
        assertThat(TextProcessor.simpleStem("running")).isEqualTo("runn");
        assertThat(TextProcessor.simpleStem("cats")).isEqualTo("cat");
        assertThat(TextProcessor.simpleStem("played")).isEqualTo("play");
        assertThat(TextProcessor.simpleStem("fastest")).isEqualTo("fast");
        assertThat(TextProcessor.simpleStem("boxes")).isEqualTo("boxe");
    }

    @Test
    void shouldNotStemBelowThreeCharacters() {
        assertThat(TextProcessor.simpleStem("a")).isEqualTo("a");
        assertThat(TextProcessor.simpleStem("bus")).isEqualTo("bus");
        assertThat(TextProcessor.simpleStem("red")).isEqualTo("red");
        assertThat(TextProcessor.simpleStem("user")).isEqualTo("user");
    }
}
