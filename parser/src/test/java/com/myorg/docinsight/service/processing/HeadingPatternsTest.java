package com.myorg.docinsight.service.processing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeadingPatterns Tests")
class HeadingPatternsTest {

    @ParameterizedTest
    @ValueSource(strings = {"1. Introduction", "1.2 Scope", "1.2.3 Detailed Design", "3.2: Results",
            "2 Background", "Chapter 3 Results", "SECTION 4", "Appendix A", "IV. Discussion", "4)"})
    @DisplayName("should recognize numbered heading prefixes")
    void shouldRecognizeNumbering(String text) {
        assertThat(HeadingPatterns.isNumbered(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"2023 revenue grew by ten percent", "12 apples were sold", "In 1999 we started",
            "the chapter ended", ""})
    @DisplayName("should not treat prose with numbers as numbered headings")
    void shouldRejectProse(String text) {
        assertThat(HeadingPatterns.isNumbered(text)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"第3章 総則", "第十二節", "問 2 次の文を読みなさい", "问题 4", "제1장 서론", "질문 3",
            "الفصل 4", "السؤال 2", "פרק 2 מבוא", "अध्याय 5", "प्रश्न 1"})
    @DisplayName("should recognize numbered chapter and question markers in other scripts")
    void shouldRecognizeNumbering_whenScriptIsNotLatin(String text) {
        assertThat(HeadingPatterns.isNumbered(text)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"問題集はこちら", "第一印象が大切です", "제품 소개", "فصل الربيع"})
    @DisplayName("should not treat non-Latin prose without a number as a numbered heading")
    void shouldRejectProse_whenScriptIsNotLatin(String text) {
        assertThat(HeadingPatterns.isNumbered(text)).isFalse();
    }

    @Test
    @DisplayName("should recognize short all-caps lines only")
    void shouldRecognizeShortAllCaps() {
        assertThat(HeadingPatterns.isShortAllCaps("RISK FACTORS", 8)).isTrue();
        assertThat(HeadingPatterns.isShortAllCaps("THIS LINE HAS FAR TOO MANY WORDS TO BE A HEADING", 8)).isFalse();
        assertThat(HeadingPatterns.isShortAllCaps("Risk Factors", 8)).isFalse();
        assertThat(HeadingPatterns.isShortAllCaps("2024", 8)).isFalse();
        assertThat(HeadingPatterns.isShortAllCaps(null, 8)).isFalse();
    }

    @Test
    @DisplayName("should recognize standard section names in any case and with numbering")
    void shouldRecognizeStandardHeadings() {
        assertThat(HeadingPatterns.isStandardHeading("Abstract")).isTrue();
        assertThat(HeadingPatterns.isStandardHeading("2. Results:")).isTrue();
        assertThat(HeadingPatterns.isStandardHeading("references")).isTrue();
        assertThat(HeadingPatterns.isStandardHeading("Results of the trial")).isFalse();
    }

    @Test
    @DisplayName("should match when any shape applies")
    void shouldMatchAnyShape() {
        assertThat(HeadingPatterns.matches("Conclusion", 8)).isTrue();
        assertThat(HeadingPatterns.matches("OVERVIEW OF OPERATIONS", 8)).isTrue();
        assertThat(HeadingPatterns.matches("a perfectly ordinary sentence.", 8)).isFalse();
    }
}
