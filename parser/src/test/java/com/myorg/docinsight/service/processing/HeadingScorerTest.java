package com.myorg.docinsight.service.processing;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.TextFragment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.myorg.docinsight.Fragments.body;
import static com.myorg.docinsight.Fragments.line;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeadingScorer Tests")
class HeadingScorerTest {

    private HeadingScorer scorer;
    private FontStatistics stats;

    @BeforeEach
    void setUp() {
        scorer = new HeadingScorer(new InsightProperties.Structure());
        // sizes 10 x7, 12, 14, 18 -> median 10, p75 12, p90 18
        List<TextFragment> doc = new ArrayList<>();
        for (int i = 0; i < 7; i++) doc.add(body("d", "body " + i, 300 + i * 20, 1));
        doc.add(line("d", "a", 12f, false, 0, 1));
        doc.add(line("d", "b", 14f, false, 0, 1));
        doc.add(line("d", "c", 18f, false, 0, 1));
        stats = FontStatistics.of(doc);
    }

    @Test
    @DisplayName("should compute percentiles by sorted index")
    void shouldComputePercentiles() {
        assertThat(stats.getMedian()).isEqualTo(10f);
        assertThat(stats.getP75()).isEqualTo(12f);
        assertThat(stats.getP90()).isEqualTo(18f);
    }

    @Test
    @DisplayName("should map font sizes to tiers")
    void shouldMapSizeTiers() {
        assertThat(stats.tierOf(0f)).isZero();
        assertThat(stats.tierOf(10f)).isZero();
        assertThat(stats.tierOf(11f)).isEqualTo(1);
        assertThat(stats.tierOf(12f)).isEqualTo(2);
        assertThat(stats.tierOf(14f)).isEqualTo(2);
        assertThat(stats.tierOf(18f)).isEqualTo(3);
        assertThat(stats.tierOf(30f)).isEqualTo(3);
    }

    @Test
    @DisplayName("should fall back to a default size when no font sizes are usable")
    void shouldUseDefault_whenNoSizes() {
        FontStatistics empty = FontStatistics.of(List.of(line("d", "x", 0f, false, 0, 1)));
        assertThat(empty.getMedian()).isEqualTo(12f);
    }

    @Test
    @DisplayName("should add up size, style, pattern and position")
    void shouldAddUpAllFactors() {
        HeadingScorer.Score s = scorer.score(line("d", "Introduction", 18f, true, 50, 1), stats);

        assertThat(s.getSizeTier()).isEqualTo(3);
        assertThat(s.getStyleBonus()).isEqualTo(1);
        assertThat(s.getPatternBonus()).isEqualTo(1);
        assertThat(s.getPositionBonus()).isEqualTo(1);
        assertThat(s.composite()).isEqualTo(6);
        assertThat(s.isEligible()).isTrue();
    }

    @Test
    @DisplayName("should not make a heading from position alone")
    void shouldNotBeEligible_whenOnlyPositionBonus() {
        HeadingScorer.Score s = scorer.score(body("d", "plain body text near the top", 50, 1), stats);

        assertThat(s.composite()).isEqualTo(1);
        assertThat(s.hasHeadingSignal()).isFalse();
        assertThat(s.isEligible()).isFalse();
    }

    @Test
    @DisplayName("should force long bold paragraphs to body through the length gate")
    void shouldNotBeEligible_whenTooLong() {
        String paragraph = "This paragraph happens to be set in bold type but it is far too long to be a heading "
                + "because it keeps going well past the length window.";
        HeadingScorer.Score s = scorer.score(line("d", paragraph, 18f, true, 50, 1), stats);

        assertThat(s.isEligible()).isFalse();
    }

    @Test
    @DisplayName("should treat fragments without a font size as body")
    void shouldNotBeEligible_whenFontSizeMissing() {
        HeadingScorer.Score s = scorer.score(line("d", "1. Looks Like A Heading", 0f, true, 50, 1), stats);

        assertThat(s.getSizeTier()).isZero();
        assertThat(s.isEligible()).isFalse();
    }

    @Test
    @DisplayName("should score independently of other fragments")
    void shouldBePure() {
        TextFragment f = line("d", "RISK FACTORS", 12f, false, 600, 2);
        assertThat(scorer.score(f, stats).composite()).isEqualTo(scorer.score(f, stats).composite());
        assertThat(scorer.score(f, stats).composite()).isEqualTo(3);
    }
}
