package com.myorg.docinsight.service.processing;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.TextFragment;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Composite heading score of a single fragment against its document's font statistics.
 * <pre>
 *   size tier (0..3) + bold (1) + heading pattern (1) + top of page (1)
 * </pre>
 * Fragments outside the length window, or without any heading signal (tier, bold or pattern),
 * are not eligible; the position bonus alone never makes a heading.
 * <p>
 * Pure function of its inputs: no state, no dependence on iteration order.
 */
public class HeadingScorer {

    private final InsightProperties.Structure props;

    public HeadingScorer(InsightProperties.Structure props) {
        this.props = props;
    }

    @Getter
    @Builder
    @ToString
    public static class Score {
        private final int sizeTier;
        private final int styleBonus;
        private final int patternBonus;
        private final int positionBonus;
        private final boolean eligible;

        public int composite() {
            return sizeTier + styleBonus + patternBonus + positionBonus;
        }

        public boolean hasHeadingSignal() {
            return sizeTier + styleBonus + patternBonus > 0;
        }
    }

    public Score score(TextFragment fragment, FontStatistics stats) {
        String text = fragment.getText() == null ? "" : fragment.getText().trim();

        int tier = stats.tierOf(fragment.getFontSize());
        int style = fragment.isBold() ? 1 : 0;
        int pattern = HeadingPatterns.matches(text, props.getMaxCapsWords()) ? 1 : 0;
        int position = isInTopRegion(fragment) ? 1 : 0;

        boolean malformed = fragment.getFontSize() <= 0f;
        boolean lengthOk = text.length() >= props.getMinHeadingLength()
                && text.length() <= props.getMaxHeadingLength();

        boolean eligible = !malformed && lengthOk && tier + style + pattern > 0;
        return Score.builder()
                .sizeTier(tier)
                .styleBonus(style)
                .patternBonus(pattern)
                .positionBonus(position)
                .eligible(eligible)
                .build();
    }

    public boolean isInTopRegion(TextFragment fragment) {
        float height = fragment.getPageHeight();
        if (height <= 0f) return false;
        return fragment.getTop() < height * props.getTopRegionRatio();
    }
}
