package com.myorg.docinsight.service.processing;

import com.myorg.docinsight.model.TextFragment;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Font size distribution of one document: median, 75th and 90th percentile.
 */
@Getter
@ToString
public class FontStatistics {

    private static final float DEFAULT_SIZE = 12f;

    private final float median;
    private final float p75;
    private final float p90;

    public FontStatistics(float median, float p75, float p90) {
        this.median = median;
        this.p75 = p75;
        this.p90 = p90;
    }

    /**
     * Percentiles over fragments with a usable font size; fragments sanitized to 0 are ignored.
     */
    public static FontStatistics of(List<TextFragment> fragments) {
        List<Float> sizes = fragments.stream()
                .map(TextFragment::getFontSize)
                .filter(s -> s > 0f)
                .sorted()
                .collect(Collectors.toList());
        if (sizes.isEmpty()) return new FontStatistics(DEFAULT_SIZE, DEFAULT_SIZE, DEFAULT_SIZE);
        return new FontStatistics(
                sizes.get(sizes.size() / 2),
                percentile(sizes, 0.75),
                percentile(sizes, 0.90));
    }

    private static float percentile(List<Float> sorted, double q) {
        int idx = (int) Math.floor(q * sorted.size());
        return sorted.get(Math.min(sorted.size() - 1, idx));
    }

    /**
     * 0 at or below the median, 1 up to p75, 2 up to p90, 3 at or above p90.
     */
    public int tierOf(float size) {
        if (size <= 0f || size <= median) return 0;
        if (size >= p90) return 3;
        if (size >= p75) return 2;
        return 1;
    }
}
