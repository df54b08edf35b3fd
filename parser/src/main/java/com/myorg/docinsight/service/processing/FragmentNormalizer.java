package com.myorg.docinsight.service.processing;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.TextFragment;
import lombok.extern.slf4j.Slf4j;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cleans the raw fragments of one document:
 * <ol>
 *   <li>sanitizes malformed values and trims text, dropping blank fragments</li>
 *   <li>drops running headers/footers (same text at the same height on most pages)</li>
 *   <li>joins runs split on one baseline, and the wrapped lines of a heading</li>
 * </ol>
 * Body lines are never joined into paragraphs: font statistics are taken per line, and
 * {@link #lines} exposes the cleaned lines before merging for that purpose.
 * Input order is preserved. Stateless and thread-safe.
 */
@Slf4j
public class FragmentNormalizer {

    private static final float SIZE_EPSILON = 0.01f;

    /** Max baseline difference, in points, for two runs to sit on the same line. */
    private static final float SAME_LINE_TOLERANCE = 2f;

    /** Line spacing, in multiples of the font size, still read as a wrapped heading. */
    private static final float HEADING_LEADING = 1.5f;

    private final InsightProperties.Normalizer props;

    public FragmentNormalizer(InsightProperties.Normalizer props) {
        this.props = props;
    }

    public List<TextFragment> normalize(List<TextFragment> raw) {
        return mergeLines(lines(raw));
    }

    /**
     * Sanitized fragments without running headers/footers, one per extracted line.
     */
    public List<TextFragment> lines(List<TextFragment> raw) {
        if (raw == null || raw.isEmpty()) return List.of();

        Map<Integer, Float> pageHeights = resolvePageHeights(raw);

        List<TextFragment> cleaned = new ArrayList<>(raw.size());
        for (TextFragment f : raw) {
            TextFragment s = sanitize(f, pageHeights);
            if (s != null) cleaned.add(s);
        }

        List<TextFragment> withoutFurniture = dropRunningHeaders(cleaned);
        log.debug("Cleaned {} raw fragments -> {} (furniture removed: {})",
                raw.size(), withoutFurniture.size(), cleaned.size() - withoutFurniture.size());
        return withoutFurniture;
    }

    // --- sanitizing ---

    private TextFragment sanitize(TextFragment f, Map<Integer, Float> pageHeights) {
        if (f == null || f.getText() == null) return null;
        String text = clean(f.getText());
        if (text.isEmpty()) return null;

        int page = Math.max(1, f.getPage());
        float height = pageHeights.getOrDefault(page, props.getDefaultPageHeight());
        // unusable sizes become 0, which the detector treats as the lowest tier
        float size = isFinitePositive(f.getFontSize()) ? f.getFontSize() : 0f;
        // unknown position: treat as bottom of page so it never earns a position bonus
        float top = Float.isFinite(f.getTop()) && f.getTop() >= 0 ? f.getTop() : height;

        return f.toBuilder()
                .text(text)
                .page(page)
                .fontSize(size)
                .top(top)
                .pageHeight(height)
                .build();
    }

    private Map<Integer, Float> resolvePageHeights(List<TextFragment> raw) {
        Map<Integer, Float> declared = new HashMap<>();
        Map<Integer, Float> maxTop = new HashMap<>();
        for (TextFragment f : raw) {
            if (f == null) continue;
            int page = Math.max(1, f.getPage());
            if (isFinitePositive(f.getPageHeight())) {
                declared.merge(page, f.getPageHeight(), Math::max);
            }
            if (isFinitePositive(f.getTop())) {
                maxTop.merge(page, f.getTop(), Math::max);
            }
        }
        Map<Integer, Float> heights = new HashMap<>(maxTop);
        heights.replaceAll((page, top) -> Math.max(top, props.getDefaultPageHeight()));
        heights.putAll(declared);
        return heights;
    }

    private static String clean(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFC)
                .replace('\u00A0', ' ')
                .replaceAll("[\\p{Cntrl}&&[^\\n\\t]]", "")
                .replaceAll("\\s+", " ")
                .trim();
    }

    private static boolean isFinitePositive(float v) {
        return Float.isFinite(v) && v > 0;
    }

    // --- running headers / footers ---

    private List<TextFragment> dropRunningHeaders(List<TextFragment> fragments) {
        Set<Integer> pages = new HashSet<>();
        for (TextFragment f : fragments) pages.add(f.getPage());
        int pageCount = pages.size();
        if (pageCount < props.getMinPagesForRepeatDetection()) return fragments;

        Map<String, Set<Integer>> pagesByKey = new HashMap<>();
        for (TextFragment f : fragments) {
            pagesByKey.computeIfAbsent(furnitureKey(f), k -> new HashSet<>()).add(f.getPage());
        }

        int threshold = (int) Math.ceil(props.getRepeatedPageRatio() * pageCount);
        Set<String> furniture = new HashSet<>();
        pagesByKey.forEach((key, seenOn) -> {
            if (seenOn.size() >= threshold) furniture.add(key);
        });
        if (furniture.isEmpty()) return fragments;

        log.debug("Dropping {} running header/footer line(s) repeated on >= {} of {} pages",
                furniture.size(), threshold, pageCount);
        List<TextFragment> kept = new ArrayList<>(fragments.size());
        for (TextFragment f : fragments) {
            if (!furniture.contains(furnitureKey(f))) kept.add(f);
        }
        return kept;
    }

    private String furnitureKey(TextFragment f) {
        int bands = Math.max(1, props.getVerticalBands());
        int band = (int) Math.min(bands - 1, Math.floor(f.getTop() / f.getPageHeight() * bands));
        return band + "|" + f.getText();
    }

    // --- line merging ---

    /**
     * Joins runs on the same baseline and the continuation lines of a wrapped heading. Lines in
     * body style are left as they are.
     */
    public List<TextFragment> mergeLines(List<TextFragment> lines) {
        if (lines == null || lines.isEmpty()) return List.of();
        float bodySize = FontStatistics.of(lines).getMedian();

        List<TextFragment> out = new ArrayList<>(lines.size());
        TextFragment current = null;
        float lastTop = 0f;
        StringBuilder buf = new StringBuilder();

        for (TextFragment f : lines) {
            if (current != null && continuesLine(current, buf, lastTop, f, bodySize)) {
                buf.append(' ').append(f.getText());
                lastTop = f.getTop();
                continue;
            }
            if (current != null) out.add(current.toBuilder().text(buf.toString()).build());
            current = f;
            lastTop = f.getTop();
            buf.setLength(0);
            buf.append(f.getText());
        }
        if (current != null) out.add(current.toBuilder().text(buf.toString()).build());

        if (out.size() < lines.size()) {
            log.debug("Merged {} lines -> {} fragments", lines.size(), out.size());
        }
        return out;
    }

    private boolean continuesLine(TextFragment open, CharSequence openText, float lastTop, TextFragment next, float bodySize) {
        if (open.getPage() != next.getPage()) return false;
        if (open.isBold() != next.isBold()) return false;
        if (Math.abs(open.getFontSize() - next.getFontSize()) > SIZE_EPSILON) return false;
        if (open.getFontSize() <= 0f) return false;
        // a numbered line starts a new item even when it shares the style
        if (HeadingPatterns.isNumbered(next.getText())) return false;

        float gap = next.getTop() - lastTop;
        if (Math.abs(gap) <= SAME_LINE_TOLERANCE) return true;

        boolean headingStyle = open.isBold() || open.getFontSize() > bodySize + SIZE_EPSILON;
        if (!headingStyle || endsSentence(openText)) return false;
        float maxGap = Math.max((float) props.getMergeGapRatio() * open.getPageHeight(),
                HEADING_LEADING * open.getFontSize());
        return gap > 0 && gap <= maxGap;
    }

    private static boolean endsSentence(CharSequence text) {
        if (text.length() == 0) return false;
        char last = text.charAt(text.length() - 1);
        return last == '.' || last == '!' || last == '?' || last == ':' || last == ';';
    }
}
