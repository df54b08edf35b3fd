package com.myorg.docinsight.service.processing;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.ClassifiedFragment;
import com.myorg.docinsight.model.DocumentStructure;
import com.myorg.docinsight.model.HeadingLevel;
import com.myorg.docinsight.model.OutlineEntry;
import com.myorg.docinsight.model.TextFragment;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Classifies the normalized fragments of one document as Title, H1, H2, H3 or Body.
 * <p>
 * Composite scores come from {@link HeadingScorer}. Heading levels are relative to the document:
 * the largest distinct score among heading candidates becomes H1, the next H2, the next H3.
 * Afterwards duplicates are demoted and depth jumps are clamped so that a heading is never more
 * than one level below the heading before it.
 */
@Slf4j
public class StructureDetector {

    private static final int MAX_DEPTH = 3;

    private final InsightProperties.Structure props;
    private final HeadingScorer scorer;

    public StructureDetector(InsightProperties.Structure props) {
        this(props, new HeadingScorer(props));
    }

    public StructureDetector(InsightProperties.Structure props, HeadingScorer scorer) {
        this.props = props;
        this.scorer = scorer;
    }

    public DocumentStructure detect(String documentId, List<TextFragment> fragments) {
        return detect(documentId, fragments, fragments == null ? null : FontStatistics.of(fragments));
    }

    /**
     * @param stats font statistics of the document, taken over its lines before any merging
     */
    public DocumentStructure detect(String documentId, List<TextFragment> fragments, FontStatistics stats) {
        if (fragments == null || fragments.isEmpty()) {
            log.debug("No fragments for {}, empty outline", documentId);
            return DocumentStructure.empty(documentId);
        }

        int n = fragments.size();
        HeadingScorer.Score[] scores = new HeadingScorer.Score[n];
        for (int i = 0; i < n; i++) {
            scores[i] = scorer.score(fragments.get(i), stats);
        }

        int titleIdx = findTitle(fragments, scores);

        // distinct candidate scores, highest first
        TreeSet<Integer> distinct = new TreeSet<>();
        for (int i = 0; i < n; i++) {
            if (i != titleIdx && scores[i].isEligible()) distinct.add(scores[i].composite());
        }
        Map<Integer, Integer> depthByScore = new HashMap<>();
        int depth = 1;
        for (Integer s : distinct.descendingSet()) {
            if (depth > MAX_DEPTH) break;
            depthByScore.put(s, depth++);
        }

        HeadingLevel[] levels = new HeadingLevel[n];
        for (int i = 0; i < n; i++) {
            if (i == titleIdx) {
                levels[i] = HeadingLevel.TITLE;
            } else if (scores[i].isEligible() && depthByScore.containsKey(scores[i].composite())) {
                levels[i] = HeadingLevel.ofDepth(depthByScore.get(scores[i].composite()));
            } else {
                levels[i] = HeadingLevel.BODY;
            }
        }

        settleLevels(fragments, levels);

        List<ClassifiedFragment> classified = new ArrayList<>(n);
        List<OutlineEntry> outline = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            TextFragment f = fragments.get(i);
            classified.add(ClassifiedFragment.builder()
                    .fragment(f)
                    .level(levels[i])
                    .score(scores[i].composite())
                    .build());
            if (levels[i].isHeading() && levels[i] != HeadingLevel.TITLE) {
                outline.add(OutlineEntry.builder()
                        .level(levels[i])
                        .text(f.getText())
                        .page(f.getPage())
                        .build());
            }
        }

        String title = titleIdx >= 0 ? fragments.get(titleIdx).getText() : fallbackTitle(documentId, fragments);
        log.debug("{}: title='{}', {} headings over {} fragments (median={}, p75={}, p90={})",
                documentId, title, outline.size(), n, stats.getMedian(), stats.getP75(), stats.getP90());

        return DocumentStructure.builder()
                .documentId(documentId)
                .title(title)
                .outline(outline)
                .fragments(classified)
                .build();
    }

    /**
     * Index of the best eligible fragment on the first page if it sits in the top region, else -1.
     */
    private int findTitle(List<TextFragment> fragments, HeadingScorer.Score[] scores) {
        int firstPage = Integer.MAX_VALUE;
        for (TextFragment f : fragments) firstPage = Math.min(firstPage, f.getPage());

        int best = -1;
        for (int i = 0; i < fragments.size(); i++) {
            if (fragments.get(i).getPage() != firstPage || !scores[i].isEligible()) continue;
            if (best < 0 || scores[i].composite() > scores[best].composite()) best = i;
        }
        if (best >= 0 && scorer.isInTopRegion(fragments.get(best))) return best;
        return -1;
    }

    private String fallbackTitle(String documentId, List<TextFragment> fragments) {
        int firstPage = fragments.get(0).getPage();
        for (TextFragment f : fragments) {
            if (f.getPage() != firstPage) break;
            int len = f.length();
            if (len >= props.getMinTitleFallbackLength() && len <= props.getMaxTitleFallbackLength()) {
                return f.getText();
            }
        }
        return documentId;
    }

    /**
     * Demotes duplicates and clamps depth jumps until neither pass changes anything; a clamp can
     * turn a heading into a duplicate of an earlier one and a demotion can open a depth gap.
     */
    void settleLevels(List<TextFragment> fragments, HeadingLevel[] levels) {
        boolean demoted;
        boolean clamped;
        do {
            demoted = demoteDuplicates(fragments, levels);
            clamped = clampDepthJumps(levels);
        } while (demoted || clamped);
    }

    /**
     * Same level and text within the page window as an earlier kept heading: keep the first.
     */
    private boolean demoteDuplicates(List<TextFragment> fragments, HeadingLevel[] levels) {
        boolean changed = false;
        Map<String, Integer> lastPage = new HashMap<>();
        for (int i = 0; i < levels.length; i++) {
            if (!levels[i].isHeading()) continue;
            TextFragment f = fragments.get(i);
            String key = levels[i] + "|" + f.getText().toLowerCase(Locale.ROOT);
            Integer prev = lastPage.get(key);
            if (prev != null && f.getPage() - prev <= props.getDuplicatePageWindow()) {
                levels[i] = HeadingLevel.BODY;
                changed = true;
                continue;
            }
            lastPage.put(key, f.getPage());
        }
        return changed;
    }

    static boolean clampDepthJumps(HeadingLevel[] levels) {
        boolean changed = false;
        int previous = HeadingLevel.TITLE.depth();
        for (int i = 0; i < levels.length; i++) {
            if (!levels[i].isHeading()) continue;
            int d = levels[i].depth();
            if (d > previous + 1) {
                d = previous + 1;
                levels[i] = HeadingLevel.ofDepth(d);
                changed = true;
            }
            previous = d;
        }
        return changed;
    }
}
