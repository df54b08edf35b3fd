package com.myorg.docinsight.config;

import com.myorg.docinsight.model.HeadingLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tunables for the structure and ranking engine, bound from {@code docinsight.*}.
 * Defaults here are the calibrated heuristic constants; application.yml only overrides them.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "docinsight")
public class InsightProperties {

    private Normalizer normalizer = new Normalizer();
    private Structure structure = new Structure();
    private Persona persona = new Persona();
    private Ranking ranking = new Ranking();
    private Synthesis synthesis = new Synthesis();
    private Pipeline pipeline = new Pipeline();
    private Storage storage = new Storage();

    @Getter
    @Setter
    public static class Normalizer {
        /** Share of pages a line must repeat on to count as a running header/footer. */
        private double repeatedPageRatio = 0.6;

        /** Header/footer detection needs at least this many pages. */
        private int minPagesForRepeatDetection = 3;

        /** Number of vertical bands a page is cut into when comparing header positions. */
        private int verticalBands = 20;

        /** Max vertical gap, as a fraction of page height, between two lines that get merged. */
        private double mergeGapRatio = 0.02;

        /** Used when neither the extractor nor the fragments tell us the page height (US Letter). */
        private float defaultPageHeight = 792f;
    }

    @Getter
    @Setter
    public static class Structure {
        private int minHeadingLength = 3;
        private int maxHeadingLength = 120;

        /** Fragments above this fraction of the page height get the position bonus. */
        private double topRegionRatio = 1.0 / 3.0;

        /** Same text + level within this many pages is a duplicate heading. */
        private int duplicatePageWindow = 1;

        /** Max words for a line to count as "short ALL-CAPS". */
        private int maxCapsWords = 8;

        private int minTitleFallbackLength = 15;
        private int maxTitleFallbackLength = 150;
    }

    @Getter
    @Setter
    public static class Persona {
        /** Location of the persona vocabulary table; classpath: or file: prefix. */
        private String vocabularyLocation = "classpath:persona-vocabulary.json";

        /** Categories scoring below this fall back to generic. */
        private double minCategoryScore = 0.5;

        private double wholeWordMatchScore = 1.0;
        private double substringMatchScore = 0.5;
    }

    @Getter
    @Setter
    public static class Ranking {
        private double lexicalWeight = 0.7;
        private double personaWeight = 0.3;

        /** Max boost for the first section of a document, decaying linearly to 0 at the last. */
        private double earlyPositionBonus = 0.05;

        /** Synthetic query repeats per unit of persona vocabulary weight. */
        private double personaTermRepeats = 2.0;

        private Map<HeadingLevel, Double> levelMultipliers = defaultMultipliers();

        public double multiplierFor(HeadingLevel level) {
            return levelMultipliers.getOrDefault(level, 1.0);
        }

        private static Map<HeadingLevel, Double> defaultMultipliers() {
            Map<HeadingLevel, Double> m = new EnumMap<>(HeadingLevel.class);
            m.put(HeadingLevel.TITLE, 1.0);
            m.put(HeadingLevel.H1, 1.0);
            m.put(HeadingLevel.H2, 0.9);
            m.put(HeadingLevel.H3, 0.8);
            m.put(HeadingLevel.BODY, 0.7);
            return m;
        }
    }

    @Getter
    @Setter
    public static class Synthesis {
        private int topSections = 5;
        private int sentencesPerAnswer = 3;
        private int minSentenceLength = 40;
        private int maxSentenceLength = 300;
        private double positionBonus = 1.0;
        private double lengthPenalty = 2.0;
    }

    @Getter
    @Setter
    public static class Pipeline {
        private int workerThreads = 4;

        /** Soft wall-clock budget per run in milliseconds; 0 or less disables it. */
        private long deadlineMs = 60_000;
    }

    @Getter
    @Setter
    public static class Storage {
        private String basePath = "output";
    }
}
