package com.myorg.docinsight.service.ranking;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.AnalysisRequest;
import com.myorg.docinsight.model.PersonaProfile;
import com.myorg.docinsight.model.QueryVector;
import com.myorg.docinsight.model.RankedSection;
import com.myorg.docinsight.model.Section;
import com.myorg.docinsight.service.text.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Scores every section of a {@link SectionIndex} against a persona + job query.
 * <pre>
 *   score = (lexicalWeight * cosine + personaWeight * personaAlignment)
 *           * levelMultiplier * (1 + earlyPositionBonus * (1 - positionFraction))
 * </pre>
 * clamped to [0, 1]. Sections without body text score 0. Ranks are a gap-free 1..N over a stable
 * order: score descending, then document order, start page and section order.
 * <p>
 * Holds no per-query state, so one instance serves concurrent queries.
 */
@Slf4j
public class RelevanceRanker {

    static final Comparator<RankedSection> RANK_ORDER = Comparator
            .comparingDouble(RankedSection::getScore).reversed()
            // an empty section sorts below every section with text at the same score
            .thenComparing(r -> !r.getSection().hasBody())
            .thenComparingInt(r -> r.getSection().getDocumentOrdinal())
            .thenComparingInt(r -> r.getSection().getStartPage())
            .thenComparingInt(r -> r.getSection().getSectionOrdinal());

    private final InsightProperties.Ranking props;
    private final TextTokenizer tokenizer;

    public RelevanceRanker(InsightProperties.Ranking props, TextTokenizer tokenizer) {
        this.props = props;
        this.tokenizer = tokenizer;
    }

    /**
     * Job text and question count once per occurrence; each persona term adds
     * {@code weight * personaTermRepeats} synthetic occurrences.
     */
    public QueryVector buildQuery(AnalysisRequest request, PersonaProfile profile) {
        Map<String, Double> tf = new TreeMap<>();
        for (String term : tokenizer.terms(request.getJobToBeDone())) tf.merge(term, 1.0, Double::sum);
        for (String term : tokenizer.terms(request.getQuestion())) tf.merge(term, 1.0, Double::sum);
        profile.getWeightedVocabulary().forEach((term, weight) ->
                tf.merge(term, weight * props.getPersonaTermRepeats(), Double::sum));
        return new QueryVector(tf);
    }

    public RankingResult rank(SectionIndex index, QueryVector query, PersonaProfile profile, Deadline deadline) {
        if (index.isEmpty()) return RankingResult.empty();

        Map<String, Double> weightedQuery = new TreeMap<>();
        double queryNormSq = 0;
        for (Map.Entry<String, Double> e : query.getTermFrequencies().entrySet()) {
            double w = e.getValue() * index.idf(e.getKey());
            weightedQuery.put(e.getKey(), w);
            queryNormSq += w * w;
        }
        double queryNorm = Math.sqrt(queryNormSq);

        List<RankedSection> scored = new ArrayList<>(index.size());
        boolean truncated = false;
        for (int i = 0; i < index.size(); i++) {
            Section section = index.section(i);
            if (!truncated && deadline.isExpired()) {
                truncated = true;
                log.warn("Deadline reached after scoring {} of {} sections", i, index.size());
            }
            if (truncated) {
                scored.add(RankedSection.builder().section(section).score(0.0).scored(false).build());
                continue;
            }
            scored.add(RankedSection.builder()
                    .section(section)
                    .score(score(index, i, weightedQuery, queryNorm, profile))
                    .scored(true)
                    .build());
        }

        scored.sort(RANK_ORDER);
        List<RankedSection> ranked = new ArrayList<>(scored.size());
        for (int i = 0; i < scored.size(); i++) {
            ranked.add(scored.get(i).toBuilder().importanceRank(i + 1).build());
        }
        return new RankingResult(ranked, truncated);
    }

    double score(SectionIndex index, int i, Map<String, Double> weightedQuery, double queryNorm, PersonaProfile profile) {
        Section section = index.section(i);
        if (!section.hasBody()) return 0.0;

        double cosine = cosine(index.vector(i), index.norm(i), weightedQuery, queryNorm);
        double alignment = personaAlignment(index.distinctTerms(i), profile);

        double raw = props.getLexicalWeight() * cosine + props.getPersonaWeight() * alignment;
        double prior = props.multiplierFor(section.getHeadingLevel())
                * (1.0 + props.getEarlyPositionBonus() * (1.0 - index.positionFraction(i)));
        return clamp(raw * prior);
    }

    private static double cosine(Map<String, Double> vector, double norm, Map<String, Double> query, double queryNorm) {
        if (norm == 0 || queryNorm == 0) return 0.0;
        double dot = 0;
        for (Map.Entry<String, Double> e : query.entrySet()) {
            Double w = vector.get(e.getKey());
            if (w != null) dot += w * e.getValue();
        }
        return dot / (norm * queryNorm);
    }

    /**
     * Weight-summed share of the section's distinct terms that are persona vocabulary.
     */
    static double personaAlignment(Set<String> distinctTerms, PersonaProfile profile) {
        if (distinctTerms.isEmpty()) return 0.0;
        double sum = 0;
        for (String term : distinctTerms) sum += profile.weightOf(term);
        return sum / distinctTerms.size();
    }

    private static double clamp(double v) {
        if (Double.isNaN(v) || v < 0) return 0.0;
        return Math.min(1.0, v);
    }
}
