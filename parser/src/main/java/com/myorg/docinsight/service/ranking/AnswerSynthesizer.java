package com.myorg.docinsight.service.ranking;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.PersonaCategory;
import com.myorg.docinsight.model.QueryVector;
import com.myorg.docinsight.model.RankedSection;
import com.myorg.docinsight.model.Section;
import com.myorg.docinsight.model.SubsectionAnswer;
import com.myorg.docinsight.service.text.TextTokenizer;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Extractive answers for the best ranked sections. Sentences are scored by the IDF mass of the
 * query terms they contain, plus a bonus for the first and last sentence, minus a penalty outside
 * the length window. The best few are emitted in their original order.
 */
@Slf4j
public class AnswerSynthesizer {

    private static final Map<PersonaCategory, String> ANSWER_PREFIXES = Map.of(
            PersonaCategory.STUDENT, "Key Information: ",
            PersonaCategory.RESEARCHER, "Research Findings: ",
            PersonaCategory.ANALYST, "Analysis: ",
            PersonaCategory.BUSINESS, "Business Insights: ");

    private static final int ANSWER_PARTS = 3;

    private final InsightProperties.Synthesis props;
    private final TextTokenizer tokenizer;

    public AnswerSynthesizer(InsightProperties.Synthesis props, TextTokenizer tokenizer) {
        this.props = props;
        this.tokenizer = tokenizer;
    }

    @Getter
    @ToString
    public static class SynthesisResult {
        private final List<SubsectionAnswer> answers;
        private final boolean truncated;

        public SynthesisResult(List<SubsectionAnswer> answers, boolean truncated) {
            this.answers = List.copyOf(answers);
            this.truncated = truncated;
        }
    }

    /**
     * One answer per top-K ranked section with body text, in rank order. {@code ranked} must already
     * be sorted by importance rank.
     */
    public SynthesisResult synthesize(SectionIndex index, QueryVector query, List<RankedSection> ranked, Deadline deadline) {
        List<SubsectionAnswer> answers = new ArrayList<>();
        for (RankedSection r : ranked) {
            if (answers.size() >= props.getTopSections()) break;
            if (!r.isScored() || !r.getSection().hasBody()) continue;
            if (deadline.isExpired()) {
                log.warn("Deadline reached after {} answer(s), skipping the rest", answers.size());
                return new SynthesisResult(answers, true);
            }
            String refined = refine(index, query, r.getSection());
            if (refined.isEmpty()) continue;
            answers.add(SubsectionAnswer.builder()
                    .documentId(r.getSection().getDocumentId())
                    .sectionTitle(r.getSection().getSectionTitle())
                    .refinedText(refined)
                    .page(r.getSection().getStartPage())
                    .build());
        }
        return new SynthesisResult(answers, false);
    }

    /**
     * Joins the refined text of the first answers into one reply with the persona category's
     * lead-in. Without answers the reply says nothing relevant was found for {@code topic}.
     */
    public String compose(PersonaCategory category, List<SubsectionAnswer> answers, String topic) {
        if (answers == null || answers.isEmpty()) {
            return "No relevant information was found for: " + topic;
        }
        StringJoiner reply = new StringJoiner(" ");
        answers.stream().limit(ANSWER_PARTS).forEach(a -> reply.add(a.getRefinedText()));
        return ANSWER_PREFIXES.getOrDefault(category, "") + reply;
    }

    String refine(SectionIndex index, QueryVector query, Section section) {
        List<String> sentences = tokenizer.sentences(section.getBodyText());
        if (sentences.isEmpty()) return "";

        List<Integer> order = new ArrayList<>(sentences.size());
        double[] scores = new double[sentences.size()];
        for (int i = 0; i < sentences.size(); i++) {
            scores[i] = sentenceScore(index, query, sentences.get(i), i, sentences.size());
            order.add(i);
        }
        // best first, earlier sentence on ties
        order.sort(Comparator.<Integer>comparingDouble(i -> -scores[i]).thenComparingInt(i -> i));

        List<Integer> picked = new ArrayList<>(order.subList(0, Math.min(props.getSentencesPerAnswer(), order.size())));
        picked.sort(Comparator.naturalOrder());

        StringBuilder sb = new StringBuilder();
        for (int i : picked) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(sentences.get(i));
        }
        return sb.toString();
    }

    double sentenceScore(SectionIndex index, QueryVector query, String sentence, int position, int count) {
        Set<String> terms = new LinkedHashSet<>(tokenizer.terms(sentence));
        double score = 0;
        for (String term : terms) {
            if (query.contains(term)) score += index.idf(term);
        }
        if (position == 0 || position == count - 1) score += props.getPositionBonus();
        int len = sentence.length();
        if (len < props.getMinSentenceLength() || len > props.getMaxSentenceLength()) score -= props.getLengthPenalty();
        return score;
    }
}
