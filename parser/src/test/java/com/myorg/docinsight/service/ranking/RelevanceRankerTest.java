package com.myorg.docinsight.service.ranking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.AnalysisRequest;
import com.myorg.docinsight.model.PersonaProfile;
import com.myorg.docinsight.model.QueryVector;
import com.myorg.docinsight.model.RankedSection;
import com.myorg.docinsight.model.Section;
import com.myorg.docinsight.service.text.SimpleTextTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.myorg.docinsight.Sections.section;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("RelevanceRanker Tests")
class RelevanceRankerTest {

    private final SimpleTextTokenizer tokenizer = new SimpleTextTokenizer();
    private InsightProperties.Ranking props;
    private RelevanceRanker ranker;
    private PersonaProfile analyst;

    @BeforeEach
    void setUp() throws IOException {
        props = new InsightProperties.Ranking();
        ranker = new RelevanceRanker(props, tokenizer);
        PersonaVocabulary vocabulary = new PersonaVocabularyLoader(new ObjectMapper()).load("classpath:persona-vocabulary.json");
        analyst = new PersonaProfileResolver(new InsightProperties.Persona(), vocabulary, tokenizer).resolve("Investment Analyst");
    }

    private QueryVector query(String job) {
        return ranker.buildQuery(AnalysisRequest.builder().persona("Investment Analyst").jobToBeDone(job).build(), analyst);
    }

    private static List<Section> mixedCorpus() {
        List<Section> sections = new ArrayList<>();
        String[] bodies = {
                "Revenue growth accelerated in every region.",
                "The recipe needs flour, sugar and butter.",
                "Market trends point to a stronger second half.",
                "Our hiking guide covers three mountain trails.",
                "Profit margins narrowed because of input costs.",
                "Cash flow from operations remained positive."};
        for (int d = 0; d < 2; d++) {
            for (int s = 0; s < bodies.length; s++) {
                sections.add(section("doc" + d + ".pdf", d, s, "Part " + s, bodies[(s + d) % bodies.length], s + 1));
            }
        }
        return sections;
    }

    private static List<String> describe(List<RankedSection> ranked) {
        return ranked.stream()
                .map(r -> r.getSection().getDocumentId() + "#" + r.getSection().getSectionOrdinal()
                        + "|" + r.getScore() + "|" + r.getImportanceRank())
                .collect(Collectors.toList());
    }

    @Test
    @DisplayName("should combine job, question and persona terms in the query")
    void shouldBuildQueryFromAllInputs() {
        QueryVector q = ranker.buildQuery(AnalysisRequest.builder()
                .jobToBeDone("analyze revenue trends")
                .question("which revenue grew")
                .build(), analyst);

        assertThat(q.getTermFrequencies().get("analyze")).isEqualTo(1.0);
        // 2 occurrences from the text plus 1.0 * 2 synthetic repeats from the persona
        assertThat(q.getTermFrequencies().get("revenue")).isEqualTo(4.0);
        assertThat(q.contains("margin")).isTrue();
    }

    @Test
    @DisplayName("should rank the financial section first for an investment analyst")
    void shouldRankFinancialSectionFirst() {
        SectionIndex index = SectionIndex.build(List.of(
                section("cookbook.pdf", 0, 0, "Cooking Recipes",
                        "Mix flour, sugar and eggs, then bake the cake for thirty minutes.", 1),
                section("report.pdf", 1, 0, "Financial Growth Metrics",
                        "Revenue growth and financial metrics improved this quarter, with strong trends in profit margins.", 1)),
                tokenizer);

        RankingResult result = ranker.rank(index, query("analyze revenue trends"), analyst, Deadline.none());

        assertThat(result.isTruncated()).isFalse();
        RankedSection top = result.getRanked().get(0);
        assertThat(top.getSection().getDocumentId()).isEqualTo("report.pdf");
        assertThat(top.getImportanceRank()).isEqualTo(1);
        assertThat(top.getScore()).isGreaterThan(result.getRanked().get(1).getScore());
    }

    @Test
    @DisplayName("should assign ranks 1..N with scores in [0,1]")
    void shouldProducePermutationWithinBounds() {
        SectionIndex index = SectionIndex.build(mixedCorpus(), tokenizer);

        List<RankedSection> ranked = ranker.rank(index, query("analyze revenue trends"), analyst, Deadline.none()).getRanked();

        assertThat(ranked).hasSize(12);
        assertThat(ranked).extracting(RankedSection::getImportanceRank)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 12).boxed().collect(Collectors.toList()));
        assertThat(ranked).allSatisfy(r -> assertThat(r.getScore()).isBetween(0.0, 1.0));
        for (int i = 1; i < ranked.size(); i++) {
            assertThat(ranked.get(i).getScore()).isLessThanOrEqualTo(ranked.get(i - 1).getScore());
        }
    }

    @Test
    @DisplayName("should clamp scores to 1 when weights overshoot")
    void shouldClampScores() {
        props.setLexicalWeight(10.0);
        props.setPersonaWeight(10.0);
        SectionIndex index = SectionIndex.build(mixedCorpus(), tokenizer);

        List<RankedSection> ranked = ranker.rank(index, query("revenue growth"), analyst, Deadline.none()).getRanked();

        assertThat(ranked).allSatisfy(r -> assertThat(r.getScore()).isBetween(0.0, 1.0));
        assertThat(ranked.get(0).getScore()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep a section with empty body at the bottom without failing")
    void shouldRankEmptyBodyLast() {
        SectionIndex index = SectionIndex.build(List.of(
                section("a.pdf", 0, 0, "Revenue Outlook", "", 1),
                section("a.pdf", 0, 1, "Sales", "Revenue rose on higher volumes.", 2),
                section("a.pdf", 0, 2, "Markets", "Market growth slowed in the autumn.", 3)), tokenizer);

        List<RankedSection> ranked = ranker.rank(index, query("analyze revenue trends"), analyst, Deadline.none()).getRanked();

        RankedSection last = ranked.get(ranked.size() - 1);
        assertThat(last.getSection().getSectionTitle()).isEqualTo("Revenue Outlook");
        assertThat(last.getScore()).isZero();
        assertThat(last.getImportanceRank()).isEqualTo(3);
        assertThat(ranked.subList(0, 2)).allSatisfy(r -> assertThat(r.getScore()).isPositive());
    }

    @Test
    @DisplayName("should place an empty section below unrelated sections with text at the same score")
    void shouldRankEmptyBelowZeroScoredText_whenScoresTie() {
        SectionIndex index = SectionIndex.build(List.of(
                section("a.pdf", 0, 0, "Cover", "", 1),
                section("b.pdf", 1, 0, "Trails", "Our hiking guide covers three mountain trails.", 1)), tokenizer);

        List<RankedSection> ranked = ranker.rank(index, query("analyze revenue trends"), analyst, Deadline.none()).getRanked();

        assertThat(ranked).extracting(RankedSection::getScore).containsOnly(0.0);
        assertThat(ranked).extracting(r -> r.getSection().getSectionTitle()).containsExactly("Trails", "Cover");
    }

    @Test
    @DisplayName("should break score ties by document order")
    void shouldBreakTiesByDocumentOrder() {
        String body = "Revenue growth accelerated in every region.";
        SectionIndex index = SectionIndex.build(List.of(
                section("second.pdf", 1, 0, "Same", body, 1),
                section("first.pdf", 0, 0, "Same", body, 1)), tokenizer);

        List<RankedSection> ranked = ranker.rank(index, query("revenue"), analyst, Deadline.none()).getRanked();

        assertThat(ranked.get(0).getScore()).isEqualTo(ranked.get(1).getScore());
        assertThat(ranked).extracting(r -> r.getSection().getDocumentId()).containsExactly("first.pdf", "second.pdf");
    }

    @Test
    @DisplayName("should favour earlier sections of the same document")
    void shouldApplyEarlyPositionBonus() {
        String body = "Revenue growth accelerated in every region.";
        SectionIndex index = SectionIndex.build(List.of(
                section("a.pdf", 0, 0, "Same", body, 1),
                section("a.pdf", 0, 1, "Same", body, 2)), tokenizer);

        List<RankedSection> ranked = ranker.rank(index, query("revenue"), analyst, Deadline.none()).getRanked();

        assertThat(ranked.get(0).getSection().getSectionOrdinal()).isZero();
        assertThat(ranked.get(0).getScore()).isCloseTo(ranked.get(1).getScore() * 1.05, within(1e-9));
    }

    @Test
    @DisplayName("should return the same ranking when run twice on one index")
    void shouldBeIdempotent() {
        SectionIndex index = SectionIndex.build(mixedCorpus(), tokenizer);
        QueryVector q = query("analyze revenue trends");

        List<RankedSection> first = ranker.rank(index, q, analyst, Deadline.none()).getRanked();
        List<RankedSection> second = ranker.rank(index, q, analyst, Deadline.none()).getRanked();

        assertThat(describe(second)).isEqualTo(describe(first));
    }

    @Test
    @DisplayName("should return an empty ranking for an empty corpus")
    void shouldReturnEmpty_whenCorpusEmpty() {
        RankingResult result = ranker.rank(SectionIndex.empty(), query("anything"), analyst, Deadline.none());

        assertThat(result.getRanked()).isEmpty();
        assertThat(result.isTruncated()).isFalse();
    }

    @Test
    @DisplayName("should list every section unscored when the deadline has already passed")
    void shouldMarkUnscored_whenDeadlineExpired() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        SectionIndex index = SectionIndex.build(mixedCorpus(), tokenizer);

        RankingResult result = ranker.rank(index, query("revenue"), analyst, Deadline.after(Duration.ZERO, clock));

        assertThat(result.isTruncated()).isTrue();
        assertThat(result.getRanked()).hasSize(12);
        assertThat(result.getRanked()).allSatisfy(r -> {
            assertThat(r.isScored()).isFalse();
            assertThat(r.getScore()).isZero();
        });
        assertThat(result.getRanked()).extracting(RankedSection::getImportanceRank)
                .containsExactlyElementsOf(IntStream.rangeClosed(1, 12).boxed().collect(Collectors.toList()));
    }
}
