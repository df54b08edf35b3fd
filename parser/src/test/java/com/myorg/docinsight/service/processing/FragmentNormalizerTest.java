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

@DisplayName("FragmentNormalizer Tests")
class FragmentNormalizerTest {

    private FragmentNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new FragmentNormalizer(new InsightProperties.Normalizer());
    }

    @Test
    @DisplayName("should return empty list for empty or null input")
    void shouldReturnEmpty_whenInputEmpty() {
        assertThat(normalizer.normalize(List.of())).isEmpty();
        assertThat(normalizer.normalize(null)).isEmpty();
    }

    @Test
    @DisplayName("should trim, collapse whitespace and drop blank fragments")
    void shouldTrimAndDropBlank() {
        List<TextFragment> out = normalizer.normalize(List.of(
                body("d", "  hello \t  world ", 100, 1),
                body("d", "   ", 300, 1),
                body("d", " ", 500, 1)));

        assertThat(out).extracting(TextFragment::getText).containsExactly("hello world");
    }

    @Test
    @DisplayName("should sanitize malformed numeric values instead of failing")
    void shouldSanitizeMalformedValues() {
        TextFragment broken = TextFragment.builder()
                .documentId("d")
                .text("Broken fragment")
                .fontSize(Float.NaN)
                .top(Float.POSITIVE_INFINITY)
                .page(0)
                .build();

        List<TextFragment> out = normalizer.normalize(List.of(broken));

        assertThat(out).hasSize(1);
        TextFragment f = out.get(0);
        assertThat(f.getFontSize()).isZero();
        assertThat(f.getPage()).isEqualTo(1);
        assertThat(f.getPageHeight()).isEqualTo(792f);
        assertThat(f.getTop()).isEqualTo(792f);
    }

    @Test
    @DisplayName("should drop running headers repeated on most pages at the same height")
    void shouldDropRunningHeaders_whenRepeatedOnMostPages() {
        List<TextFragment> raw = new ArrayList<>();
        for (int page = 1; page <= 3; page++) {
            raw.add(body("d", "ACME Corp Confidential", 20, page));
            raw.add(body("d", "Distinct body text for page " + page, 400, page));
        }

        List<TextFragment> out = normalizer.normalize(raw);

        assertThat(out).extracting(TextFragment::getText)
                .containsExactly("Distinct body text for page 1",
                        "Distinct body text for page 2",
                        "Distinct body text for page 3");
    }

    @Test
    @DisplayName("should keep a line that repeats on too few pages")
    void shouldKeepLine_whenRepeatedOnFewPages() {
        List<TextFragment> raw = new ArrayList<>();
        raw.add(body("d", "Only once at the top", 20, 1));
        for (int page = 1; page <= 4; page++) {
            raw.add(body("d", "Body text " + page, 400, page));
        }

        assertThat(normalizer.normalize(raw)).extracting(TextFragment::getText)
                .contains("Only once at the top");
    }

    @Test
    @DisplayName("should not detect running headers in short documents")
    void shouldKeepRepeats_whenDocumentTooShort() {
        List<TextFragment> raw = List.of(
                body("d", "Header", 20, 1),
                body("d", "First page text", 400, 1),
                body("d", "Header", 20, 2),
                body("d", "Second page text", 400, 2));

        assertThat(normalizer.normalize(raw)).extracting(TextFragment::getText)
                .containsExactly("Header", "First page text", "Header", "Second page text");
    }

    @Test
    @DisplayName("should keep body lines of a paragraph apart")
    void shouldKeepBodyLinesApart_whenParagraphWraps() {
        List<TextFragment> out = normalizer.normalize(List.of(
                body("d", "first line of a paragraph", 100, 1),
                body("d", "continues here", 112, 1),
                body("d", "and ends here.", 124, 1)));

        assertThat(out).extracting(TextFragment::getText)
                .containsExactly("first line of a paragraph", "continues here", "and ends here.");
    }

    @Test
    @DisplayName("should join runs that share a baseline")
    void shouldMergeRuns_whenOnSameBaseline() {
        List<TextFragment> out = normalizer.normalize(List.of(
                body("d", "revenue rose", 100, 1),
                body("d", "in every region", 101, 1),
                body("d", "next line", 112, 1)));

        assertThat(out).extracting(TextFragment::getText)
                .containsExactly("revenue rose in every region", "next line");
    }

    @Test
    @DisplayName("should join the wrapped lines of a bold or large heading")
    void shouldMergeWrappedHeading_whenHeadingStyle() {
        List<TextFragment> out = normalizer.normalize(List.of(
                line("d", "Results of the Annual", 18f, false, 80, 1),
                line("d", "Customer Survey", 18f, false, 102, 1),
                line("d", "Regional Sales and", 10f, true, 200, 1),
                line("d", "Distribution", 10f, true, 212, 1),
                body("d", "body one", 230, 1),
                body("d", "body two", 242, 1),
                body("d", "body three", 254, 1)));

        assertThat(out).extracting(TextFragment::getText)
                .containsExactly("Results of the Annual Customer Survey", "Regional Sales and Distribution",
                        "body one", "body two", "body three");
        assertThat(out.get(0).getTop()).isEqualTo(80f);
    }

    @Test
    @DisplayName("should not glue a heading to the next line once it ends a sentence")
    void shouldNotMergeHeading_whenTextEndsSentence() {
        List<TextFragment> out = normalizer.normalize(List.of(
                line("d", "Summary:", 10f, true, 100, 1),
                line("d", "Totals rose", 10f, true, 112, 1),
                body("d", "body", 300, 1)));

        assertThat(out).extracting(TextFragment::getText).containsExactly("Summary:", "Totals rose", "body");
    }

    @Test
    @DisplayName("should expose cleaned lines before merging")
    void shouldReturnUnmergedLines() {
        List<TextFragment> raw = List.of(
                line("d", "Wrapped Bold", 10f, true, 100, 1),
                line("d", "Heading", 10f, true, 112, 1));

        assertThat(normalizer.lines(raw)).extracting(TextFragment::getText).containsExactly("Wrapped Bold", "Heading");
        assertThat(normalizer.normalize(raw)).extracting(TextFragment::getText).containsExactly("Wrapped Bold Heading");
    }

    @Test
    @DisplayName("should not merge a numbered line into the previous one")
    void shouldNotMerge_whenNextLineIsNumbered() {
        List<TextFragment> out = normalizer.normalize(List.of(
                body("d", "closing words of the section", 100, 1),
                body("d", "2. Methods", 110, 1)));

        assertThat(out).extracting(TextFragment::getText)
                .containsExactly("closing words of the section", "2. Methods");
    }

    @Test
    @DisplayName("should not merge lines across pages")
    void shouldNotMerge_acrossPages() {
        List<TextFragment> out = normalizer.normalize(List.of(
                body("d", "end of page one", 780, 1),
                body("d", "start of page two", 785, 2)));

        assertThat(out).hasSize(2);
    }
}
