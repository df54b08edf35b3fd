package com.myorg.docinsight.service.implementation;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.metrics.InsightMetrics;
import com.myorg.docinsight.metrics.PerfProbe;
import com.myorg.docinsight.model.AnalysisMetadata;
import com.myorg.docinsight.model.AnalysisRequest;
import com.myorg.docinsight.model.AnalysisResult;
import com.myorg.docinsight.model.DocumentOutline;
import com.myorg.docinsight.model.DocumentStructure;
import com.myorg.docinsight.model.ExtractedSection;
import com.myorg.docinsight.model.PersonaProfile;
import com.myorg.docinsight.model.QueryVector;
import com.myorg.docinsight.model.RankedSection;
import com.myorg.docinsight.model.Section;
import com.myorg.docinsight.model.SourceDocument;
import com.myorg.docinsight.model.TextFragment;
import com.myorg.docinsight.service.processing.FontStatistics;
import com.myorg.docinsight.service.processing.FragmentNormalizer;
import com.myorg.docinsight.service.processing.SectionAssembler;
import com.myorg.docinsight.service.processing.StructureDetector;
import com.myorg.docinsight.service.ranking.AnswerSynthesizer;
import com.myorg.docinsight.service.ranking.Deadline;
import com.myorg.docinsight.service.ranking.IndexHolder;
import com.myorg.docinsight.service.ranking.PersonaProfileResolver;
import com.myorg.docinsight.service.ranking.PersonaVocabulary;
import com.myorg.docinsight.service.ranking.RankingResult;
import com.myorg.docinsight.service.ranking.RelevanceRanker;
import com.myorg.docinsight.service.ranking.SectionIndex;
import com.myorg.docinsight.service.text.TextTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the two phases of the engine.
 * <ol>
 *   <li>Structuring, per document and in parallel on the injected executor: normalize, detect
 *   structure, assemble sections. All documents are joined before indexing.</li>
 *   <li>Indexing, once per collection, published through {@link IndexHolder}; any number of
 *   {@link #analyze} calls may then run concurrently against the same index.</li>
 * </ol>
 * A document that fails to structure is logged and treated as empty. The soft deadline never
 * raises; it truncates the result instead.
 */
@Slf4j
public class InsightPipeline {

    private final InsightProperties props;
    private final Executor executor;
    private final TextTokenizer tokenizer;
    private final FragmentNormalizer normalizer;
    private final StructureDetector detector;
    private final SectionAssembler assembler;
    private final PersonaProfileResolver personaResolver;
    private final RelevanceRanker ranker;
    private final AnswerSynthesizer synthesizer;
    private final IndexHolder indexHolder;
    private final Clock clock;

    private final AtomicReference<InsightMetrics> lastMetrics = new AtomicReference<>(InsightMetrics.none());

    public InsightPipeline(InsightProperties props,
                           Executor executor,
                           TextTokenizer tokenizer,
                           FragmentNormalizer normalizer,
                           StructureDetector detector,
                           SectionAssembler assembler,
                           PersonaProfileResolver personaResolver,
                           RelevanceRanker ranker,
                           AnswerSynthesizer synthesizer,
                           IndexHolder indexHolder,
                           Clock clock) {
        this.props = props;
        this.executor = executor;
        this.tokenizer = tokenizer;
        this.normalizer = normalizer;
        this.detector = detector;
        this.assembler = assembler;
        this.personaResolver = personaResolver;
        this.ranker = ranker;
        this.synthesizer = synthesizer;
        this.indexHolder = indexHolder;
        this.clock = clock;
    }

    public static InsightPipeline create(InsightProperties props, Executor executor, TextTokenizer tokenizer,
                                         PersonaVocabulary vocabulary, Clock clock) {
        return new InsightPipeline(
                props,
                executor,
                tokenizer,
                new FragmentNormalizer(props.getNormalizer()),
                new StructureDetector(props.getStructure()),
                new SectionAssembler(),
                new PersonaProfileResolver(props.getPersona(), vocabulary, tokenizer),
                new RelevanceRanker(props.getRanking(), tokenizer),
                new AnswerSynthesizer(props.getSynthesis(), tokenizer),
                new IndexHolder(),
                clock);
    }

    // ===== Phase 1: structure =====

    public DocumentStructure structure(SourceDocument document) {
        List<TextFragment> lines = normalizer.lines(document.getFragments());
        List<TextFragment> merged = normalizer.mergeLines(lines);
        return detector.detect(document.getDocumentId(), merged, FontStatistics.of(lines));
    }

    /**
     * Structures every document in parallel, preserving input order in the result.
     */
    public List<DocumentStructure> structureAll(List<SourceDocument> documents) {
        return structureAll(documents, new AtomicInteger());
    }

    private List<DocumentStructure> structureAll(List<SourceDocument> documents, AtomicInteger failures) {
        List<CompletableFuture<DocumentStructure>> futures = new ArrayList<>(documents.size());
        for (SourceDocument doc : documents) {
            futures.add(submit(doc)
                    .exceptionally(ex -> {
                        failures.incrementAndGet();
                        log.warn("Structure detection failed for {}, treating it as empty: {}",
                                doc.getDocumentId(), ex.getMessage(), ex);
                        return DocumentStructure.empty(doc.getDocumentId());
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<DocumentStructure> structures = new ArrayList<>(futures.size());
        for (CompletableFuture<DocumentStructure> f : futures) structures.add(f.join());
        return structures;
    }

    private CompletableFuture<DocumentStructure> submit(SourceDocument doc) {
        try {
            return CompletableFuture.supplyAsync(() -> structure(doc), executor);
        } catch (RejectedExecutionException ex) {
            log.debug("Executor saturated, structuring {} on the calling thread", doc.getDocumentId());
            return CompletableFuture.supplyAsync(() -> structure(doc), Runnable::run);
        }
    }

    /**
     * Structure-only mode: title and outline per document, in input order.
     */
    public List<DocumentOutline> extractOutlines(List<SourceDocument> documents) {
        PerfProbe probe = new PerfProbe("outline");
        List<DocumentOutline> outlines = new ArrayList<>(documents.size());
        for (DocumentStructure s : structureAll(documents)) outlines.add(s.toOutline());
        probe.mark("Outlines extracted", outlines.size());
        probe.done("Outline run");
        return outlines;
    }

    // ===== Phase 2: index =====

    /**
     * Structures and assembles the collection, builds its index and publishes it as the current one.
     */
    public SectionIndex index(List<SourceDocument> documents) {
        PerfProbe probe = new PerfProbe("index");
        AtomicInteger failures = new AtomicInteger();
        List<DocumentStructure> structures = structureAll(documents, failures);
        probe.mark("Documents structured", structures.size());

        List<Section> sections = new ArrayList<>();
        List<String> documentIds = new ArrayList<>(structures.size());
        int headings = 0;
        for (int i = 0; i < structures.size(); i++) {
            DocumentStructure s = structures.get(i);
            documentIds.add(s.getDocumentId());
            headings += s.getOutline().size();
            sections.addAll(assembler.assemble(s, i));
        }
        probe.mark("Sections assembled", sections.size());

        SectionIndex index = indexHolder.rebuild(() -> SectionIndex.build(documentIds, sections, tokenizer));
        probe.mark("Index built", index.size());

        InsightMetrics metrics = InsightMetrics.builder()
                .documents(documents.size())
                .failedDocuments(failures.get())
                .pages(countPages(documents))
                .fragments(documents.stream().mapToInt(d -> d.getFragments().size()).sum())
                .headings(headings)
                .sections(sections.size())
                .elapsedMs(probe.done("Index run"))
                .build();
        lastMetrics.set(metrics);
        log.info("Indexed collection: {}", metrics);
        return index;
    }

    private static int countPages(List<SourceDocument> documents) {
        int pages = 0;
        for (SourceDocument d : documents) {
            Set<Integer> seen = new HashSet<>();
            for (TextFragment f : d.getFragments()) seen.add(f.getPage());
            pages += seen.size();
        }
        return pages;
    }

    // ===== Phase 3: query =====

    /**
     * Ranks against the currently published index.
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        return analyze(indexHolder.current(), request);
    }

    public AnalysisResult analyze(SectionIndex index, AnalysisRequest request) {
        return analyze(index, request, Deadline.ofMillis(props.getPipeline().getDeadlineMs(), clock));
    }

    public AnalysisResult analyze(SectionIndex index, AnalysisRequest request, Deadline deadline) {
        PerfProbe probe = new PerfProbe("analyze");
        PersonaProfile profile = personaResolver.resolve(request.getPersona());
        QueryVector query = ranker.buildQuery(request, profile);

        RankingResult ranking = ranker.rank(index, query, profile, deadline);
        probe.mark("Sections ranked", ranking.getRanked().size());

        List<RankedSection> ranked = ranking.getRanked();
        Integer limit = request.getLimit();
        if (limit != null && limit > 0 && limit < ranked.size()) {
            ranked = ranked.subList(0, limit);
        }

        AnswerSynthesizer.SynthesisResult synthesis = synthesizer.synthesize(index, query, ranked, deadline);
        probe.mark("Answers synthesized", synthesis.getAnswers().size());

        List<ExtractedSection> extracted = new ArrayList<>(ranked.size());
        for (RankedSection r : ranked) extracted.add(ExtractedSection.of(r));

        boolean truncated = ranking.isTruncated() || synthesis.isTruncated();
        if (truncated) {
            log.warn("Analysis for persona '{}' truncated by deadline", request.getPersona());
        }
        probe.done("Analysis");

        return AnalysisResult.builder()
                .metadata(AnalysisMetadata.builder()
                        .inputDocuments(index.getDocumentIds())
                        .persona(request.getPersona())
                        .jobToBeDone(request.getJobToBeDone())
                        .question(request.getQuestion())
                        .personaCategory(profile.getCategory())
                        .processingTimestamp(Instant.now(clock).toString())
                        .build())
                .extractedSections(extracted)
                .subsectionAnalysis(synthesis.getAnswers())
                .answer(synthesizer.compose(profile.getCategory(), synthesis.getAnswers(), topicOf(request)))
                .confidence(ranking.getRanked().isEmpty() ? 0.0 : ranking.getRanked().get(0).getScore())
                .truncated(truncated)
                .build();
    }

    private static String topicOf(AnalysisRequest request) {
        String question = request.getQuestion();
        return question != null && !question.isBlank() ? question : request.getJobToBeDone();
    }

    public IndexHolder getIndexHolder() {
        return indexHolder;
    }

    public InsightMetrics getLastMetrics() {
        return lastMetrics.get();
    }
}
