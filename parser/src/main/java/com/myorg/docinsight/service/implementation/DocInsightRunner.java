package com.myorg.docinsight.service.implementation;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.model.AnalysisRequest;
import com.myorg.docinsight.model.AnalysisResult;
import com.myorg.docinsight.model.DocumentOutline;
import com.myorg.docinsight.model.Section;
import com.myorg.docinsight.model.SourceDocument;
import com.myorg.docinsight.service.ranking.PersonaVocabulary;
import com.myorg.docinsight.service.ranking.PersonaVocabularyLoader;
import com.myorg.docinsight.service.ranking.SectionIndex;
import com.myorg.docinsight.service.text.SimpleTextTokenizer;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Standalone batch runner over a directory of PDFs.
 *
 * Usage: run main with args: <input-dir> [output-dir]
 *
 * - Writes one <name>.json outline per PDF and sections.jsonl for the whole collection.
 * - If <input-dir>/config.json exists (persona, job_to_be_done, optional question and limit),
 *   also writes analysis.json.
 */
@Slf4j
public class DocInsightRunner {

    static final String CONFIG_FILE = "config.json";

    private final InsightPipeline pipeline;
    private final DocumentLoader loader;
    private final ObjectMapper mapper;

    public DocInsightRunner(InsightPipeline pipeline, DocumentLoader loader, ObjectMapper mapper) {
        this.pipeline = pipeline;
        this.loader = loader;
        this.mapper = mapper;
    }

    /**
     * @throws IOException when the input directory is missing or an output file cannot be written
     */
    public void run(Path inputDir, Path outputDir) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new FileNotFoundException("Input directory not found: " + inputDir.toAbsolutePath());
        }
        Files.createDirectories(outputDir);

        List<File> pdfs = listPdfs(inputDir);
        log.info("Processing {} PDF(s) from {}", pdfs.size(), inputDir.toAbsolutePath());
        List<SourceDocument> documents = loader.loadAll(pdfs);

        // 1) Outlines
        List<DocumentOutline> outlines = pipeline.extractOutlines(documents);
        for (int i = 0; i < documents.size(); i++) {
            Path out = outputDir.resolve(stem(documents.get(i).getDocumentId()) + ".json");
            mapper.writeValue(out.toFile(), outlines.get(i));
        }

        // 2) Sections of the whole collection
        SectionIndex index = pipeline.index(documents);
        new JacksonJsonlWriter<Section>().write(outputDir.resolve("sections.jsonl").toFile(), index.getSections());

        // 3) Persona analysis, when configured
        Path config = inputDir.resolve(CONFIG_FILE);
        if (Files.isRegularFile(config)) {
            RunConfig rc = mapper.readValue(config.toFile(), RunConfig.class);
            AnalysisResult result = pipeline.analyze(index, AnalysisRequest.builder()
                    .persona(rc.getPersona())
                    .jobToBeDone(rc.getJobToBeDone())
                    .question(rc.getQuestion())
                    .limit(rc.getLimit())
                    .build());
            mapper.writeValue(outputDir.resolve("analysis.json").toFile(), result);
            log.info("Analysis written: {} ranked sections, {} answers, truncated={}",
                    result.getExtractedSections().size(), result.getSubsectionAnalysis().size(), result.isTruncated());
        } else {
            log.info("No {} in {}, skipping persona analysis", CONFIG_FILE, inputDir);
        }

        log.info("Completed: {} -> {}", pipeline.getLastMetrics(), outputDir.toAbsolutePath());
    }

    static List<File> listPdfs(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf"))
                    .sorted()
                    .map(Path::toFile)
                    .collect(Collectors.toCollection(ArrayList::new));
        }
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Getter
    @Setter
    static class RunConfig {
        @JsonProperty("persona")
        private String persona;

        @JsonProperty("job_to_be_done")
        private String jobToBeDone;

        @JsonProperty("question")
        private String question;

        @JsonProperty("limit")
        private Integer limit;
    }

    /* ----------------- main for batch runs ----------------- */
    public static void main(String[] args) throws IOException {
        if (args.length < 1) {
            log.error("Usage: DocInsightRunner <input-dir> [output-dir]");
            System.exit(2);
        }
        Path input = Path.of(args[0]);
        Path output = (args.length >= 2) ? Path.of(args[1]) : Path.of("output");

        InsightProperties props = new InsightProperties();
        ObjectMapper mapper = defaultMapper();
        PersonaVocabulary vocabulary = new PersonaVocabularyLoader(mapper).load(props.getPersona().getVocabularyLocation());
        ExecutorService executor = Executors.newFixedThreadPool(props.getPipeline().getWorkerThreads());
        try {
            InsightPipeline pipeline = InsightPipeline.create(props, executor, new SimpleTextTokenizer(), vocabulary, Clock.systemUTC());
            new DocInsightRunner(pipeline, new DocumentLoader(new PdfBoxFragmentExtractor()), mapper).run(input, output);
        } finally {
            executor.shutdown();
        }
    }
}
