package com.myorg.docinsight.controller;

import com.myorg.docinsight.config.InsightProperties;
import com.myorg.docinsight.exception.ValidationException;
import com.myorg.docinsight.metrics.InsightMetrics;
import com.myorg.docinsight.model.AnalysisRequest;
import com.myorg.docinsight.model.AnalysisResult;
import com.myorg.docinsight.model.DocumentOutline;
import com.myorg.docinsight.model.SourceDocument;
import com.myorg.docinsight.service.implementation.DocumentLoader;
import com.myorg.docinsight.service.implementation.InsightPipeline;
import com.myorg.docinsight.service.ranking.SectionIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/documents")
public class DocumentInsightController {

    private static final Logger PerfLogger = LoggerFactory.getLogger("performance");

    private final InsightProperties properties;
    private final InsightPipeline pipeline;
    private final DocumentLoader loader;

    /**
     * Structure-only mode for one PDF. An unreadable PDF is a 422.
     */
    @PostMapping("/outline")
    public ResponseEntity<DocumentOutline> outline(@RequestParam("file") MultipartFile file) throws IOException {
        Path uploadDir = newUploadDir();
        try {
            File saved = saveUpload(file, uploadDir);
            long t0 = System.nanoTime();
            SourceDocument document = loader.load(saved);
            DocumentOutline outline = pipeline.extractOutlines(List.of(document)).get(0);
            PerfLogger.info("Outline for {}: {} heading(s) in {} ms",
                    document.getDocumentId(), outline.getOutline().size(), msSince(t0));
            return ResponseEntity.ok(outline);
        } finally {
            deleteUploadDir(uploadDir);
        }
    }

    /**
     * Builds and publishes the section index for a collection; later /analyze calls without files
     * reuse it.
     */
    @PostMapping("/index")
    public ResponseEntity<InsightMetrics> index(@RequestParam("files") List<MultipartFile> files) throws IOException {
        Path uploadDir = newUploadDir();
        try {
            pipeline.index(loader.loadAll(saveUploads(files, uploadDir)));
            return ResponseEntity.ok(pipeline.getLastMetrics());
        } finally {
            deleteUploadDir(uploadDir);
        }
    }

    /**
     * Ranks the uploaded collection, or the last published index when no files are sent.
     */
    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResult> analyze(@RequestParam(value = "files", required = false) List<MultipartFile> files,
                                                  @RequestParam("persona") String persona,
                                                  @RequestParam("job") String job,
                                                  @RequestParam(value = "question", required = false) String question,
                                                  @RequestParam(value = "limit", required = false) Integer limit) throws IOException {
        if (persona.isBlank()) throw new ValidationException("Persona must not be blank.");
        if (job.isBlank()) throw new ValidationException("Job to be done must not be blank.");
        if (limit != null && limit < 1) throw new ValidationException("Limit must be at least 1.");

        long t0 = System.nanoTime();
        AnalysisRequest request = AnalysisRequest.builder()
                .persona(persona)
                .jobToBeDone(job)
                .question(question)
                .limit(limit)
                .build();

        AnalysisResult result;
        if (files != null && !files.isEmpty()) {
            Path uploadDir = newUploadDir();
            try {
                // rank the index built here, not whatever another request published meanwhile
                SectionIndex index = pipeline.index(loader.loadAll(saveUploads(files, uploadDir)));
                result = pipeline.analyze(index, request);
            } finally {
                deleteUploadDir(uploadDir);
            }
        } else {
            result = pipeline.analyze(request);
        }
        PerfLogger.info("Analysis for '{}': {} section(s), {} answer(s), truncated={} in {} ms",
                persona, result.getExtractedSections().size(), result.getSubsectionAnalysis().size(),
                result.isTruncated(), msSince(t0));
        return ResponseEntity.ok(result);
    }

    @GetMapping("/metrics")
    public ResponseEntity<InsightMetrics> metrics() {
        return ResponseEntity.ok(pipeline.getLastMetrics());
    }

    // ===== Helpers =====

    private Path newUploadDir() throws IOException {
        Path base = Path.of(properties.getStorage().getBasePath()).toAbsolutePath().normalize();
        Files.createDirectories(base);
        return Files.createTempDirectory(base, "upload-");
    }

    private void deleteUploadDir(Path dir) {
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException ex) {
            log.warn("Could not delete upload directory {}: {}", dir, ex.getMessage());
        }
    }

    private List<File> saveUploads(List<MultipartFile> files, Path uploadDir) throws IOException {
        if (files == null || files.isEmpty()) {
            throw new ValidationException("Please upload at least one PDF file.");
        }
        List<File> saved = new ArrayList<>(files.size());
        for (MultipartFile f : files) saved.add(saveUpload(f, uploadDir));
        return saved;
    }

    private File saveUpload(MultipartFile file, Path uploadDir) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new ValidationException("Please upload a non-empty PDF file.");
        }
        final String originalName = file.getOriginalFilename();
        if (originalName == null || originalName.isBlank()) {
            throw new ValidationException("Uploaded file has no filename.");
        }
        final String lower = originalName.toLowerCase(Locale.ROOT);
        final String contentType = file.getContentType() == null ? "" : file.getContentType().toLowerCase(Locale.ROOT);
        if (!(lower.endsWith(".pdf") || contentType.contains("pdf"))) {
            throw new ValidationException("Only PDF files are accepted: " + originalName);
        }

        Path target = uploadDir.resolve(Path.of(originalName).getFileName().toString());
        Files.copy(file.getInputStream(), target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Upload saved: {}", target);
        return target.toFile();
    }

    private static long msSince(long nano) {
        return Duration.ofNanos(System.nanoTime() - nano).toMillis();
    }
}
