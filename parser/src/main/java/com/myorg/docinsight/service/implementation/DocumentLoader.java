package com.myorg.docinsight.service.implementation;

import com.myorg.docinsight.exception.DocumentProcessingException;
import com.myorg.docinsight.model.SourceDocument;
import com.myorg.docinsight.service.FragmentExtractor;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads document files into {@link SourceDocument}s. The document id is the file name.
 */
@Slf4j
public class DocumentLoader {

    private final FragmentExtractor extractor;

    public DocumentLoader(FragmentExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * @throws DocumentProcessingException when the file cannot be read as a document
     */
    public SourceDocument load(File file) {
        String documentId = file.getName();
        try {
            return SourceDocument.builder()
                    .documentId(documentId)
                    .fragments(extractor.extract(file, documentId))
                    .build();
        } catch (IOException ex) {
            throw new DocumentProcessingException(documentId, "Could not read document: " + documentId, ex);
        }
    }

    /**
     * Loads every file; an unreadable one is logged and kept as a document without fragments so
     * that the rest of the collection is still processed.
     */
    public List<SourceDocument> loadAll(List<File> files) {
        List<SourceDocument> documents = new ArrayList<>(files.size());
        for (File file : files) {
            try {
                documents.add(load(file));
            } catch (DocumentProcessingException ex) {
                log.warn("Skipping unreadable document {}: {}", ex.getDocumentId(), ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
                documents.add(SourceDocument.builder().documentId(file.getName()).fragments(List.of()).build());
            }
        }
        return documents;
    }
}
