package com.myorg.docinsight.exception;

import lombok.Getter;

/**
 * A document could not be turned into text fragments.
 */
@Getter
public class DocumentProcessingException extends RuntimeException {

    private final String documentId;

    public DocumentProcessingException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }
}
