package com.knowledgedesk.ragbot.service.ingestion;

import org.springframework.http.HttpStatus;

/**
 * A document request that cannot be served as asked: a malformed upload, an oversized file or an
 * unknown document id. Carries the HTTP status the admin API answers with.
 */
public class IngestionException extends RuntimeException {

    private final HttpStatus status;
    private final String documentId;

    private IngestionException(HttpStatus status, String documentId, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.documentId = documentId;
    }

    public static IngestionException invalidRequest(String message) {
        return new IngestionException(HttpStatus.BAD_REQUEST, null, message, null);
    }

    public static IngestionException documentNotFound(String documentId) {
        return new IngestionException(HttpStatus.NOT_FOUND, documentId, "Unknown document " + documentId, null);
    }

    public static IngestionException uploadTooLarge(String filename, long limitBytes, Throwable cause) {
        String name = filename == null || filename.isBlank() ? "Upload" : filename;
        return new IngestionException(HttpStatus.PAYLOAD_TOO_LARGE, null,
                name + " exceeds the upload limit of " + limitBytes + " bytes", cause);
    }

    public HttpStatus status() {
        return status;
    }

    /**
     * The document the request named, when it named one.
     */
    public String documentId() {
        return documentId;
    }
}
