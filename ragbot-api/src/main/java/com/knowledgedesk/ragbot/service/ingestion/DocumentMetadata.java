package com.knowledgedesk.ragbot.service.ingestion;

import java.time.OffsetDateTime;
import java.util.Map;

public record DocumentMetadata(
        String title,
        String author,
        OffsetDateTime createdAt,
        String contentType,
        String source
) {

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, null, null, null, null);
    }

    public DocumentMetadata withTitle(String value) {
        return new DocumentMetadata(normalise(value), author, createdAt, contentType, source);
    }

    public DocumentMetadata withAuthor(String value) {
        return new DocumentMetadata(title, normalise(value), createdAt, contentType, source);
    }

    public DocumentMetadata withCreatedAt(OffsetDateTime value) {
        return new DocumentMetadata(title, author, value, contentType, source);
    }

    public DocumentMetadata withContentType(String value) {
        return new DocumentMetadata(title, author, createdAt, normalise(value), source);
    }

    public DocumentMetadata withSource(String value) {
        return new DocumentMetadata(title, author, createdAt, contentType, normalise(value));
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    /** Payload fields stored next to every chunk of the document. */
    public Map<String, String> asChunkMetadata() {
        Map<String, String> fields = new java.util.LinkedHashMap<>();
        if (author != null && !author.isBlank()) {
            fields.put("author", author);
        }
        if (contentType != null && !contentType.isBlank()) {
            fields.put("content_type", contentType);
        }
        if (createdAt != null) {
            fields.put("created_at", createdAt.toString());
        }
        return fields;
    }

    private static String normalise(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
