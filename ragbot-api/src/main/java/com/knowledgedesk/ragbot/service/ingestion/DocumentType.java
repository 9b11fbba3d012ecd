package com.knowledgedesk.ragbot.service.ingestion;

import java.util.Locale;
import java.util.Optional;

public enum DocumentType {
    PDF,
    DOCX,
    TABULAR,
    CSV,
    HTML,
    TEXT;

    /** Row-oriented content: workbooks and delimited text. */
    public boolean isTabular() {
        return this == TABULAR || this == CSV;
    }

    public static Optional<DocumentType> fromFileType(String fileType) {
        if (fileType == null || fileType.isBlank()) {
            return Optional.empty();
        }
        return switch (fileType.trim().toLowerCase(Locale.ROOT)) {
            case "pdf" -> Optional.of(PDF);
            case "docx", "doc" -> Optional.of(DOCX);
            case "xlsx", "xls" -> Optional.of(TABULAR);
            case "csv", "tsv" -> Optional.of(CSV);
            case "html", "htm" -> Optional.of(HTML);
            case "txt", "text", "md", "markdown" -> Optional.of(TEXT);
            default -> Optional.empty();
        };
    }

    public static Optional<DocumentType> fromContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return Optional.empty();
        }
        String mime = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        if (mime.equals("text/html") || mime.equals("application/xhtml+xml")) {
            return Optional.of(HTML);
        }
        if (mime.equals("application/pdf")) {
            return Optional.of(PDF);
        }
        if (mime.equals("application/vnd.openxmlformats-officedocument.wordprocessingml.document")
                || mime.equals("application/msword")) {
            return Optional.of(DOCX);
        }
        if (mime.equals("text/csv") || mime.equals("application/csv") || mime.equals("text/tab-separated-values")) {
            return Optional.of(CSV);
        }
        if (mime.equals("application/vnd.ms-excel")
                || mime.equals("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")) {
            return Optional.of(TABULAR);
        }
        if (mime.startsWith("text/")) {
            return Optional.of(TEXT);
        }
        return Optional.empty();
    }
}
