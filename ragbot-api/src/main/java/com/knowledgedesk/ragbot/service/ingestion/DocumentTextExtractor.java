package com.knowledgedesk.ragbot.service.ingestion;

public interface DocumentTextExtractor {

    ExtractedDocument extract(DocumentType type, String filename, String sourceUrl, byte[] content);

    record ExtractedDocument(DocumentMetadata metadata, String text) {}
}
