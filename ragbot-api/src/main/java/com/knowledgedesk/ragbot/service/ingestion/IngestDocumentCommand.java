package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.model.Attachment;
import com.knowledgedesk.ragbot.model.DocumentSource;

public record IngestDocumentCommand(String documentId,
                                    DocumentSource sourceKind,
                                    String source,
                                    String title,
                                    String filename,
                                    String fileType,
                                    byte[] bytes,
                                    String eventId) {

    public static IngestDocumentCommand forAttachment(Attachment attachment, byte[] bytes, String eventId) {
        String source = attachment.downloadUrl() != null ? attachment.downloadUrl() : attachment.name();
        return new IngestDocumentCommand(DocumentIds.forFile(attachment.id()), DocumentSource.FILE, source,
                attachment.name(), attachment.name(), attachment.normalisedType(), bytes, eventId);
    }

    public static IngestDocumentCommand forUrl(String url, String eventId) {
        return new IngestDocumentCommand(DocumentIds.forUrl(url), DocumentSource.URL, url, null, null, null, null, eventId);
    }

    public static IngestDocumentCommand forUpload(String filename, String title, byte[] bytes) {
        return new IngestDocumentCommand(DocumentIds.forUpload(filename), DocumentSource.FILE, filename,
                title == null || title.isBlank() ? filename : title, filename, null, bytes, null);
    }

    public IngestDocumentCommand withTitle(String value) {
        if (value == null || value.isBlank()) {
            return this;
        }
        return new IngestDocumentCommand(documentId, sourceKind, source, value.trim(), filename, fileType, bytes, eventId);
    }

    public boolean hasContent() {
        return bytes != null && bytes.length > 0;
    }
}
