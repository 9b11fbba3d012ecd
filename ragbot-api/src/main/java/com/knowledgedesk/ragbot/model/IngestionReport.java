package com.knowledgedesk.ragbot.model;

import java.time.OffsetDateTime;

public record IngestionReport(String documentId,
                              String title,
                              DocumentSource sourceKind,
                              String source,
                              DocumentStatus status,
                              int chunks,
                              boolean deduplicated,
                              String failureReason,
                              OffsetDateTime updatedAt) {

    public boolean indexed() {
        return status == DocumentStatus.INDEXED;
    }
}
