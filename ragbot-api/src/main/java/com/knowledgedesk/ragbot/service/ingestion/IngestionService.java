package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.model.DocumentStatus;
import com.knowledgedesk.ragbot.model.IngestionReport;

import java.util.List;
import java.util.Optional;

public interface IngestionService {

    /**
     * Runs the whole pipeline and returns the document in a terminal state. Stage failures are reported
     * in the result rather than thrown.
     */
    IngestionReport ingest(IngestDocumentCommand command);

    Optional<IngestionReport> find(String documentId);

    /**
     * Most recently updated documents, optionally restricted to one status.
     */
    List<IngestionReport> recent(DocumentStatus status);

    /**
     * Removes the document and all of its index records. Returns false when the document is unknown.
     */
    boolean delete(String documentId);
}
