package com.knowledgedesk.ragbot.service.index;

import java.util.List;
import java.util.Map;

public interface VectorStoreClient {

    /**
     * Stores records, replacing any with the same chunk id.
     */
    UpsertResult upsert(List<IndexRecord> records);

    /**
     * Returns at most {@code k} records matching every filter, ordered by {@link ScoredRecord#RANKING}.
     */
    List<ScoredRecord> query(List<Double> vector, int k, Map<String, String> filters);

    /**
     * Removes every record of the document and returns how many were removed.
     */
    long deleteByDocument(String documentId);

    long countByDocument(String documentId);
}
