package com.knowledgedesk.ragbot.service.index;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Cosine-similarity store kept in memory, for local runs without Qdrant.
 */
@Component
@Profile("inmemory")
public class InMemoryVectorStoreClient implements VectorStoreClient {

    private final ConcurrentMap<String, IndexRecord> records = new ConcurrentHashMap<>();

    @Override
    public UpsertResult upsert(List<IndexRecord> batch) {
        if (batch == null || batch.isEmpty()) {
            return UpsertResult.complete(0);
        }
        batch.forEach(record -> records.put(record.chunkId(), record));
        return UpsertResult.complete(batch.size());
    }

    @Override
    public List<ScoredRecord> query(List<Double> vector, int k, Map<String, String> filters) {
        if (vector == null || vector.isEmpty() || k <= 0) {
            return List.of();
        }
        return records.values().stream()
                .filter(record -> matches(record, filters))
                .map(record -> new ScoredRecord(record, cosine(vector, record.vector())))
                .sorted(ScoredRecord.RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public long deleteByDocument(String documentId) {
        List<String> ids = records.values().stream()
                .filter(record -> record.documentId().equals(documentId))
                .map(IndexRecord::chunkId)
                .toList();
        ids.forEach(records::remove);
        return ids.size();
    }

    @Override
    public long countByDocument(String documentId) {
        return records.values().stream()
                .filter(record -> record.documentId().equals(documentId))
                .count();
    }

    private boolean matches(IndexRecord record, Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return true;
        }
        for (Map.Entry<String, String> filter : filters.entrySet()) {
            String actual = switch (filter.getKey()) {
                case QdrantVectorStoreClient.DOCUMENT_ID_FIELD -> record.documentId();
                case "title" -> record.title();
                case "source" -> record.source();
                case "model_version" -> record.modelVersion();
                default -> record.metadata().get(filter.getKey());
            };
            if (!filter.getValue().equals(actual)) {
                return false;
            }
        }
        return true;
    }

    static double cosine(List<Double> left, List<Double> right) {
        if (left.size() != right.size() || left.isEmpty()) {
            return 0.0;
        }
        double dot = 0.0;
        double leftNorm = 0.0;
        double rightNorm = 0.0;
        for (int i = 0; i < left.size(); i++) {
            double a = left.get(i);
            double b = right.get(i);
            dot += a * b;
            leftNorm += a * a;
            rightNorm += b * b;
        }
        if (leftNorm == 0.0 || rightNorm == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }
}
