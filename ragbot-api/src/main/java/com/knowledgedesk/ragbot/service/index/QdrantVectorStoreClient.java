package com.knowledgedesk.ragbot.service.index;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgedesk.ragbot.config.RagbotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

@Component
@Profile("!inmemory")
public class QdrantVectorStoreClient implements VectorStoreClient {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorStoreClient.class);

    static final String DOCUMENT_ID_FIELD = "document_id";

    private final WebClient qdrantWebClient;
    private final RagbotProperties.Index settings;

    public QdrantVectorStoreClient(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                   RagbotProperties properties) {
        this.qdrantWebClient = qdrantWebClient;
        this.settings = properties.index();
    }

    @Override
    public UpsertResult upsert(List<IndexRecord> records) {
        if (records == null || records.isEmpty()) {
            return UpsertResult.complete(0);
        }
        int stored = 0;
        int batchSize = settings.upsertBatchSize();
        for (int start = 0; start < records.size(); start += batchSize) {
            List<IndexRecord> batch = records.subList(start, Math.min(records.size(), start + batchSize));
            List<Point> points = batch.stream()
                    .map(record -> new Point(pointId(record.chunkId()), record.vector(), payloadFor(record)))
                    .toList();
            try {
                call(qdrantWebClient.put()
                        .uri(uri -> uri.path("/collections/{collection}/points").queryParam("wait", "true")
                                .build(settings.collection()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(new UpsertRequest(points))
                        .retrieve()
                        .bodyToMono(OperationResponse.class), "upsert");
                stored += batch.size();
            } catch (IndexUnavailableException ex) {
                List<String> failed = records.subList(start, records.size()).stream()
                        .map(IndexRecord::chunkId)
                        .toList();
                log.error("Upsert into {} stopped after {} of {} records: {}", settings.collection(), stored,
                        records.size(), ex.getMessage());
                return new UpsertResult(stored, failed);
            }
        }
        return UpsertResult.complete(stored);
    }

    @Override
    public List<ScoredRecord> query(List<Double> vector, int k, Map<String, String> filters) {
        if (vector == null || vector.isEmpty() || k <= 0) {
            return List.of();
        }
        SearchResponse response = call(qdrantWebClient.post()
                .uri("/collections/{collection}/points/search", settings.collection())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new SearchRequest(vector, k, buildFilter(filters), true))
                .retrieve()
                .bodyToMono(SearchResponse.class), "search");
        if (response == null || response.result() == null) {
            return List.of();
        }
        return response.result().stream()
                .map(Hit::toScoredRecord)
                .sorted(ScoredRecord.RANKING)
                .limit(k)
                .toList();
    }

    @Override
    public long deleteByDocument(String documentId) {
        long existing = countByDocument(documentId);
        if (existing == 0) {
            return 0;
        }
        call(qdrantWebClient.post()
                .uri(uri -> uri.path("/collections/{collection}/points/delete").queryParam("wait", "true")
                        .build(settings.collection()))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new FilterSelector(documentFilter(documentId)))
                .retrieve()
                .bodyToMono(OperationResponse.class), "delete");
        log.info("Deleted {} records of document {} from {}", existing, documentId, settings.collection());
        return existing;
    }

    @Override
    public long countByDocument(String documentId) {
        CountResponse response = call(qdrantWebClient.post()
                .uri("/collections/{collection}/points/count", settings.collection())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CountRequest(documentFilter(documentId), true))
                .retrieve()
                .bodyToMono(CountResponse.class), "count");
        return response == null || response.result() == null ? 0 : response.result().count();
    }

    static String pointId(String chunkId) {
        return UUID.nameUUIDFromBytes(chunkId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private <T> T call(Mono<T> request, String operation) {
        Duration timeout = settings.timeout();
        int maxAttempts = settings.maxAttempts();
        try {
            return request
                    .timeout(timeout)
                    .onErrorMap(throwable -> classify(throwable, operation))
                    .retryWhen(Retry.backoff(maxAttempts - 1L, settings.initialBackoff())
                            .maxBackoff(settings.maxBackoff())
                            .filter(IndexUnavailableException.class::isInstance)
                            .doBeforeRetry(signal -> log.warn("Qdrant {} failed on attempt {}/{}: {}", operation,
                                    signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();
        } catch (IndexUnavailableException | IndexRejectedException ex) {
            throw ex;
        } catch (Exception e) {
            throw new IndexUnavailableException("Qdrant " + operation + " failed", e);
        }
    }

    private Throwable classify(Throwable throwable, String operation) {
        if (throwable instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            if (status == 408 || status == 429 || status >= 500) {
                return new IndexUnavailableException("Qdrant " + operation + " unavailable (HTTP " + status + ")", throwable);
            }
            log.error("Qdrant rejected {}: {} {}", operation, status, responseException.getResponseBodyAsString());
            return new IndexRejectedException("Qdrant rejected " + operation + " (HTTP " + status + ")", throwable);
        }
        if (throwable instanceof TimeoutException || throwable instanceof WebClientRequestException) {
            return new IndexUnavailableException("Qdrant " + operation + " did not respond", throwable);
        }
        return throwable;
    }

    private Map<String, Object> payloadFor(IndexRecord record) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("chunk_id", record.chunkId());
        payload.put(DOCUMENT_ID_FIELD, record.documentId());
        payload.put("title", record.title());
        payload.put("source", record.source());
        payload.put("text", record.text());
        payload.put("sequence_index", record.sequenceIndex());
        payload.put("model_version", record.modelVersion());
        payload.put("metadata", record.metadata());
        return payload;
    }

    private QueryFilter documentFilter(String documentId) {
        return buildFilter(Map.of(DOCUMENT_ID_FIELD, documentId));
    }

    private QueryFilter buildFilter(Map<String, String> filters) {
        if (filters == null || filters.isEmpty()) {
            return null;
        }
        List<FieldCondition> must = new ArrayList<>();
        new LinkedHashMap<>(filters).forEach((key, value) -> {
            if (value != null && !value.isBlank()) {
                must.add(new FieldCondition(key, new Match(value)));
            }
        });
        return must.isEmpty() ? null : new QueryFilter(List.copyOf(must));
    }

    private record Point(String id, List<Double> vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<Point> points) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record SearchRequest(List<Double> vector,
                                 int limit,
                                 QueryFilter filter,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record CountRequest(QueryFilter filter, boolean exact) {}

    private record FilterSelector(QueryFilter filter) {}

    private record QueryFilter(List<FieldCondition> must) {}

    private record FieldCondition(String key, Match match) {}

    private record Match(String value) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record OperationResponse(Object result, String status) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CountResponse(CountResult result) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record CountResult(long count) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SearchResponse(List<Hit> result) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Hit(Object id, double score, Map<String, Object> payload) {
        ScoredRecord toScoredRecord() {
            Map<String, Object> fields = payload == null ? Map.of() : payload;
            Map<String, String> metadata = new LinkedHashMap<>();
            if (fields.get("metadata") instanceof Map<?, ?> nested) {
                nested.forEach((key, value) -> {
                    if (key != null && value != null) {
                        metadata.put(String.valueOf(key), String.valueOf(value));
                    }
                });
            }
            Object sequence = fields.get("sequence_index");
            IndexRecord record = new IndexRecord(
                    text(fields, "chunk_id", String.valueOf(id)),
                    text(fields, DOCUMENT_ID_FIELD, ""),
                    text(fields, "title", ""),
                    text(fields, "source", ""),
                    text(fields, "text", ""),
                    sequence instanceof Number number ? number.intValue() : 0,
                    List.of(),
                    text(fields, "model_version", null),
                    metadata);
            return new ScoredRecord(record, score);
        }

        private static String text(Map<String, Object> fields, String key, String fallback) {
            Object value = fields.get(key);
            return value == null ? fallback : String.valueOf(value);
        }
    }
}
