package com.knowledgedesk.ragbot.service.index;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InMemoryVectorStoreClientTest {

    private final InMemoryVectorStoreClient store = new InMemoryVectorStoreClient();

    @Test
    void queryRanksByCosineSimilarity() {
        store.upsert(List.of(
                record("a-0", "a", 0, List.of(1.0, 0.0)),
                record("a-1", "a", 1, List.of(0.7, 0.7)),
                record("b-0", "b", 0, List.of(0.0, 1.0))));

        List<ScoredRecord> hits = store.query(List.of(1.0, 0.1), 2, Map.of());

        assertThat(hits).extracting(hit -> hit.record().chunkId()).containsExactly("a-0", "a-1");
    }

    @Test
    void upsertReplacesRecordsWithTheSameChunkId() {
        store.upsert(List.of(record("a-0", "a", 0, List.of(1.0, 0.0))));
        store.upsert(List.of(record("a-0", "a", 0, List.of(0.0, 1.0))));

        assertThat(store.countByDocument("a")).isEqualTo(1);
        assertThat(store.query(List.of(0.0, 1.0), 1, Map.of()).get(0).score()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void tiesAreBrokenBySequenceIndex() {
        store.upsert(List.of(
                record("a-1", "a", 1, List.of(1.0, 0.0)),
                record("a-0", "a", 0, List.of(1.0, 0.0))));

        assertThat(store.query(List.of(1.0, 0.0), 2, Map.of()))
                .extracting(hit -> hit.record().chunkId()).containsExactly("a-0", "a-1");
    }

    @Test
    void filtersAndDeletesByDocument() {
        store.upsert(List.of(
                record("a-0", "a", 0, List.of(1.0, 0.0)),
                record("b-0", "b", 0, List.of(1.0, 0.0))));

        assertThat(store.query(List.of(1.0, 0.0), 5, Map.of("document_id", "b")))
                .extracting(hit -> hit.record().documentId()).containsExactly("b");
        assertThat(store.deleteByDocument("a")).isEqualTo(1);
        assertThat(store.countByDocument("a")).isZero();
        assertThat(store.countByDocument("b")).isEqualTo(1);
    }

    @Test
    void cosineOfMismatchedOrZeroVectorsIsZero() {
        assertThat(InMemoryVectorStoreClient.cosine(List.of(1.0), List.of(1.0, 0.0))).isZero();
        assertThat(InMemoryVectorStoreClient.cosine(List.of(0.0, 0.0), List.of(1.0, 0.0))).isZero();
    }

    private static IndexRecord record(String chunkId, String documentId, int sequence, List<Double> vector) {
        return new IndexRecord(chunkId, documentId, "Title " + documentId, documentId + ".txt", "text of " + chunkId,
                sequence, vector, "m1", Map.of());
    }
}
