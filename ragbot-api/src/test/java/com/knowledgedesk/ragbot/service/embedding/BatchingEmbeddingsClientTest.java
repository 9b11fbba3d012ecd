package com.knowledgedesk.ragbot.service.embedding;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchingEmbeddingsClientTest {

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void preservesInputOrderAcrossConcurrentBatches() {
        List<List<String>> seenBatches = Collections.synchronizedList(new ArrayList<>());
        FakeEndpoint endpoint = new FakeEndpoint(batch -> {
            seenBatches.add(batch);
            // earlier batches answer last
            long delay = 60L - 10L * (batch.get(0).charAt(0) - 'a');
            return Mono.just(vectorsFor(batch)).delayElement(Duration.ofMillis(delay));
        });
        BatchingEmbeddingsClient client = client(endpoint, 4);

        EmbeddingsClient.EmbeddingBatch result = client.embed(List.of("a", "b", "c", "d", "e"));

        assertThat(result.vectors()).containsExactly(
                List.of((double) 'a'), List.of((double) 'b'), List.of((double) 'c'), List.of((double) 'd'), List.of((double) 'e'));
        assertThat(result.dimensions()).isEqualTo(1);
        assertThat(result.model()).isEqualTo("test-model");
        assertThat(seenBatches).hasSize(3).allSatisfy(batch -> assertThat(batch.size()).isLessThanOrEqualTo(2));
    }

    @Test
    void retriesUnavailableBatchesUntilTheySucceed() {
        AtomicInteger calls = new AtomicInteger();
        FakeEndpoint endpoint = new FakeEndpoint(batch -> calls.incrementAndGet() <= 2
                ? Mono.error(new EmbeddingUnavailableException("HTTP 503"))
                : Mono.just(vectorsFor(batch)));
        BatchingEmbeddingsClient client = client(endpoint, 4);

        EmbeddingsClient.EmbeddingBatch result = client.embed(List.of("a", "b"));

        assertThat(result.vectors()).hasSize(2);
        assertThat(calls).hasValue(3);
        assertThat(meterRegistry.counter("ragbot.embedding.retries").count()).isEqualTo(2.0);
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();
        FakeEndpoint endpoint = new FakeEndpoint(batch -> {
            calls.incrementAndGet();
            return Mono.error(new EmbeddingUnavailableException("HTTP 429"));
        });
        BatchingEmbeddingsClient client = client(endpoint, 3);

        assertThatThrownBy(() -> client.embed(List.of("a")))
                .isInstanceOf(EmbeddingUnavailableException.class)
                .hasMessageContaining("after 3 attempts");
        assertThat(calls).hasValue(3);
    }

    @Test
    void rejectedBatchesAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        FakeEndpoint endpoint = new FakeEndpoint(batch -> {
            calls.incrementAndGet();
            return Mono.error(new EmbeddingRejectedException("HTTP 400"));
        });
        BatchingEmbeddingsClient client = client(endpoint, 4);

        assertThatThrownBy(() -> client.embed(List.of("a")))
                .isInstanceOf(EmbeddingRejectedException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void batchReturningTooFewVectorsIsRejected() {
        FakeEndpoint endpoint = new FakeEndpoint(batch -> Mono.just(vectorsFor(batch.subList(0, 1))));
        BatchingEmbeddingsClient client = client(endpoint, 4);

        assertThatThrownBy(() -> client.embed(List.of("a", "b")))
                .isInstanceOf(EmbeddingRejectedException.class);
    }

    @Test
    void emptyInputMakesNoCalls() {
        AtomicInteger calls = new AtomicInteger();
        FakeEndpoint endpoint = new FakeEndpoint(batch -> {
            calls.incrementAndGet();
            return Mono.just(vectorsFor(batch));
        });

        EmbeddingsClient.EmbeddingBatch result = client(endpoint, 4).embed(List.of());

        assertThat(result.vectors()).isEmpty();
        assertThat(calls).hasValue(0);
    }

    private BatchingEmbeddingsClient client(EmbeddingsEndpoint endpoint, int maxAttempts) {
        RagbotProperties properties = RagbotProperties.defaults().withEmbedding(new RagbotProperties.Embedding(
                null, null, "test-model", 1, 2, 3, maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5), null, null));
        return new BatchingEmbeddingsClient(endpoint, properties, meterRegistry);
    }

    private static EmbeddingsClient.EmbeddingBatch vectorsFor(List<String> batch) {
        List<List<Double>> vectors = batch.stream().map(text -> List.of((double) text.charAt(0))).toList();
        return new EmbeddingsClient.EmbeddingBatch(vectors, "test-model", 1);
    }

    private record FakeEndpoint(Function<List<String>, Mono<EmbeddingsClient.EmbeddingBatch>> behaviour)
            implements EmbeddingsEndpoint {

        @Override
        public Mono<EmbeddingsClient.EmbeddingBatch> embedBatch(List<String> texts) {
            return behaviour.apply(texts);
        }

        @Override
        public String model() {
            return "test-model";
        }
    }
}
