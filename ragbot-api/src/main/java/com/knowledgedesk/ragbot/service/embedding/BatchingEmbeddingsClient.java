package com.knowledgedesk.ragbot.service.embedding;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits texts into batches, embeds up to {@code concurrency} batches at once and reassembles the
 * vectors in input order. Unavailable batches are retried with exponential backoff; rejected
 * batches fail immediately.
 */
@Component
public class BatchingEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(BatchingEmbeddingsClient.class);

    private final EmbeddingsEndpoint endpoint;
    private final RagbotProperties.Embedding settings;
    private final Counter retryCounter;

    public BatchingEmbeddingsClient(EmbeddingsEndpoint endpoint,
                                    RagbotProperties properties,
                                    MeterRegistry meterRegistry) {
        this.endpoint = endpoint;
        this.settings = properties.embedding();
        this.retryCounter = meterRegistry.counter("ragbot.embedding.retries");
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return new EmbeddingBatch(List.of(), endpoint.model(), 0);
        }
        List<List<String>> batches = partition(texts, settings.batchSize());
        List<EmbeddingBatch> results = Flux.fromIterable(batches)
                .flatMapSequential(this::embedWithRetry, settings.concurrency())
                .collectList()
                .block();
        if (results == null || results.size() != batches.size()) {
            throw new EmbeddingUnavailableException("Embedding produced an incomplete result");
        }
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        Integer dimensions = null;
        String model = endpoint.model();
        for (EmbeddingBatch batch : results) {
            for (List<Double> vector : batch.vectors()) {
                if (dimensions == null) {
                    dimensions = vector.size();
                } else if (dimensions != vector.size()) {
                    throw new EmbeddingRejectedException("Embedding dimensions changed within one request: "
                            + dimensions + " vs " + vector.size());
                }
                vectors.add(vector);
            }
            if (batch.model() != null) {
                model = batch.model();
            }
        }
        if (vectors.size() != texts.size()) {
            throw new EmbeddingRejectedException("Expected " + texts.size() + " vectors but received " + vectors.size());
        }
        return new EmbeddingBatch(List.copyOf(vectors), model, dimensions == null ? 0 : dimensions);
    }

    @Override
    public String modelVersion() {
        return endpoint.model();
    }

    private Mono<EmbeddingBatch> embedWithRetry(List<String> batch) {
        int maxAttempts = settings.maxAttempts();
        return Mono.defer(() -> endpoint.embedBatch(batch))
                .flatMap(result -> result.vectors().size() == batch.size()
                        ? Mono.just(result)
                        : Mono.error(new EmbeddingRejectedException("Batch of " + batch.size()
                                + " texts returned " + result.vectors().size() + " vectors")))
                .retryWhen(Retry.backoff(maxAttempts - 1L, settings.initialBackoff())
                        .maxBackoff(settings.maxBackoff())
                        .filter(EmbeddingUnavailableException.class::isInstance)
                        .doBeforeRetry(signal -> {
                            retryCounter.increment();
                            log.warn("Embedding batch of {} texts failed on attempt {}/{}; retrying: {}",
                                    batch.size(), signal.totalRetries() + 1, maxAttempts, signal.failure().getMessage());
                        })
                        .onRetryExhaustedThrow((retrySpec, signal) -> new EmbeddingUnavailableException(
                                "Embeddings service still unavailable after " + maxAttempts + " attempts",
                                signal.failure())));
    }

    private List<List<String>> partition(List<String> texts, int size) {
        List<List<String>> batches = new ArrayList<>();
        for (int start = 0; start < texts.size(); start += size) {
            batches.add(texts.subList(start, Math.min(texts.size(), start + size)));
        }
        return batches;
    }
}
