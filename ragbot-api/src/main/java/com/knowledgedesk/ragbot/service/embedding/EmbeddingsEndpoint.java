package com.knowledgedesk.ragbot.service.embedding;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A single call to the embedding service. Implementations map transport failures to
 * {@link EmbeddingUnavailableException} or {@link EmbeddingRejectedException}.
 */
public interface EmbeddingsEndpoint {

    Mono<EmbeddingsClient.EmbeddingBatch> embedBatch(List<String> texts);

    String model();
}
