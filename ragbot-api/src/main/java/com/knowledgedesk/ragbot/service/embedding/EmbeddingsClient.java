package com.knowledgedesk.ragbot.service.embedding;

import java.util.List;

public interface EmbeddingsClient {

    /**
     * Embeds every text, returning vectors in input order. Fails as a whole when any batch cannot be embedded.
     */
    EmbeddingBatch embed(List<String> texts);

    String modelVersion();

    record EmbeddingBatch(List<List<Double>> vectors, String model, int dimensions) {}
}
