package com.knowledgedesk.ragbot.service.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.knowledgedesk.ragbot.config.RagbotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * OpenAI-compatible {@code POST /v1/embeddings}.
 */
@Component
public class OpenAiEmbeddingsEndpoint implements EmbeddingsEndpoint {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingsEndpoint.class);

    private final WebClient embeddingsWebClient;
    private final String model;
    private final Duration timeout;
    private final int maxInputChars;

    public OpenAiEmbeddingsEndpoint(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                    RagbotProperties properties) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = properties.embedding().model();
        this.timeout = properties.embedding().timeout();
        this.maxInputChars = properties.embedding().maxInputChars();
    }

    @Override
    public Mono<EmbeddingsClient.EmbeddingBatch> embedBatch(List<String> texts) {
        List<String> input = texts.stream().map(this::clip).toList();
        return embeddingsWebClient.post()
                .uri("/v1/embeddings")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new EmbedRequest(model, input))
                .retrieve()
                .bodyToMono(EmbedResponse.class)
                .timeout(timeout)
                .onErrorMap(this::classify)
                .map(response -> toBatch(response, input.size()));
    }

    @Override
    public String model() {
        return model;
    }

    private String clip(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > maxInputChars ? text.substring(0, maxInputChars) : text;
    }

    private Throwable classify(Throwable throwable) {
        if (throwable instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            log.warn("Embeddings service answered {}: {}", status, responseException.getMessage());
            if (isRetryableStatus(status)) {
                return new EmbeddingUnavailableException("Embeddings service unavailable (HTTP " + status + ")", throwable);
            }
            return new EmbeddingRejectedException("Embeddings service rejected the request (HTTP " + status + ")", throwable);
        }
        if (throwable instanceof TimeoutException || throwable instanceof WebClientRequestException) {
            log.warn("Embeddings service call failed: {}", throwable.getMessage());
            return new EmbeddingUnavailableException("Embeddings service did not respond", throwable);
        }
        return throwable;
    }

    static boolean isRetryableStatus(int status) {
        return status == 408 || status == 409 || status == 425 || status == 429 || status >= 500;
    }

    private EmbeddingsClient.EmbeddingBatch toBatch(EmbedResponse response, int expected) {
        if (response == null || response.data() == null || response.data().size() != expected) {
            throw new EmbeddingRejectedException("Embeddings service returned "
                    + (response == null || response.data() == null ? 0 : response.data().size())
                    + " vectors for " + expected + " inputs");
        }
        List<List<Double>> ordered = new ArrayList<>(expected);
        for (int i = 0; i < expected; i++) {
            ordered.add(null);
        }
        for (int position = 0; position < response.data().size(); position++) {
            EmbeddingData item = response.data().get(position);
            int index = item.index() == null ? position : item.index();
            if (index < 0 || index >= expected || item.embedding() == null || item.embedding().isEmpty()) {
                throw new EmbeddingRejectedException("Embeddings response contained an invalid entry at " + position);
            }
            ordered.set(index, item.embedding());
        }
        if (ordered.contains(null)) {
            throw new EmbeddingRejectedException("Embeddings response is missing an entry");
        }
        String responseModel = response.model() == null ? model : response.model();
        return new EmbeddingsClient.EmbeddingBatch(List.copyOf(ordered), responseModel, ordered.get(0).size());
    }

    private record EmbedRequest(String model, List<String> input) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbedResponse(List<EmbeddingData> data, String model) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record EmbeddingData(Integer index, List<Double> embedding) {}
}
