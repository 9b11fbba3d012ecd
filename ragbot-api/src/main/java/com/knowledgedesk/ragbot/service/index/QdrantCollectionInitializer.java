package com.knowledgedesk.ragbot.service.index;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Map;

/**
 * Creates the collection and its document id payload index on startup when they are missing.
 */
@Component
@Profile("!inmemory")
public class QdrantCollectionInitializer implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(QdrantCollectionInitializer.class);

    private final WebClient qdrantWebClient;
    private final RagbotProperties properties;

    public QdrantCollectionInitializer(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                                       RagbotProperties properties) {
        this.qdrantWebClient = qdrantWebClient;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.index().autoCreate()) {
            return;
        }
        String collection = properties.index().collection();
        try {
            if (exists(collection)) {
                log.info("Qdrant collection {} already exists", collection);
                return;
            }
            qdrantWebClient.put()
                    .uri("/collections/{collection}", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("vectors", Map.of("size", properties.embedding().dimensions(), "distance", "Cosine")))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.index().timeout())
                    .block();
            qdrantWebClient.put()
                    .uri("/collections/{collection}/index", collection)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("field_name", QdrantVectorStoreClient.DOCUMENT_ID_FIELD, "field_schema", "keyword"))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.index().timeout())
                    .block();
            log.info("Created Qdrant collection {} with {} dimensions", collection, properties.embedding().dimensions());
        } catch (Exception e) {
            log.warn("Could not prepare Qdrant collection {}: {}", collection, e.getMessage());
        }
    }

    private boolean exists(String collection) {
        try {
            qdrantWebClient.get()
                    .uri("/collections/{collection}", collection)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(properties.index().timeout())
                    .block();
            return true;
        } catch (WebClientResponseException ex) {
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                return false;
            }
            throw ex;
        }
    }
}
