package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Component
public class UrlContentFetcher {

    private static final Logger log = LoggerFactory.getLogger(UrlContentFetcher.class);

    private final WebClient fetchWebClient;
    private final Duration timeout;

    public UrlContentFetcher(@Qualifier("fetchWebClient") WebClient fetchWebClient, RagbotProperties properties) {
        this.fetchWebClient = fetchWebClient;
        this.timeout = properties.fetch().timeout();
    }

    public FetchedContent fetch(String url) {
        URI uri = parse(url);
        try {
            ResponseEntity<byte[]> response = fetchWebClient.get()
                    .uri(uri)
                    .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/pdf,text/plain;q=0.9,*/*;q=0.8")
                    .retrieve()
                    .toEntity(byte[].class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.getBody() == null || response.getBody().length == 0) {
                throw new ExtractionException("URL " + url + " returned no content");
            }
            String contentType = response.getHeaders().getContentType() == null
                    ? null
                    : response.getHeaders().getContentType().toString();
            return new FetchedContent(response.getBody(), contentType, url);
        } catch (ExtractionException ex) {
            throw ex;
        } catch (WebClientResponseException ex) {
            log.warn("Fetching {} failed with status {}", url, ex.getStatusCode().value());
            boolean transientFailure = ex.getStatusCode().is5xxServerError() || ex.getStatusCode().value() == 429;
            throw new ExtractionException("URL " + url + " returned HTTP " + ex.getStatusCode().value(), ex, transientFailure);
        } catch (WebClientRequestException ex) {
            log.warn("Fetching {} failed: {}", url, ex.getMessage());
            throw new ExtractionException("URL " + url + " could not be reached", ex, true);
        } catch (Exception e) {
            String reason = e.getCause() instanceof TimeoutException ? "Timed out fetching " : "Failed to fetch ";
            throw new ExtractionException(reason + url, e, true);
        }
    }

    private URI parse(String url) {
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                throw new ExtractionException("Only http and https URLs can be imported: " + url);
            }
            return uri;
        } catch (IllegalArgumentException ex) {
            throw new ExtractionException("Malformed URL: " + url, ex);
        }
    }

    public record FetchedContent(byte[] body, String contentType, String url) {}
}
