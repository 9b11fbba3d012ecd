package com.knowledgedesk.ragbot.service.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.Attachment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

@Component
public class SlackWebApiClient implements ChatPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(SlackWebApiClient.class);

    private final WebClient slackWebClient;
    private final Duration timeout;

    public SlackWebApiClient(@Qualifier("slackWebClient") WebClient slackWebClient, RagbotProperties properties) {
        this.slackWebClient = slackWebClient;
        this.timeout = properties.fetch().timeout();
    }

    @Override
    public boolean postMessage(String channel, String threadTs, String text) {
        try {
            SlackResponse response = slackWebClient.post()
                    .uri("/chat.postMessage")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new PostMessageRequest(channel, text, threadTs))
                    .retrieve()
                    .bodyToMono(SlackResponse.class)
                    .timeout(timeout)
                    .block();
            if (response == null || !response.ok()) {
                log.warn("chat.postMessage to {} was refused: {}", channel, response == null ? "empty response" : response.error());
                return false;
            }
            return true;
        } catch (Exception e) {
            log.error("Failed to post message to {}: {}", channel, e.getMessage());
            return false;
        }
    }

    @Override
    public byte[] downloadFile(Attachment attachment) {
        String url = attachment.downloadUrl() != null && !attachment.downloadUrl().isBlank()
                ? attachment.downloadUrl()
                : lookupDownloadUrl(attachment.id());
        try {
            // url_private is already percent-encoded and must not be expanded as a template
            ResponseEntity<byte[]> response = slackWebClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .toEntity(byte[].class)
                    .timeout(timeout)
                    .block();
            if (response == null || response.getBody() == null || response.getBody().length == 0) {
                throw new SlackApiException("File " + attachment.name() + " was empty");
            }
            MediaType contentType = response.getHeaders().getContentType();
            if (contentType != null && contentType.isCompatibleWith(MediaType.TEXT_HTML)
                    && !"html".equals(attachment.normalisedType())) {
                // the login page comes back when the token lacks files:read
                throw new SlackApiException("Download of " + attachment.name() + " returned an HTML page");
            }
            return response.getBody();
        } catch (SlackApiException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Failed to download file {}: {}", attachment.id(), e.getMessage());
            throw new SlackApiException("Failed to download " + attachment.name(), e);
        }
    }

    private String lookupDownloadUrl(String fileId) {
        FileInfoResponse info;
        try {
            info = slackWebClient.get()
                    .uri(uri -> uri.path("/files.info").queryParam("file", fileId).build())
                    .retrieve()
                    .bodyToMono(FileInfoResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (Exception e) {
            throw new SlackApiException("files.info failed for " + fileId, e);
        }
        if (info == null || !info.ok() || info.file() == null || info.file().urlPrivate() == null) {
            throw new SlackApiException("files.info returned no download URL for " + fileId
                    + (info == null ? "" : ": " + info.error()));
        }
        return info.file().urlPrivate();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record PostMessageRequest(String channel, String text, @JsonProperty("thread_ts") String threadTs) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SlackResponse(boolean ok, String error) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record FileInfoResponse(boolean ok, String error, FileInfo file) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record FileInfo(String id, @JsonProperty("url_private") String urlPrivate) {}
}
