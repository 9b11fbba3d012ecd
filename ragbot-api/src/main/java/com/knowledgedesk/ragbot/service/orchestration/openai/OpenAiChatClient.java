package com.knowledgedesk.ragbot.service.orchestration.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgedesk.ragbot.config.RagbotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Blocking client for an OpenAI-compatible {@code POST /v1/chat/completions} endpoint.
 */
@Component
public class OpenAiChatClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiChatClient.class);

    static final String COMPLETIONS_PATH = "/v1/chat/completions";

    private final WebClient webClient;
    private final Duration timeout;

    public OpenAiChatClient(@Qualifier("llmWebClient") WebClient webClient, RagbotProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.llm().timeout();
    }

    public ChatCompletion complete(ChatCompletionRequest request) {
        try {
            return webClient.post()
                    .uri(COMPLETIONS_PATH)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(ChatCompletion.class)
                    .timeout(timeout)
                    .onErrorMap(WebClientResponseException.class, OpenAiChatClient::statusFailure)
                    .onErrorMap(TimeoutException.class,
                            ex -> new OpenAiChatException("Chat completion timed out after " + timeout.toMillis() + " ms", ex))
                    .block();
        } catch (OpenAiChatException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new OpenAiChatException("Chat completion request failed: " + ex.getMessage(), ex);
        }
    }

    private static OpenAiChatException statusFailure(WebClientResponseException exception) {
        int status = exception.getStatusCode().value();
        log.warn("Chat completion endpoint answered {}: {}", status, exception.getResponseBodyAsString());
        return new OpenAiChatException("Chat completion returned HTTP " + status, status, exception);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ChatCompletionRequest(String model,
                                        List<Message> messages,
                                        Double temperature,
                                        @JsonProperty("max_tokens") Integer maxTokens,
                                        boolean stream) {

        public static ChatCompletionRequest of(String model, List<Message> messages, Double temperature, Integer maxTokens) {
            return new ChatCompletionRequest(model, List.copyOf(messages), temperature, maxTokens, false);
        }
    }

    public record Message(String role, String content) {

        public static Message system(String content) {
            return new Message("system", content);
        }

        public static Message user(String content) {
            return new Message("user", content);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatCompletion(List<Choice> choices) {

        /** Text of the first choice, or null when the model produced nothing. */
        public String content() {
            Choice choice = choices == null || choices.isEmpty() ? null : choices.get(0);
            if (choice == null || choice.message() == null) {
                return null;
            }
            String text = choice.message().content();
            return text == null || text.isBlank() ? null : text.trim();
        }

        public String finishReason() {
            return choices == null || choices.isEmpty() ? null : choices.get(0).finishReason();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(Message message, @JsonProperty("finish_reason") String finishReason) {
    }
}
