package com.knowledgedesk.ragbot.service.orchestration;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.RetrievedChunk;
import com.knowledgedesk.ragbot.service.orchestration.openai.OpenAiChatClient;
import com.knowledgedesk.ragbot.service.orchestration.openai.OpenAiChatException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiLlmClientTest {

    private static final LlmRequest REQUEST = new LlmRequest("Answer from the passages only.", "Is remote work allowed?",
            List.of(new RetrievedChunk("file-f1-0", "file-f1", "Policy A", "policy-a.pdf", 0,
                    "Remote work is allowed three days a week.", 0.81)));

    @Test
    void returnsTheFirstChoice() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        OpenAiLlmClient client = client(HttpStatus.OK, """
                {"id":"chatcmpl-1","choices":[
                  {"index":0,"message":{"role":"assistant","content":"  Three days a week [S1].  "},"finish_reason":"stop"}
                ],"usage":{"total_tokens":42}}
                """, captured);

        LlmResponse response = client.generate(REQUEST);

        assertThat(response.answer()).isEqualTo("Three days a week [S1].");
        assertThat(response.truncated()).isFalse();
        assertThat(captured.get().url().getPath()).isEqualTo("/v1/chat/completions");
    }

    @Test
    void lengthFinishIsReportedAsTruncated() {
        OpenAiLlmClient client = client(HttpStatus.OK,
                "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"Three days\"},\"finish_reason\":\"length\"}]}",
                new AtomicReference<>());

        assertThat(client.generate(REQUEST).truncated()).isTrue();
    }

    @Test
    void emptyChoicesAreUnavailable() {
        OpenAiLlmClient client = client(HttpStatus.OK, "{\"choices\":[]}", new AtomicReference<>());

        assertThatThrownBy(() -> client.generate(REQUEST))
                .isInstanceOf(GenerationUnavailableException.class)
                .hasMessageContaining("no content");
    }

    @Test
    void serverErrorIsWrapped() {
        OpenAiLlmClient client = client(HttpStatus.BAD_GATEWAY, "{\"error\":\"upstream\"}", new AtomicReference<>());

        assertThatThrownBy(() -> client.generate(REQUEST))
                .isInstanceOf(GenerationUnavailableException.class)
                .hasCauseInstanceOf(OpenAiChatException.class)
                .satisfies(ex -> assertThat(((OpenAiChatException) ex.getCause()).status()).isEqualTo(502));
    }

    @Test
    void distinguishesRejectedRequests() {
        assertThat(new OpenAiChatException("bad", 400, null).rejected()).isTrue();
        assertThat(new OpenAiChatException("slow down", 429, null).rejected()).isFalse();
        assertThat(new OpenAiChatException("down", 503, null).rejected()).isFalse();
        assertThat(new OpenAiChatException("io", null).rejected()).isFalse();
    }

    private static OpenAiLlmClient client(HttpStatus status, String body, AtomicReference<ClientRequest> captured) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://llm.test")
                .exchangeFunction(request -> {
                    captured.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        RagbotProperties properties = RagbotProperties.defaults();
        return new OpenAiLlmClient(new OpenAiChatClient(webClient, properties), properties);
    }
}
