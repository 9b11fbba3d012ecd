package com.knowledgedesk.ragbot.service.orchestration;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.RetrievedChunk;
import com.knowledgedesk.ragbot.service.orchestration.openai.OpenAiChatClient;
import com.knowledgedesk.ragbot.service.orchestration.openai.OpenAiChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@Profile("!template")
public class OpenAiLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiLlmClient.class);

    private final OpenAiChatClient chatClient;
    private final RagbotProperties.Llm settings;

    public OpenAiLlmClient(OpenAiChatClient chatClient, RagbotProperties properties) {
        this.chatClient = chatClient;
        this.settings = properties.llm();
    }

    @Override
    public LlmResponse generate(LlmRequest request) {
        OpenAiChatClient.ChatCompletion completion;
        try {
            completion = chatClient.complete(OpenAiChatClient.ChatCompletionRequest.of(settings.model(),
                    buildMessages(request), settings.temperature(), settings.maxOutputTokens()));
        } catch (OpenAiChatException ex) {
            if (ex.rejected()) {
                log.error("Model {} rejected the completion request: {}", settings.model(), ex.getMessage());
            } else {
                log.warn("Answer generation unavailable: {}", ex.getMessage());
            }
            throw new GenerationUnavailableException("Answer generation failed", ex);
        }
        String content = completion == null ? null : completion.content();
        if (content == null) {
            log.warn("Model {} returned an empty answer", settings.model());
            throw new GenerationUnavailableException("Answer generation returned no content");
        }
        LlmResponse response = new LlmResponse(content, completion.finishReason());
        if (response.truncated()) {
            log.warn("Answer was cut off at {} tokens", settings.maxOutputTokens());
        }
        return response;
    }

    private List<OpenAiChatClient.Message> buildMessages(LlmRequest request) {
        StringBuilder builder = new StringBuilder("Passages:\n\n");
        List<RetrievedChunk> passages = request.passages();
        for (int i = 0; i < passages.size(); i++) {
            RetrievedChunk passage = passages.get(i);
            builder.append(LlmRequest.label(i))
                    .append(' ')
                    .append(passage.title() == null || passage.title().isBlank() ? "Document" : passage.title())
                    .append('\n')
                    .append(passage.text() == null ? "" : passage.text().trim())
                    .append("\n\n");
        }
        builder.append("Question:\n").append(request.question() == null ? "" : request.question().trim());
        return List.of(
                OpenAiChatClient.Message.system(request.systemPrompt()),
                OpenAiChatClient.Message.user(builder.toString()));
    }
}
