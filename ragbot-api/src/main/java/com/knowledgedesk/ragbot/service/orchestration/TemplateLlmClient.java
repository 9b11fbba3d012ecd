package com.knowledgedesk.ragbot.service.orchestration;

import com.knowledgedesk.ragbot.model.RetrievedChunk;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Offline generator that quotes the best passage. Used for local runs without a model endpoint.
 */
@Component
@Profile("template")
public class TemplateLlmClient implements LlmClient {

    @Override
    public LlmResponse generate(LlmRequest request) {
        List<RetrievedChunk> passages = request.passages();
        if (passages.isEmpty()) {
            throw new GenerationUnavailableException("No passages to answer from");
        }
        StringBuilder builder = new StringBuilder("From the indexed documents:\n");
        int limit = Math.min(2, passages.size());
        for (int i = 0; i < limit; i++) {
            builder.append("- ")
                    .append(normalise(passages.get(i).text()))
                    .append(' ')
                    .append(LlmRequest.label(i))
                    .append('\n');
        }
        return new LlmResponse(builder.toString().trim(), "stop");
    }

    private String normalise(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.replaceAll("\\s+", " ").trim();
        if (trimmed.length() <= 240) {
            return trimmed;
        }
        return trimmed.substring(0, 237) + "...";
    }
}
