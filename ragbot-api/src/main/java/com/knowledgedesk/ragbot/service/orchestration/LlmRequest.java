package com.knowledgedesk.ragbot.service.orchestration;

import com.knowledgedesk.ragbot.model.RetrievedChunk;

import java.util.List;

/**
 * Passage {@code i} of {@code passages} is presented to the model under the label {@code [S(i+1)]}.
 */
public record LlmRequest(String systemPrompt,
                         String question,
                         List<RetrievedChunk> passages) {

    public LlmRequest {
        passages = passages == null ? List.of() : List.copyOf(passages);
    }

    public static String label(int index) {
        return "[S" + (index + 1) + "]";
    }
}
