package com.knowledgedesk.ragbot.service.retrieval;

import com.knowledgedesk.ragbot.model.RetrievedChunk;
import com.knowledgedesk.ragbot.service.ingestion.TokenCounter;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps passages in rank order until the context budget is spent. The first passage is always kept.
 */
public class TokenBudgetGuard {

    private final int maxTokens;

    public TokenBudgetGuard(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public GuardedChunks enforce(List<RetrievedChunk> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            return new GuardedChunks(List.of(), false);
        }
        int budget = maxTokens;
        List<RetrievedChunk> accepted = new ArrayList<>();
        boolean truncated = false;
        for (RetrievedChunk chunk : chunks) {
            int tokens = TokenCounter.count(chunk.text());
            if (tokens > budget && !accepted.isEmpty()) {
                truncated = true;
                break;
            }
            budget -= tokens;
            accepted.add(chunk);
        }
        return new GuardedChunks(List.copyOf(accepted), truncated);
    }

    public record GuardedChunks(List<RetrievedChunk> chunks, boolean truncated) {}
}
