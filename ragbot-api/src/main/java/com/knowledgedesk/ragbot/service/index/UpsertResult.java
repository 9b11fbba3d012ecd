package com.knowledgedesk.ragbot.service.index;

import java.util.List;

public record UpsertResult(int stored, List<String> failedChunkIds) {

    public UpsertResult {
        failedChunkIds = failedChunkIds == null ? List.of() : List.copyOf(failedChunkIds);
    }

    public static UpsertResult complete(int stored) {
        return new UpsertResult(stored, List.of());
    }

    public boolean partialFailure() {
        return !failedChunkIds.isEmpty();
    }
}
