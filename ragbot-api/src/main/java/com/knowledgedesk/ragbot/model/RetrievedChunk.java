package com.knowledgedesk.ragbot.model;

public record RetrievedChunk(
        String chunkId,
        String docId,
        String title,
        String source,
        int sequenceIndex,
        String text,
        double score
) {
}
