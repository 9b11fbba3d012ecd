package com.knowledgedesk.ragbot.service.ingestion;

import java.util.Map;

public record Chunk(String chunkId,
                    String documentId,
                    int sequenceIndex,
                    String text,
                    int tokenLength,
                    Map<String, String> metadata) {

    public Chunk {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static String chunkId(String documentId, int sequenceIndex) {
        return documentId + "-" + sequenceIndex;
    }

    public boolean truncated() {
        return Boolean.parseBoolean(metadata.get("truncated"));
    }
}
