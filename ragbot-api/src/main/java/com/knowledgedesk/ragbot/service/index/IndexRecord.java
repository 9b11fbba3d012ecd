package com.knowledgedesk.ragbot.service.index;

import java.util.List;
import java.util.Map;

public record IndexRecord(String chunkId,
                          String documentId,
                          String title,
                          String source,
                          String text,
                          int sequenceIndex,
                          List<Double> vector,
                          String modelVersion,
                          Map<String, String> metadata) {

    public IndexRecord {
        vector = vector == null ? List.of() : vector;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
