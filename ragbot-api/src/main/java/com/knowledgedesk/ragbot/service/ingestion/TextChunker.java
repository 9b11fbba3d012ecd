package com.knowledgedesk.ragbot.service.ingestion;

import java.util.List;

public interface TextChunker {

    List<Chunk> chunk(String documentId, String text, DocumentType type);

    List<Chunk> chunk(String documentId, String text, DocumentType type, int maxTokens, int overlapTokens);
}
