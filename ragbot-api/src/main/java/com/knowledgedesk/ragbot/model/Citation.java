package com.knowledgedesk.ragbot.model;

public record Citation(String docId,
                       String title,
                       String source,
                       String reference) {
}
