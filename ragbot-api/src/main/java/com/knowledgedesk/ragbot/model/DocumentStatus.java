package com.knowledgedesk.ragbot.model;

public enum DocumentStatus {
    PENDING,
    CHUNKING,
    EMBEDDING,
    INDEXED,
    FAILED;

    public boolean isTerminal() {
        return this == INDEXED || this == FAILED;
    }

    public boolean canTransitionTo(DocumentStatus next) {
        if (next == null || isTerminal()) {
            return false;
        }
        return next == FAILED || next.ordinal() > ordinal();
    }
}
