package com.knowledgedesk.ragbot.model;

public enum EventKind {
    QUESTION,
    UPLOAD,
    IGNORED
}
