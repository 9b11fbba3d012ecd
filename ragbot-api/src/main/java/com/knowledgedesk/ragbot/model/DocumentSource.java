package com.knowledgedesk.ragbot.model;

public enum DocumentSource {
    FILE,
    URL
}
