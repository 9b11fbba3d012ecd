package com.knowledgedesk.ragbot.service.dedup;

public enum ClaimOutcome {
    IN_PROGRESS,
    COMPLETED,
    FAILED
}
