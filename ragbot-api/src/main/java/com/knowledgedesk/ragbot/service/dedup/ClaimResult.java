package com.knowledgedesk.ragbot.service.dedup;

public enum ClaimResult {
    CLAIMED,
    ALREADY_CLAIMED
}
