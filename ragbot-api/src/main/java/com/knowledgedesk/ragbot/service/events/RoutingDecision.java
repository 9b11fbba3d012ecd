package com.knowledgedesk.ragbot.service.events;

public enum RoutingDecision {
    DISPATCHED,
    DUPLICATE,
    IGNORED,
    /** The worker pool refused the task; the claim was dropped so a redelivery is processed. */
    REJECTED
}
