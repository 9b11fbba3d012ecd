package com.knowledgedesk.ragbot.service.dedup;

/**
 * Guarantees that each platform event id is processed at most once within the retention window,
 * across every running instance.
 */
public interface DedupGuard {

    /**
     * Atomically claims the event. Only one caller ever sees {@link ClaimResult#CLAIMED} for an id
     * until its claim expires.
     */
    ClaimResult claim(String eventId);

    /**
     * Records the terminal outcome. A released id stays claimed, so platform retries are not reprocessed.
     */
    void release(String eventId, ClaimOutcome outcome);

    /**
     * Operator reset: drops the claim so the event may be processed again.
     */
    boolean forget(String eventId);

    int purgeExpired();
}
