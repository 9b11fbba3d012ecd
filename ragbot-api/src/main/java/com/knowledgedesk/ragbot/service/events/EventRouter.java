package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.model.InboundEvent;

public interface EventRouter {

    /**
     * Claims and dispatches the event without waiting for it to be processed.
     */
    RoutingDecision route(InboundEvent event);
}
