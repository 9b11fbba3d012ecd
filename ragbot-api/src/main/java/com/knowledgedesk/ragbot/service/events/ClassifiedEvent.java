package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.model.EventKind;
import com.knowledgedesk.ragbot.model.InboundEvent;

import java.util.List;

public record ClassifiedEvent(InboundEvent event, EventKind kind, String text, List<String> urls) {

    public ClassifiedEvent {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }
}
