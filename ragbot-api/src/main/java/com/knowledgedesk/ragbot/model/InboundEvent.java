package com.knowledgedesk.ragbot.model;

import java.util.List;

/**
 * A chat event as delivered by the platform, before classification.
 */
public record InboundEvent(String eventId,
                           String type,
                           String subtype,
                           String channel,
                           String threadTs,
                           String messageTs,
                           String userId,
                           String botId,
                           String text,
                           List<Attachment> attachments) {

    public InboundEvent {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
        text = text == null ? "" : text;
    }

    public boolean fromBot() {
        return (botId != null && !botId.isBlank()) || "bot_message".equals(subtype);
    }

    /** Replies go into the originating thread, or start one under the message. */
    public String replyThread() {
        return threadTs != null && !threadTs.isBlank() ? threadTs : messageTs;
    }
}
