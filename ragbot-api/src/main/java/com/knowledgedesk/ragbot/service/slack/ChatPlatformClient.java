package com.knowledgedesk.ragbot.service.slack;

import com.knowledgedesk.ragbot.model.Attachment;

public interface ChatPlatformClient {

    /**
     * Posts a message, threaded under {@code threadTs} when given. Returns false when the platform refused it.
     */
    boolean postMessage(String channel, String threadTs, String text);

    byte[] downloadFile(Attachment attachment);
}
