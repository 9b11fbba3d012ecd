package com.knowledgedesk.ragbot.service.orchestration.openai;

/**
 * Chat completion failure. {@link #status()} is the HTTP status when the endpoint answered, otherwise 0.
 */
public class OpenAiChatException extends RuntimeException {

    private final int status;

    public OpenAiChatException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public OpenAiChatException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int status() {
        return status;
    }

    /** Client errors other than throttling will fail the same way on every attempt. */
    public boolean rejected() {
        return status >= 400 && status < 500 && status != 408 && status != 429;
    }
}
