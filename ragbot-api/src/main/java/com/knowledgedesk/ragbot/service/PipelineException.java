package com.knowledgedesk.ragbot.service;

/**
 * Failure of one pipeline stage. Transient failures may succeed on retry, permanent ones will not.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();

    public abstract String stage();
}
