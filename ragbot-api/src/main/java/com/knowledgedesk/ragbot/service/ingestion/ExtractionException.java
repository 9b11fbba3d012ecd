package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.service.PipelineException;

public class ExtractionException extends PipelineException {

    private final boolean transientFailure;

    public ExtractionException(String message) {
        this(message, null, false);
    }

    public ExtractionException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ExtractionException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    @Override
    public boolean isTransient() {
        return transientFailure;
    }

    @Override
    public String stage() {
        return "extract";
    }
}
