package com.knowledgedesk.ragbot.service.embedding;

import com.knowledgedesk.ragbot.service.PipelineException;

public class EmbeddingRejectedException extends PipelineException {

    public EmbeddingRejectedException(String message) {
        super(message);
    }

    public EmbeddingRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }

    @Override
    public String stage() {
        return "embed";
    }
}
