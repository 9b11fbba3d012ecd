package com.knowledgedesk.ragbot.service.embedding;

import com.knowledgedesk.ragbot.service.PipelineException;

public class EmbeddingUnavailableException extends PipelineException {

    public EmbeddingUnavailableException(String message) {
        super(message);
    }

    public EmbeddingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }

    @Override
    public String stage() {
        return "embed";
    }
}
