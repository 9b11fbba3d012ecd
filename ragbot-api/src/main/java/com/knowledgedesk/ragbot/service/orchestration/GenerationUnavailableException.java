package com.knowledgedesk.ragbot.service.orchestration;

import com.knowledgedesk.ragbot.service.PipelineException;

public class GenerationUnavailableException extends PipelineException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }

    @Override
    public String stage() {
        return "generate";
    }
}
