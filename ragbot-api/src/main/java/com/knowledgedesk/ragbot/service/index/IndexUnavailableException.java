package com.knowledgedesk.ragbot.service.index;

import com.knowledgedesk.ragbot.service.PipelineException;

public class IndexUnavailableException extends PipelineException {

    public IndexUnavailableException(String message) {
        super(message);
    }

    public IndexUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }

    @Override
    public String stage() {
        return "index";
    }
}
