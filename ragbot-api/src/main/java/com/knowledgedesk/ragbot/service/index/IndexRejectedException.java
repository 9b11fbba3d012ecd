package com.knowledgedesk.ragbot.service.index;

import com.knowledgedesk.ragbot.service.PipelineException;

public class IndexRejectedException extends PipelineException {

    public IndexRejectedException(String message) {
        super(message);
    }

    public IndexRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }

    @Override
    public String stage() {
        return "index";
    }
}
