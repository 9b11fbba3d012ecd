package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.service.PipelineException;

public class UnsupportedDocumentTypeException extends PipelineException {

    public UnsupportedDocumentTypeException(String message) {
        super(message);
    }

    @Override
    public boolean isTransient() {
        return false;
    }

    @Override
    public String stage() {
        return "extract";
    }
}
