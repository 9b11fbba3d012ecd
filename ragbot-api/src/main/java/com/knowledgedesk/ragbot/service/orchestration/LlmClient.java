package com.knowledgedesk.ragbot.service.orchestration;

public interface LlmClient {

    /**
     * Generates an answer from the labelled passages.
     *
     * @throws GenerationUnavailableException when the model cannot be reached or returns nothing usable
     */
    LlmResponse generate(LlmRequest request);
}
