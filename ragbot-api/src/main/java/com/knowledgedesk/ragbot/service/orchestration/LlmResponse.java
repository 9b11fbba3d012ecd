package com.knowledgedesk.ragbot.service.orchestration;

public record LlmResponse(String answer, String finishReason) {

    public boolean truncated() {
        return "length".equals(finishReason);
    }
}
