package com.knowledgedesk.ragbot.service.retrieval;

import com.knowledgedesk.ragbot.model.Answer;

public interface RagResponder {

    Answer answer(String question);
}
