package com.knowledgedesk.ragbot.model;

import java.util.List;

/**
 * Reply to a question. {@code grounded} is false when nothing relevant was retrieved and the
 * generator was never asked.
 */
public record Answer(String text, List<Citation> citations, boolean grounded) {

    public Answer {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static Answer notFound(String text) {
        return new Answer(text, List.of(), false);
    }
}
