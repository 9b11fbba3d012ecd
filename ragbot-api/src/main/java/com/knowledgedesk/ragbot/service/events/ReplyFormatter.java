package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.model.Answer;
import com.knowledgedesk.ragbot.model.Citation;
import com.knowledgedesk.ragbot.model.DocumentSource;
import com.knowledgedesk.ragbot.model.IngestionReport;

import java.util.List;

final class ReplyFormatter {

    static final String UNAVAILABLE = "Sorry, I can't answer right now because a backing service is unavailable. Please try again in a moment.";
    static final String UNEXPECTED = "Sorry, something went wrong while handling your message.";
    static final String NO_URL = "I couldn't find a URL to import in your message.";

    private ReplyFormatter() {
    }

    static String answer(Answer answer) {
        if (answer.citations().isEmpty()) {
            return answer.text();
        }
        StringBuilder builder = new StringBuilder(answer.text()).append("\n\n*Sources:*");
        for (Citation citation : answer.citations()) {
            builder.append("\n• ").append(citation.reference()).append(' ').append(citation.title());
            if (citation.source() != null && citation.source().startsWith("http")) {
                builder.append(" <").append(citation.source()).append('>');
            }
        }
        return builder.toString();
    }

    static String ingestion(IngestionReport report) {
        if (report.deduplicated()) {
            return "*" + report.title() + "* is already indexed and has not changed.";
        }
        if (report.indexed()) {
            return "Added *" + report.title() + "* to the knowledge base (" + report.chunks() + " chunks).";
        }
        String what = report.sourceKind() == DocumentSource.URL ? report.source() : report.title();
        return "Could not add *" + what + "*: " + report.failureReason();
    }

    static String unsupported(String name, List<String> allowed) {
        return "Unsupported file type for *" + name + "*. Supported types: " + String.join(", ", allowed) + ".";
    }

    static String downloadFailed(String name) {
        return "Could not download *" + name + "*. Please try uploading it again.";
    }
}
