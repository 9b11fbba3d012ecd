package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.model.EventKind;
import com.knowledgedesk.ragbot.model.InboundEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Attachments or links in a mention mean "ingest this"; anything else is a question.
 */
@Component
public class EventClassifier {

    static final String IMPORT_KEYWORD = "import rag";

    private static final Pattern MENTION = Pattern.compile("<@[A-Z0-9]+(\\|[^>]*)?>");
    private static final Pattern URL = Pattern.compile("(https?://[^\\s<>|]+)");
    private static final Pattern TRAILING_NOISE = Pattern.compile("[^\\w/:.-]+$");

    public ClassifiedEvent classify(InboundEvent event) {
        if (event == null || event.fromBot() || !"app_mention".equals(event.type())) {
            return new ClassifiedEvent(event, EventKind.IGNORED, "", List.of());
        }
        String text = MENTION.matcher(event.text()).replaceAll(" ").replaceAll("\\s+", " ").trim();
        if (!event.attachments().isEmpty()) {
            return new ClassifiedEvent(event, EventKind.UPLOAD, text, extractUrls(text));
        }
        List<String> urls = extractUrls(text);
        if (!urls.isEmpty() || text.toLowerCase(Locale.ROOT).contains(IMPORT_KEYWORD)) {
            return new ClassifiedEvent(event, EventKind.UPLOAD, text, urls);
        }
        return new ClassifiedEvent(event, EventKind.QUESTION, text, List.of());
    }

    static List<String> extractUrls(String text) {
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL.matcher(text == null ? "" : text);
        while (matcher.find()) {
            String url = TRAILING_NOISE.matcher(matcher.group(1)).replaceAll("");
            if (url.length() > "https://".length()) {
                urls.add(url);
            }
        }
        return new ArrayList<>(urls);
    }
}
