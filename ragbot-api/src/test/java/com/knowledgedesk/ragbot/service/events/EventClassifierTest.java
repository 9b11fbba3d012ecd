package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.model.Attachment;
import com.knowledgedesk.ragbot.model.EventKind;
import com.knowledgedesk.ragbot.model.InboundEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventClassifierTest {

    private final EventClassifier classifier = new EventClassifier();

    @Test
    void mentionWithoutLinksIsAQuestion() {
        ClassifiedEvent classified = classifier.classify(mention("<@U0BOT> What is the remote work policy?", List.of()));

        assertThat(classified.kind()).isEqualTo(EventKind.QUESTION);
        assertThat(classified.text()).isEqualTo("What is the remote work policy?");
        assertThat(classified.urls()).isEmpty();
    }

    @Test
    void attachmentsMakeAnUpload() {
        Attachment file = new Attachment("F1", "policy-a.pdf", "pdf", null);

        ClassifiedEvent classified = classifier.classify(mention("<@U0BOT> please index this", List.of(file)));

        assertThat(classified.kind()).isEqualTo(EventKind.UPLOAD);
    }

    @Test
    void slackFormattedLinksAreExtracted() {
        ClassifiedEvent classified = classifier.classify(mention(
                "<@U0BOT> import rag <https://intranet.example.com/policy-a|Policy A> and <https://wiki.example.com/b>.", List.of()));

        assertThat(classified.kind()).isEqualTo(EventKind.UPLOAD);
        assertThat(classified.urls()).containsExactly("https://intranet.example.com/policy-a", "https://wiki.example.com/b");
    }

    @Test
    void importKeywordWithoutLinkIsStillAnUpload() {
        ClassifiedEvent classified = classifier.classify(mention("<@U0BOT> Import RAG", List.of()));

        assertThat(classified.kind()).isEqualTo(EventKind.UPLOAD);
        assertThat(classified.urls()).isEmpty();
    }

    @Test
    void botMessagesAndOtherEventTypesAreIgnored() {
        InboundEvent fromBot = new InboundEvent("Ev1", "app_mention", null, "C1", null, "1.0", null, "B1", "hi", List.of());
        InboundEvent reaction = new InboundEvent("Ev2", "reaction_added", null, "C1", null, "1.0", "U1", null, "", List.of());

        assertThat(classifier.classify(fromBot).kind()).isEqualTo(EventKind.IGNORED);
        assertThat(classifier.classify(reaction).kind()).isEqualTo(EventKind.IGNORED);
    }

    @Test
    void trailingPunctuationIsTrimmedFromUrls() {
        assertThat(EventClassifier.extractUrls("see https://example.com/page), thanks"))
                .containsExactly("https://example.com/page");
        assertThat(EventClassifier.extractUrls("no links")).isEmpty();
    }

    private static InboundEvent mention(String text, List<Attachment> attachments) {
        return new InboundEvent("Ev1", "app_mention", null, "C1", null, "1700000000.000100", "U1", null, text, attachments);
    }
}
