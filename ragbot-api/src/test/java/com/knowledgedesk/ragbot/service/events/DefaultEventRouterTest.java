package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.Answer;
import com.knowledgedesk.ragbot.model.Attachment;
import com.knowledgedesk.ragbot.model.Citation;
import com.knowledgedesk.ragbot.model.DocumentSource;
import com.knowledgedesk.ragbot.model.DocumentStatus;
import com.knowledgedesk.ragbot.model.InboundEvent;
import com.knowledgedesk.ragbot.model.IngestionReport;
import com.knowledgedesk.ragbot.service.dedup.ClaimOutcome;
import com.knowledgedesk.ragbot.service.dedup.ClaimResult;
import com.knowledgedesk.ragbot.service.dedup.DedupGuard;
import com.knowledgedesk.ragbot.service.embedding.EmbeddingUnavailableException;
import com.knowledgedesk.ragbot.service.ingestion.DocumentIds;
import com.knowledgedesk.ragbot.service.ingestion.IngestDocumentCommand;
import com.knowledgedesk.ragbot.service.ingestion.IngestionService;
import com.knowledgedesk.ragbot.service.retrieval.RagResponder;
import com.knowledgedesk.ragbot.service.slack.ChatPlatformClient;
import com.knowledgedesk.ragbot.service.slack.SlackApiException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DefaultEventRouterTest {

    private static final String CHANNEL = "C1";
    private static final String TS = "1700000000.000100";

    @Mock
    private DedupGuard dedupGuard;

    @Mock
    private IngestionService ingestionService;

    @Mock
    private RagResponder ragResponder;

    @Mock
    private ChatPlatformClient chatClient;

    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
    }

    @Test
    void questionIsAnsweredInTheThread() {
        when(dedupGuard.claim("Ev1")).thenReturn(ClaimResult.CLAIMED);
        when(ragResponder.answer("What is the remote work policy?")).thenReturn(new Answer("Three days a week [S1].",
                List.of(new Citation("file-f1", "Policy A", "https://files.example.com/policy-a.pdf", "[S1]")), true));

        RoutingDecision decision = router(Runnable::run, dedupGuard).route(mention("Ev1", "<@U0BOT> What is the remote work policy?"));

        assertThat(decision).isEqualTo(RoutingDecision.DISPATCHED);
        ArgumentCaptor<String> reply = ArgumentCaptor.forClass(String.class);
        verify(chatClient).postMessage(eq(CHANNEL), eq(TS), reply.capture());
        assertThat(reply.getValue()).startsWith("Three days a week [S1].").contains("*Sources:*", "[S1] Policy A");
        verify(dedupGuard).release("Ev1", ClaimOutcome.COMPLETED);
        assertThat(meterRegistry.counter("ragbot.events", "outcome", "dispatched").count()).isEqualTo(1.0);
    }

    @Test
    void duplicateDeliveryIsNotProcessed() {
        when(dedupGuard.claim("Ev1")).thenReturn(ClaimResult.ALREADY_CLAIMED);

        RoutingDecision decision = router(Runnable::run, dedupGuard).route(mention("Ev1", "<@U0BOT> hello?"));

        assertThat(decision).isEqualTo(RoutingDecision.DUPLICATE);
        verifyNoInteractions(ragResponder, ingestionService, chatClient);
        verify(dedupGuard, never()).release(anyString(), any());
    }

    @Test
    void botMessagesAreIgnoredWithoutClaiming() {
        InboundEvent fromBot = new InboundEvent("Ev1", "app_mention", null, CHANNEL, null, TS, null, "B1", "echo", List.of());

        assertThat(router(Runnable::run, dedupGuard).route(fromBot)).isEqualTo(RoutingDecision.IGNORED);
        verifyNoInteractions(dedupGuard, chatClient);
    }

    @Test
    void unavailableBackendProducesOneApology() {
        when(dedupGuard.claim("Ev1")).thenReturn(ClaimResult.CLAIMED);
        when(ragResponder.answer(anyString())).thenThrow(new EmbeddingUnavailableException("still unavailable after 4 attempts"));

        router(Runnable::run, dedupGuard).route(mention("Ev1", "<@U0BOT> Is remote work allowed?"));

        verify(chatClient, times(1)).postMessage(CHANNEL, TS, ReplyFormatter.UNAVAILABLE);
        verify(dedupGuard).release("Ev1", ClaimOutcome.FAILED);
    }

    @Test
    void unexpectedFailureIsReportedAndReleased() {
        when(dedupGuard.claim("Ev1")).thenReturn(ClaimResult.CLAIMED);
        when(ragResponder.answer(anyString())).thenThrow(new IllegalStateException("boom"));

        router(Runnable::run, dedupGuard).route(mention("Ev1", "<@U0BOT> Is remote work allowed?"));

        verify(chatClient).postMessage(CHANNEL, TS, ReplyFormatter.UNEXPECTED);
        verify(dedupGuard).release("Ev1", ClaimOutcome.FAILED);
    }

    @Test
    void attachmentIsDownloadedAndIngested() {
        Attachment file = new Attachment("F1", "policy-a.pdf", "pdf", "https://files.example.com/F1/policy-a.pdf");
        when(dedupGuard.claim("Ev2")).thenReturn(ClaimResult.CLAIMED);
        when(chatClient.downloadFile(file)).thenReturn(new byte[]{1, 2, 3});
        when(ingestionService.ingest(any())).thenReturn(indexed("file-f1", "policy-a.pdf"));

        router(Runnable::run, dedupGuard).route(upload("Ev2", file));

        ArgumentCaptor<IngestDocumentCommand> command = ArgumentCaptor.forClass(IngestDocumentCommand.class);
        verify(ingestionService).ingest(command.capture());
        assertThat(command.getValue().documentId()).isEqualTo("file-f1");
        assertThat(command.getValue().eventId()).isEqualTo("Ev2");
        verify(chatClient).postMessage(eq(CHANNEL), eq(TS), contains("Added *policy-a.pdf*"));
        verify(dedupGuard).release("Ev2", ClaimOutcome.COMPLETED);
    }

    @Test
    void unsupportedAttachmentIsRefused() {
        Attachment file = new Attachment("F9", "clip.mp4", "mp4", null);
        when(dedupGuard.claim("Ev3")).thenReturn(ClaimResult.CLAIMED);

        router(Runnable::run, dedupGuard).route(upload("Ev3", file));

        verify(chatClient).postMessage(eq(CHANNEL), eq(TS), contains("Unsupported file type"));
        verify(chatClient, never()).downloadFile(any());
        verifyNoInteractions(ingestionService);
        verify(dedupGuard).release("Ev3", ClaimOutcome.FAILED);
    }

    @Test
    void failedDownloadIsReported() {
        Attachment file = new Attachment("F1", "policy-a.pdf", "pdf", null);
        when(dedupGuard.claim("Ev4")).thenReturn(ClaimResult.CLAIMED);
        when(chatClient.downloadFile(file)).thenThrow(new SlackApiException("HTTP 403"));

        router(Runnable::run, dedupGuard).route(upload("Ev4", file));

        verify(chatClient).postMessage(eq(CHANNEL), eq(TS), contains("Could not download"));
        verifyNoInteractions(ingestionService);
    }

    @Test
    void linksInAMentionAreImported() {
        String url = "https://intranet.example.com/policy-a";
        when(dedupGuard.claim("Ev5")).thenReturn(ClaimResult.CLAIMED);
        when(ingestionService.ingest(any())).thenReturn(indexed(DocumentIds.forUrl(url), "Policy A"));

        router(Runnable::run, dedupGuard).route(mention("Ev5", "<@U0BOT> import rag <" + url + "|Policy A>"));

        ArgumentCaptor<IngestDocumentCommand> command = ArgumentCaptor.forClass(IngestDocumentCommand.class);
        verify(ingestionService).ingest(command.capture());
        assertThat(command.getValue().source()).isEqualTo(url);
        assertThat(command.getValue().sourceKind()).isEqualTo(DocumentSource.URL);
        verify(dedupGuard).release("Ev5", ClaimOutcome.COMPLETED);
    }

    @Test
    void rejectedTaskDropsTheClaimForRedelivery() {
        when(dedupGuard.claim("Ev6")).thenReturn(ClaimResult.CLAIMED);
        Executor rejecting = task -> {
            throw new RejectedExecutionException("pool shut down");
        };

        RoutingDecision decision = router(rejecting, dedupGuard).route(mention("Ev6", "<@U0BOT> hello?"));

        assertThat(decision).isEqualTo(RoutingDecision.REJECTED);
        verify(dedupGuard).forget("Ev6");
        verify(dedupGuard, never()).release(anyString(), any());
        verifyNoInteractions(ragResponder);
    }

    @Test
    void redeliveredUploadIsIngestedOnce() {
        DedupGuard inMemoryGuard = new InMemoryDedupGuard();
        Attachment file = new Attachment("F1", "policy-a.pdf", "pdf", null);
        when(chatClient.downloadFile(file)).thenReturn(new byte[]{1});
        when(ingestionService.ingest(any())).thenReturn(indexed("file-f1", "policy-a.pdf"));
        DefaultEventRouter router = router(Runnable::run, inMemoryGuard);

        assertThat(router.route(upload("Ev7", file))).isEqualTo(RoutingDecision.DISPATCHED);
        assertThat(router.route(upload("Ev7", file))).isEqualTo(RoutingDecision.DUPLICATE);

        verify(ingestionService, times(1)).ingest(any());
        verify(chatClient, times(1)).postMessage(eq(CHANNEL), eq(TS), anyString());
    }

    private DefaultEventRouter router(Executor executor, DedupGuard guard) {
        return new DefaultEventRouter(new EventClassifier(), guard, ingestionService, ragResponder, chatClient,
                executor, RagbotProperties.defaults(), meterRegistry);
    }

    private static InboundEvent mention(String eventId, String text) {
        return new InboundEvent(eventId, "app_mention", null, CHANNEL, null, TS, "U1", null, text, List.of());
    }

    private static InboundEvent upload(String eventId, Attachment attachment) {
        return new InboundEvent(eventId, "app_mention", null, CHANNEL, null, TS, "U1", null, "<@U0BOT>", List.of(attachment));
    }

    private static IngestionReport indexed(String documentId, String title) {
        return new IngestionReport(documentId, title, DocumentSource.FILE, title, DocumentStatus.INDEXED, 3, false, null,
                OffsetDateTime.parse("2026-03-02T09:00:00Z"));
    }

    private static final class InMemoryDedupGuard implements DedupGuard {

        private final Map<String, ClaimOutcome> claims = new ConcurrentHashMap<>();

        @Override
        public ClaimResult claim(String eventId) {
            return claims.putIfAbsent(eventId, ClaimOutcome.IN_PROGRESS) == null ? ClaimResult.CLAIMED : ClaimResult.ALREADY_CLAIMED;
        }

        @Override
        public void release(String eventId, ClaimOutcome outcome) {
            claims.replace(eventId, ClaimOutcome.IN_PROGRESS, outcome);
        }

        @Override
        public boolean forget(String eventId) {
            return claims.remove(eventId) != null;
        }

        @Override
        public int purgeExpired() {
            return 0;
        }
    }
}
