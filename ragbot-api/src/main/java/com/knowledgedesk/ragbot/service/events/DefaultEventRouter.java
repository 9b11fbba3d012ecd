package com.knowledgedesk.ragbot.service.events;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.Answer;
import com.knowledgedesk.ragbot.model.Attachment;
import com.knowledgedesk.ragbot.model.EventKind;
import com.knowledgedesk.ragbot.model.InboundEvent;
import com.knowledgedesk.ragbot.model.IngestionReport;
import com.knowledgedesk.ragbot.service.PipelineException;
import com.knowledgedesk.ragbot.service.dedup.ClaimOutcome;
import com.knowledgedesk.ragbot.service.dedup.ClaimResult;
import com.knowledgedesk.ragbot.service.dedup.DedupGuard;
import com.knowledgedesk.ragbot.service.ingestion.IngestDocumentCommand;
import com.knowledgedesk.ragbot.service.ingestion.IngestionService;
import com.knowledgedesk.ragbot.service.retrieval.RagResponder;
import com.knowledgedesk.ragbot.service.slack.ChatPlatformClient;
import com.knowledgedesk.ragbot.service.slack.SlackApiException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

@Service
public class DefaultEventRouter implements EventRouter {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventRouter.class);

    private final EventClassifier classifier;
    private final DedupGuard dedupGuard;
    private final IngestionService ingestionService;
    private final RagResponder ragResponder;
    private final ChatPlatformClient chatClient;
    private final Executor executor;
    private final List<String> allowedFileTypes;
    private final MeterRegistry meterRegistry;

    public DefaultEventRouter(EventClassifier classifier,
                              DedupGuard dedupGuard,
                              IngestionService ingestionService,
                              RagResponder ragResponder,
                              ChatPlatformClient chatClient,
                              @Qualifier("eventProcessingExecutor") Executor executor,
                              RagbotProperties properties,
                              MeterRegistry meterRegistry) {
        this.classifier = classifier;
        this.dedupGuard = dedupGuard;
        this.ingestionService = ingestionService;
        this.ragResponder = ragResponder;
        this.chatClient = chatClient;
        this.executor = executor;
        this.allowedFileTypes = properties.slack().allowedFileTypes();
        this.meterRegistry = meterRegistry;
    }

    @Override
    public RoutingDecision route(InboundEvent event) {
        if (event == null || event.eventId() == null || event.eventId().isBlank()) {
            log.warn("Dropping event without an id");
            return count(RoutingDecision.IGNORED);
        }
        ClassifiedEvent classified = classifier.classify(event);
        if (classified.kind() == EventKind.IGNORED) {
            log.debug("Ignoring event {} of type {}", event.eventId(), event.type());
            return count(RoutingDecision.IGNORED);
        }
        if (dedupGuard.claim(event.eventId()) == ClaimResult.ALREADY_CLAIMED) {
            log.info("Skipping duplicate delivery of event {}", event.eventId());
            return count(RoutingDecision.DUPLICATE);
        }
        try {
            executor.execute(() -> process(classified));
        } catch (RejectedExecutionException ex) {
            log.error("Could not schedule event {}, dropping its claim for redelivery", event.eventId(), ex);
            dedupGuard.forget(event.eventId());
            return count(RoutingDecision.REJECTED);
        }
        return count(RoutingDecision.DISPATCHED);
    }

    void process(ClassifiedEvent classified) {
        InboundEvent event = classified.event();
        ClaimOutcome outcome = ClaimOutcome.FAILED;
        try {
            outcome = classified.kind() == EventKind.UPLOAD ? handleUpload(classified) : handleQuestion(classified);
        } catch (RuntimeException ex) {
            log.error("Processing event {} failed", event.eventId(), ex);
            reply(event, ReplyFormatter.UNEXPECTED);
        } finally {
            try {
                dedupGuard.release(event.eventId(), outcome);
            } catch (RuntimeException ex) {
                log.error("Could not record outcome {} for event {}", outcome, event.eventId(), ex);
            }
        }
    }

    private ClaimOutcome handleQuestion(ClassifiedEvent classified) {
        InboundEvent event = classified.event();
        try {
            Answer answer = ragResponder.answer(classified.text());
            reply(event, ReplyFormatter.answer(answer));
            return ClaimOutcome.COMPLETED;
        } catch (PipelineException ex) {
            log.warn("Could not answer event {} ({} stage): {}", event.eventId(), ex.stage(), ex.getMessage());
            reply(event, ReplyFormatter.UNAVAILABLE);
            return ClaimOutcome.FAILED;
        }
    }

    private ClaimOutcome handleUpload(ClassifiedEvent classified) {
        InboundEvent event = classified.event();
        boolean allSucceeded = true;
        for (Attachment attachment : event.attachments()) {
            allSucceeded &= ingestAttachment(event, attachment);
        }
        for (String url : classified.urls()) {
            IngestionReport report = ingestionService.ingest(IngestDocumentCommand.forUrl(url, event.eventId()));
            reply(event, ReplyFormatter.ingestion(report));
            allSucceeded &= report.indexed();
        }
        if (event.attachments().isEmpty() && classified.urls().isEmpty()) {
            reply(event, ReplyFormatter.NO_URL);
        }
        return allSucceeded ? ClaimOutcome.COMPLETED : ClaimOutcome.FAILED;
    }

    private boolean ingestAttachment(InboundEvent event, Attachment attachment) {
        if (!allowedFileTypes.contains(attachment.normalisedType())) {
            reply(event, ReplyFormatter.unsupported(attachment.name(), allowedFileTypes));
            return false;
        }
        byte[] content;
        try {
            content = chatClient.downloadFile(attachment);
        } catch (SlackApiException ex) {
            log.warn("Download of {} for event {} failed: {}", attachment.id(), event.eventId(), ex.getMessage());
            reply(event, ReplyFormatter.downloadFailed(attachment.name()));
            return false;
        }
        IngestionReport report = ingestionService.ingest(IngestDocumentCommand.forAttachment(attachment, content, event.eventId()));
        reply(event, ReplyFormatter.ingestion(report));
        return report.indexed();
    }

    private void reply(InboundEvent event, String text) {
        chatClient.postMessage(event.channel(), event.replyThread(), text);
    }

    private RoutingDecision count(RoutingDecision decision) {
        meterRegistry.counter("ragbot.events", "outcome", decision.name().toLowerCase(Locale.ROOT)).increment();
        return decision;
    }
}
