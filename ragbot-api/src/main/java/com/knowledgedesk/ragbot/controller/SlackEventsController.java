package com.knowledgedesk.ragbot.controller;

import com.knowledgedesk.ragbot.model.SlackEventEnvelope;
import com.knowledgedesk.ragbot.service.events.EventRouter;
import com.knowledgedesk.ragbot.service.events.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Locale;
import java.util.Map;

/**
 * Slack Events API webhook. Events are only claimed and handed to the worker pool here; replies are
 * posted to the thread once processing finishes.
 */
@RestController
@RequestMapping("/api/slack")
public class SlackEventsController {

    private static final Logger log = LoggerFactory.getLogger(SlackEventsController.class);

    static final String URL_VERIFICATION = "url_verification";
    static final String EVENT_CALLBACK = "event_callback";

    private final EventRouter eventRouter;

    public SlackEventsController(EventRouter eventRouter) {
        this.eventRouter = eventRouter;
    }

    @PostMapping(value = "/events", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Map<String, Object>>> events(@RequestBody SlackEventEnvelope envelope,
                                                            @RequestHeader(value = "X-Slack-Retry-Num", required = false) String retryNum) {
        if (URL_VERIFICATION.equals(envelope.type())) {
            if (envelope.challenge() == null) {
                return Mono.just(ResponseEntity.badRequest().body(Map.<String, Object>of("error", "challenge is required")));
            }
            return Mono.just(ResponseEntity.ok(Map.<String, Object>of("challenge", envelope.challenge())));
        }
        if (!EVENT_CALLBACK.equals(envelope.type())) {
            log.debug("Acknowledging unsupported envelope type {}", envelope.type());
            return Mono.just(ResponseEntity.ok(Map.<String, Object>of("status", "ignored")));
        }
        if (retryNum != null) {
            log.info("Slack redelivery #{} of event {}", retryNum, envelope.eventId());
        }
        // the claim is a blocking database write
        return Mono.fromCallable(() -> eventRouter.route(envelope.toInboundEvent()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(decision -> ResponseEntity.status(decision == RoutingDecision.REJECTED ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK)
                        .body(Map.<String, Object>of("status", decision.name().toLowerCase(Locale.ROOT))));
    }
}
