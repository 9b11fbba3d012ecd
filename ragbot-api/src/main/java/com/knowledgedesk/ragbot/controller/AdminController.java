package com.knowledgedesk.ragbot.controller;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.DocumentStatus;
import com.knowledgedesk.ragbot.model.IngestUrlRequest;
import com.knowledgedesk.ragbot.model.IngestionReport;
import com.knowledgedesk.ragbot.service.dedup.DedupGuard;
import com.knowledgedesk.ragbot.service.ingestion.IngestDocumentCommand;
import com.knowledgedesk.ragbot.service.ingestion.IngestionException;
import com.knowledgedesk.ragbot.service.ingestion.IngestionService;
import jakarta.validation.Valid;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/admin")
@Validated
public class AdminController {

    private final IngestionService ingestionService;
    private final DedupGuard dedupGuard;
    private final int maxUploadBytes;

    public AdminController(IngestionService ingestionService, DedupGuard dedupGuard, RagbotProperties properties) {
        this.ingestionService = ingestionService;
        this.dedupGuard = dedupGuard;
        this.maxUploadBytes = properties.fetch().maxBytes();
    }

    @PostMapping(value = "/ingest/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestionReport> upload(@RequestPart("file") FilePart file,
                                        @RequestPart(value = "title", required = false) String title) {
        return DataBufferUtils.join(file.content(), maxUploadBytes)
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .onErrorMap(DataBufferLimitException.class,
                        ex -> IngestionException.uploadTooLarge(file.filename(), maxUploadBytes, ex))
                .defaultIfEmpty(new byte[0])
                .publishOn(Schedulers.boundedElastic())
                .map(bytes -> ingestionService.ingest(IngestDocumentCommand.forUpload(file.filename(), title, bytes)));
    }

    @PostMapping(value = "/ingest/url", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestionReport> ingestUrl(@Valid @RequestBody IngestUrlRequest request) {
        IngestDocumentCommand command = IngestDocumentCommand.forUrl(request.url().trim(), null).withTitle(request.title());
        return Mono.fromCallable(() -> ingestionService.ingest(command))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/documents", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<IngestionReport>> documents(@RequestParam(value = "status", required = false) DocumentStatus status) {
        return Mono.fromCallable(() -> ingestionService.recent(status))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping(value = "/documents/{documentId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IngestionReport> document(@PathVariable String documentId) {
        return Mono.fromCallable(() -> ingestionService.find(documentId)
                        .orElseThrow(() -> IngestionException.documentNotFound(documentId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/documents/{documentId}")
    public Mono<ResponseEntity<Void>> deleteDocument(@PathVariable String documentId) {
        return Mono.fromCallable(() -> ingestionService.delete(documentId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(AdminController::noContentOrNotFound);
    }

    @DeleteMapping("/events/{eventId}/claim")
    public Mono<ResponseEntity<Void>> forgetEvent(@PathVariable String eventId) {
        return Mono.fromCallable(() -> dedupGuard.forget(eventId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(AdminController::noContentOrNotFound);
    }

    private static ResponseEntity<Void> noContentOrNotFound(boolean found) {
        return found ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }
}
