package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.model.DocumentSource;
import com.knowledgedesk.ragbot.model.DocumentStatus;
import com.knowledgedesk.ragbot.model.IngestionReport;
import com.knowledgedesk.ragbot.persistence.entity.DocumentEntity;
import com.knowledgedesk.ragbot.persistence.repository.DocumentRepository;
import com.knowledgedesk.ragbot.service.PipelineException;
import com.knowledgedesk.ragbot.service.embedding.EmbeddingRejectedException;
import com.knowledgedesk.ragbot.service.embedding.EmbeddingsClient;
import com.knowledgedesk.ragbot.service.index.IndexRecord;
import com.knowledgedesk.ragbot.service.index.IndexUnavailableException;
import com.knowledgedesk.ragbot.service.index.UpsertResult;
import com.knowledgedesk.ragbot.service.index.VectorStoreClient;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class DefaultIngestionService implements IngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultIngestionService.class);

    private final DocumentTextExtractor textExtractor;
    private final UrlContentFetcher urlContentFetcher;
    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final VectorStoreClient vectorStoreClient;
    private final DocumentRepository documentRepository;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Counter indexedCounter;
    private final Counter failedCounter;
    private final Counter dedupCounter;
    private final Timer ingestionTimer;

    public DefaultIngestionService(DocumentTextExtractor textExtractor,
                                   UrlContentFetcher urlContentFetcher,
                                   TextChunker textChunker,
                                   EmbeddingsClient embeddingsClient,
                                   VectorStoreClient vectorStoreClient,
                                   DocumentRepository documentRepository,
                                   Clock clock,
                                   MeterRegistry meterRegistry) {
        this.textExtractor = textExtractor;
        this.urlContentFetcher = urlContentFetcher;
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.vectorStoreClient = vectorStoreClient;
        this.documentRepository = documentRepository;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.indexedCounter = meterRegistry.counter("ragbot.ingest.documents", "outcome", "indexed");
        this.failedCounter = meterRegistry.counter("ragbot.ingest.documents", "outcome", "failed");
        this.dedupCounter = meterRegistry.counter("ragbot.ingest.documents", "outcome", "deduplicated");
        this.ingestionTimer = meterRegistry.timer("ragbot.ingest.duration");
    }

    @Override
    public IngestionReport ingest(IngestDocumentCommand command) {
        if (command == null || command.documentId() == null || command.documentId().isBlank()) {
            throw IngestionException.invalidRequest("A document id is required");
        }
        if (command.sourceKind() == DocumentSource.FILE && !command.hasContent()) {
            throw IngestionException.invalidRequest("Uploaded file is empty");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return ingestInternal(command);
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    @Override
    public Optional<IngestionReport> find(String documentId) {
        return documentRepository.findById(documentId).map(entity -> toReport(entity, false));
    }

    @Override
    public List<IngestionReport> recent(DocumentStatus status) {
        List<DocumentEntity> entities = status == null
                ? documentRepository.findTop50ByOrderByUpdatedAtDesc()
                : documentRepository.findByStatusOrderByUpdatedAtDesc(status);
        return entities.stream().map(entity -> toReport(entity, false)).toList();
    }

    @Override
    public boolean delete(String documentId) {
        Optional<DocumentEntity> existing = documentRepository.findById(documentId);
        if (existing.isEmpty()) {
            return false;
        }
        long removed = vectorStoreClient.deleteByDocument(documentId);
        documentRepository.delete(existing.get());
        log.info("Deleted document {} and {} index records", documentId, removed);
        return true;
    }

    private IngestionReport ingestInternal(IngestDocumentCommand command) {
        String documentId = command.documentId();
        DocumentEntity existing = documentRepository.findById(documentId).orElse(null);

        DocumentTextExtractor.ExtractedDocument extracted;
        DocumentType type;
        try {
            LoadedContent content = load(command);
            type = content.type();
            extracted = textExtractor.extract(type, content.filename(), content.sourceUrl(), content.bytes());
        } catch (PipelineException ex) {
            String title = resolveTitle(command.title(), null, command);
            if (existing != null && existing.getStatus() == DocumentStatus.INDEXED) {
                // the indexed version stays live; only this attempt is reported as failed
                log.warn("New version of document {} could not be read, keeping the indexed one: {}", documentId, ex.getMessage());
                failedCounter.increment();
                return new IngestionReport(documentId, title, command.sourceKind(), existing.getSource(),
                        DocumentStatus.FAILED, 0, false, ex.getMessage(), now());
            }
            return fail(existing != null ? existing : newEntity(command, title), title, command, ex, false);
        }

        String title = resolveTitle(command.title(), extracted.metadata().title(), command);
        String contentHash = DocumentIds.sha256(normaliseWhitespace(extracted.text()));
        String modelVersion = embeddingsClient.modelVersion();
        if (existing != null
                && existing.getStatus() == DocumentStatus.INDEXED
                && contentHash.equals(existing.getContentHash())
                && modelVersion.equals(existing.getModelVersion())) {
            dedupCounter.increment();
            log.info("Skipped re-ingestion of document {}: content unchanged", documentId);
            return toReport(existing, true);
        }

        DocumentEntity entity = existing != null ? existing : newEntity(command, title);
        boolean replacing = existing != null;
        entity.startAttempt(title, command.eventId(), now());
        entity.setContentHash(contentHash);
        entity.setContentType(extracted.metadata().contentType());
        entity.setModelVersion(modelVersion);
        entity = documentRepository.save(entity);

        try {
            entity = advance(entity, DocumentStatus.CHUNKING);
            List<Chunk> chunks = textChunker.chunk(documentId, extracted.text(), type);
            if (chunks.isEmpty()) {
                throw new ExtractionException("No content chunks were produced for " + title);
            }

            entity = advance(entity, DocumentStatus.EMBEDDING);
            EmbeddingsClient.EmbeddingBatch embeddings = embeddingsClient.embed(chunks.stream().map(Chunk::text).toList());
            if (embeddings.vectors().size() != chunks.size()) {
                throw new EmbeddingRejectedException("Embedding returned " + embeddings.vectors().size()
                        + " vectors for " + chunks.size() + " chunks");
            }

            if (replacing) {
                vectorStoreClient.deleteByDocument(documentId);
            }
            List<IndexRecord> records = toRecords(command, title, extracted.metadata(), chunks, embeddings);
            UpsertResult result = vectorStoreClient.upsert(records);
            if (result.partialFailure()) {
                throw new IndexUnavailableException(result.failedChunkIds().size() + " of " + records.size()
                        + " records could not be stored");
            }

            entity.setChunks(chunks.size());
            entity = advance(entity, DocumentStatus.INDEXED);
            indexedCounter.increment();
            log.info("Indexed document {} ({}) with {} chunks", documentId, title, chunks.size());
            return toReport(entity, false);
        } catch (PipelineException ex) {
            return fail(entity, title, command, ex, true);
        } catch (RuntimeException ex) {
            log.error("Unexpected failure while ingesting document {}", documentId, ex);
            return fail(entity, title, command, new ExtractionException("Unexpected ingestion failure: " + ex.getMessage(), ex), true);
        }
    }

    private IngestionReport fail(DocumentEntity entity,
                                 String title,
                                 IngestDocumentCommand command,
                                 PipelineException cause,
                                 boolean indexTouched) {
        log.warn("Ingestion of document {} failed at {} ({}): {}", command.documentId(), cause.stage(),
                cause.isTransient() ? "transient" : "permanent", cause.getMessage());
        if (indexTouched) {
            rollback(command.documentId());
        }
        if (entity.getStatus().isTerminal()) {
            entity.startAttempt(title, command.eventId(), now());
        }
        entity.markFailed(cause.getMessage(), now());
        DocumentEntity saved = documentRepository.save(entity);
        failedCounter.increment();
        return toReport(saved, false);
    }

    private void rollback(String documentId) {
        try {
            long removed = vectorStoreClient.deleteByDocument(documentId);
            if (removed > 0) {
                log.info("Rolled back {} index records of document {}", removed, documentId);
            }
        } catch (RuntimeException ex) {
            log.error("Rollback of document {} failed; index records may remain", documentId, ex);
        }
    }

    private DocumentEntity advance(DocumentEntity entity, DocumentStatus next) {
        entity.transitionTo(next, now());
        return documentRepository.save(entity);
    }

    private LoadedContent load(IngestDocumentCommand command) {
        if (command.sourceKind() == DocumentSource.URL) {
            UrlContentFetcher.FetchedContent fetched = urlContentFetcher.fetch(command.source());
            DocumentType type = DocumentType.fromContentType(fetched.contentType())
                    .or(() -> DocumentType.fromFileType(FilenameUtils.getExtension(pathOf(fetched.url()))))
                    .orElseThrow(() -> new UnsupportedDocumentTypeException(
                            "Unsupported content type " + fetched.contentType() + " at " + fetched.url()));
            return new LoadedContent(type, pathOf(fetched.url()), fetched.url(), fetched.body());
        }
        String fileType = command.fileType() != null && !command.fileType().isBlank()
                ? command.fileType()
                : FilenameUtils.getExtension(command.filename() == null ? "" : command.filename());
        DocumentType type = DocumentType.fromFileType(fileType)
                .orElseThrow(() -> new UnsupportedDocumentTypeException("Unsupported file type: "
                        + (fileType == null || fileType.isBlank() ? "unknown" : fileType)));
        return new LoadedContent(type, command.filename(), null, command.bytes());
    }

    private List<IndexRecord> toRecords(IngestDocumentCommand command,
                                        String title,
                                        DocumentMetadata metadata,
                                        List<Chunk> chunks,
                                        EmbeddingsClient.EmbeddingBatch embeddings) {
        List<IndexRecord> records = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            Map<String, String> fields = new LinkedHashMap<>(metadata.asChunkMetadata());
            fields.putAll(chunk.metadata());
            records.add(new IndexRecord(chunk.chunkId(), command.documentId(), title, command.source(), chunk.text(),
                    chunk.sequenceIndex(), embeddings.vectors().get(i), embeddings.model(), fields));
        }
        return records;
    }

    private DocumentEntity newEntity(IngestDocumentCommand command, String title) {
        String source = command.source() == null ? command.documentId() : command.source();
        return new DocumentEntity(command.documentId(), command.sourceKind(), source, title, now());
    }

    private IngestionReport toReport(DocumentEntity entity, boolean deduplicated) {
        return new IngestionReport(entity.getDocumentId(), entity.getTitle(), entity.getSourceKind(), entity.getSource(),
                entity.getStatus(), entity.getChunks(), deduplicated, entity.getFailureReason(), entity.getUpdatedAt());
    }

    private String resolveTitle(String preferred, String extracted, IngestDocumentCommand command) {
        String title;
        if (preferred != null && !preferred.isBlank()) {
            title = preferred.trim();
        } else if (extracted != null && !extracted.isBlank()) {
            title = extracted.trim();
        } else {
            title = command.source() != null ? command.source() : "Document";
        }
        return title.length() <= DocumentEntity.TITLE_MAX_LENGTH ? title : title.substring(0, DocumentEntity.TITLE_MAX_LENGTH);
    }

    private String pathOf(String url) {
        try {
            String path = URI.create(url).getPath();
            return path == null ? "" : path;
        } catch (IllegalArgumentException ex) {
            return "";
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private String normaliseWhitespace(String value) {
        return value == null ? "" : value.replaceAll("\\s+", " ").trim();
    }

    private record LoadedContent(DocumentType type, String filename, String sourceUrl, byte[] bytes) {}
}
