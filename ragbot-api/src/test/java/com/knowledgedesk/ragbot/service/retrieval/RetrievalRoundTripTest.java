package com.knowledgedesk.ragbot.service.retrieval;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.Answer;
import com.knowledgedesk.ragbot.model.DocumentStatus;
import com.knowledgedesk.ragbot.model.IngestionReport;
import com.knowledgedesk.ragbot.persistence.entity.DocumentEntity;
import com.knowledgedesk.ragbot.persistence.repository.DocumentRepository;
import com.knowledgedesk.ragbot.service.embedding.BatchingEmbeddingsClient;
import com.knowledgedesk.ragbot.service.embedding.EmbeddingsClient;
import com.knowledgedesk.ragbot.service.embedding.EmbeddingsEndpoint;
import com.knowledgedesk.ragbot.service.index.InMemoryVectorStoreClient;
import com.knowledgedesk.ragbot.service.index.IndexRecord;
import com.knowledgedesk.ragbot.service.index.ScoredRecord;
import com.knowledgedesk.ragbot.service.index.UpsertResult;
import com.knowledgedesk.ragbot.service.ingestion.Chunk;
import com.knowledgedesk.ragbot.service.ingestion.DefaultIngestionService;
import com.knowledgedesk.ragbot.service.ingestion.DocumentType;
import com.knowledgedesk.ragbot.service.ingestion.HtmlMainContentExtractor;
import com.knowledgedesk.ragbot.service.ingestion.IngestDocumentCommand;
import com.knowledgedesk.ragbot.service.ingestion.PdfPageExtractor;
import com.knowledgedesk.ragbot.service.ingestion.SentenceWindowChunker;
import com.knowledgedesk.ragbot.service.ingestion.SpreadsheetRowExtractor;
import com.knowledgedesk.ragbot.service.ingestion.TikaDocumentTextExtractor;
import com.knowledgedesk.ragbot.service.ingestion.TypeDispatchingTextExtractor;
import com.knowledgedesk.ragbot.service.ingestion.UrlContentFetcher;
import com.knowledgedesk.ragbot.service.orchestration.TemplateLlmClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Ingestion and answering wired together over an in-memory index and a bag-of-words embedding.
 */
class RetrievalRoundTripTest {

    private static final String POLICY_A = "Employees may work remotely up to three days per week. "
            + "Remote work requires approval from your manager.";
    private static final String POLICY_B = "Expense reports must be submitted within thirty days. "
            + "Receipts are required for all expenses.";
    private static final String HANDBOOK = "Badges are issued at reception on the first day. "
            + "Laptops are shipped to new hires one week before they start. "
            + "The cafeteria serves lunch between noon and two. "
            + "Parking permits are requested through the facilities portal. "
            + "Security training must be completed within the first month.";

    private final Map<String, DocumentEntity> documents = new ConcurrentHashMap<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private RagbotProperties properties;
    private SentenceWindowChunker chunker;
    private EmbeddingsClient embeddingsClient;
    private DefaultRagResponder responder;

    @BeforeEach
    void setUp() {
        properties = RagbotProperties.defaults().withChunking(new RagbotProperties.Chunking(16, 4));
        chunker = new SentenceWindowChunker(properties);
        embeddingsClient = new BatchingEmbeddingsClient(new BagOfWordsEndpoint(), properties, meterRegistry);
    }

    @Test
    void remoteWorkQuestionIsAnsweredFromPolicyA() {
        InMemoryVectorStoreClient store = new InMemoryVectorStoreClient();
        DefaultIngestionService ingestion = ingestion(store);
        ingestion.ingest(upload("policy-a.txt", "Policy A", POLICY_A));
        ingestion.ingest(upload("policy-b.txt", "Policy B", POLICY_B));

        List<Double> question = embeddingsClient.embed(List.of("What is the remote work policy?")).vectors().get(0);
        List<ScoredRecord> hits = store.query(question, 3, Map.of());
        Answer answer = responder.answer("What is the remote work policy?");

        assertThat(hits.get(0).record().title()).isEqualTo("Policy A");
        assertThat(hits.get(0).record().text()).contains("Remote work");
        assertThat(answer.grounded()).isTrue();
        assertThat(answer.citations()).isNotEmpty();
        assertThat(answer.citations().get(0).title()).isEqualTo("Policy A");
    }

    @Test
    void everyChunkIsRetrievableByItsOwnText() {
        InMemoryVectorStoreClient store = new InMemoryVectorStoreClient();
        IngestionReport report = ingestion(store).ingest(upload("handbook.txt", "Handbook", HANDBOOK));
        List<Chunk> chunks = chunker.chunk(report.documentId(), HANDBOOK, DocumentType.TEXT);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(store.countByDocument(report.documentId())).isEqualTo(chunks.size());
        for (Chunk chunk : chunks) {
            List<Double> vector = embeddingsClient.embed(List.of(chunk.text())).vectors().get(0);
            assertThat(store.query(vector, 3, Map.of()))
                    .extracting(hit -> hit.record().chunkId())
                    .contains(chunk.chunkId());
        }
    }

    @Test
    void sameUploadTwiceKeepsOneSetOfRecords() {
        InMemoryVectorStoreClient store = new InMemoryVectorStoreClient();
        DefaultIngestionService ingestion = ingestion(store);

        IngestionReport first = ingestion.ingest(upload("handbook.txt", "Handbook", HANDBOOK));
        long stored = store.countByDocument(first.documentId());
        IngestionReport second = ingestion.ingest(upload("handbook.txt", "Handbook", HANDBOOK));

        assertThat(second.documentId()).isEqualTo(first.documentId());
        assertThat(second.deduplicated()).isTrue();
        assertThat(documents).hasSize(1);
        assertThat(store.countByDocument(first.documentId())).isEqualTo(stored);
    }

    @Test
    void failedUpsertLeavesNoRecordsBehind() {
        InMemoryVectorStoreClient store = new InMemoryVectorStoreClient() {
            @Override
            public UpsertResult upsert(List<IndexRecord> batch) {
                super.upsert(batch.subList(0, 1));
                List<String> failed = new ArrayList<>();
                batch.subList(1, batch.size()).forEach(record -> failed.add(record.chunkId()));
                return new UpsertResult(1, failed);
            }
        };

        IngestionReport report = ingestion(store).ingest(upload("handbook.txt", "Handbook", HANDBOOK));

        assertThat(report.status()).isEqualTo(DocumentStatus.FAILED);
        assertThat(store.countByDocument(report.documentId())).isZero();
        assertThat(documents.get(report.documentId()).getStatus()).isEqualTo(DocumentStatus.FAILED);
    }

    private DefaultIngestionService ingestion(InMemoryVectorStoreClient store) {
        DocumentRepository repository = mock(DocumentRepository.class);
        when(repository.findById(anyString())).thenAnswer(invocation -> Optional.ofNullable(documents.get((String) invocation.getArgument(0))));
        when(repository.save(any(DocumentEntity.class))).thenAnswer(invocation -> {
            DocumentEntity entity = invocation.getArgument(0);
            documents.put(entity.getDocumentId(), entity);
            return entity;
        });
        TypeDispatchingTextExtractor extractor = new TypeDispatchingTextExtractor(new PdfPageExtractor(),
                new SpreadsheetRowExtractor(), new HtmlMainContentExtractor(), new TikaDocumentTextExtractor());
        responder = new DefaultRagResponder(embeddingsClient, store, new TemplateLlmClient(), properties, meterRegistry);
        return new DefaultIngestionService(extractor, mock(UrlContentFetcher.class), chunker, embeddingsClient, store,
                repository, Clock.systemUTC(), meterRegistry);
    }

    private static IngestDocumentCommand upload(String filename, String title, String text) {
        return IngestDocumentCommand.forUpload(filename, title, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hashes lower-cased words into a fixed number of buckets and L2-normalises the counts.
     */
    private static final class BagOfWordsEndpoint implements EmbeddingsEndpoint {

        private static final int DIMENSIONS = 512;

        @Override
        public Mono<EmbeddingsClient.EmbeddingBatch> embedBatch(List<String> texts) {
            List<List<Double>> vectors = texts.stream().map(BagOfWordsEndpoint::vectorFor).toList();
            return Mono.just(new EmbeddingsClient.EmbeddingBatch(vectors, model(), DIMENSIONS));
        }

        @Override
        public String model() {
            return "bag-of-words";
        }

        private static List<Double> vectorFor(String text) {
            double[] counts = new double[DIMENSIONS];
            for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
                if (!word.isEmpty()) {
                    counts[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1.0;
                }
            }
            double norm = 0.0;
            for (double count : counts) {
                norm += count * count;
            }
            double scale = norm == 0.0 ? 0.0 : 1.0 / Math.sqrt(norm);
            List<Double> vector = new ArrayList<>(DIMENSIONS);
            for (double count : counts) {
                vector.add(count * scale);
            }
            return vector;
        }
    }
}
