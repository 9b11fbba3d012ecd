package com.knowledgedesk.ragbot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Immutable runtime configuration, bound once at startup from {@code ragbot.*} and handed to
 * each component through its constructor. Every group falls back to its defaults when absent.
 */
@ConfigurationProperties(prefix = "ragbot")
public record RagbotProperties(Chunking chunking,
                               Embedding embedding,
                               Index index,
                               Retrieval retrieval,
                               Llm llm,
                               Dedup dedup,
                               Slack slack,
                               Fetch fetch,
                               Worker worker) {

    public RagbotProperties {
        chunking = chunking == null ? new Chunking(null, null) : chunking;
        embedding = embedding == null ? new Embedding(null, null, null, null, null, null, null, null, null, null, null) : embedding;
        index = index == null ? new Index(null, null, null, null, null, null, null, null, null) : index;
        retrieval = retrieval == null ? new Retrieval(null, null, null) : retrieval;
        llm = llm == null ? new Llm(null, null, null, null, null, null) : llm;
        dedup = dedup == null ? new Dedup(null, null, null) : dedup;
        slack = slack == null ? new Slack(null, null, null) : slack;
        fetch = fetch == null ? new Fetch(null, null, null) : fetch;
        worker = worker == null ? new Worker(null, null, null) : worker;
    }

    public static RagbotProperties defaults() {
        return new RagbotProperties(null, null, null, null, null, null, null, null, null);
    }

    public RagbotProperties withChunking(Chunking value) {
        return new RagbotProperties(value, embedding, index, retrieval, llm, dedup, slack, fetch, worker);
    }

    public RagbotProperties withEmbedding(Embedding value) {
        return new RagbotProperties(chunking, value, index, retrieval, llm, dedup, slack, fetch, worker);
    }

    public RagbotProperties withIndex(Index value) {
        return new RagbotProperties(chunking, embedding, value, retrieval, llm, dedup, slack, fetch, worker);
    }

    public RagbotProperties withRetrieval(Retrieval value) {
        return new RagbotProperties(chunking, embedding, index, value, llm, dedup, slack, fetch, worker);
    }

    public RagbotProperties withDedup(Dedup value) {
        return new RagbotProperties(chunking, embedding, index, retrieval, llm, value, slack, fetch, worker);
    }

    public RagbotProperties withWorker(Worker value) {
        return new RagbotProperties(chunking, embedding, index, retrieval, llm, dedup, slack, fetch, value);
    }

    public record Chunking(Integer maxTokens, Integer overlapTokens) {
        public Chunking {
            maxTokens = maxTokens == null ? 200 : maxTokens;
            overlapTokens = overlapTokens == null ? 40 : overlapTokens;
            if (overlapTokens < 0 || maxTokens <= overlapTokens) {
                throw new IllegalArgumentException("ragbot.chunking requires max-tokens > overlap-tokens >= 0");
            }
        }
    }

    public record Embedding(String baseUrl,
                            String apiKey,
                            String model,
                            Integer dimensions,
                            Integer batchSize,
                            Integer concurrency,
                            Integer maxAttempts,
                            Duration initialBackoff,
                            Duration maxBackoff,
                            Duration timeout,
                            Integer maxInputChars) {
        public Embedding {
            baseUrl = orDefault(baseUrl, "http://localhost:9000");
            apiKey = apiKey == null ? "" : apiKey;
            model = orDefault(model, "text-embedding-3-small");
            dimensions = dimensions == null ? 1536 : dimensions;
            batchSize = batchSize == null ? 16 : Math.max(1, batchSize);
            concurrency = concurrency == null ? 4 : Math.max(1, concurrency);
            maxAttempts = maxAttempts == null ? 4 : Math.max(1, maxAttempts);
            initialBackoff = initialBackoff == null ? Duration.ofMillis(500) : initialBackoff;
            maxBackoff = maxBackoff == null ? Duration.ofSeconds(8) : maxBackoff;
            timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
            maxInputChars = maxInputChars == null ? 32_000 : maxInputChars;
        }
    }

    public record Index(String baseUrl,
                        String apiKey,
                        String collection,
                        Integer upsertBatchSize,
                        Integer maxAttempts,
                        Duration initialBackoff,
                        Duration maxBackoff,
                        Duration timeout,
                        Boolean autoCreate) {
        public Index {
            baseUrl = orDefault(baseUrl, "http://localhost:6333");
            apiKey = apiKey == null ? "" : apiKey;
            collection = orDefault(collection, "documents-index");
            upsertBatchSize = upsertBatchSize == null ? 64 : Math.max(1, upsertBatchSize);
            maxAttempts = maxAttempts == null ? 3 : Math.max(1, maxAttempts);
            initialBackoff = initialBackoff == null ? Duration.ofMillis(250) : initialBackoff;
            maxBackoff = maxBackoff == null ? Duration.ofSeconds(4) : maxBackoff;
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
            autoCreate = autoCreate == null ? Boolean.TRUE : autoCreate;
        }
    }

    public record Retrieval(Integer topK, Double minScore, Integer maxContextTokens) {
        public Retrieval {
            topK = topK == null ? 3 : Math.max(1, topK);
            minScore = minScore == null ? 0.2 : minScore;
            maxContextTokens = maxContextTokens == null ? 2048 : maxContextTokens;
        }
    }

    public record Llm(String baseUrl,
                      String apiKey,
                      String model,
                      Double temperature,
                      Integer maxOutputTokens,
                      Duration timeout) {
        public Llm {
            baseUrl = orDefault(baseUrl, "http://localhost:1234");
            apiKey = apiKey == null ? "" : apiKey;
            model = orDefault(model, "gpt-4o");
            temperature = temperature == null ? 0.2 : temperature;
            maxOutputTokens = maxOutputTokens == null ? 1000 : Math.max(64, maxOutputTokens);
            timeout = timeout == null ? Duration.ofSeconds(60) : timeout;
        }
    }

    public record Dedup(Duration retention, Duration purgeInterval, String instanceId) {
        public Dedup {
            retention = retention == null ? Duration.ofHours(24) : retention;
            purgeInterval = purgeInterval == null ? Duration.ofHours(1) : purgeInterval;
            instanceId = orDefault(instanceId, "ragbot-" + ProcessHandle.current().pid());
        }
    }

    public record Slack(String baseUrl, String botToken, List<String> allowedFileTypes) {
        public Slack {
            baseUrl = orDefault(baseUrl, "https://slack.com/api");
            botToken = botToken == null ? "" : botToken;
            allowedFileTypes = allowedFileTypes == null || allowedFileTypes.isEmpty()
                    ? List.of("pdf", "docx", "doc", "xlsx", "xls", "csv", "txt", "md", "html")
                    : allowedFileTypes.stream().map(type -> type.trim().toLowerCase(Locale.ROOT)).toList();
        }
    }

    public record Fetch(Duration timeout, String userAgent, Integer maxBytes) {
        public Fetch {
            timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
            userAgent = orDefault(userAgent, "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36");
            maxBytes = maxBytes == null ? 20 * 1024 * 1024 : maxBytes;
        }
    }

    public record Worker(Integer corePoolSize, Integer maxPoolSize, Integer queueCapacity) {
        public Worker {
            corePoolSize = corePoolSize == null ? 4 : corePoolSize;
            maxPoolSize = maxPoolSize == null ? 8 : Math.max(corePoolSize, maxPoolSize);
            queueCapacity = queueCapacity == null ? 200 : queueCapacity;
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
