package com.knowledgedesk.ragbot.service.retrieval;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.model.Answer;
import com.knowledgedesk.ragbot.model.Citation;
import com.knowledgedesk.ragbot.model.RetrievedChunk;
import com.knowledgedesk.ragbot.service.embedding.EmbeddingsClient;
import com.knowledgedesk.ragbot.service.index.IndexRecord;
import com.knowledgedesk.ragbot.service.index.ScoredRecord;
import com.knowledgedesk.ragbot.service.index.VectorStoreClient;
import com.knowledgedesk.ragbot.service.orchestration.LlmClient;
import com.knowledgedesk.ragbot.service.orchestration.LlmRequest;
import com.knowledgedesk.ragbot.service.orchestration.LlmResponse;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class DefaultRagResponder implements RagResponder {

    private static final Logger log = LoggerFactory.getLogger(DefaultRagResponder.class);

    public static final String NOT_FOUND_MESSAGE =
            "I couldn't find anything about that in the indexed documents. Try rephrasing, or share the relevant document first.";
    public static final String EMPTY_QUESTION_MESSAGE = "Please include a question after mentioning me.";

    static final String SYSTEM_PROMPT = """
            You answer questions for a team using only the passages provided.
            Each passage starts with a label such as [S1]. Cite every passage you rely on by writing its label.
            If the passages do not contain the answer, say that you could not find it. Never invent facts.
            Answer in the language of the question.""";

    private static final Pattern CITATION_LABEL = Pattern.compile("\\[S(\\d+)]");

    private final EmbeddingsClient embeddingsClient;
    private final VectorStoreClient vectorStoreClient;
    private final LlmClient llmClient;
    private final TokenBudgetGuard tokenGuard;
    private final RagbotProperties.Retrieval settings;
    private final MeterRegistry meterRegistry;

    public DefaultRagResponder(EmbeddingsClient embeddingsClient,
                               VectorStoreClient vectorStoreClient,
                               LlmClient llmClient,
                               RagbotProperties properties,
                               MeterRegistry meterRegistry) {
        this.embeddingsClient = embeddingsClient;
        this.vectorStoreClient = vectorStoreClient;
        this.llmClient = llmClient;
        this.settings = properties.retrieval();
        this.tokenGuard = new TokenBudgetGuard(settings.maxContextTokens());
        this.meterRegistry = meterRegistry;
    }

    @Override
    public Answer answer(String question) {
        if (question == null || question.isBlank()) {
            return Answer.notFound(EMPTY_QUESTION_MESSAGE);
        }
        List<Double> vector = embeddingsClient.embed(List.of(question.trim())).vectors().get(0);
        List<ScoredRecord> hits = vectorStoreClient.query(vector, settings.topK(), Map.of());
        List<RetrievedChunk> relevant = hits.stream()
                .filter(hit -> hit.score() >= settings.minScore())
                .map(DefaultRagResponder::toChunk)
                .toList();
        if (relevant.isEmpty()) {
            log.info("No passage above {} for question; best score was {}", settings.minScore(),
                    hits.isEmpty() ? "n/a" : hits.get(0).score());
            meterRegistry.counter("ragbot.answers", "outcome", "not_found").increment();
            return Answer.notFound(NOT_FOUND_MESSAGE);
        }

        TokenBudgetGuard.GuardedChunks guarded = tokenGuard.enforce(relevant);
        if (guarded.truncated()) {
            log.debug("Context budget kept {} of {} passages", guarded.chunks().size(), relevant.size());
        }
        List<RetrievedChunk> passages = guarded.chunks();
        LlmResponse response = llmClient.generate(new LlmRequest(SYSTEM_PROMPT, question.trim(), passages));
        List<Citation> citations = citationsFor(response.answer(), passages);
        meterRegistry.counter("ragbot.answers", "outcome", "answered").increment();
        return new Answer(response.answer(), citations, true);
    }

    /**
     * One citation per document, in order of first mention. Falls back to every passage when the answer
     * cites none, so the reply still names its sources.
     */
    static List<Citation> citationsFor(String answer, List<RetrievedChunk> passages) {
        Set<Integer> cited = new LinkedHashSet<>();
        Matcher matcher = CITATION_LABEL.matcher(answer == null ? "" : answer);
        while (matcher.find()) {
            try {
                int index = Integer.parseInt(matcher.group(1)) - 1;
                if (index >= 0 && index < passages.size()) {
                    cited.add(index);
                }
            } catch (NumberFormatException ex) {
                log.debug("Ignoring citation label {}", matcher.group());
            }
        }
        if (cited.isEmpty()) {
            for (int i = 0; i < passages.size(); i++) {
                cited.add(i);
            }
        }
        List<Citation> citations = new ArrayList<>();
        Set<String> documents = new LinkedHashSet<>();
        for (int index : cited) {
            RetrievedChunk passage = passages.get(index);
            if (documents.add(passage.docId())) {
                citations.add(new Citation(passage.docId(), passage.title(), passage.source(), LlmRequest.label(index)));
            }
        }
        return List.copyOf(citations);
    }

    private static RetrievedChunk toChunk(ScoredRecord hit) {
        IndexRecord record = hit.record();
        return new RetrievedChunk(record.chunkId(), record.documentId(), record.title(), record.source(),
                record.sequenceIndex(), record.text(), hit.score());
    }
}
