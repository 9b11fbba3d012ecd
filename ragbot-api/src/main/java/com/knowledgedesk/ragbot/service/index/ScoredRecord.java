package com.knowledgedesk.ragbot.service.index;

import java.util.Comparator;

public record ScoredRecord(IndexRecord record, double score) {

    /** Highest score first; ties broken by position in the document, then chunk id. */
    public static final Comparator<ScoredRecord> RANKING = Comparator
            .comparingDouble(ScoredRecord::score).reversed()
            .thenComparingInt((ScoredRecord scored) -> scored.record().sequenceIndex())
            .thenComparing(scored -> scored.record().chunkId());
}
