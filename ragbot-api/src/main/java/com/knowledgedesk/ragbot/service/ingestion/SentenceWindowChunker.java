package com.knowledgedesk.ragbot.service.ingestion;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Packs whole sentences (or spreadsheet rows) into windows of at most {@code maxTokens} tokens.
 * Consecutive windows share {@code overlapTokens} tokens. A single unit longer than a window is
 * hard-split and flagged as truncated.
 */
@Component
public class SentenceWindowChunker implements TextChunker {

    static final String PAGE_BREAK = "\f";
    static final String SHEET_PREFIX = "Sheet: ";

    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n\\s*\\r?\\n");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+|(?<=[。！？])");
    private static final int MAX_HEADING_LENGTH = 80;

    private final RagbotProperties.Chunking defaults;

    public SentenceWindowChunker(RagbotProperties properties) {
        this.defaults = properties.chunking();
    }

    @Override
    public List<Chunk> chunk(String documentId, String text, DocumentType type) {
        return chunk(documentId, text, type, defaults.maxTokens(), defaults.overlapTokens());
    }

    @Override
    public List<Chunk> chunk(String documentId, String text, DocumentType type, int maxTokens, int overlapTokens) {
        Objects.requireNonNull(documentId, "documentId");
        if (maxTokens <= 0 || overlapTokens < 0 || overlapTokens >= maxTokens) {
            throw new IllegalArgumentException("Chunking requires maxTokens > overlapTokens >= 0 but got "
                    + maxTokens + "/" + overlapTokens);
        }
        if (text == null || text.isBlank()) {
            return List.of();
        }
        DocumentType effectiveType = type == null ? DocumentType.TEXT : type;
        List<Unit> units = segment(text, effectiveType);
        if (units.isEmpty()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        int[] unitEnd = new int[units.size()];
        List<Integer> unitOf = new ArrayList<>();
        for (int u = 0; u < units.size(); u++) {
            for (String token : units.get(u).tokens()) {
                tokens.add(token);
                unitOf.add(u);
            }
            unitEnd[u] = tokens.size();
        }

        List<Chunk> chunks = new ArrayList<>();
        int total = tokens.size();
        int start = 0;
        while (start < total) {
            int end = windowEnd(start, unitOf, unitEnd, maxTokens);
            int sequence = chunks.size();
            chunks.add(new Chunk(Chunk.chunkId(documentId, sequence), documentId, sequence,
                    render(tokens, unitOf, start, end, effectiveType),
                    end - start,
                    metadata(units, unitOf, start, end, maxTokens)));
            if (end >= total) {
                break;
            }
            int nextStart = end - overlapTokens;
            int previousEnd = end;
            start = nextStart > start ? nextStart : end;
            if (windowEnd(start, unitOf, unitEnd, maxTokens) <= previousEnd) {
                // the overlap leaves no room for the following unit: keep only the overlap that still fits
                int following = unitOf.get(previousEnd);
                start = Math.min(previousEnd, Math.max(start, unitEnd[following] - maxTokens));
            }
        }
        return List.copyOf(chunks);
    }

    private static int windowEnd(int start, List<Integer> unitOf, int[] unitEnd, int maxTokens) {
        int unit = unitOf.get(start);
        if (unitEnd[unit] - start > maxTokens) {
            return start + maxTokens;
        }
        int end = unitEnd[unit];
        int next = unit + 1;
        while (next < unitEnd.length && unitEnd[next] - start <= maxTokens) {
            end = unitEnd[next];
            next++;
        }
        return end;
    }

    private List<Unit> segment(String text, DocumentType type) {
        List<Unit> units = new ArrayList<>();
        if (type.isTabular()) {
            segmentRows(text, units);
            return units;
        }
        if (type == DocumentType.PDF) {
            String[] pages = text.split(PAGE_BREAK, -1);
            for (int p = 0; p < pages.length; p++) {
                segmentProse(pages[p], p + 1, units);
            }
            return units;
        }
        segmentProse(text, null, units);
        return units;
    }

    private void segmentRows(String text, List<Unit> units) {
        String sheet = null;
        for (String line : LINE_BREAK.split(text)) {
            String row = line.trim();
            if (row.isEmpty()) {
                continue;
            }
            if (row.startsWith(SHEET_PREFIX)) {
                sheet = row.substring(SHEET_PREFIX.length()).trim();
            }
            units.add(new Unit(TokenCounter.tokenize(row), null, sheet, null));
        }
    }

    private void segmentProse(String text, Integer page, List<Unit> units) {
        String section = null;
        for (String rawParagraph : PARAGRAPH_BREAK.split(text)) {
            String paragraph = rawParagraph.trim();
            if (paragraph.isEmpty()) {
                continue;
            }
            String heading = headingOf(paragraph);
            if (heading != null) {
                section = heading;
            }
            for (String sentence : SENTENCE_END.split(paragraph)) {
                List<String> tokens = TokenCounter.tokenize(sentence);
                if (!tokens.isEmpty()) {
                    units.add(new Unit(tokens, page, null, section));
                }
            }
        }
    }

    private String headingOf(String paragraph) {
        String firstLine = LINE_BREAK.split(paragraph, 2)[0].trim();
        if (firstLine.startsWith("#")) {
            String stripped = firstLine.replaceFirst("^#+", "").trim();
            return stripped.isEmpty() ? null : stripped;
        }
        if (paragraph.contains("\n") || paragraph.length() > MAX_HEADING_LENGTH) {
            return null;
        }
        char last = paragraph.charAt(paragraph.length() - 1);
        return ".!?。！？,;:、".indexOf(last) >= 0 ? null : paragraph;
    }

    private String render(List<String> tokens, List<Integer> unitOf, int start, int end, DocumentType type) {
        String unitSeparator = type.isTabular() ? "\n" : " ";
        StringBuilder builder = new StringBuilder();
        String previous = null;
        for (int i = start; i < end; i++) {
            boolean unitBoundary = i > start && !unitOf.get(i).equals(unitOf.get(i - 1));
            TokenCounter.appendJoined(builder, previous, tokens.get(i), unitBoundary ? unitSeparator : " ");
            previous = tokens.get(i);
        }
        return builder.toString();
    }

    private Map<String, String> metadata(List<Unit> units, List<Integer> unitOf, int start, int end, int maxTokens) {
        Unit first = units.get(unitOf.get(start));
        Map<String, String> metadata = new LinkedHashMap<>();
        if (first.page() != null) {
            metadata.put("page", String.valueOf(first.page()));
        }
        if (first.sheet() != null) {
            metadata.put("sheet", first.sheet());
        }
        if (first.section() != null) {
            metadata.put("section", first.section());
        }
        boolean truncated = false;
        for (int u = unitOf.get(start); u <= unitOf.get(end - 1); u++) {
            if (units.get(u).tokens().size() > maxTokens) {
                truncated = true;
                break;
            }
        }
        if (truncated) {
            metadata.put("truncated", "true");
        }
        return metadata;
    }

    private record Unit(List<String> tokens, Integer page, String sheet, String section) {
    }
}
