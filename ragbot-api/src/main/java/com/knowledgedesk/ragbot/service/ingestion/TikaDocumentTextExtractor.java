package com.knowledgedesk.ragbot.service.ingestion;

import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Word documents and plain text go through Tika's auto-detecting parser.
 */
@Component
public class TikaDocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    private final AutoDetectParser parser = new AutoDetectParser();

    public DocumentTextExtractor.ExtractedDocument extract(String filename, byte[] content) throws Exception {
        try (InputStream inputStream = new ByteArrayInputStream(content)) {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            if (filename != null) {
                metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            }
            parser.parse(inputStream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString()).map(String::trim).orElse("");
            return new DocumentTextExtractor.ExtractedDocument(buildMetadata(metadata), text);
        }
    }

    private DocumentMetadata buildMetadata(Metadata metadata) {
        DocumentMetadata enriched = DocumentMetadata.empty()
                .withTitle(metadata.get(TikaCoreProperties.TITLE))
                .withAuthor(metadata.get(TikaCoreProperties.CREATOR))
                .withContentType(metadata.get(Metadata.CONTENT_TYPE));
        OffsetDateTime created = parseDate(metadata.get(TikaCoreProperties.CREATED));
        return created == null ? enriched : enriched.withCreatedAt(created);
    }

    private OffsetDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException ex) {
            log.debug("Unable to parse creation date {}", value, ex);
            return null;
        }
    }
}
