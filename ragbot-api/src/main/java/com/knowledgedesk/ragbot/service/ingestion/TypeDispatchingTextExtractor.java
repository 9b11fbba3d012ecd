package com.knowledgedesk.ragbot.service.ingestion;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class TypeDispatchingTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TypeDispatchingTextExtractor.class);

    private final PdfPageExtractor pdfExtractor;
    private final SpreadsheetRowExtractor spreadsheetExtractor;
    private final HtmlMainContentExtractor htmlExtractor;
    private final TikaDocumentTextExtractor tikaExtractor;

    public TypeDispatchingTextExtractor(PdfPageExtractor pdfExtractor,
                                        SpreadsheetRowExtractor spreadsheetExtractor,
                                        HtmlMainContentExtractor htmlExtractor,
                                        TikaDocumentTextExtractor tikaExtractor) {
        this.pdfExtractor = pdfExtractor;
        this.spreadsheetExtractor = spreadsheetExtractor;
        this.htmlExtractor = htmlExtractor;
        this.tikaExtractor = tikaExtractor;
    }

    @Override
    public ExtractedDocument extract(DocumentType type, String filename, String sourceUrl, byte[] content) {
        if (type == null) {
            throw new UnsupportedDocumentTypeException("Unsupported document type for " + filename);
        }
        if (content == null || content.length == 0) {
            throw new ExtractionException("Document " + filename + " is empty");
        }
        ExtractedDocument extracted;
        try {
            extracted = switch (type) {
                case PDF -> pdfExtractor.extract(content);
                case TABULAR -> spreadsheetExtractor.isWorkbook(content)
                        ? spreadsheetExtractor.extractWorkbook(content)
                        : spreadsheetExtractor.extractDelimited(content);
                case CSV -> spreadsheetExtractor.extractDelimited(content);
                case HTML -> htmlExtractor.extract(content, sourceUrl);
                case DOCX, TEXT -> tikaExtractor.extract(filename, content);
            };
        } catch (ExtractionException | UnsupportedDocumentTypeException ex) {
            throw ex;
        } catch (Exception e) {
            log.error("Failed to extract text from {} document {}", type, filename, e);
            throw new ExtractionException("Failed to extract text from " + filename, e);
        }
        if (extracted.text() == null || extracted.text().isBlank()) {
            throw new ExtractionException("No text could be extracted from " + filename);
        }
        DocumentMetadata metadata = extracted.metadata().hasTitle()
                ? extracted.metadata()
                : extracted.metadata().withTitle(defaultTitle(filename));
        return new ExtractedDocument(metadata, extracted.text());
    }

    private String defaultTitle(String filename) {
        if (filename == null || filename.isBlank()) {
            return "Document";
        }
        String baseName = FilenameUtils.getBaseName(filename);
        return baseName.isBlank() ? "Document" : baseName;
    }
}
