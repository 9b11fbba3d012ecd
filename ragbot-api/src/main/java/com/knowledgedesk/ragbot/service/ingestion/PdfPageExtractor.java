package com.knowledgedesk.ragbot.service.ingestion;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts PDF text page by page and joins the pages with a form feed so that chunks can carry
 * their page number.
 */
@Component
public class PdfPageExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfPageExtractor.class);

    public DocumentTextExtractor.ExtractedDocument extract(byte[] content) throws IOException {
        try (PDDocument document = PDDocument.load(content)) {
            int totalPages = document.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            List<String> pages = new ArrayList<>(totalPages);
            for (int page = 1; page <= totalPages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(stripper.getText(document).trim());
            }
            log.debug("Extracted {} pages from PDF", totalPages);
            DocumentMetadata metadata = DocumentMetadata.empty().withContentType("application/pdf");
            PDDocumentInformation info = document.getDocumentInformation();
            if (info != null) {
                metadata = metadata.withTitle(info.getTitle()).withAuthor(info.getAuthor());
            }
            return new DocumentTextExtractor.ExtractedDocument(metadata, String.join(SentenceWindowChunker.PAGE_BREAK, pages));
        }
    }
}
