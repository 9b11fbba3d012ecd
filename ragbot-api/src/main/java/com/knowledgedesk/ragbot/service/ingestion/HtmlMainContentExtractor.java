package com.knowledgedesk.ragbot.service.ingestion;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;

/**
 * Pulls the main readable content out of an HTML page, dropping scripts and navigation chrome.
 */
@Component
public class HtmlMainContentExtractor {

    private static final String[] REMOVE_SELECTORS = {
            "script", "style", "noscript", "nav", "header", "footer", "aside", "form", "iframe",
            ".navigation", ".navbar", ".sidebar", ".breadcrumb", ".footer", ".header", "#nav", "#navigation"
    };

    private static final String[] CONTENT_SELECTORS = {
            "main", "article", ".content", "#content", ".main", "#main", ".main-content"
    };

    private static final String BLOCKS = "h1, h2, h3, h4, h5, h6, p, li, td, th, pre, dt, dd";

    public DocumentTextExtractor.ExtractedDocument extract(byte[] content, String url) {
        Document document = Jsoup.parse(new String(content, StandardCharsets.UTF_8), url == null ? "" : url);
        String title = document.title() == null ? "" : document.title().trim();
        for (String selector : REMOVE_SELECTORS) {
            document.select(selector).remove();
        }
        Element main = findMainContent(document);
        StringBuilder text = new StringBuilder();
        if (!title.isEmpty()) {
            text.append("Title: ").append(title).append("\n\n");
        }
        if (url != null && !url.isBlank()) {
            text.append("URL: ").append(url).append("\n\n");
        }
        text.append(blockText(main));
        DocumentMetadata metadata = DocumentMetadata.empty()
                .withContentType("text/html")
                .withTitle(title.isEmpty() ? null : title)
                .withSource(url);
        return new DocumentTextExtractor.ExtractedDocument(metadata, text.toString().trim());
    }

    private Element findMainContent(Document document) {
        for (String selector : CONTENT_SELECTORS) {
            Elements elements = document.select(selector);
            if (!elements.isEmpty()) {
                return elements.stream()
                        .max(Comparator.comparingInt(element -> element.text().length()))
                        .orElse(elements.first());
            }
        }
        return document.body() != null ? document.body() : document;
    }

    private String blockText(Element root) {
        Elements blocks = root.select(BLOCKS);
        if (blocks.isEmpty()) {
            return root.text();
        }
        StringBuilder builder = new StringBuilder();
        for (Element block : blocks) {
            boolean nested = block.select(BLOCKS).stream().anyMatch(inner -> inner != block);
            // nested blocks are emitted on their own
            String text = nested ? block.ownText().trim() : block.text().trim();
            if (!text.isEmpty()) {
                builder.append(text).append("\n\n");
            }
        }
        return builder.toString().trim();
    }
}
