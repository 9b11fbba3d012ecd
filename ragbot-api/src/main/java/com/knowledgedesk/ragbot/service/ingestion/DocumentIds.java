package com.knowledgedesk.ragbot.service.ingestion;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Stable document identities. The same file or URL always maps to the same id, so re-ingesting it
 * replaces the previous version.
 */
public final class DocumentIds {

    private DocumentIds() {
    }

    public static String forFile(String fileId) {
        return "file-" + fileId.trim().toLowerCase(Locale.ROOT);
    }

    public static String forUrl(String url) {
        return "url-" + sha256(url.trim()).substring(0, 32);
    }

    public static String forUpload(String filename) {
        return "upload-" + sha256(filename == null ? "" : filename.trim()).substring(0, 32);
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
