package com.knowledgedesk.ragbot.model;

import java.util.Locale;

public record Attachment(String id, String name, String fileType, String downloadUrl) {

    public String normalisedType() {
        if (fileType != null && !fileType.isBlank()) {
            return fileType.trim().toLowerCase(Locale.ROOT);
        }
        if (name != null && name.contains(".")) {
            return name.substring(name.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
