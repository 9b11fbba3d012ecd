package com.knowledgedesk.ragbot.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record IngestUrlRequest(
        @NotBlank
        @Pattern(regexp = "(?i)https?://\\S+", message = "must be an http or https URL")
        String url,
        String title
) {
}
