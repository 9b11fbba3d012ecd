package com.knowledgedesk.ragbot.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackEventEnvelope(String type,
                                 String token,
                                 String challenge,
                                 @JsonProperty("team_id") String teamId,
                                 @JsonProperty("event_id") String eventId,
                                 @JsonProperty("event_time") Long eventTime,
                                 Event event) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Event(String type,
                        String subtype,
                        String channel,
                        String user,
                        @JsonProperty("bot_id") String botId,
                        String text,
                        String ts,
                        @JsonProperty("thread_ts") String threadTs,
                        List<File> files) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record File(String id,
                       String name,
                       String filetype,
                       @JsonProperty("url_private_download") String urlPrivateDownload,
                       @JsonProperty("url_private") String urlPrivate) {
    }

    public InboundEvent toInboundEvent() {
        if (event == null) {
            return new InboundEvent(eventId, type, null, null, null, null, null, null, "", List.of());
        }
        List<Attachment> attachments = event.files() == null ? List.of() : event.files().stream()
                .map(file -> new Attachment(file.id(), file.name(), file.filetype(),
                        file.urlPrivateDownload() != null ? file.urlPrivateDownload() : file.urlPrivate()))
                .toList();
        return new InboundEvent(eventId, event.type(), event.subtype(), event.channel(), event.threadTs(), event.ts(),
                event.user(), event.botId(), event.text(), attachments);
    }
}
