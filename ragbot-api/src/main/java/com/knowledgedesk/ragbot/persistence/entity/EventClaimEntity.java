package com.knowledgedesk.ragbot.persistence.entity;

import com.knowledgedesk.ragbot.service.dedup.ClaimOutcome;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.springframework.data.domain.Persistable;

import java.time.OffsetDateTime;

/**
 * One row per platform event id. Always persisted as a fresh insert, so a duplicate id fails on the
 * primary key instead of silently merging.
 */
@Entity
@Table(name = "event_claims")
public class EventClaimEntity implements Persistable<String> {

    @Id
    @Column(length = 128)
    private String eventId;

    @Column(nullable = false)
    private OffsetDateTime firstSeenAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private ClaimOutcome outcome;

    @Column(length = 128)
    private String owner;

    @Column(nullable = false)
    private OffsetDateTime updatedAt;

    @Transient
    private boolean fresh = true;

    protected EventClaimEntity() {
        this.fresh = false;
    }

    public EventClaimEntity(String eventId, String owner, OffsetDateTime now) {
        this.eventId = eventId;
        this.owner = owner;
        this.firstSeenAt = now;
        this.updatedAt = now;
        this.outcome = ClaimOutcome.IN_PROGRESS;
    }

    @Override
    public String getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return fresh;
    }

    public String getEventId() {
        return eventId;
    }

    public OffsetDateTime getFirstSeenAt() {
        return firstSeenAt;
    }

    public ClaimOutcome getOutcome() {
        return outcome;
    }

    public String getOwner() {
        return owner;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
