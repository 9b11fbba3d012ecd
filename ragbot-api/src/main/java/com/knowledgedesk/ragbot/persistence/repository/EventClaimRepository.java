package com.knowledgedesk.ragbot.persistence.repository;

import com.knowledgedesk.ragbot.persistence.entity.EventClaimEntity;
import com.knowledgedesk.ragbot.service.dedup.ClaimOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;

public interface EventClaimRepository extends JpaRepository<EventClaimEntity, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update EventClaimEntity c
               set c.firstSeenAt = :now, c.updatedAt = :now, c.owner = :owner, c.outcome = :outcome
             where c.eventId = :eventId and c.firstSeenAt < :cutoff
            """)
    int reclaimExpired(@Param("eventId") String eventId,
                       @Param("cutoff") OffsetDateTime cutoff,
                       @Param("now") OffsetDateTime now,
                       @Param("owner") String owner,
                       @Param("outcome") ClaimOutcome outcome);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update EventClaimEntity c
               set c.outcome = :outcome, c.updatedAt = :now
             where c.eventId = :eventId and c.outcome = :expected
            """)
    int recordOutcome(@Param("eventId") String eventId,
                      @Param("expected") ClaimOutcome expected,
                      @Param("outcome") ClaimOutcome outcome,
                      @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("delete from EventClaimEntity c where c.firstSeenAt < :cutoff")
    int deleteExpired(@Param("cutoff") OffsetDateTime cutoff);
}
