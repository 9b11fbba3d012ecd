package com.knowledgedesk.ragbot.service.dedup;

import com.knowledgedesk.ragbot.config.RagbotProperties;
import com.knowledgedesk.ragbot.persistence.entity.EventClaimEntity;
import com.knowledgedesk.ragbot.persistence.repository.EventClaimRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;

/**
 * Claims are rows keyed by event id. The insert is the atomic check-and-set: the database lets exactly
 * one concurrent insert of an id succeed. Expired rows are taken over with a conditional update.
 */
@Service
public class JpaDedupGuard implements DedupGuard {

    private static final Logger log = LoggerFactory.getLogger(JpaDedupGuard.class);

    private final EventClaimRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration retention;
    private final String owner;

    public JpaDedupGuard(EventClaimRepository repository,
                         PlatformTransactionManager transactionManager,
                         Clock clock,
                         RagbotProperties properties) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.retention = properties.dedup().retention();
        this.owner = properties.dedup().instanceId();
    }

    @Override
    public ClaimResult claim(String eventId) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("Event id is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        try {
            transactionTemplate.executeWithoutResult(status ->
                    repository.saveAndFlush(new EventClaimEntity(eventId, owner, now)));
            log.debug("Claimed event {}", eventId);
            return ClaimResult.CLAIMED;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException ex) {
            log.debug("Event {} is already claimed: {}", eventId, ex.getMessage());
        }
        Integer reclaimed = transactionTemplate.execute(status ->
                repository.reclaimExpired(eventId, now.minus(retention), now, owner, ClaimOutcome.IN_PROGRESS));
        if (reclaimed != null && reclaimed == 1) {
            log.info("Reclaimed expired claim for event {}", eventId);
            return ClaimResult.CLAIMED;
        }
        return ClaimResult.ALREADY_CLAIMED;
    }

    @Override
    public void release(String eventId, ClaimOutcome outcome) {
        if (outcome == null || outcome == ClaimOutcome.IN_PROGRESS) {
            throw new IllegalArgumentException("Release requires a terminal outcome");
        }
        Integer updated = transactionTemplate.execute(status ->
                repository.recordOutcome(eventId, ClaimOutcome.IN_PROGRESS, outcome, OffsetDateTime.now(clock)));
        if (updated == null || updated == 0) {
            log.warn("Event {} had no claim in progress when releasing with {}", eventId, outcome);
        }
    }

    @Override
    public boolean forget(String eventId) {
        Boolean removed = transactionTemplate.execute(status -> {
            if (!repository.existsById(eventId)) {
                return false;
            }
            repository.deleteById(eventId);
            return true;
        });
        if (Boolean.TRUE.equals(removed)) {
            log.info("Forgot claim for event {}", eventId);
        }
        return Boolean.TRUE.equals(removed);
    }

    @Override
    public int purgeExpired() {
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minus(retention);
        Integer purged = transactionTemplate.execute(status -> repository.deleteExpired(cutoff));
        return purged == null ? 0 : purged;
    }
}
