package com.knowledgedesk.ragbot.service.dedup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class DedupPurgeJob {

    private static final Logger log = LoggerFactory.getLogger(DedupPurgeJob.class);

    private final DedupGuard dedupGuard;

    public DedupPurgeJob(DedupGuard dedupGuard) {
        this.dedupGuard = dedupGuard;
    }

    @Scheduled(fixedDelayString = "${ragbot.dedup.purge-interval:PT1H}", initialDelayString = "${ragbot.dedup.purge-interval:PT1H}")
    public void purge() {
        try {
            int purged = dedupGuard.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} expired event claims", purged);
            }
        } catch (RuntimeException ex) {
            log.warn("Purging expired event claims failed: {}", ex.getMessage());
        }
    }
}
