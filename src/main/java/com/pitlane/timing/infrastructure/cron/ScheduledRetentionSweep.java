package com.pitlane.timing.infrastructure.cron;

import com.pitlane.timing.application.PurgeStaleSessions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(prefix = "pitlane.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScheduledRetentionSweep {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledRetentionSweep.class);
    private final PurgeStaleSessions purgeStaleSessions;

    public ScheduledRetentionSweep(PurgeStaleSessions purgeStaleSessions) {
        this.purgeStaleSessions = purgeStaleSessions;
    }

    @Scheduled(cron = "${pitlane.retention.cron:0 30 3 * * *}") // nightly by default
    public void sweep() {
        logger.info("Running scheduled retention sweep");
        int removed = purgeStaleSessions.purge();
        logger.info("Retention sweep finished, {} session results removed", removed);
    }
}
