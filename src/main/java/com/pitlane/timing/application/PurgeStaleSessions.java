package com.pitlane.timing.application;

import com.pitlane.timing.domain.port.in.RecordStore;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

@Service
public class PurgeStaleSessions {

    private static final Logger logger = LoggerFactory.getLogger(PurgeStaleSessions.class);

    private final RecordStore recordStore;
    private final int retentionDays;

    public PurgeStaleSessions(RecordStore recordStore,
                              @Value("${pitlane.retention.days:30}") int retentionDays) {
        this.recordStore = recordStore;
        this.retentionDays = retentionDays;
    }

    /**
     * @return number of session results removed
     */
    public int purge() {
        logger.info("Starting retention sweep of sessions older than {} days", retentionDays);
        try {
            return recordStore.purgeOlderThan(retentionDays).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Retention sweep interrupted");
            return 0;
        } catch (ExecutionException e) {
            logger.error("Retention sweep failed", e.getCause());
            return 0;
        }
    }

    public int retentionDays() {
        return retentionDays;
    }
}
