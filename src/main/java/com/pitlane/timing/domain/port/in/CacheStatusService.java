package com.pitlane.timing.domain.port.in;

import com.pitlane.timing.domain.model.HealthReport;
import com.pitlane.timing.domain.model.TimingCacheReport;
import java.util.concurrent.CompletableFuture;

public interface CacheStatusService {

    CompletableFuture<TimingCacheReport> stats();

    /**
     * Reconnects the volatile tier if needed, then reports healthy, fallback or error.
     */
    CompletableFuture<HealthReport> healthCheck();
}
