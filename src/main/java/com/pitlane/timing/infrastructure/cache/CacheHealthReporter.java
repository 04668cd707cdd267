package com.pitlane.timing.infrastructure.cache;

import com.pitlane.timing.domain.model.DurableStoreStats;
import com.pitlane.timing.domain.model.HealthReport;
import com.pitlane.timing.domain.model.TimingCacheReport;
import com.pitlane.timing.domain.port.in.CacheStatusService;
import com.pitlane.timing.domain.port.out.DurableStore;
import com.pitlane.timing.domain.port.out.VolatileCache;
import com.pitlane.timing.infrastructure.persistence.CacheAsideCoordinator;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Read-only view over both tiers and the coordinator's lookup counters.
 */
@Component
public class CacheHealthReporter implements CacheStatusService {

    private static final Logger logger = LoggerFactory.getLogger(CacheHealthReporter.class);

    private final VolatileCache volatileCache;
    private final DurableStore durableStore;
    private final CacheAsideCoordinator coordinator;
    private final CacheKeys keys;
    private final TimingCacheProperties properties;
    private final Executor executor;

    public CacheHealthReporter(VolatileCache volatileCache,
                               DurableStore durableStore,
                               CacheAsideCoordinator coordinator,
                               CacheKeys keys,
                               TimingCacheProperties properties,
                               @Qualifier("asyncExecutor") Executor executor) {
        this.volatileCache = volatileCache;
        this.durableStore = durableStore;
        this.coordinator = coordinator;
        this.keys = keys;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<TimingCacheReport> stats() {
        return CompletableFuture.supplyAsync(() -> {
            DurableStoreStats durable = durableStore.stats();
            TimingCacheReport report = new TimingCacheReport(
                    volatileCache.isConnected(),
                    properties.getDefaultTtlSeconds(),
                    volatileCache.fallbackEntryCount(),
                    volatileCache.countKeys(keys.namespacePrefix()),
                    durable,
                    coordinator.lookupStats());
            logger.debug("Cache report: {}", report.lookups().summary());
            return report;
        }, executor);
    }

    @Override
    public CompletableFuture<HealthReport> healthCheck() {
        return CompletableFuture.supplyAsync(this::check, executor);
    }

    private HealthReport check() {
        try {
            if (!volatileCache.isConnected()) {
                volatileCache.connect();
            }
            if (volatileCache.isConnected() && volatileCache.ping()) {
                return HealthReport.healthy();
            }
            return HealthReport.fallback("Volatile tier unreachable, serving from in-process cache");
        } catch (RuntimeException e) {
            logger.warn("Health check failed: {}", e.getMessage());
            return HealthReport.error(e.getMessage());
        }
    }
}
