package com.pitlane.timing.infrastructure.cache;

import com.pitlane.timing.domain.model.StoreOutcome;
import com.pitlane.timing.domain.port.out.DurableStore;
import com.pitlane.timing.domain.port.out.VolatileCache;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Connects the volatile tier and seeds the supported seasons when the context starts,
 * and drops the connection on shutdown.
 */
@Component
public class VolatileCacheLifecycle implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(VolatileCacheLifecycle.class);

    private final VolatileCache volatileCache;
    private final DurableStore durableStore;
    private final List<Integer> supportedSeasons;

    private volatile boolean running;

    public VolatileCacheLifecycle(VolatileCache volatileCache,
                                  DurableStore durableStore,
                                  @Value("${pitlane.seasons.supported:2021,2022,2023,2024,2025}") List<Integer> supportedSeasons) {
        this.volatileCache = volatileCache;
        this.durableStore = durableStore;
        this.supportedSeasons = List.copyOf(supportedSeasons);
    }

    @Override
    public void start() {
        boolean connected = volatileCache.connect();
        logger.info("Volatile tier started in {} mode", connected ? "redis" : "fallback");

        StoreOutcome seeded = durableStore.upsertSeasons(supportedSeasons);
        if (seeded.success()) {
            logger.info("Seeded seasons {}", supportedSeasons);
        } else {
            logger.warn("Season seeding failed: {}", seeded.detail());
        }
        running = true;
    }

    @Override
    public void stop() {
        volatileCache.disconnect();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
