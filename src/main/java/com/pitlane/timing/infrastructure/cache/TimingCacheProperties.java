package com.pitlane.timing.infrastructure.cache;

import java.time.Duration;
import java.time.Year;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration of the volatile tier and the cache-aside coordinator
 */
@Component
@ConfigurationProperties(prefix = "pitlane.cache")
public class TimingCacheProperties {

    private String namespace = "f1dash";
    private long defaultTtlSeconds = 3600;
    private int scheduleTtlMultiplier = 24;
    private long volatileTimeoutMillis = 500;
    private boolean redisEnabled = true;
    private int currentSeasonThreshold = Year.now().getValue();

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public void setDefaultTtlSeconds(long defaultTtlSeconds) {
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public int getScheduleTtlMultiplier() {
        return scheduleTtlMultiplier;
    }

    public void setScheduleTtlMultiplier(int scheduleTtlMultiplier) {
        this.scheduleTtlMultiplier = scheduleTtlMultiplier;
    }

    public long getVolatileTimeoutMillis() {
        return volatileTimeoutMillis;
    }

    public void setVolatileTimeoutMillis(long volatileTimeoutMillis) {
        this.volatileTimeoutMillis = volatileTimeoutMillis;
    }

    public boolean isRedisEnabled() {
        return redisEnabled;
    }

    public void setRedisEnabled(boolean redisEnabled) {
        this.redisEnabled = redisEnabled;
    }

    public int getCurrentSeasonThreshold() {
        return currentSeasonThreshold;
    }

    public void setCurrentSeasonThreshold(int currentSeasonThreshold) {
        this.currentSeasonThreshold = currentSeasonThreshold;
    }

    public Duration defaultTtl() {
        return Duration.ofSeconds(defaultTtlSeconds);
    }

    /**
     * Schedules change far less often than timing data
     */
    public Duration scheduleTtl() {
        return Duration.ofSeconds(defaultTtlSeconds * scheduleTtlMultiplier);
    }

    public Duration volatileTimeout() {
        return Duration.ofMillis(volatileTimeoutMillis);
    }
}
