package com.pitlane.timing.infrastructure.config;

import com.pitlane.timing.domain.ScheduleCompletenessPolicy;
import com.pitlane.timing.infrastructure.cache.CacheKeys;
import com.pitlane.timing.infrastructure.cache.TimingCacheProperties;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimingCacheConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public CacheKeys cacheKeys(TimingCacheProperties properties) {
        return new CacheKeys(properties.getNamespace());
    }

    @Bean
    public ScheduleCompletenessPolicy scheduleCompletenessPolicy(TimingCacheProperties properties) {
        return new ScheduleCompletenessPolicy(properties.getCurrentSeasonThreshold());
    }
}
