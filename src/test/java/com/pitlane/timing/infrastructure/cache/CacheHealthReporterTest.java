package com.pitlane.timing.infrastructure.cache;

import com.pitlane.timing.domain.model.CacheStats;
import com.pitlane.timing.domain.model.DurableStoreStats;
import com.pitlane.timing.domain.model.HealthReport;
import com.pitlane.timing.domain.model.HealthStatus;
import com.pitlane.timing.domain.model.TimingCacheReport;
import com.pitlane.timing.domain.port.out.DurableStore;
import com.pitlane.timing.domain.port.out.VolatileCache;
import com.pitlane.timing.infrastructure.persistence.CacheAsideCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheHealthReporterTest {

    @Mock
    private VolatileCache volatileCache;

    @Mock
    private DurableStore durableStore;

    @Mock
    private CacheAsideCoordinator coordinator;

    private final CacheKeys keys = new CacheKeys("f1dash");
    private CacheHealthReporter reporter;

    @BeforeEach
    void setUp() {
        TimingCacheProperties properties = new TimingCacheProperties();
        properties.setDefaultTtlSeconds(1800);
        reporter = new CacheHealthReporter(volatileCache, durableStore, coordinator, keys, properties, Runnable::run);
    }

    @Test
    void shouldCombineBothTiersIntoReport() {
        // Given
        DurableStoreStats durable = new DurableStoreStats(5, 24, 12, Map.of(2024, 12L), 4096);
        CacheStats lookups = new CacheStats(3, 1, 1, 0, 0);
        when(volatileCache.isConnected()).thenReturn(true);
        when(volatileCache.fallbackEntryCount()).thenReturn(0);
        when(volatileCache.countKeys(keys.namespacePrefix())).thenReturn(7L);
        when(durableStore.stats()).thenReturn(durable);
        when(coordinator.lookupStats()).thenReturn(lookups);

        // When
        TimingCacheReport report = reporter.stats().join();

        // Then
        assertThat(report.connected()).isTrue();
        assertThat(report.defaultTtlSeconds()).isEqualTo(1800);
        assertThat(report.volatileKeys()).isEqualTo(7);
        assertThat(report.durable()).isEqualTo(durable);
        assertThat(report.lookups().hitRatio()).isEqualTo(0.8);
    }

    @Test
    void shouldReportFallbackEntriesWhenDisconnected() {
        // Given
        when(volatileCache.isConnected()).thenReturn(false);
        when(volatileCache.fallbackEntryCount()).thenReturn(3);
        when(volatileCache.countKeys(keys.namespacePrefix())).thenReturn(-1L);
        when(durableStore.stats()).thenReturn(DurableStoreStats.empty());
        when(coordinator.lookupStats()).thenReturn(new CacheStats(0, 0, 0, 0, 0));

        // When
        TimingCacheReport report = reporter.stats().join();

        // Then
        assertThat(report.connected()).isFalse();
        assertThat(report.fallbackEntries()).isEqualTo(3);
        assertThat(report.volatileKeys()).isEqualTo(-1);
    }

    @Test
    void shouldBeHealthyWhenPingSucceeds() {
        when(volatileCache.isConnected()).thenReturn(true);
        when(volatileCache.ping()).thenReturn(true);

        HealthReport health = reporter.healthCheck().join();

        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(health.fallbackActive()).isFalse();
        verify(volatileCache, never()).connect();
    }

    @Test
    void shouldReconnectBeforeCheckingHealth() {
        // Given
        when(volatileCache.isConnected()).thenReturn(false, true);
        when(volatileCache.connect()).thenReturn(true);
        when(volatileCache.ping()).thenReturn(true);

        // When
        HealthReport health = reporter.healthCheck().join();

        // Then
        assertThat(health.status()).isEqualTo(HealthStatus.HEALTHY);
        verify(volatileCache).connect();
    }

    @Test
    void shouldReportFallbackWhenRedisIsUnreachable() {
        when(volatileCache.isConnected()).thenReturn(false);
        when(volatileCache.connect()).thenReturn(false);

        HealthReport health = reporter.healthCheck().join();

        assertThat(health.status()).isEqualTo(HealthStatus.FALLBACK);
        assertThat(health.fallbackActive()).isTrue();
        assertThat(health.volatileConnected()).isFalse();
    }

    @Test
    void shouldReportErrorWhenCheckItselfFails() {
        when(volatileCache.isConnected()).thenReturn(true);
        when(volatileCache.ping()).thenThrow(new IllegalStateException("connection reset"));

        HealthReport health = reporter.healthCheck().join();

        assertThat(health.status()).isEqualTo(HealthStatus.ERROR);
        assertThat(health.detail()).isEqualTo("connection reset");
    }
}
