package com.pitlane.timing.application;

import com.pitlane.timing.domain.port.in.RecordStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PurgeStaleSessionsTest {

    @Mock
    private RecordStore recordStore;

    @Test
    void shouldPurgeWithConfiguredRetention() {
        // Given
        when(recordStore.purgeOlderThan(30)).thenReturn(CompletableFuture.completedFuture(4));
        PurgeStaleSessions purge = new PurgeStaleSessions(recordStore, 30);

        // When
        int removed = purge.purge();

        // Then
        assertThat(removed).isEqualTo(4);
    }

    @Test
    void shouldReportNothingPurgedWhenSweepFails() {
        // Given
        when(recordStore.purgeOlderThan(7))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("database is locked")));
        PurgeStaleSessions purge = new PurgeStaleSessions(recordStore, 7);

        // When
        int removed = purge.purge();

        // Then
        assertThat(removed).isZero();
    }
}
