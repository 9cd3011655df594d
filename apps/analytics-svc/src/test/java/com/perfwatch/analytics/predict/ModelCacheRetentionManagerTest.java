package com.perfwatch.analytics.predict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ModelCacheRetentionManagerTest {

    @Mock
    private ModelRegistry registry;

    private ModelCacheRetentionManager manager;
    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        manager = new ModelCacheRetentionManager(registry, 30, clock);
    }

    @Test
    void evictsModelsIdleBeforeCutoff() {
        when(registry.evictIdleSince(Instant.parse("2024-05-02T12:00:00Z"))).thenReturn(3);

        int removed = manager.evictIdleModelsNow();

        ArgumentCaptor<Instant> captor = ArgumentCaptor.forClass(Instant.class);
        verify(registry).evictIdleSince(captor.capture());
        assertThat(captor.getValue()).isEqualTo(Instant.parse("2024-05-02T12:00:00Z"));
        assertThat(removed).isEqualTo(3);
    }

    @Test
    void currentCutoffMatchesRetentionWindow() {
        assertThat(manager.currentCutoff()).isEqualTo(Instant.parse("2024-05-02T12:00:00Z"));
    }

    @Test
    void rejectsInvalidRetention() {
        assertThatThrownBy(() -> new ModelCacheRetentionManager(registry, 0, clock))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retentionDays");
    }
}
