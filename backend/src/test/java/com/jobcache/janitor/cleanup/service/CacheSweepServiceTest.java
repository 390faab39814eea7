package com.jobcache.janitor.cleanup.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobcache.janitor.cleanup.model.CleanupSummary;
import com.jobcache.janitor.cleanup.model.CurrentStats;
import com.jobcache.janitor.cleanup.model.StageResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CacheSweepServiceTest {
    private static final Instant NOW = Instant.parse("2026-03-01T06:00:00Z");

    @Mock
    private ExpiryReaper expiryReaper;
    @Mock
    private StalenessDecay stalenessDecay;
    @Mock
    private OrphanReclaimer orphanReclaimer;
    @Mock
    private StatsAggregator statsAggregator;
    @Mock
    private LegacySweeper legacySweeper;

    private CacheSweepService service;

    @BeforeEach
    void setUp() {
        service = new CacheSweepService(
            expiryReaper,
            stalenessDecay,
            orphanReclaimer,
            statsAggregator,
            legacySweeper,
            Clock.fixed(NOW, ZoneOffset.UTC),
            new ObjectMapper()
        );
    }

    @Test
    void runsStagesInOrderWithOneSharedTimestamp() {
        when(expiryReaper.run(NOW)).thenReturn(StageResult.succeeded(ExpiryReaper.STAGE, 3));
        when(stalenessDecay.run(NOW)).thenReturn(StageResult.succeeded(StalenessDecay.STAGE, 4));
        when(orphanReclaimer.run(NOW)).thenReturn(StageResult.succeeded(OrphanReclaimer.STAGE, 2));
        when(statsAggregator.collect()).thenReturn(new CurrentStats(10L, 20L, 30L));
        when(legacySweeper.run(NOW)).thenReturn(StageResult.succeeded(LegacySweeper.STAGE, 1));

        CleanupSummary summary = service.sweep();

        assertThat(summary).isEqualTo(new CleanupSummary(true, 3, 4, 2, 1, new CurrentStats(10L, 20L, 30L)));
        InOrder order = inOrder(expiryReaper, stalenessDecay, orphanReclaimer, statsAggregator, legacySweeper);
        order.verify(expiryReaper).run(NOW);
        order.verify(stalenessDecay).run(NOW);
        order.verify(orphanReclaimer).run(NOW);
        order.verify(statsAggregator).collect();
        order.verify(legacySweeper).run(NOW);
    }

    @Test
    void expiredJobFailureAbortsBeforeAnyOtherStage() {
        when(expiryReaper.run(NOW)).thenReturn(StageResult.failed(ExpiryReaper.STAGE, "connection refused"));

        CacheSweepFailedException thrown =
            catchThrowableOfType(() -> service.sweep(), CacheSweepFailedException.class);

        assertThat(thrown).hasMessage("connection refused");
        assertThat(thrown.getStage()).isEqualTo(ExpiryReaper.STAGE);

        verifyNoInteractions(stalenessDecay, orphanReclaimer, statsAggregator, legacySweeper);
        assertThat(service.isRunning()).isFalse();
    }

    @Test
    void nonFatalFailuresReportZeroAndLaterStagesStillRun() {
        when(expiryReaper.run(NOW)).thenReturn(StageResult.succeeded(ExpiryReaper.STAGE, 5));
        when(stalenessDecay.run(NOW)).thenReturn(StageResult.failed(StalenessDecay.STAGE, "timeout"));
        when(orphanReclaimer.run(NOW)).thenReturn(StageResult.failed(OrphanReclaimer.STAGE, "timeout"));
        when(statsAggregator.collect()).thenReturn(CurrentStats.empty());
        when(legacySweeper.run(NOW)).thenReturn(StageResult.skipped(LegacySweeper.STAGE, "table_absent"));

        CleanupSummary summary = service.sweep();

        assertThat(summary.success()).isTrue();
        assertThat(summary.deletedExpiredJobs()).isEqualTo(5);
        assertThat(summary.resetStaleSearchTerms()).isZero();
        assertThat(summary.deletedOrphanedTerms()).isZero();
        assertThat(summary.oldCacheDeleted()).isZero();
        assertThat(summary.currentStats()).isEqualTo(CurrentStats.empty());
        verify(legacySweeper).run(NOW);
    }

    @Test
    void rejectsSweepWhileAnotherIsRunning() {
        when(expiryReaper.run(NOW)).thenReturn(StageResult.succeeded(ExpiryReaper.STAGE, 0));
        when(stalenessDecay.run(NOW)).thenAnswer(invocation -> {
            assertThatThrownBy(() -> service.sweep()).isInstanceOf(ActiveSweepException.class);
            return StageResult.succeeded(StalenessDecay.STAGE, 0);
        });
        when(orphanReclaimer.run(NOW)).thenReturn(StageResult.succeeded(OrphanReclaimer.STAGE, 0));
        when(statsAggregator.collect()).thenReturn(CurrentStats.empty());
        when(legacySweeper.run(NOW)).thenReturn(StageResult.succeeded(LegacySweeper.STAGE, 0));

        service.sweep();

        verify(expiryReaper).run(NOW);
        assertThat(service.isRunning()).isFalse();
    }
}
