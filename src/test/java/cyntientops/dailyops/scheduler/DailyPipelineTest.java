package cyntientops.dailyops.scheduler;

import cyntientops.dailyops.config.DailyOpsConfig;
import cyntientops.dailyops.config.Dependencies;
import cyntientops.dailyops.model.RunOutcome;
import cyntientops.dailyops.model.TriggerState;
import cyntientops.dailyops.support.MutableClock;
import cyntientops.dailyops.support.TestData;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the daily run: marker handling, at-most-once per day, failure path.
 */
class DailyPipelineTest {

    @TempDir
    Path backupDir;

    private final MutableClock clock = MutableClock.utc("2024-03-04T00:01:00Z");
    private Dependencies deps;

    private Dependencies create(String expectedChecksum) {
        DailyOpsConfig config = DailyOpsConfig.defaults()
                .withDatabaseUrl(TestData.h2Url("test-pipeline"))
                .withBackupDirectory(backupDir)
                .withZone(ZoneOffset.UTC)
                .withExpectedDatasetChecksum(expectedChecksum);
        return Dependencies.create(config, clock);
    }

    @AfterEach
    void teardown() throws Exception {
        if (deps != null) {
            TestData.wipe(deps.database());
            deps.close();
        }
    }

    @Test
    void firstRunMigratesGeneratesAndAdvancesMarker() {
        deps = create(null);
        Set<String> invalidated = new HashSet<>();
        deps.eventBus().onMetricsInvalidated(invalidated::addAll);

        assertEquals(RunOutcome.COMPLETED, deps.dailyTrigger().runNow());

        assertEquals(1, deps.migrationOrchestrator().currentVersion());
        assertEquals(LocalDate.of(2024, 3, 4), deps.migrationStateRepository().lastRunDate().orElseThrow());
        assertFalse(deps.instanceRepository().findByDate(LocalDate.of(2024, 3, 4)).isEmpty());
        assertFalse(invalidated.isEmpty());
    }

    @Test
    void secondRunSameDayDoesNothing() {
        deps = create(null);
        deps.dailyTrigger().runNow();
        int instances = deps.instanceRepository().count();

        clock.advance(Duration.ofHours(12));

        assertEquals(RunOutcome.ALREADY_RAN_TODAY, deps.dailyTrigger().runNow());
        assertEquals(instances, deps.instanceRepository().count());
    }

    @Test
    void nextDayRunsAgain() {
        deps = create(null);
        List<LocalDate> generated = new ArrayList<>();
        deps.eventBus().onInstancesGenerated((date, count) -> generated.add(date));

        deps.dailyTrigger().runNow();
        clock.advance(Duration.ofDays(1));

        assertEquals(RunOutcome.COMPLETED, deps.dailyTrigger().runNow());
        assertEquals(List.of(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 5)), generated);
        assertEquals(LocalDate.of(2024, 3, 5), deps.migrationStateRepository().lastRunDate().orElseThrow());
    }

    @Test
    void failedMigrationLeavesMarkerUntouched() {
        deps = create("not-the-real-checksum");

        assertEquals(RunOutcome.FAILED, deps.dailyTrigger().runNow());

        assertEquals(RunOutcome.FAILED, deps.dailyTrigger().lastOutcome().orElseThrow());
        assertEquals(TriggerState.IDLE, deps.dailyTrigger().state());
        assertTrue(deps.migrationStateRepository().lastRunDate().isEmpty());
        assertEquals(0, deps.instanceRepository().count());
        assertEquals(RunOutcome.FAILED, deps.dailyTrigger().runNow(), "retried on the next trigger");
    }
}
