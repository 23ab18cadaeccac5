package cyntientops.dailyops.scheduler;

import cyntientops.dailyops.model.RunOutcome;
import cyntientops.dailyops.model.TriggerState;
import cyntientops.dailyops.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DailyTrigger scheduling and the in-progress guard.
 */
class DailyTriggerTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");
    private static final LocalTime FIRE = LocalTime.of(0, 1);

    private final MutableClock clock = MutableClock.utc("2024-03-04T15:00:00Z");

    private static DailyPipeline pipeline(Function<LocalDate, RunOutcome> body) {
        return new DailyPipeline(null, null, null, null, null, 0) {
            @Override
            public RunOutcome run(LocalDate today) {
                return body.apply(today);
            }
        };
    }

    @Test
    void nextFireLaterToday() {
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 4, 0, 0, 30, 0, NEW_YORK);

        assertEquals(Duration.ofSeconds(30), DailyTrigger.nextFireDelay(now, FIRE));
    }

    @Test
    void fireTimeReachedSchedulesTomorrow() {
        ZonedDateTime atFire = ZonedDateTime.of(2024, 3, 4, 0, 1, 0, 0, NEW_YORK);
        ZonedDateTime evening = ZonedDateTime.of(2024, 3, 4, 23, 0, 0, 0, NEW_YORK);

        assertEquals(Duration.ofHours(24), DailyTrigger.nextFireDelay(atFire, FIRE));
        assertEquals(Duration.ofMinutes(61), DailyTrigger.nextFireDelay(evening, FIRE));
    }

    @Test
    void nextFireAcrossDaylightSavingStart() {
        // Clocks skip 02:00 -> 03:00 on 2024-03-10 in New York
        ZonedDateTime now = ZonedDateTime.of(2024, 3, 10, 0, 30, 0, 0, NEW_YORK);

        assertEquals(Duration.ofHours(22).plusMinutes(31), DailyTrigger.nextFireDelay(now, FIRE));
    }

    @Test
    void runNowUsesLocalDateInConfiguredZone() {
        // 03:30 UTC on the 5th is still the 4th in New York
        clock.set(Instant.parse("2024-03-05T03:30:00Z"));
        List<LocalDate> dates = new ArrayList<>();
        DailyTrigger trigger = new DailyTrigger(pipeline(d -> {
            dates.add(d);
            return RunOutcome.COMPLETED;
        }), clock, NEW_YORK, FIRE);

        assertEquals(RunOutcome.COMPLETED, trigger.runNow());
        assertEquals(List.of(LocalDate.of(2024, 3, 4)), dates);
    }

    @Test
    void concurrentAttemptIsIgnored() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DailyTrigger trigger = new DailyTrigger(pipeline(d -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return RunOutcome.COMPLETED;
        }), clock, NEW_YORK, FIRE);

        CompletableFuture<RunOutcome> first = CompletableFuture.supplyAsync(trigger::runNow);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertEquals(TriggerState.RUNNING, trigger.state());
        assertEquals(RunOutcome.ALREADY_RUNNING, trigger.runNow());

        release.countDown();
        assertEquals(RunOutcome.COMPLETED, first.get(5, TimeUnit.SECONDS));
        assertEquals(TriggerState.IDLE, trigger.state());
    }

    @Test
    void failedRunPassesThroughFailedBackToIdle() {
        List<RunOutcome> outcomes = new ArrayList<>(List.of(RunOutcome.FAILED, RunOutcome.COMPLETED));
        DailyTrigger trigger = new DailyTrigger(pipeline(d -> outcomes.remove(0)), clock, NEW_YORK, FIRE);
        List<TriggerState> transitions = new ArrayList<>();
        trigger.setStateListener(transitions::add);
        assertTrue(trigger.lastOutcome().isEmpty());

        assertEquals(RunOutcome.FAILED, trigger.runNow());
        assertEquals(List.of(TriggerState.RUNNING, TriggerState.FAILED, TriggerState.IDLE), transitions);
        assertEquals(TriggerState.IDLE, trigger.state());
        assertEquals(RunOutcome.FAILED, trigger.lastOutcome().orElseThrow());

        transitions.clear();
        assertEquals(RunOutcome.COMPLETED, trigger.runNow());
        assertEquals(List.of(TriggerState.RUNNING, TriggerState.IDLE), transitions);
        assertEquals(RunOutcome.COMPLETED, trigger.lastOutcome().orElseThrow());
    }

    @Test
    void unexpectedExceptionIsReportedAsFailed() {
        DailyTrigger trigger = new DailyTrigger(pipeline(d -> {
            throw new IllegalStateException("boom");
        }), clock, NEW_YORK, FIRE);

        assertEquals(RunOutcome.FAILED, trigger.runNow());
        assertEquals(RunOutcome.FAILED, trigger.lastOutcome().orElseThrow());
        assertEquals(TriggerState.IDLE, trigger.state());
        assertEquals(RunOutcome.FAILED, trigger.runNow(), "guard released after failure");
    }

    @Test
    void startRunsCatchUpCheck() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);
        try (DailyTrigger trigger = new DailyTrigger(pipeline(d -> {
            ran.countDown();
            return RunOutcome.ALREADY_RAN_TODAY;
        }), clock, NEW_YORK, FIRE)) {
            trigger.onResume(); // ignored before start
            trigger.start();

            assertTrue(ran.await(5, TimeUnit.SECONDS));
            assertTrue(trigger.isRunning());
        }
    }

    @Test
    void resumeOnStartedTriggerRunsAnotherCatchUp() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch startupDone = new CountDownLatch(1);
        CountDownLatch resumeDone = new CountDownLatch(1);
        try (DailyTrigger trigger = new DailyTrigger(pipeline(d -> {
            if (calls.incrementAndGet() == 1) {
                startupDone.countDown();
            } else {
                resumeDone.countDown();
            }
            return RunOutcome.ALREADY_RAN_TODAY;
        }), clock, NEW_YORK, FIRE)) {
            trigger.start();
            assertTrue(startupDone.await(5, TimeUnit.SECONDS));

            trigger.onResume();

            assertTrue(resumeDone.await(5, TimeUnit.SECONDS));
            assertEquals(2, calls.get());
        }
    }

    @Test
    void resumeWhileRunInProgressIsIgnored() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch startupDone = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DailyTrigger trigger = new DailyTrigger(pipeline(d -> {
            if (calls.incrementAndGet() == 1) {
                startupDone.countDown();
                return RunOutcome.ALREADY_RAN_TODAY;
            }
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return RunOutcome.COMPLETED;
        }), clock, NEW_YORK, FIRE);
        List<TriggerState> transitions = new CopyOnWriteArrayList<>();
        try {
            trigger.start();
            assertTrue(startupDone.await(5, TimeUnit.SECONDS));

            CompletableFuture<RunOutcome> blocked = CompletableFuture.supplyAsync(trigger::runNow);
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            trigger.setStateListener(transitions::add);

            trigger.onResume();
            // stop() drains the queued resume check while the manual run still holds the guard
            trigger.stop();

            assertEquals(2, calls.get(), "resume must not reach the pipeline during a run");
            assertTrue(transitions.isEmpty());
            assertEquals(TriggerState.RUNNING, trigger.state());

            release.countDown();
            assertEquals(RunOutcome.COMPLETED, blocked.get(5, TimeUnit.SECONDS));
            assertEquals(TriggerState.IDLE, trigger.state());
        } finally {
            release.countDown();
            trigger.stop();
        }
    }

    @Test
    void startAfterStopFailsClearly() {
        DailyTrigger trigger = new DailyTrigger(pipeline(d -> RunOutcome.ALREADY_RAN_TODAY), clock, NEW_YORK, FIRE);
        trigger.start();
        trigger.stop();

        assertFalse(trigger.isRunning());
        assertThrows(IllegalStateException.class, trigger::start);
    }
}
