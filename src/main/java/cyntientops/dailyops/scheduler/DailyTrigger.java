package cyntientops.dailyops.scheduler;

import cyntientops.dailyops.model.RunOutcome;
import cyntientops.dailyops.model.TriggerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Fires the daily pipeline once per local day.
 *
 * <p>
 * Three entry points share one in-progress guard: the scheduled fire at the
 * configured local time, the catch-up check on {@link #start()} and
 * {@link #onResume()}, and the synchronous {@link #runNow()}. Whichever wins
 * runs; the others get {@link RunOutcome#ALREADY_RUNNING}. The pipeline's run
 * marker makes every entry point at-most-once per day.
 *
 * <p>
 * State moves IDLE -> RUNNING -> IDLE on success and RUNNING -> FAILED -> IDLE
 * on error; the failed day is retried at the next trigger. {@link #lastOutcome()}
 * keeps the result of the latest attempt. {@link #stop()} is terminal: a stopped
 * trigger cannot be started again.
 */
public class DailyTrigger implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DailyTrigger.class);

    private final DailyPipeline pipeline;
    private final Clock clock;
    private final ZoneId zone;
    private final LocalTime fireTime;
    private final ScheduledExecutorService executor;

    private final AtomicBoolean inProgress = new AtomicBoolean(false);
    private final AtomicReference<TriggerState> state = new AtomicReference<>(TriggerState.IDLE);
    private final AtomicReference<RunOutcome> lastOutcome = new AtomicReference<>();
    private volatile Consumer<TriggerState> stateListener = s -> {
    };
    private volatile boolean running = false;
    private volatile ScheduledFuture<?> nextFire;

    public DailyTrigger(DailyPipeline pipeline, Clock clock, ZoneId zone, LocalTime fireTime) {
        this.pipeline = pipeline;
        this.clock = clock;
        this.zone = zone;
        this.fireTime = fireTime;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "dailyops-trigger");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start: run a catch-up check now, then schedule the next daily fire.
     */
    public void start() {
        if (executor.isShutdown()) {
            throw new IllegalStateException("Daily trigger was stopped and cannot be restarted");
        }
        if (running) {
            log.warn("Daily trigger already running");
            return;
        }
        running = true;

        executor.execute(this::catchUp);
        scheduleNext();
        log.info("Daily trigger started (fire time {} {})", fireTime, zone);
    }

    /**
     * The host came back to the foreground or woke from sleep: check whether
     * today's run was missed.
     */
    public void onResume() {
        if (!running) {
            log.debug("Resume ignored, trigger not started");
            return;
        }
        executor.execute(this::catchUp);
    }

    /**
     * Run the pipeline for today on the calling thread.
     */
    public RunOutcome runNow() {
        return attempt(today());
    }

    public TriggerState state() {
        return state.get();
    }

    /**
     * Result of the latest attempt that reached the pipeline, empty before the first.
     */
    public Optional<RunOutcome> lastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    /**
     * Receives every state transition, on the thread that made it.
     */
    public void setStateListener(Consumer<TriggerState> listener) {
        this.stateListener = listener != null ? listener : s -> {
        };
    }

    public boolean isRunning() {
        return running;
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        ScheduledFuture<?> pending = nextFire;
        if (pending != null) {
            pending.cancel(false);
        }
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Daily trigger forcefully stopped");
            } else {
                log.info("Daily trigger stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    RunOutcome attempt(LocalDate today) {
        if (!inProgress.compareAndSet(false, true)) {
            log.info("Daily run already in progress, ignoring trigger");
            return RunOutcome.ALREADY_RUNNING;
        }
        try {
            transition(TriggerState.RUNNING);
            RunOutcome outcome;
            try {
                outcome = pipeline.run(today);
            } catch (RuntimeException e) {
                log.error("Daily run for {} failed unexpectedly", today, e);
                outcome = RunOutcome.FAILED;
            }
            lastOutcome.set(outcome);
            if (outcome == RunOutcome.FAILED) {
                transition(TriggerState.FAILED);
                log.warn("Daily run for {} failed; retrying at the next trigger", today);
            }
            transition(TriggerState.IDLE);
            return outcome;
        } finally {
            inProgress.set(false);
        }
    }

    private void transition(TriggerState next) {
        state.set(next);
        try {
            stateListener.accept(next);
        } catch (RuntimeException e) {
            log.warn("Trigger state listener failed", e);
        }
    }

    /**
     * Delay from now until the next occurrence of the fire time in the zone.
     * A fire time equal to now counts as next day.
     */
    static Duration nextFireDelay(ZonedDateTime now, LocalTime fireTime) {
        ZonedDateTime next = now.toLocalDate().atTime(fireTime).atZone(now.getZone());
        if (!next.isAfter(now)) {
            next = now.toLocalDate().plusDays(1).atTime(fireTime).atZone(now.getZone());
        }
        return Duration.between(now, next);
    }

    private void catchUp() {
        RunOutcome outcome = attempt(today());
        log.debug("Catch-up check finished: {}", outcome);
    }

    private void fire() {
        try {
            RunOutcome outcome = attempt(today());
            log.info("Scheduled daily run finished: {}", outcome);
        } finally {
            scheduleNext();
        }
    }

    private void scheduleNext() {
        if (!running) {
            return;
        }
        Duration delay = nextFireDelay(ZonedDateTime.now(clock).withZoneSameInstant(zone), fireTime);
        nextFire = executor.schedule(this::fire, delay.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Next daily run in {}", delay);
    }

    private LocalDate today() {
        return ZonedDateTime.now(clock).withZoneSameInstant(zone).toLocalDate();
    }
}
