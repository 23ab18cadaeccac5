package cyntientops.dailyops.scheduler;

import cyntientops.dailyops.core.OperationsEventBus;
import cyntientops.dailyops.exception.DailyOpsException;
import cyntientops.dailyops.migration.MigrationOrchestrator;
import cyntientops.dailyops.model.CleanupReport;
import cyntientops.dailyops.model.GenerationReport;
import cyntientops.dailyops.model.RunOutcome;
import cyntientops.dailyops.repository.MigrationStateRepository;
import cyntientops.dailyops.service.InstanceGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One daily run: migrate if needed, generate the day's instances, sweep old
 * records. The run marker advances only when all three succeed.
 */
public class DailyPipeline {

    private static final Logger log = LoggerFactory.getLogger(DailyPipeline.class);

    private final MigrationStateRepository state;
    private final MigrationOrchestrator orchestrator;
    private final InstanceGenerator generator;
    private final RetentionSweeper sweeper;
    private final OperationsEventBus eventBus;
    private final int retentionDays;

    public DailyPipeline(MigrationStateRepository state,
            MigrationOrchestrator orchestrator,
            InstanceGenerator generator,
            RetentionSweeper sweeper,
            OperationsEventBus eventBus,
            int retentionDays) {
        this.state = state;
        this.orchestrator = orchestrator;
        this.generator = generator;
        this.sweeper = sweeper;
        this.eventBus = eventBus;
        this.retentionDays = retentionDays;
    }

    /**
     * Run the daily operations for a date.
     *
     * @param today the local calendar date of this run
     * @return COMPLETED, ALREADY_RAN_TODAY or FAILED
     */
    public RunOutcome run(LocalDate today) {
        try {
            Optional<LocalDate> lastRun = state.lastRunDate();
            if (lastRun.filter(today::equals).isPresent()) {
                log.debug("Daily operations already ran for {}", today);
                return RunOutcome.ALREADY_RAN_TODAY;
            }

            log.info("Starting daily operations for {} (last run: {})", today, lastRun.orElse(null));

            if (orchestrator.runMigrationIfNeeded()) {
                log.info("Migration applied before generation");
            }

            GenerationReport generation = generator.generateForDate(today);
            CleanupReport cleanup = sweeper.sweep(retentionDays);

            state.setLastRunDate(today);

            if (!generation.affectedBuildings().isEmpty()) {
                eventBus.fireMetricsInvalidated(generation.affectedBuildings());
            }

            log.info("Daily operations completed for {}: {} instances created, {} records cleaned up",
                    today, generation.created(), cleanup.total());
            return RunOutcome.COMPLETED;
        } catch (DailyOpsException e) {
            log.error("Daily operations failed for {} [{}]: {}", today, e.getErrorCode(), e.getMessage(), e);
            return RunOutcome.FAILED;
        }
    }
}
