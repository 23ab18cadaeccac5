package cyntientops.dailyops.config;

import cyntientops.dailyops.core.OperationsEventBus;
import cyntientops.dailyops.migration.MigrationOrchestrator;
import cyntientops.dailyops.migration.steps.DefaultMigrationSteps;
import cyntientops.dailyops.recurrence.RecurrenceEngine;
import cyntientops.dailyops.repository.InstanceRepository;
import cyntientops.dailyops.repository.MigrationStateRepository;
import cyntientops.dailyops.repository.OperationalDataSource;
import cyntientops.dailyops.repository.RetentionRepository;
import cyntientops.dailyops.repository.TemplateRepository;
import cyntientops.dailyops.scheduler.DailyPipeline;
import cyntientops.dailyops.scheduler.DailyTrigger;
import cyntientops.dailyops.scheduler.RetentionSweeper;
import cyntientops.dailyops.service.BackupService;
import cyntientops.dailyops.service.ChecksumService;
import cyntientops.dailyops.service.InstanceGenerator;
import cyntientops.dailyops.store.Database;
import cyntientops.dailyops.store.JdbcInstanceRepository;
import cyntientops.dailyops.store.JdbcMigrationStateRepository;
import cyntientops.dailyops.store.JdbcRetentionRepository;
import cyntientops.dailyops.store.JdbcTemplateRepository;
import cyntientops.dailyops.store.JsonOperationalDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(DailyOpsConfig.fromEnv());
 * deps.dailyTrigger().start(); // catch-up check + daily schedule
 * // ... run ...
 * deps.close(); // stops the trigger and the pool
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final DailyOpsConfig config;
    private final Clock clock;
    private final Database database;
    private final OperationsEventBus eventBus;

    private final TemplateRepository templateRepository;
    private final InstanceRepository instanceRepository;
    private final RetentionRepository retentionRepository;
    private final MigrationStateRepository migrationStateRepository;
    private final OperationalDataSource operationalDataSource;

    private final ChecksumService checksumService;
    private final BackupService backupService;
    private final MigrationOrchestrator migrationOrchestrator;
    private final InstanceGenerator instanceGenerator;
    private final RetentionSweeper retentionSweeper;
    private final DailyPipeline dailyPipeline;
    private final DailyTrigger dailyTrigger;

    private Dependencies(DailyOpsConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.eventBus = new OperationsEventBus();

        // Repositories
        this.templateRepository = new JdbcTemplateRepository(database);
        this.instanceRepository = new JdbcInstanceRepository(database);
        this.retentionRepository = new JdbcRetentionRepository(database);
        this.migrationStateRepository = new JdbcMigrationStateRepository(database);
        this.operationalDataSource = new JsonOperationalDataSource(config.datasetResource());

        // Services
        this.checksumService = new ChecksumService();
        this.backupService = new BackupService(config.backupDirectory(), checksumService, clock);
        this.migrationOrchestrator = new MigrationOrchestrator(
                migrationStateRepository,
                operationalDataSource,
                checksumService,
                backupService,
                DefaultMigrationSteps.create(clock),
                eventBus,
                config.targetSchemaVersion(),
                config.expectedDatasetChecksum(),
                clock);
        this.instanceGenerator = new InstanceGenerator(
                templateRepository, instanceRepository, new RecurrenceEngine(), eventBus, clock);
        this.retentionSweeper = new RetentionSweeper(instanceRepository, retentionRepository, clock);

        // Daily run
        this.dailyPipeline = new DailyPipeline(migrationStateRepository, migrationOrchestrator,
                instanceGenerator, retentionSweeper, eventBus, config.retentionDays());
        this.dailyTrigger = new DailyTrigger(dailyPipeline, clock, config.zone(), config.fireTime());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and the system clock.
     */
    public static Dependencies create(DailyOpsConfig config) {
        return create(config, Clock.system(config.zone()));
    }

    public static Dependencies create(DailyOpsConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(DailyOpsConfig.fromEnv());
    }

    // Getters
    public DailyOpsConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public OperationsEventBus eventBus() {
        return eventBus;
    }

    public TemplateRepository templateRepository() {
        return templateRepository;
    }

    public InstanceRepository instanceRepository() {
        return instanceRepository;
    }

    public RetentionRepository retentionRepository() {
        return retentionRepository;
    }

    public MigrationStateRepository migrationStateRepository() {
        return migrationStateRepository;
    }

    public ChecksumService checksumService() {
        return checksumService;
    }

    public BackupService backupService() {
        return backupService;
    }

    public MigrationOrchestrator migrationOrchestrator() {
        return migrationOrchestrator;
    }

    public InstanceGenerator instanceGenerator() {
        return instanceGenerator;
    }

    public RetentionSweeper retentionSweeper() {
        return retentionSweeper;
    }

    public DailyPipeline dailyPipeline() {
        return dailyPipeline;
    }

    public DailyTrigger dailyTrigger() {
        return dailyTrigger;
    }

    @Override
    public void close() {
        log.info("Shutting down dependencies...");

        dailyTrigger.stop();
        database.close();

        log.info("Dependencies shut down");
    }
}
