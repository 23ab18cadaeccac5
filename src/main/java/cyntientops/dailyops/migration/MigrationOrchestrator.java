package cyntientops.dailyops.migration;

import cyntientops.dailyops.core.OperationsEventBus;
import cyntientops.dailyops.exception.DatabaseException;
import cyntientops.dailyops.exception.IntegrityCheckFailedException;
import cyntientops.dailyops.exception.StepExecutionFailedException;
import cyntientops.dailyops.model.BackupRecord;
import cyntientops.dailyops.model.OperationalAssignment;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.repository.MigrationStateRepository;
import cyntientops.dailyops.repository.OperationalDataSource;
import cyntientops.dailyops.service.BackupService;
import cyntientops.dailyops.service.ChecksumService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the one-time migration of the canonical operational dataset into the database.
 *
 * <p>Order of an attempt:
 * <ol>
 * <li>return immediately if the stored schema version has reached the target</li>
 * <li>verify the dataset (checksum against the last known-good value, references)</li>
 * <li>back the dataset up (reused when resuming an attempt on unchanged data)</li>
 * <li>run each step not yet in the migration log, in declared order, on one
 * connection; a step's rows and its log entry commit together</li>
 * <li>advance the schema version and publish migration-completed</li>
 * </ol>
 * A failing step aborts the attempt; the steps before it stay recorded, so the
 * next attempt resumes at the first incomplete step.
 */
public class MigrationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MigrationOrchestrator.class);

    private static final int PRE_STEPS = 2; // integrity check + backup

    private final MigrationStateRepository state;
    private final OperationalDataSource dataSource;
    private final ChecksumService checksumService;
    private final BackupService backupService;
    private final List<MigrationStep> steps;
    private final OperationsEventBus eventBus;
    private final int targetVersion;
    private final String expectedChecksum;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile MigrationProgressListener progressListener = MigrationProgressListener.NONE;

    public MigrationOrchestrator(MigrationStateRepository state,
            OperationalDataSource dataSource,
            ChecksumService checksumService,
            BackupService backupService,
            List<MigrationStep> steps,
            OperationsEventBus eventBus,
            int targetVersion,
            String expectedChecksum,
            Clock clock) {
        this.state = state;
        this.dataSource = dataSource;
        this.checksumService = checksumService;
        this.backupService = backupService;
        this.steps = steps.stream().sorted(Comparator.comparingInt(MigrationStep::order)).toList();
        this.eventBus = eventBus;
        this.targetVersion = targetVersion;
        this.expectedChecksum = expectedChecksum;
        this.clock = clock;
    }

    public void setProgressListener(MigrationProgressListener listener) {
        this.progressListener = listener != null ? listener : MigrationProgressListener.NONE;
    }

    public boolean needsMigration() {
        return state.schemaVersion() < targetVersion;
    }

    public int currentVersion() {
        return state.schemaVersion();
    }

    public int targetVersion() {
        return targetVersion;
    }

    /**
     * Migrate if the stored schema version is below the target. Safe to call
     * repeatedly; concurrent callers are serialized and the later one sees the
     * migration already done.
     *
     * @return true if this call advanced the schema version
     * @throws IntegrityCheckFailedException if the dataset drifted or is inconsistent
     * @throws cyntientops.dailyops.exception.BackupFailedException if the snapshot could not be written
     * @throws StepExecutionFailedException if a step failed
     * @throws DatabaseException if the migration state cannot be read or written
     */
    public boolean runMigrationIfNeeded() {
        lock.lock();
        try {
            int current = state.schemaVersion();
            if (current >= targetVersion) {
                log.debug("Migration already completed (version {})", current);
                return false;
            }

            log.info("Starting one-time operational data migration: version {} -> {}", current, targetVersion);
            int total = PRE_STEPS + steps.size();
            Set<String> completed = state.completedStepKeys();
            // A backup taken for this target means an earlier attempt already started
            boolean resuming = state.lastBackupVersion().filter(v -> v == targetVersion).isPresent()
                    || completed.stream().anyMatch(k -> k.endsWith("@v" + targetVersion));

            OperationalDataset dataset = dataSource.load();

            progress(1, total, "Verifying data integrity...");
            String checksum = verifyIntegrity(dataset, resuming);

            progress(2, total, "Creating backup of operational data...");
            ensureBackup(dataset, checksum, resuming);

            runSteps(dataset, completed, total);

            state.setSchemaVersion(targetVersion);
            progress(total, total, "Migration completed successfully");
            log.info("One-time migration completed (version {})", targetVersion);

            eventBus.fireMigrationCompleted(targetVersion);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check the dataset against its last known-good checksum and validate references.
     *
     * @return the dataset checksum
     */
    String verifyIntegrity(OperationalDataset dataset, boolean resuming) {
        String actual = checksumService.checksum(dataset);

        Optional<String> knownGood = expectedChecksum != null && !expectedChecksum.isBlank()
                ? Optional.of(expectedChecksum)
                : resuming ? state.lastMigrationChecksum() : Optional.empty();

        if (knownGood.isPresent() && !knownGood.get().equals(actual)) {
            log.error("Operational data checksum mismatch: expected {}, got {}", knownGood.get(), actual);
            throw new IntegrityCheckFailedException(knownGood.get(), actual);
        }

        if (dataset.workers().isEmpty() || dataset.buildings().isEmpty()) {
            throw new IntegrityCheckFailedException("Operational dataset has no workers or no buildings");
        }

        Set<String> workerIds = dataset.workerIds();
        Set<String> buildingIds = dataset.buildingIds();
        for (OperationalAssignment a : dataset.assignments()) {
            if (!a.hasIds()) {
                continue; // skipped by the template import
            }
            if (!workerIds.contains(a.workerId()) || !buildingIds.contains(a.buildingId())) {
                throw new IntegrityCheckFailedException(String.format(
                        "Assignment '%s' references unknown worker %s or building %s",
                        a.taskName(), a.workerId(), a.buildingId()));
            }
        }

        log.info("Operational data verified (checksum {})", actual);
        return actual;
    }

    private void ensureBackup(OperationalDataset dataset, String checksum, boolean resuming) {
        if (resuming) {
            Optional<String> lastPath = state.lastBackupPath();
            Optional<String> lastChecksum = state.lastMigrationChecksum();
            if (lastPath.isPresent() && lastChecksum.filter(checksum::equals).isPresent()
                    && Files.exists(Path.of(lastPath.get()))) {
                log.info("Resuming migration; reusing backup {}", lastPath.get());
                return;
            }
        }

        BackupRecord backup = backupService.createBackup(dataset);
        state.recordBackup(backup.path().toString(), backup.checksum(), targetVersion);
    }

    private void runSteps(OperationalDataset dataset, Set<String> completed, int total) {
        try (Connection conn = state.openWriteScope()) {
            for (int i = 0; i < steps.size(); i++) {
                MigrationStep step = steps.get(i);
                String key = step.key(targetVersion);

                if (completed.contains(key)) {
                    log.info("Skipping step {} (already complete)", key);
                    continue;
                }

                progress(PRE_STEPS + i + 1, total, step.description());
                try {
                    int rows = step.apply(conn, dataset);
                    state.recordStep(conn, key, step.order(), targetVersion, step.description(), rows,
                            clock.instant());
                    conn.commit();
                    log.info("Step {} complete: {} rows inserted", key, rows);
                } catch (SQLException | RuntimeException e) {
                    rollback(conn);
                    log.error("Migration step {} failed", key, e);
                    throw new StepExecutionFailedException(key, e);
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("Migration write scope failed", e);
        }
    }

    private void rollback(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback after failed step did not complete: {}", e.getMessage());
        }
    }

    private void progress(int step, int total, String status) {
        log.debug("[{}/{}] {}", step, total, status);
        try {
            progressListener.onProgress(step, total, status);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed", e);
        }
    }
}
