package cyntientops.dailyops.repository;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted migration and daily-run bookkeeping: schema version, the ordered
 * migration log, the daily run marker and the last backup reference.
 */
public interface MigrationStateRepository {

    /**
     * Stored schema version, 0 for a fresh installation.
     */
    int schemaVersion();

    void setSchemaVersion(int version);

    /**
     * Idempotency keys of steps recorded as complete.
     */
    Set<String> completedStepKeys();

    /**
     * Record a step as complete on the caller's connection, so the marker
     * commits or rolls back together with the step's data.
     */
    void recordStep(Connection conn, String key, int order, int version, String description, int rowsAffected,
            Instant completedAt) throws SQLException;

    /**
     * Date of the last fully successful daily run.
     */
    Optional<LocalDate> lastRunDate();

    void setLastRunDate(LocalDate date);

    Optional<String> lastBackupPath();

    /**
     * Checksum recorded with the last backup: the last known-good dataset checksum.
     */
    Optional<String> lastMigrationChecksum();

    /**
     * Schema version the last backup was taken for. A backup for the current
     * target marks a migration attempt as started.
     */
    Optional<Integer> lastBackupVersion();

    void recordBackup(String path, String checksum, int targetVersion);

    /**
     * Open a connection for an exclusive migration write scope.
     * Caller owns commit, rollback and close.
     */
    Connection openWriteScope() throws SQLException;
}
