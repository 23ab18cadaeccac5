package cyntientops.dailyops.exception;

/**
 * The source dataset could not be snapshotted. Aborts the migration attempt
 * before any step runs.
 */
public class BackupFailedException extends DailyOpsException {

    private final String reason;

    public BackupFailedException(String reason) {
        super("BACKUP_FAILED", "Backup failed: " + reason);
        this.reason = reason;
    }

    public BackupFailedException(String reason, Throwable cause) {
        super("BACKUP_FAILED", "Backup failed: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
