package cyntientops.dailyops.config;

import java.nio.file.Path;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Configuration holder for daily operations settings.
 * All settings have sensible defaults.
 */
public final class DailyOpsConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/dailyops;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 4;

    // Migration settings
    private int targetSchemaVersion = 1;
    private Path backupDirectory = Path.of("./data/backups");
    private String expectedDatasetChecksum = null; // If set, the source dataset must hash to this value
    private String datasetResource = "/dailyops/operational-data.json";

    // Daily run settings
    private LocalTime fireTime = LocalTime.of(0, 1);
    private ZoneId zone = ZoneId.systemDefault();
    private int retentionDays = 90;

    private DailyOpsConfig() {
    }

    public static DailyOpsConfig defaults() {
        return new DailyOpsConfig();
    }

    public static DailyOpsConfig fromEnv() {
        DailyOpsConfig config = new DailyOpsConfig();

        // Override from environment variables
        String dbUrl = System.getenv("DAILYOPS_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String fireTime = System.getenv("DAILYOPS_FIRE_TIME");
        if (fireTime != null && !fireTime.isBlank()) {
            config.fireTime = LocalTime.parse(fireTime.trim());
        }

        String zone = System.getenv("DAILYOPS_ZONE");
        if (zone != null && !zone.isBlank()) {
            config.zone = ZoneId.of(zone.trim());
        }

        String retention = System.getenv("DAILYOPS_RETENTION_DAYS");
        if (retention != null && !retention.isBlank()) {
            config.retentionDays = Integer.parseInt(retention.trim());
        }

        String targetVersion = System.getenv("DAILYOPS_TARGET_VERSION");
        if (targetVersion != null && !targetVersion.isBlank()) {
            config.targetSchemaVersion = Integer.parseInt(targetVersion.trim());
        }

        String backupDir = System.getenv("DAILYOPS_BACKUP_DIR");
        if (backupDir != null && !backupDir.isBlank()) {
            config.backupDirectory = Path.of(backupDir.trim());
        }

        String checksum = System.getenv("DAILYOPS_EXPECTED_CHECKSUM");
        if (checksum != null && !checksum.isBlank()) {
            config.expectedDatasetChecksum = checksum.trim();
        }

        return config;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int targetSchemaVersion() {
        return targetSchemaVersion;
    }

    public Path backupDirectory() {
        return backupDirectory;
    }

    public String expectedDatasetChecksum() {
        return expectedDatasetChecksum;
    }

    public boolean hasExpectedDatasetChecksum() {
        return expectedDatasetChecksum != null && !expectedDatasetChecksum.isBlank();
    }

    public String datasetResource() {
        return datasetResource;
    }

    public LocalTime fireTime() {
        return fireTime;
    }

    public ZoneId zone() {
        return zone;
    }

    public int retentionDays() {
        return retentionDays;
    }

    // Fluent setters for testing/customization
    public DailyOpsConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public DailyOpsConfig withTargetSchemaVersion(int version) {
        this.targetSchemaVersion = version;
        return this;
    }

    public DailyOpsConfig withBackupDirectory(Path directory) {
        this.backupDirectory = directory;
        return this;
    }

    public DailyOpsConfig withExpectedDatasetChecksum(String checksum) {
        this.expectedDatasetChecksum = checksum;
        return this;
    }

    public DailyOpsConfig withDatasetResource(String resource) {
        this.datasetResource = resource;
        return this;
    }

    public DailyOpsConfig withFireTime(LocalTime time) {
        this.fireTime = time;
        return this;
    }

    public DailyOpsConfig withZone(ZoneId zone) {
        this.zone = zone;
        return this;
    }

    public DailyOpsConfig withRetentionDays(int days) {
        this.retentionDays = days;
        return this;
    }

    @Override
    public String toString() {
        return "DailyOpsConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", targetSchemaVersion=" + targetSchemaVersion +
                ", fireTime=" + fireTime +
                ", zone=" + zone +
                ", retentionDays=" + retentionDays +
                ", backupDirectory=" + backupDirectory +
                ", expectedChecksumSet=" + hasExpectedDatasetChecksum() +
                '}';
    }
}
