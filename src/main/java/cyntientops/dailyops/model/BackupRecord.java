package cyntientops.dailyops.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Handle to a written dataset snapshot.
 */
public record BackupRecord(
        Path path,
        String checksum,
        Instant createdAt,
        int workerCount,
        int buildingCount,
        int assignmentCount) {
}
