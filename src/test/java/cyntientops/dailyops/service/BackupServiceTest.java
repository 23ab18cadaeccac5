package cyntientops.dailyops.service;

import cyntientops.dailyops.exception.BackupFailedException;
import cyntientops.dailyops.model.BackupRecord;
import cyntientops.dailyops.model.DatasetSnapshot;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.support.MutableClock;
import cyntientops.dailyops.support.TestData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BackupServiceTest {

    @TempDir
    Path dir;

    private final ChecksumService checksumService = new ChecksumService();
    private final MutableClock clock = MutableClock.utc("2024-03-04T05:01:00Z");

    @Test
    void writesSnapshotWithChecksumAndCounts() {
        BackupService service = new BackupService(dir, checksumService, clock);
        OperationalDataset dataset = TestData.smallDataset();

        BackupRecord record = service.createBackup(dataset);

        assertTrue(Files.exists(record.path()));
        assertTrue(record.path().getFileName().toString().startsWith("operational_backup_"));
        assertEquals(checksumService.checksum(dataset), record.checksum());
        assertEquals(2, record.workerCount());
        assertEquals(2, record.buildingCount());
        assertEquals(4, record.assignmentCount());

        DatasetSnapshot snapshot = service.read(record.path());
        assertEquals(DatasetSnapshot.FORMAT, snapshot.format());
        assertEquals(record.checksum(), snapshot.checksum());
        assertEquals(dataset, snapshot.dataset());
    }

    @Test
    void neverOverwritesAnExistingBackup() throws Exception {
        BackupService service = new BackupService(dir, checksumService, clock);

        BackupRecord first = service.createBackup(TestData.smallDataset());
        byte[] firstBytes = Files.readAllBytes(first.path());

        // Same instant, so the second file must pick a different name
        BackupRecord second = service.createBackup(TestData.smallDataset());

        assertNotEquals(first.path(), second.path());
        assertArrayEquals(firstBytes, Files.readAllBytes(first.path()));
        assertEquals(2, service.listBackups().size());
        assertEquals(second.path(), service.latestBackup().orElseThrow());
    }

    @Test
    void unwritableLocationFailsWithBackupFailed() throws Exception {
        Path blocker = dir.resolve("not-a-directory");
        Files.writeString(blocker, "x");
        BackupService service = new BackupService(blocker.resolve("backups"), checksumService, clock);

        BackupFailedException e = assertThrows(BackupFailedException.class,
                () -> service.createBackup(TestData.smallDataset()));
        assertEquals("BACKUP_FAILED", e.getErrorCode());
        assertTrue(e.getReason().startsWith("cannot write to"));
    }

    @Test
    void listIsEmptyWhenDirectoryIsMissing() {
        BackupService service = new BackupService(dir.resolve("missing"), checksumService, clock);

        assertTrue(service.listBackups().isEmpty());
        assertTrue(service.latestBackup().isEmpty());
    }
}
