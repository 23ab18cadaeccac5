package cyntientops.dailyops.service;

import cyntientops.dailyops.exception.BackupFailedException;
import cyntientops.dailyops.exception.SerializationException;
import cyntientops.dailyops.model.BackupRecord;
import cyntientops.dailyops.model.DatasetSnapshot;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes dataset snapshots to the backup directory before a migration mutates anything.
 * Every call produces a new file; existing backups are never overwritten.
 */
public class BackupService {

    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    static final String PREFIX = "operational_backup_";
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final Path backupDirectory;
    private final ChecksumService checksumService;
    private final Clock clock;

    public BackupService(Path backupDirectory, ChecksumService checksumService, Clock clock) {
        this.backupDirectory = backupDirectory;
        this.checksumService = checksumService;
        this.clock = clock;
    }

    /**
     * Serialize the dataset with its checksum, counts and timestamp.
     *
     * @throws BackupFailedException if the snapshot cannot be serialized or written
     */
    public BackupRecord createBackup(OperationalDataset dataset) {
        log.info("Creating operational data backup in {}", backupDirectory);

        Instant now = clock.instant();
        String checksum;
        byte[] bytes;
        try {
            checksum = checksumService.checksum(dataset);
            bytes = Jsons.mapper().writeValueAsBytes(DatasetSnapshot.of(dataset, checksum, now));
        } catch (SerializationException | IOException e) {
            throw new BackupFailedException("cannot serialize dataset: " + e.getMessage(), e);
        }

        Path path;
        try {
            Files.createDirectories(backupDirectory);
            path = writeNew(bytes, now);
        } catch (IOException e) {
            throw new BackupFailedException("cannot write to " + backupDirectory + ": " + e.getMessage(), e);
        }

        BackupRecord record = new BackupRecord(path, checksum, now,
                dataset.workers().size(), dataset.buildings().size(), dataset.assignments().size());
        log.info("Backup created at {}: {} workers, {} buildings, {} assignments (checksum {})",
                path, record.workerCount(), record.buildingCount(), record.assignmentCount(), checksum);
        return record;
    }

    /**
     * Read a snapshot back, e.g. for diagnosing a failed migration.
     */
    public DatasetSnapshot read(Path path) {
        try {
            return Jsons.mapper().readValue(path.toFile(), DatasetSnapshot.class);
        } catch (IOException e) {
            throw new SerializationException("Failed to read backup " + path, e);
        }
    }

    /**
     * All backups in the directory, oldest first.
     */
    public List<Path> listBackups() {
        if (!Files.isDirectory(backupDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(backupDirectory)) {
            return files
                    .filter(p -> p.getFileName().toString().startsWith(PREFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Cannot list backups in {}: {}", backupDirectory, e.getMessage());
            return List.of();
        }
    }

    public Optional<Path> latestBackup() {
        List<Path> backups = listBackups();
        return backups.isEmpty() ? Optional.empty() : Optional.of(backups.get(backups.size() - 1));
    }

    private Path writeNew(byte[] bytes, Instant now) throws IOException {
        String base = PREFIX + now.toEpochMilli();
        for (int n = 0; n < MAX_NAME_ATTEMPTS; n++) {
            Path candidate = backupDirectory.resolve(n == 0 ? base + ".json" : base + "_" + n + ".json");
            try (OutputStream out = Files.newOutputStream(candidate, StandardOpenOption.CREATE_NEW,
                    StandardOpenOption.WRITE)) {
                out.write(bytes);
                return candidate;
            } catch (FileAlreadyExistsException e) {
                log.debug("Backup name {} taken, trying next", candidate.getFileName());
            }
        }
        throw new IOException("no free backup file name for " + base);
    }
}
