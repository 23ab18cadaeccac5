package cyntientops.dailyops.scheduler;

import cyntientops.dailyops.model.CleanupReport;
import cyntientops.dailyops.repository.InstanceRepository;
import cyntientops.dailyops.repository.RetentionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;

/**
 * Reclaims historical records past the retention horizon:
 * - COMPLETED task instances last updated before the cutoff
 * - closed work sessions that ended before the cutoff
 * - photo evidence whose completion record is gone (any age)
 *
 * Pending instances are never touched. Each record is deleted on its own, so
 * one failure only skips that record.
 */
public class RetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

    private final InstanceRepository instanceRepository;
    private final RetentionRepository retentionRepository;
    private final Clock clock;

    public RetentionSweeper(InstanceRepository instanceRepository,
            RetentionRepository retentionRepository,
            Clock clock) {
        this.instanceRepository = instanceRepository;
        this.retentionRepository = retentionRepository;
        this.clock = clock;
    }

    /**
     * Delete records older than the horizon.
     *
     * @param horizonDays retention horizon in days, must not be negative
     * @return per-category deletion counts
     * @throws cyntientops.dailyops.exception.DatabaseException if candidates cannot be listed
     */
    public CleanupReport sweep(int horizonDays) {
        if (horizonDays < 0) {
            throw new IllegalArgumentException("horizonDays must not be negative: " + horizonDays);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(horizonDays));

        int[] failed = {0};
        int instances = deleteEach("completed instance",
                instanceRepository.findCompletedUpdatedBefore(cutoff), instanceRepository::deleteById, failed);
        int sessions = deleteEach("work session",
                retentionRepository.findClosedSessionsEndedBefore(cutoff), retentionRepository::deleteSession, failed);
        int attachments = deleteEach("orphaned photo evidence",
                retentionRepository.findOrphanedAttachments(), retentionRepository::deleteAttachment, failed);

        CleanupReport report = new CleanupReport(instances, sessions, attachments, failed[0]);
        log.info("Retention sweep (cutoff {}): {} instances, {} sessions, {} attachments deleted, {} failed",
                cutoff, instances, sessions, attachments, failed[0]);
        return report;
    }

    private static int deleteEach(String kind, List<String> ids, Predicate<String> delete, int[] failed) {
        int deleted = 0;
        for (String id : ids) {
            try {
                if (delete.test(id)) {
                    deleted++;
                }
            } catch (Exception e) {
                failed[0]++;
                log.error("Failed to delete {} {}", kind, id, e);
            }
        }
        return deleted;
    }
}
