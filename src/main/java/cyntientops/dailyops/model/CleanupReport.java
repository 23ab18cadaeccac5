package cyntientops.dailyops.model;

/**
 * Outcome of one retention sweep.
 */
public record CleanupReport(
        int deletedInstances,
        int deletedSessions,
        int deletedOrphanedAttachments,
        int failed) {

    public int total() {
        return deletedInstances + deletedSessions + deletedOrphanedAttachments;
    }
}
