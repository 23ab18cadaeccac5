package cyntientops.dailyops.repository;

import java.time.Instant;
import java.util.List;

/**
 * Access to historical records owned by other workflows (work sessions,
 * completions, photo evidence) that the retention sweep reclaims.
 */
public interface RetentionRepository {

    /**
     * IDs of closed work sessions (clock-out recorded) that ended before the cutoff.
     */
    List<String> findClosedSessionsEndedBefore(Instant cutoff);

    boolean deleteSession(String sessionId);

    /**
     * IDs of photo evidence rows whose owning completion record no longer exists.
     */
    List<String> findOrphanedAttachments();

    boolean deleteAttachment(String attachmentId);
}
