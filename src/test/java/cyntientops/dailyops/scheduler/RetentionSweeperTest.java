package cyntientops.dailyops.scheduler;

import cyntientops.dailyops.exception.DatabaseException;
import cyntientops.dailyops.model.CleanupReport;
import cyntientops.dailyops.model.TaskInstance;
import cyntientops.dailyops.store.Database;
import cyntientops.dailyops.store.JdbcInstanceRepository;
import cyntientops.dailyops.store.JdbcRetentionRepository;
import cyntientops.dailyops.support.MutableClock;
import cyntientops.dailyops.support.TestData;
import org.junit.jupiter.api.*;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RetentionSweeper: only old terminal records and orphans are removed.
 */
class RetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2024-06-01T05:01:00Z");
    private static final Instant OLD = NOW.minus(Duration.ofDays(120));
    private static final Instant RECENT = NOW.minus(Duration.ofDays(10));

    private static Database db;
    private static JdbcInstanceRepository instances;
    private static JdbcRetentionRepository retention;

    private RetentionSweeper sweeper;

    @BeforeAll
    static void setup() {
        db = new Database(TestData.h2Url("test-retention"), 2);
        instances = new JdbcInstanceRepository(db);
        retention = new JdbcRetentionRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestData.wipe(db);
        sweeper = new RetentionSweeper(instances, retention, new MutableClock(NOW, ZoneOffset.UTC));
    }

    private static String instance(String templateId, Instant createdAt, boolean completed) {
        TaskInstance instance = TaskInstance.pendingFrom(TestData.template(templateId, "daily").build(),
                LocalDate.of(2024, 1, 2), createdAt);
        instances.insert(instance);
        if (completed) {
            instances.markCompleted(instance.id(), createdAt);
        }
        return instance.id();
    }

    private static void exec(String sql, Object... args) throws Exception {
        try (var conn = db.getConnection();
                var ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < args.length; i++) {
                Object arg = args[i];
                ps.setObject(i + 1, arg instanceof Instant t ? Timestamp.from(t) : arg);
            }
            ps.executeUpdate();
            conn.commit();
        }
    }

    @Test
    void deletesOnlyOldCompletedInstances() {
        String oldPending = instance("old-pending", OLD, false);
        String oldCompleted = instance("old-completed", OLD, true);
        String recentCompleted = instance("recent-completed", RECENT, true);

        CleanupReport report = sweeper.sweep(90);

        assertEquals(1, report.deletedInstances());
        assertTrue(instances.findById(oldPending).isPresent(), "pending instances are never deleted");
        assertTrue(instances.findById(oldCompleted).isEmpty());
        assertTrue(instances.findById(recentCompleted).isPresent());
    }

    @Test
    void deletesOnlyOldClosedSessions() throws Exception {
        exec("INSERT INTO clock_sessions (id, worker_id, clock_in_time, clock_out_time) VALUES (?, ?, ?, ?)",
                "old-closed", "4", OLD, OLD.plusSeconds(3600));
        exec("INSERT INTO clock_sessions (id, worker_id, clock_in_time, clock_out_time) VALUES (?, ?, ?, NULL)",
                "old-open", "4", OLD);
        exec("INSERT INTO clock_sessions (id, worker_id, clock_in_time, clock_out_time) VALUES (?, ?, ?, ?)",
                "recent-closed", "4", RECENT, RECENT.plusSeconds(3600));

        CleanupReport report = sweeper.sweep(90);

        assertEquals(1, report.deletedSessions());
        assertEquals(2, count("clock_sessions"));
    }

    @Test
    void deletesOrphanedAttachmentsOfAnyAge() throws Exception {
        exec("INSERT INTO task_completions (id, task_id, worker_id, completed_at) VALUES (?, ?, ?, ?)",
                "c-1", "t-1", "4", RECENT);
        exec("INSERT INTO photo_evidence (id, completion_id, file_path, created_at) VALUES (?, ?, ?, ?)",
                "p-kept", "c-1", "/photos/a.jpg", RECENT);
        exec("INSERT INTO photo_evidence (id, completion_id, file_path, created_at) VALUES (?, ?, ?, ?)",
                "p-orphan", "c-gone", "/photos/b.jpg", RECENT);

        CleanupReport report = sweeper.sweep(90);

        assertEquals(1, report.deletedOrphanedAttachments());
        assertEquals(1, count("photo_evidence"));
    }

    @Test
    void zeroHorizonStillKeepsPending() {
        String pending = instance("pending", RECENT, false);
        instance("completed", RECENT, true);

        CleanupReport report = sweeper.sweep(0);

        assertEquals(1, report.deletedInstances());
        assertTrue(instances.findById(pending).isPresent());
        assertThrows(IllegalArgumentException.class, () -> sweeper.sweep(-1));
    }

    private static int count(String table) throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement();
                var rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    @Test
    void candidateListingFailurePropagates() {
        JdbcRetentionRepository unreachable = new JdbcRetentionRepository(db) {
            @Override
            public List<String> findClosedSessionsEndedBefore(Instant cutoff) {
                throw new DatabaseException("storage unreachable", new SQLException("connection refused"));
            }
        };
        RetentionSweeper failing = new RetentionSweeper(instances, unreachable,
                new MutableClock(NOW, ZoneOffset.UTC));

        assertThrows(DatabaseException.class, () -> failing.sweep(90));
    }
}
