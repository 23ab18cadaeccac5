package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.migration.MigrationStep;
import cyntientops.dailyops.model.OperationalAssignment;
import cyntientops.dailyops.model.OperationalDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

import static cyntientops.dailyops.store.JdbcSupport.setTimestamp;

/**
 * One primary maintenance assignment per distinct worker-building pair.
 */
public class CreateAssignmentsStep implements MigrationStep {

    private static final Logger log = LoggerFactory.getLogger(CreateAssignmentsStep.class);

    static final String DEFAULT_ROLE = "maintenance";

    private final Clock clock;

    public CreateAssignmentsStep(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int order() {
        return 4;
    }

    @Override
    public String name() {
        return "create-assignments";
    }

    @Override
    public String description() {
        return "Creating worker assignments...";
    }

    @Override
    public int apply(Connection conn, OperationalDataset dataset) throws SQLException {
        Set<String> pairs = new LinkedHashSet<>();
        for (OperationalAssignment task : dataset.assignments()) {
            if (task.hasIds()) {
                pairs.add(task.workerId() + "-" + task.buildingId());
            }
        }

        String sql = """
                    INSERT INTO worker_assignments (id, worker_id, building_id, role, is_primary, created_at)
                    VALUES (?, ?, ?, ?, TRUE, ?)
                """;

        int created = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (OperationalAssignment task : dataset.assignments()) {
                if (!task.hasIds() || !pairs.remove(task.workerId() + "-" + task.buildingId())) {
                    continue;
                }
                if (assignmentExists(conn, task.workerId(), task.buildingId())) {
                    continue;
                }
                ps.setString(1, UUID.nameUUIDFromBytes(("assignment:" + task.workerId() + "-" + task.buildingId())
                        .getBytes(StandardCharsets.UTF_8)).toString());
                ps.setString(2, task.workerId());
                ps.setString(3, task.buildingId());
                ps.setString(4, DEFAULT_ROLE);
                setTimestamp(ps, 5, clock.instant());
                ps.executeUpdate();
                created++;
            }
        }

        log.info("Created {} worker-building assignments", created);
        return created;
    }

    private static boolean assignmentExists(Connection conn, String workerId, String buildingId)
            throws SQLException {
        String sql = "SELECT 1 FROM worker_assignments WHERE worker_id = ? AND building_id = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, workerId);
            ps.setString(2, buildingId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
