package cyntientops.dailyops.store;

import cyntientops.dailyops.exception.DatabaseException;
import cyntientops.dailyops.model.InstanceStatus;
import cyntientops.dailyops.model.TaskInstance;
import cyntientops.dailyops.model.TaskPriority;
import cyntientops.dailyops.repository.InstanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static cyntientops.dailyops.store.JdbcSupport.isUniqueViolation;
import static cyntientops.dailyops.store.JdbcSupport.rollbackQuietly;
import static cyntientops.dailyops.store.JdbcSupport.setTimestamp;
import static cyntientops.dailyops.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of InstanceRepository.
 * The (template_id, scheduled_date) unique constraint backs the dedup check.
 */
public class JdbcInstanceRepository implements InstanceRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcInstanceRepository.class);

    private final Database db;

    public JdbcInstanceRepository(Database db) {
        this.db = db;
    }

    @Override
    public boolean insert(TaskInstance instance) {
        String sql = """
                    INSERT INTO routine_tasks (id, template_id, building_id, worker_id, title, description, category,
                                               priority, status, frequency, estimated_duration, requires_photo,
                                               scheduled_date, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, instance.id());
                ps.setString(2, instance.templateId());
                ps.setString(3, instance.buildingId());
                ps.setString(4, instance.workerId());
                ps.setString(5, instance.title());
                ps.setString(6, instance.description());
                ps.setString(7, instance.category());
                ps.setInt(8, instance.priority().rank());
                ps.setString(9, instance.status().name());
                ps.setString(10, instance.frequency());
                ps.setInt(11, instance.estimatedDuration());
                ps.setBoolean(12, instance.requiresPhoto());
                ps.setObject(13, instance.scheduledDate());
                setTimestamp(ps, 14, instance.createdAt());
                setTimestamp(ps, 15, instance.updatedAt());

                ps.executeUpdate();
                conn.commit();
                return true;
            } catch (SQLException e) {
                rollbackQuietly(conn, log);
                if (isUniqueViolation(e)) {
                    log.debug("Instance for template {} on {} already exists", instance.templateId(),
                            instance.scheduledDate());
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new DatabaseException("Failed to insert instance for template: " + instance.templateId(), e);
        }
    }

    @Override
    public Optional<TaskInstance> findByTemplateAndDate(String templateId, LocalDate date) {
        String sql = "SELECT * FROM routine_tasks WHERE template_id = ? AND scheduled_date = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, templateId);
            ps.setObject(2, date);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find instance for template " + templateId + " on " + date, e);
        }
    }

    @Override
    public Optional<TaskInstance> findById(String instanceId) {
        String sql = "SELECT * FROM routine_tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instanceId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find instance: " + instanceId, e);
        }
    }

    @Override
    public List<TaskInstance> findByDate(LocalDate date) {
        String sql = "SELECT * FROM routine_tasks WHERE scheduled_date = ? ORDER BY worker_id, building_id, priority DESC";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, date);
            List<TaskInstance> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find instances for " + date, e);
        }
    }

    @Override
    public boolean markCompleted(String instanceId, Instant completedAt) {
        String sql = "UPDATE routine_tasks SET status = 'COMPLETED', updated_at = ? WHERE id = ? AND status = 'PENDING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, completedAt);
            ps.setString(2, instanceId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to complete instance: " + instanceId, e);
        }
    }

    @Override
    public List<String> findCompletedUpdatedBefore(Instant cutoff) {
        String sql = "SELECT id FROM routine_tasks WHERE status = 'COMPLETED' AND updated_at < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            List<String> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find expired completed instances", e);
        }
    }

    @Override
    public boolean deleteById(String instanceId) {
        // Status re-checked so a row reopened since the scan is kept
        String sql = "DELETE FROM routine_tasks WHERE id = ? AND status = 'COMPLETED'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, instanceId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to delete instance: " + instanceId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM routine_tasks")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to count instances", e);
        }
    }

    private TaskInstance mapRow(ResultSet rs) throws SQLException {
        return TaskInstance.builder()
                .id(rs.getString("id"))
                .templateId(rs.getString("template_id"))
                .workerId(rs.getString("worker_id"))
                .buildingId(rs.getString("building_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .category(rs.getString("category"))
                .priority(TaskPriority.fromRank(rs.getInt("priority")))
                .status(InstanceStatus.valueOf(rs.getString("status")))
                .frequency(rs.getString("frequency"))
                .estimatedDuration(rs.getInt("estimated_duration"))
                .requiresPhoto(rs.getBoolean("requires_photo"))
                .scheduledDate(rs.getObject("scheduled_date", LocalDate.class))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
