package cyntientops.dailyops.store;

import cyntientops.dailyops.exception.DatabaseException;
import cyntientops.dailyops.model.RoutineTemplate;
import cyntientops.dailyops.model.TaskPriority;
import cyntientops.dailyops.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static cyntientops.dailyops.store.JdbcSupport.getIntOrNull;
import static cyntientops.dailyops.store.JdbcSupport.setIntOrNull;
import static cyntientops.dailyops.store.JdbcSupport.setTimestamp;
import static cyntientops.dailyops.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TemplateRepository.
 */
public class JdbcTemplateRepository implements TemplateRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTemplateRepository.class);

    static final String INSERT_SQL = """
                INSERT INTO routine_templates (id, worker_id, building_id, title, description, category, frequency,
                                               days_of_week, estimated_duration, requires_photo, priority,
                                               start_hour, end_hour, is_active, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private final Database db;

    public JdbcTemplateRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(RoutineTemplate template) {
        try (Connection conn = db.getConnection()) {
            insert(conn, template);
            conn.commit();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to save template: " + template.id(), e);
        }
    }

    /**
     * Insert on the caller's connection without committing.
     */
    public static void insert(Connection conn, RoutineTemplate template) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            Instant created = template.createdAt() != null ? template.createdAt() : Instant.now();
            ps.setString(1, template.id());
            ps.setString(2, template.workerId());
            ps.setString(3, template.buildingId());
            ps.setString(4, template.title());
            ps.setString(5, template.description());
            ps.setString(6, template.category());
            ps.setString(7, template.frequency());
            ps.setString(8, template.daysOfWeek());
            ps.setInt(9, template.estimatedDuration());
            ps.setBoolean(10, template.requiresPhoto());
            ps.setInt(11, template.priority().rank());
            setIntOrNull(ps, 12, template.startHour());
            setIntOrNull(ps, 13, template.endHour());
            ps.setBoolean(14, template.active());
            setTimestamp(ps, 15, created);
            setTimestamp(ps, 16, template.updatedAt() != null ? template.updatedAt() : created);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<RoutineTemplate> findById(String templateId) {
        String sql = "SELECT * FROM routine_templates WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, templateId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find template: " + templateId, e);
        }
    }

    @Override
    public List<RoutineTemplate> findActive() {
        String sql = """
                    SELECT * FROM routine_templates
                    WHERE is_active = TRUE
                    ORDER BY worker_id, building_id, priority DESC, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<RoutineTemplate> results = new ArrayList<>();
            while (rs.next()) {
                results.add(mapRow(rs));
            }
            log.debug("Loaded {} active templates", results.size());
            return results;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to fetch active templates", e);
        }
    }

    @Override
    public boolean setActive(String templateId, boolean active) {
        String sql = "UPDATE routine_templates SET is_active = ?, updated_at = ? WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setBoolean(1, active);
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, templateId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to update template: " + templateId, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM routine_templates")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to count templates", e);
        }
    }

    private RoutineTemplate mapRow(ResultSet rs) throws SQLException {
        return RoutineTemplate.builder()
                .id(rs.getString("id"))
                .workerId(rs.getString("worker_id"))
                .buildingId(rs.getString("building_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .category(rs.getString("category"))
                .frequency(rs.getString("frequency"))
                .daysOfWeek(rs.getString("days_of_week"))
                .estimatedDuration(rs.getInt("estimated_duration"))
                .requiresPhoto(rs.getBoolean("requires_photo"))
                .priority(TaskPriority.fromRank(rs.getInt("priority")))
                .startHour(getIntOrNull(rs, "start_hour"))
                .endHour(getIntOrNull(rs, "end_hour"))
                .active(rs.getBoolean("is_active"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }
}
