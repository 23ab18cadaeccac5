package cyntientops.dailyops.store;

import cyntientops.dailyops.exception.DatabaseException;
import cyntientops.dailyops.repository.RetentionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static cyntientops.dailyops.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of RetentionRepository.
 */
public class JdbcRetentionRepository implements RetentionRepository {

    private final Database db;

    public JdbcRetentionRepository(Database db) {
        this.db = db;
    }

    @Override
    public List<String> findClosedSessionsEndedBefore(Instant cutoff) {
        String sql = "SELECT id FROM clock_sessions WHERE clock_out_time IS NOT NULL AND clock_out_time < ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, cutoff);
            return ids(ps);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find expired work sessions", e);
        }
    }

    @Override
    public boolean deleteSession(String sessionId) {
        return deleteById("DELETE FROM clock_sessions WHERE id = ? AND clock_out_time IS NOT NULL", sessionId);
    }

    @Override
    public List<String> findOrphanedAttachments() {
        String sql = """
                    SELECT p.id FROM photo_evidence p
                    WHERE p.completion_id IS NOT NULL
                      AND NOT EXISTS (SELECT 1 FROM task_completions c WHERE c.id = p.completion_id)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return ids(ps);
        } catch (SQLException e) {
            throw new DatabaseException("Failed to find orphaned attachments", e);
        }
    }

    @Override
    public boolean deleteAttachment(String attachmentId) {
        return deleteById("DELETE FROM photo_evidence WHERE id = ?", attachmentId);
    }

    private boolean deleteById(String sql, String id) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to delete record: " + id, e);
        }
    }

    private static List<String> ids(PreparedStatement ps) throws SQLException {
        List<String> ids = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                ids.add(rs.getString(1));
            }
        }
        return ids;
    }
}
