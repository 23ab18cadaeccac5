package cyntientops.dailyops.store;

import org.slf4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Null-safe JDBC parameter and column helpers shared by the repositories
 * and migration steps.
 */
public final class JdbcSupport {

    /** SQLSTATE for unique constraint violations */
    private static final String UNIQUE_VIOLATION = "23505";

    private JdbcSupport() {
    }

    public static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }

    public static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    public static void setIntOrNull(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) {
            ps.setInt(index, value);
        } else {
            ps.setNull(index, Types.INTEGER);
        }
    }

    public static Integer getIntOrNull(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    public static boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    /**
     * True if a row with the given primary key exists in the table.
     * Table and column names are trusted constants.
     */
    public static boolean exists(Connection conn, String table, String column, String id) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT 1 FROM " + table + " WHERE " + column + " = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    static void rollbackQuietly(Connection conn, Logger log) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
