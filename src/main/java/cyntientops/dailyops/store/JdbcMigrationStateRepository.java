package cyntientops.dailyops.store;

import cyntientops.dailyops.exception.DatabaseException;
import cyntientops.dailyops.repository.MigrationStateRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static cyntientops.dailyops.store.JdbcSupport.setTimestamp;

/**
 * JDBC implementation of MigrationStateRepository.
 * Scalar state lives in {@code app_settings}; step completion in {@code migration_log}.
 */
public class JdbcMigrationStateRepository implements MigrationStateRepository {

    static final String SCHEMA_VERSION = "schema_version";
    static final String LAST_RUN_DATE = "last_daily_run_date";
    static final String LAST_BACKUP_PATH = "last_backup_path";
    static final String LAST_MIGRATION_CHECKSUM = "last_migration_checksum";
    static final String LAST_BACKUP_VERSION = "last_backup_version";

    private final Database db;

    public JdbcMigrationStateRepository(Database db) {
        this.db = db;
    }

    @Override
    public int schemaVersion() {
        return get(SCHEMA_VERSION).map(Integer::parseInt).orElse(0);
    }

    @Override
    public void setSchemaVersion(int version) {
        put(SCHEMA_VERSION, Integer.toString(version));
    }

    @Override
    public Set<String> completedStepKeys() {
        String sql = "SELECT idempotency_key FROM migration_log ORDER BY step_order";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            Set<String> keys = new LinkedHashSet<>();
            while (rs.next()) {
                keys.add(rs.getString(1));
            }
            return keys;
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read migration log", e);
        }
    }

    @Override
    public void recordStep(Connection conn, String key, int order, int version, String description,
            int rowsAffected, Instant completedAt) throws SQLException {
        String sql = """
                    INSERT INTO migration_log (idempotency_key, step_order, version, description, rows_affected, completed_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setInt(2, order);
            ps.setInt(3, version);
            ps.setString(4, description);
            ps.setInt(5, rowsAffected);
            setTimestamp(ps, 6, completedAt);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<LocalDate> lastRunDate() {
        return get(LAST_RUN_DATE).map(LocalDate::parse);
    }

    @Override
    public void setLastRunDate(LocalDate date) {
        put(LAST_RUN_DATE, date.toString());
    }

    @Override
    public Optional<String> lastBackupPath() {
        return get(LAST_BACKUP_PATH);
    }

    @Override
    public Optional<String> lastMigrationChecksum() {
        return get(LAST_MIGRATION_CHECKSUM);
    }

    @Override
    public Optional<Integer> lastBackupVersion() {
        return get(LAST_BACKUP_VERSION).map(Integer::parseInt);
    }

    @Override
    public void recordBackup(String path, String checksum, int targetVersion) {
        try (Connection conn = db.getConnection()) {
            upsert(conn, LAST_BACKUP_PATH, path);
            upsert(conn, LAST_MIGRATION_CHECKSUM, checksum);
            upsert(conn, LAST_BACKUP_VERSION, Integer.toString(targetVersion));
            conn.commit();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to record backup " + path, e);
        }
    }

    @Override
    public Connection openWriteScope() throws SQLException {
        Connection conn = db.getConnection();
        conn.setAutoCommit(false);
        return conn;
    }

    private Optional<String> get(String key) {
        String sql = "SELECT setting_value FROM app_settings WHERE setting_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to read setting: " + key, e);
        }
    }

    private void put(String key, String value) {
        try (Connection conn = db.getConnection()) {
            upsert(conn, key, value);
            conn.commit();
        } catch (SQLException e) {
            throw new DatabaseException("Failed to write setting: " + key, e);
        }
    }

    private static void upsert(Connection conn, String key, String value) throws SQLException {
        String update = "UPDATE app_settings SET setting_value = ?, updated_at = ? WHERE setting_key = ?";
        try (PreparedStatement ps = conn.prepareStatement(update)) {
            ps.setString(1, value);
            setTimestamp(ps, 2, Instant.now());
            ps.setString(3, key);
            if (ps.executeUpdate() > 0) {
                return;
            }
        }

        String insert = "INSERT INTO app_settings (setting_key, setting_value, updated_at) VALUES (?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(insert)) {
            ps.setString(1, key);
            ps.setString(2, value);
            setTimestamp(ps, 3, Instant.now());
            ps.executeUpdate();
        }
    }
}
