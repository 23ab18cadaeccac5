package cyntientops.dailyops.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import cyntientops.dailyops.config.DailyOpsConfig;
import cyntientops.dailyops.exception.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(DailyOpsConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("dailyops-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for committing and closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Check if database is reachable.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- BOOKKEEPING ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS app_settings (
                            setting_key     VARCHAR(128) PRIMARY KEY,
                            setting_value   VARCHAR(2048),
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS migration_log (
                            idempotency_key VARCHAR(128) PRIMARY KEY,
                            step_order      INT NOT NULL,
                            version         INT NOT NULL,
                            description     VARCHAR(256),
                            rows_affected   INT DEFAULT 0,
                            completed_at    TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- REFERENCE DATA ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS workers (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(256) NOT NULL,
                            email           VARCHAR(256),
                            role            VARCHAR(64),
                            shift           VARCHAR(64),
                            hire_date       VARCHAR(32),
                            is_active       BOOLEAN DEFAULT TRUE
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS buildings (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(256) NOT NULL,
                            address         VARCHAR(512),
                            building_type   VARCHAR(64),
                            floors          INT,
                            has_elevator    BOOLEAN DEFAULT FALSE,
                            has_doorman     BOOLEAN DEFAULT FALSE,
                            latitude        DOUBLE,
                            longitude       DOUBLE,
                            is_active       BOOLEAN DEFAULT TRUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_assignments (
                            id              VARCHAR(64) PRIMARY KEY,
                            worker_id       VARCHAR(64) NOT NULL,
                            building_id     VARCHAR(64) NOT NULL,
                            role            VARCHAR(64),
                            is_primary      BOOLEAN DEFAULT TRUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_assignment UNIQUE (worker_id, building_id)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_capabilities (
                            worker_id                      VARCHAR(64) PRIMARY KEY,
                            can_upload_photos              BOOLEAN,
                            can_add_notes                  BOOLEAN,
                            can_view_map                   BOOLEAN,
                            can_add_emergency_tasks        BOOLEAN,
                            requires_photo_for_sanitation  BOOLEAN,
                            simplified_interface           BOOLEAN,
                            created_at                     TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- TEMPLATES / INSTANCES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS routine_templates (
                            id                  VARCHAR(64) PRIMARY KEY,
                            worker_id           VARCHAR(64) NOT NULL,
                            building_id         VARCHAR(64) NOT NULL,
                            title               VARCHAR(512) NOT NULL,
                            description         VARCHAR(2048),
                            category            VARCHAR(64),
                            frequency           VARCHAR(128),
                            days_of_week        VARCHAR(128),
                            estimated_duration  INT DEFAULT 30,
                            requires_photo      BOOLEAN DEFAULT FALSE,
                            priority            INT DEFAULT 2,
                            start_hour          INT,
                            end_hour            INT,
                            is_active           BOOLEAN DEFAULT TRUE,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_template UNIQUE (worker_id, building_id, title)
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS routine_tasks (
                            id                  VARCHAR(64) PRIMARY KEY,
                            template_id         VARCHAR(64) NOT NULL,
                            worker_id           VARCHAR(64),
                            building_id         VARCHAR(64),
                            title               VARCHAR(512) NOT NULL,
                            description         VARCHAR(2048),
                            category            VARCHAR(64),
                            priority            INT DEFAULT 2,
                            status              VARCHAR(20) DEFAULT 'PENDING',
                            frequency           VARCHAR(128),
                            estimated_duration  INT DEFAULT 30,
                            requires_photo      BOOLEAN DEFAULT FALSE,
                            scheduled_date      DATE NOT NULL,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_template_date UNIQUE (template_id, scheduled_date)
                        );
                    """);

            // ---------- HISTORY (owned by other workflows) ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS clock_sessions (
                            id              VARCHAR(64) PRIMARY KEY,
                            worker_id       VARCHAR(64) NOT NULL,
                            building_id     VARCHAR(64),
                            clock_in_time   TIMESTAMP NOT NULL,
                            clock_out_time  TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_completions (
                            id              VARCHAR(64) PRIMARY KEY,
                            task_id         VARCHAR(64),
                            worker_id       VARCHAR(64),
                            completed_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS photo_evidence (
                            id              VARCHAR(64) PRIMARY KEY,
                            completion_id   VARCHAR(64),
                            file_path       VARCHAR(1024),
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_templates_active ON routine_templates(is_active, worker_id, building_id, priority DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status_updated ON routine_tasks(status, updated_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_date ON routine_tasks(scheduled_date);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_sessions_clock_out ON clock_sessions(clock_out_time);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_photos_completion ON photo_evidence(completion_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new DatabaseException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
