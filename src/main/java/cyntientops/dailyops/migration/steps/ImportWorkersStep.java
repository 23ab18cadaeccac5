package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.migration.MigrationStep;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.model.WorkerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import static cyntientops.dailyops.store.JdbcSupport.exists;

public class ImportWorkersStep implements MigrationStep {

    private static final Logger log = LoggerFactory.getLogger(ImportWorkersStep.class);

    @Override
    public int order() {
        return 1;
    }

    @Override
    public String name() {
        return "import-workers";
    }

    @Override
    public String description() {
        return "Importing workers...";
    }

    @Override
    public int apply(Connection conn, OperationalDataset dataset) throws SQLException {
        String sql = """
                    INSERT INTO workers (id, name, email, role, shift, hire_date, is_active)
                    VALUES (?, ?, ?, ?, ?, ?, TRUE)
                """;

        int imported = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (WorkerRecord worker : dataset.workers()) {
                if (exists(conn, "workers", "id", worker.id())) {
                    log.debug("Worker already exists: {}", worker.name());
                    continue;
                }
                ps.setString(1, worker.id());
                ps.setString(2, worker.name());
                ps.setString(3, worker.email());
                ps.setString(4, worker.role() != null ? worker.role() : "General");
                ps.setString(5, worker.shift());
                ps.setString(6, worker.hireDate());
                ps.executeUpdate();
                imported++;
            }
        }

        log.info("Imported {} workers", imported);
        return imported;
    }
}
