package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.migration.MigrationStep;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.model.WorkerCapability;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

import static cyntientops.dailyops.store.JdbcSupport.exists;

public class SetupCapabilitiesStep implements MigrationStep {

    private static final Logger log = LoggerFactory.getLogger(SetupCapabilitiesStep.class);

    @Override
    public int order() {
        return 5;
    }

    @Override
    public String name() {
        return "setup-capabilities";
    }

    @Override
    public String description() {
        return "Setting up worker capabilities...";
    }

    @Override
    public int apply(Connection conn, OperationalDataset dataset) throws SQLException {
        String sql = """
                    INSERT INTO worker_capabilities (worker_id, can_upload_photos, can_add_notes, can_view_map,
                                                     can_add_emergency_tasks, requires_photo_for_sanitation,
                                                     simplified_interface)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        int created = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (WorkerCapability c : dataset.capabilities()) {
                if (exists(conn, "worker_capabilities", "worker_id", c.workerId())) {
                    continue;
                }
                ps.setString(1, c.workerId());
                ps.setBoolean(2, c.canUploadPhotos());
                ps.setBoolean(3, c.canAddNotes());
                ps.setBoolean(4, c.canViewMap());
                ps.setBoolean(5, c.canAddEmergencyTasks());
                ps.setBoolean(6, c.requiresPhotoForSanitation());
                ps.setBoolean(7, c.simplifiedInterface());
                ps.executeUpdate();
                created++;
            }
        }

        log.info("Set up capabilities for {} workers", created);
        return created;
    }
}
