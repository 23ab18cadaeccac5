package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.migration.MigrationStep;
import cyntientops.dailyops.model.BuildingRecord;
import cyntientops.dailyops.model.OperationalDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;

import static cyntientops.dailyops.store.JdbcSupport.exists;
import static cyntientops.dailyops.store.JdbcSupport.setTimestamp;

public class ImportBuildingsStep implements MigrationStep {

    private static final Logger log = LoggerFactory.getLogger(ImportBuildingsStep.class);

    private final Clock clock;

    public ImportBuildingsStep(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int order() {
        return 2;
    }

    @Override
    public String name() {
        return "import-buildings";
    }

    @Override
    public String description() {
        return "Importing buildings...";
    }

    @Override
    public int apply(Connection conn, OperationalDataset dataset) throws SQLException {
        String sql = """
                    INSERT INTO buildings (id, name, address, building_type, floors, has_elevator, has_doorman,
                                           latitude, longitude, is_active, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE, ?, ?)
                """;

        Instant now = clock.instant();
        int imported = 0;
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (BuildingRecord building : dataset.buildings()) {
                if (exists(conn, "buildings", "id", building.id())) {
                    log.debug("Building already exists: {}", building.name());
                    continue;
                }
                ps.setString(1, building.id());
                ps.setString(2, building.name());
                ps.setString(3, building.address());
                ps.setString(4, building.type());
                ps.setInt(5, building.floors());
                ps.setBoolean(6, building.hasElevator());
                ps.setBoolean(7, building.hasDoorman());
                ps.setDouble(8, building.latitude());
                ps.setDouble(9, building.longitude());
                setTimestamp(ps, 10, now);
                setTimestamp(ps, 11, now);
                ps.executeUpdate();
                imported++;
            }
        }

        log.info("Imported {} buildings", imported);
        return imported;
    }
}
