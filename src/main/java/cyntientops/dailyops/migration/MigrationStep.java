package cyntientops.dailyops.migration;

import cyntientops.dailyops.model.OperationalDataset;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * One ordered, idempotent unit of the one-time migration.
 *
 * <p>Implementations must be insert-if-absent: running a step twice against the
 * same data leaves the database as running it once. The orchestrator commits the
 * step's writes together with its completion marker.
 */
public interface MigrationStep {

    /** Position in the declared execution order */
    int order();

    /** Stable short name, e.g. "import-workers" */
    String name();

    /** Human-readable progress text */
    String description();

    /**
     * Apply the step on the given connection without committing.
     *
     * @return number of rows inserted
     */
    int apply(Connection conn, OperationalDataset dataset) throws SQLException;

    /**
     * Idempotency key for this step under a schema version, e.g. "import-workers@v1".
     */
    default String key(int version) {
        return name() + "@v" + version;
    }
}
