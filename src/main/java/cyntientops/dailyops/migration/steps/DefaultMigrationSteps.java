package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.migration.MigrationStep;

import java.time.Clock;
import java.util.List;

/**
 * The declared step list of the operational data migration.
 */
public final class DefaultMigrationSteps {

    private DefaultMigrationSteps() {
    }

    public static List<MigrationStep> create(Clock clock) {
        return List.of(
                new ImportWorkersStep(),
                new ImportBuildingsStep(clock),
                new ImportTemplatesStep(clock),
                new CreateAssignmentsStep(clock),
                new SetupCapabilitiesStep());
    }
}
