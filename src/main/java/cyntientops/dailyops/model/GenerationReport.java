package cyntientops.dailyops.model;

import java.time.LocalDate;
import java.util.Set;

/**
 * Outcome of one instance generation pass.
 *
 * @param affectedBuildings buildings that received at least one new instance
 */
public record GenerationReport(
        LocalDate date,
        int created,
        int skippedExisting,
        int skippedNotDue,
        int failed,
        Set<String> affectedBuildings) {

    public GenerationReport {
        affectedBuildings = affectedBuildings == null ? Set.of() : Set.copyOf(affectedBuildings);
    }

    public int templatesSeen() {
        return created + skippedExisting + skippedNotDue + failed;
    }
}
