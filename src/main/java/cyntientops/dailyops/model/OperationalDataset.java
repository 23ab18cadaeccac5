package cyntientops.dailyops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical in-memory operational dataset: the source of the one-time migration.
 * Immutable; lists are copied on construction.
 */
public record OperationalDataset(
        @JsonProperty("version") String version,
        @JsonProperty("workers") List<WorkerRecord> workers,
        @JsonProperty("buildings") List<BuildingRecord> buildings,
        @JsonProperty("assignments") List<OperationalAssignment> assignments,
        @JsonProperty("capabilities") List<WorkerCapability> capabilities) {

    public OperationalDataset {
        workers = workers == null ? List.of() : List.copyOf(workers);
        buildings = buildings == null ? List.of() : List.copyOf(buildings);
        assignments = assignments == null ? List.of() : List.copyOf(assignments);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public Set<String> workerIds() {
        return workers.stream().map(WorkerRecord::id).collect(Collectors.toSet());
    }

    public Set<String> buildingIds() {
        return buildings.stream().map(BuildingRecord::id).collect(Collectors.toSet());
    }
}
