package cyntientops.dailyops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * On-disk form of a backup: the dataset as it was when the migration attempt began,
 * with its checksum and counts. Written once, never modified.
 */
public record DatasetSnapshot(
        @JsonProperty("format") String format,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("checksum") String checksum,
        @JsonProperty("workerCount") int workerCount,
        @JsonProperty("buildingCount") int buildingCount,
        @JsonProperty("assignmentCount") int assignmentCount,
        @JsonProperty("dataset") OperationalDataset dataset) {

    public static final String FORMAT = "dailyops-backup/1";

    public static DatasetSnapshot of(OperationalDataset dataset, String checksum, Instant createdAt) {
        return new DatasetSnapshot(FORMAT, createdAt, checksum,
                dataset.workers().size(), dataset.buildings().size(), dataset.assignments().size(), dataset);
    }
}
