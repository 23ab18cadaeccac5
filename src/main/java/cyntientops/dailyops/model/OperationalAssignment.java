package cyntientops.dailyops.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One real-world routine as recorded in the canonical dataset: who does what,
 * where, and how often. Becomes a {@link RoutineTemplate} on import.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationalAssignment(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("buildingId") String buildingId,
        @JsonProperty("taskName") String taskName,
        @JsonProperty("category") String category,
        @JsonProperty("skillLevel") String skillLevel,
        @JsonProperty("recurrence") String recurrence,
        @JsonProperty("startHour") Integer startHour,
        @JsonProperty("endHour") Integer endHour,
        @JsonProperty("daysOfWeek") String daysOfWeek,
        @JsonProperty("estimatedDuration") Integer estimatedDuration,
        @JsonProperty("requiresPhoto") boolean requiresPhoto) {

    public boolean hasIds() {
        return workerId != null && !workerId.isBlank() && buildingId != null && !buildingId.isBlank();
    }

    /** Deduplication key used when importing templates */
    public String templateKey() {
        return workerId + "-" + buildingId + "-" + taskName;
    }
}
