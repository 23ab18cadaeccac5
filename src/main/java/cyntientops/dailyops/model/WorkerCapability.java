package cyntientops.dailyops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-worker feature flags for the field application.
 */
public record WorkerCapability(
        @JsonProperty("workerId") String workerId,
        @JsonProperty("canUploadPhotos") boolean canUploadPhotos,
        @JsonProperty("canAddNotes") boolean canAddNotes,
        @JsonProperty("canViewMap") boolean canViewMap,
        @JsonProperty("canAddEmergencyTasks") boolean canAddEmergencyTasks,
        @JsonProperty("requiresPhotoForSanitation") boolean requiresPhotoForSanitation,
        @JsonProperty("simplifiedInterface") boolean simplifiedInterface) {
}
