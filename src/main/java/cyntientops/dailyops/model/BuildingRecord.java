package cyntientops.dailyops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Building entry of the canonical operational dataset.
 */
public record BuildingRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("address") String address,
        @JsonProperty("type") String type,
        @JsonProperty("floors") int floors,
        @JsonProperty("hasElevator") boolean hasElevator,
        @JsonProperty("hasDoorman") boolean hasDoorman,
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude) {
}
