package cyntientops.dailyops.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Worker entry of the canonical operational dataset.
 */
public record WorkerRecord(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("role") String role,
        @JsonProperty("shift") String shift,
        @JsonProperty("hireDate") String hireDate) {

    /** Login email derived from the worker's name */
    public String email() {
        return name.toLowerCase().replace(' ', '.') + "@cyntientops.com";
    }
}
