package cyntientops.dailyops.model;

import cyntientops.dailyops.recurrence.DaySets;
import cyntientops.dailyops.recurrence.Recurrence;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable recurring work definition from which dated task instances are generated.
 * Templates are never deleted, only deactivated.
 */
public final class RoutineTemplate {
    private final String id;
    private final String workerId;
    private final String buildingId;
    private final String title;
    private final String description;
    private final String category;
    private final TaskPriority priority;
    private final String frequency; // raw recurrence vocabulary value
    private final String daysOfWeek; // "mon,wed" or null for any day
    private final int estimatedDuration; // minutes
    private final boolean requiresPhoto;
    private final Integer startHour;
    private final Integer endHour;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;

    private RoutineTemplate(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId is required");
        this.buildingId = Objects.requireNonNull(builder.buildingId, "buildingId is required");
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.description = builder.description;
        this.category = builder.category;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.frequency = builder.frequency;
        this.daysOfWeek = builder.daysOfWeek;
        this.estimatedDuration = builder.estimatedDuration;
        this.requiresPhoto = builder.requiresPhoto;
        this.startHour = builder.startHour;
        this.endHour = builder.endHour;
        this.active = builder.active;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    // Getters
    public String id() {
        return id;
    }

    public String workerId() {
        return workerId;
    }

    public String buildingId() {
        return buildingId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String category() {
        return category;
    }

    public TaskPriority priority() {
        return priority;
    }

    public String frequency() {
        return frequency;
    }

    public String daysOfWeek() {
        return daysOfWeek;
    }

    public int estimatedDuration() {
        return estimatedDuration;
    }

    public boolean requiresPhoto() {
        return requiresPhoto;
    }

    public Integer startHour() {
        return startHour;
    }

    public Integer endHour() {
        return endHour;
    }

    public boolean active() {
        return active;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Parsed recurrence rule */
    public Recurrence recurrence() {
        return Recurrence.parse(frequency);
    }

    /**
     * Explicit day-of-week constraint. Empty when the template runs on any day;
     * a present but empty set matches no day.
     */
    public Optional<Set<DayOfWeek>> dayGate() {
        if (daysOfWeek == null || daysOfWeek.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(DaySets.parse(daysOfWeek));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String workerId;
        private String buildingId;
        private String title;
        private String description;
        private String category;
        private TaskPriority priority = TaskPriority.NORMAL;
        private String frequency = "daily";
        private String daysOfWeek;
        private int estimatedDuration = 30;
        private boolean requiresPhoto;
        private Integer startHour;
        private Integer endHour;
        private boolean active = true;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder buildingId(String buildingId) {
            this.buildingId = buildingId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder frequency(String frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder daysOfWeek(String daysOfWeek) {
            this.daysOfWeek = daysOfWeek;
            return this;
        }

        public Builder estimatedDuration(int estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder requiresPhoto(boolean requiresPhoto) {
            this.requiresPhoto = requiresPhoto;
            return this;
        }

        public Builder startHour(Integer startHour) {
            this.startHour = startHour;
            return this;
        }

        public Builder endHour(Integer endHour) {
            this.endHour = endHour;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public RoutineTemplate build() {
            return new RoutineTemplate(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RoutineTemplate that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RoutineTemplate{id='" + id + "', title='" + title + "', frequency='" + frequency
                + "', daysOfWeek='" + daysOfWeek + "', active=" + active + "}";
    }
}
