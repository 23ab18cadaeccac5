package cyntientops.dailyops.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable dated occurrence of a {@link RoutineTemplate}.
 * At most one instance exists per (template, scheduled date).
 */
public final class TaskInstance {
    private final String id;
    private final String templateId;
    private final String workerId;
    private final String buildingId;
    private final String title;
    private final String description;
    private final String category;
    private final TaskPriority priority;
    private final String frequency;
    private final int estimatedDuration;
    private final boolean requiresPhoto;
    private final LocalDate scheduledDate;
    private final InstanceStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;

    private TaskInstance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.templateId = Objects.requireNonNull(builder.templateId, "templateId is required");
        this.workerId = builder.workerId;
        this.buildingId = builder.buildingId;
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.description = builder.description;
        this.category = builder.category;
        this.priority = Objects.requireNonNull(builder.priority, "priority is required");
        this.frequency = builder.frequency;
        this.estimatedDuration = builder.estimatedDuration;
        this.requiresPhoto = builder.requiresPhoto;
        this.scheduledDate = Objects.requireNonNull(builder.scheduledDate, "scheduledDate is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    /**
     * New pending instance of the template for the given date.
     * Copies the fields a worker sees from the template.
     */
    public static TaskInstance pendingFrom(RoutineTemplate template, LocalDate date, Instant now) {
        return builder()
                .id(UUID.randomUUID().toString())
                .templateId(template.id())
                .workerId(template.workerId())
                .buildingId(template.buildingId())
                .title(template.title())
                .description(template.description())
                .category(template.category())
                .priority(template.priority())
                .frequency(template.frequency())
                .estimatedDuration(template.estimatedDuration())
                .requiresPhoto(template.requiresPhoto())
                .scheduledDate(date)
                .status(InstanceStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    // Getters
    public String id() {
        return id;
    }

    public String templateId() {
        return templateId;
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

    public int estimatedDuration() {
        return estimatedDuration;
    }

    public boolean requiresPhoto() {
        return requiresPhoto;
    }

    public LocalDate scheduledDate() {
        return scheduledDate;
    }

    public InstanceStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String templateId;
        private String workerId;
        private String buildingId;
        private String title;
        private String description;
        private String category;
        private TaskPriority priority = TaskPriority.NORMAL;
        private String frequency;
        private int estimatedDuration = 30;
        private boolean requiresPhoto;
        private LocalDate scheduledDate;
        private InstanceStatus status = InstanceStatus.PENDING;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
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

        public Builder estimatedDuration(int estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder requiresPhoto(boolean requiresPhoto) {
            this.requiresPhoto = requiresPhoto;
            return this;
        }

        public Builder scheduledDate(LocalDate scheduledDate) {
            this.scheduledDate = scheduledDate;
            return this;
        }

        public Builder status(InstanceStatus status) {
            this.status = status;
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

        public TaskInstance build() {
            return new TaskInstance(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskInstance that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskInstance{id='" + id + "', templateId='" + templateId + "', date=" + scheduledDate
                + ", status=" + status + "}";
    }
}
