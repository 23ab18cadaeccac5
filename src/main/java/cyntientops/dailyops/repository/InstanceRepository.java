package cyntientops.dailyops.repository;

import cyntientops.dailyops.model.TaskInstance;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for task instance persistence.
 */
public interface InstanceRepository {

    /**
     * Insert a new instance.
     *
     * @param instance the instance
     * @return false if an instance already exists for the same template and date
     */
    boolean insert(TaskInstance instance);

    /**
     * Find the instance generated for a template on a date.
     *
     * @param templateId the template ID
     * @param date       the scheduled date
     * @return the instance if one exists
     */
    Optional<TaskInstance> findByTemplateAndDate(String templateId, LocalDate date);

    Optional<TaskInstance> findById(String instanceId);

    /**
     * All instances scheduled for a date.
     */
    List<TaskInstance> findByDate(LocalDate date);

    /**
     * Mark an instance completed.
     *
     * @param instanceId  the instance ID
     * @param completedAt completion time, stored as the last update time
     * @return true if a pending instance was transitioned
     */
    boolean markCompleted(String instanceId, Instant completedAt);

    /**
     * IDs of COMPLETED instances last updated before the cutoff.
     * Pending instances are never returned.
     */
    List<String> findCompletedUpdatedBefore(Instant cutoff);

    /**
     * Delete one instance by ID.
     *
     * @return true if a row was deleted
     */
    boolean deleteById(String instanceId);

    int count();
}
