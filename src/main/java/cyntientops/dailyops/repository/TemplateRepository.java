package cyntientops.dailyops.repository;

import cyntientops.dailyops.model.RoutineTemplate;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for routine template persistence.
 * Templates are created by the migration import step and never deleted.
 */
public interface TemplateRepository {

    /**
     * Save a new template.
     *
     * @param template the template to save
     */
    void save(RoutineTemplate template);

    /**
     * Find a template by ID.
     *
     * @param templateId the template ID
     * @return the template if found
     */
    Optional<RoutineTemplate> findById(String templateId);

    /**
     * Fetch all active templates ordered by worker, building, then priority
     * (highest first).
     *
     * @return active templates in generation order
     */
    List<RoutineTemplate> findActive();

    /**
     * Flip the active flag of a template.
     *
     * @return true if the template exists
     */
    boolean setActive(String templateId, boolean active);

    /**
     * Count all templates, active or not.
     */
    int count();
}
