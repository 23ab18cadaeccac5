package cyntientops.dailyops.service;

import cyntientops.dailyops.core.OperationsEventBus;
import cyntientops.dailyops.model.GenerationReport;
import cyntientops.dailyops.model.RoutineTemplate;
import cyntientops.dailyops.model.TaskInstance;
import cyntientops.dailyops.recurrence.RecurrenceEngine;
import cyntientops.dailyops.repository.InstanceRepository;
import cyntientops.dailyops.repository.TemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Materializes the day's task instances from active routine templates.
 *
 * <p>
 * At most one instance exists per (template, date): the existence check here
 * is backed by the unique constraint on the instances table, so a concurrent
 * or repeated pass only counts the duplicate as skipped.
 */
public class InstanceGenerator {

    private static final Logger log = LoggerFactory.getLogger(InstanceGenerator.class);

    private final TemplateRepository templateRepository;
    private final InstanceRepository instanceRepository;
    private final RecurrenceEngine recurrenceEngine;
    private final OperationsEventBus eventBus;
    private final Clock clock;

    public InstanceGenerator(TemplateRepository templateRepository,
            InstanceRepository instanceRepository,
            RecurrenceEngine recurrenceEngine,
            OperationsEventBus eventBus,
            Clock clock) {
        this.templateRepository = templateRepository;
        this.instanceRepository = instanceRepository;
        this.recurrenceEngine = recurrenceEngine;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Create pending instances for every active template due on the date.
     *
     * @param date the calendar date to generate for
     * @return counts per outcome and the buildings that received new instances
     * @throws cyntientops.dailyops.exception.DatabaseException if templates cannot be fetched
     */
    public GenerationReport generateForDate(LocalDate date) {
        List<RoutineTemplate> templates = templateRepository.findActive();

        int created = 0;
        int skippedExisting = 0;
        int skippedNotDue = 0;
        int failed = 0;
        Set<String> affectedBuildings = new HashSet<>();

        for (RoutineTemplate template : templates) {
            try {
                if (!recurrenceEngine.isDue(template, date)) {
                    skippedNotDue++;
                    continue;
                }
                if (instanceRepository.findByTemplateAndDate(template.id(), date).isPresent()) {
                    skippedExisting++;
                    continue;
                }

                Instant now = clock.instant();
                if (instanceRepository.insert(TaskInstance.pendingFrom(template, date, now))) {
                    created++;
                    affectedBuildings.add(template.buildingId());
                } else {
                    skippedExisting++;
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to generate instance for template {} on {}", template.id(), date, e);
            }
        }

        log.info("Generated {} task instances for {} ({} existing, {} not due, {} failed)",
                created, date, skippedExisting, skippedNotDue, failed);

        eventBus.fireInstancesGenerated(date, created);
        return new GenerationReport(date, created, skippedExisting, skippedNotDue, failed, affectedBuildings);
    }
}
