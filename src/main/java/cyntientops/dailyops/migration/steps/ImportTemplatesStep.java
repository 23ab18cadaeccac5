package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.migration.MigrationStep;
import cyntientops.dailyops.model.OperationalAssignment;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.model.RoutineTemplate;
import cyntientops.dailyops.model.TaskPriority;
import cyntientops.dailyops.store.JdbcTemplateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Turns each distinct (worker, building, task name) assignment into a routine template.
 * Template IDs are derived from that key, so a re-run maps to the same rows.
 */
public class ImportTemplatesStep implements MigrationStep {

    private static final Logger log = LoggerFactory.getLogger(ImportTemplatesStep.class);

    static final String DEFAULT_DESCRIPTION = "Routine maintenance task";
    static final int DEFAULT_DURATION_MINUTES = 30;

    private final Clock clock;

    public ImportTemplatesStep(Clock clock) {
        this.clock = clock;
    }

    @Override
    public int order() {
        return 3;
    }

    @Override
    public String name() {
        return "import-templates";
    }

    @Override
    public String description() {
        return "Importing routine templates...";
    }

    @Override
    public int apply(Connection conn, OperationalDataset dataset) throws SQLException {
        Instant now = clock.instant();
        Set<String> seen = new HashSet<>();
        int imported = 0;
        int skipped = 0;

        for (OperationalAssignment task : dataset.assignments()) {
            if (!task.hasIds()) {
                log.warn("Skipping task with missing IDs: {}", task.taskName());
                skipped++;
                continue;
            }
            if (!seen.add(task.templateKey())) {
                continue;
            }
            if (templateExists(conn, task)) {
                continue;
            }

            JdbcTemplateRepository.insert(conn, toTemplate(task, now));
            imported++;
        }

        log.info("Imported {} routine templates (skipped {} invalid)", imported, skipped);
        return imported;
    }

    static String templateId(OperationalAssignment task) {
        return UUID.nameUUIDFromBytes(("template:" + task.templateKey()).getBytes(StandardCharsets.UTF_8))
                .toString();
    }

    static RoutineTemplate toTemplate(OperationalAssignment task, Instant now) {
        return RoutineTemplate.builder()
                .id(templateId(task))
                .workerId(task.workerId())
                .buildingId(task.buildingId())
                .title(task.taskName())
                .description(DEFAULT_DESCRIPTION)
                .category(task.category())
                .priority(TaskPriority.derive(task.taskName(), task.category()))
                .frequency(task.recurrence())
                .daysOfWeek(task.daysOfWeek())
                .estimatedDuration(task.estimatedDuration() != null ? task.estimatedDuration()
                        : DEFAULT_DURATION_MINUTES)
                .requiresPhoto(task.requiresPhoto())
                .startHour(task.startHour())
                .endHour(task.endHour())
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static boolean templateExists(Connection conn, OperationalAssignment task) throws SQLException {
        String sql = "SELECT 1 FROM routine_templates WHERE worker_id = ? AND building_id = ? AND title = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, task.workerId());
            ps.setString(2, task.buildingId());
            ps.setString(3, task.taskName());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }
}
