package cyntientops.dailyops.migration.steps;

import cyntientops.dailyops.model.OperationalAssignment;
import cyntientops.dailyops.model.OperationalDataset;
import cyntientops.dailyops.model.RoutineTemplate;
import cyntientops.dailyops.model.TaskPriority;
import cyntientops.dailyops.store.Database;
import cyntientops.dailyops.store.JdbcTemplateRepository;
import cyntientops.dailyops.support.MutableClock;
import cyntientops.dailyops.support.TestData;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportTemplatesStepTest {

    private static Database db;
    private static JdbcTemplateRepository templates;

    private final ImportTemplatesStep step = new ImportTemplatesStep(MutableClock.utc("2024-03-04T05:01:00Z"));

    @BeforeAll
    static void setup() {
        db = new Database(TestData.h2Url("test-import-templates"), 2);
        templates = new JdbcTemplateRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        TestData.wipe(db);
    }

    private int apply(OperationalDataset dataset) throws Exception {
        try (Connection conn = db.getConnection()) {
            int rows = step.apply(conn, dataset);
            conn.commit();
            return rows;
        }
    }

    private static OperationalDataset withAssignments(OperationalAssignment... assignments) {
        OperationalDataset base = TestData.smallDataset();
        return new OperationalDataset(base.version(), base.workers(), base.buildings(), List.of(assignments),
                List.of());
    }

    @Test
    void deduplicatesAndSkipsAssignmentsWithoutIds() throws Exception {
        OperationalDataset dataset = withAssignments(
                TestData.assignment("4", "14", "Trash Area Clean", "daily"),
                TestData.assignment("4", "14", "Trash Area Clean", "weekly"),
                TestData.assignment("", "14", "Orphan Task", "daily"),
                TestData.assignment("4", "10", "Trash Area Clean", "daily"));

        assertEquals(2, apply(dataset));
        assertEquals(2, templates.count());
    }

    @Test
    void reapplyingInsertsNothing() throws Exception {
        OperationalDataset dataset = TestData.smallDataset();

        assertEquals(3, apply(dataset));
        assertEquals(0, apply(dataset));
        assertEquals(3, templates.count());
    }

    @Test
    void templateCarriesDerivedFieldsAndDeterministicId() throws Exception {
        OperationalAssignment emergency = new OperationalAssignment("1", "10", "Emergency Repair Standby",
                "Repair", "Advanced", "daily", 9, 17, "mon,tue", null, true);
        apply(withAssignments(emergency));

        RoutineTemplate template = templates.findById(ImportTemplatesStep.templateId(emergency)).orElseThrow();
        assertEquals(TaskPriority.URGENT, template.priority());
        assertEquals(ImportTemplatesStep.DEFAULT_DURATION_MINUTES, template.estimatedDuration());
        assertEquals(ImportTemplatesStep.DEFAULT_DESCRIPTION, template.description());
        assertEquals("mon,tue", template.daysOfWeek());
        assertTrue(template.requiresPhoto());
        assertTrue(template.active());
        assertEquals(ImportTemplatesStep.templateId(emergency), ImportTemplatesStep.templateId(emergency));
    }

    @Test
    void priorityDerivation() {
        assertEquals(TaskPriority.URGENT, TaskPriority.derive("Emergency Lighting Test", "Inspection"));
        assertEquals(TaskPriority.HIGH, TaskPriority.derive("Elevator Inspection", "Maintenance"));
        assertEquals(TaskPriority.HIGH, TaskPriority.derive("Compliance Walkthrough", null));
        assertEquals(TaskPriority.HIGH, TaskPriority.derive("Trash Area Clean", "Sanitation"));
        assertEquals(TaskPriority.NORMAL, TaskPriority.derive("Lobby Glass Clean", "Cleaning"));
    }
}
