package cyntientops.dailyops.integration;

import cyntientops.dailyops.config.DailyOpsConfig;
import cyntientops.dailyops.config.Dependencies;
import cyntientops.dailyops.model.GenerationReport;
import cyntientops.dailyops.support.MutableClock;
import cyntientops.dailyops.support.TestData;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fresh installation through migration and the first day's generation.
 */
class EndToEndTest {

    // Monday, not the first of the month
    private static final LocalDate TODAY = LocalDate.of(2024, 3, 4);

    @TempDir
    Path backupDir;

    private Dependencies deps;

    @BeforeEach
    void setup() {
        DailyOpsConfig config = DailyOpsConfig.defaults()
                .withDatabaseUrl(TestData.h2Url("test-e2e"))
                .withBackupDirectory(backupDir)
                .withDatasetResource("/dailyops/e2e-dataset.json")
                .withZone(ZoneOffset.UTC);
        deps = Dependencies.create(config, MutableClock.utc("2024-03-04T00:01:00Z"));
    }

    @AfterEach
    void teardown() throws Exception {
        TestData.wipe(deps.database());
        deps.close();
    }

    @Test
    void freshInstallationMigratesOnceThenGeneratesOncePerDay() throws Exception {
        var orchestrator = deps.migrationOrchestrator();
        assertEquals(0, orchestrator.currentVersion());

        assertTrue(orchestrator.runMigrationIfNeeded());
        assertEquals(1, orchestrator.currentVersion());
        assertEquals(2, count("workers"));
        assertEquals(2, count("buildings"));
        assertEquals(2, deps.templateRepository().count());

        assertFalse(orchestrator.runMigrationIfNeeded());
        assertEquals(2, deps.templateRepository().count());
        assertEquals(1, deps.backupService().listBackups().size());

        GenerationReport first = deps.instanceGenerator().generateForDate(TODAY);
        assertEquals(1, first.created(), "only the daily template is due");
        assertEquals(1, first.skippedNotDue());

        GenerationReport second = deps.instanceGenerator().generateForDate(TODAY);
        assertEquals(0, second.created());
        assertEquals(1, deps.instanceRepository().findByDate(TODAY).size());
    }

    private int count(String table) throws Exception {
        try (var conn = deps.database().getConnection();
                var st = conn.createStatement();
                var rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }
}
