package cyntientops.dailyops.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Fan-out of pipeline events to collaborators (metrics, cache invalidation, UI refresh).
 * A failing listener is logged and does not affect the publisher or other listeners.
 */
public final class OperationsEventBus {

    private static final Logger log = LoggerFactory.getLogger(OperationsEventBus.class);

    private final CopyOnWriteArrayList<IntConsumer> migrationCompleted = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<BiConsumer<LocalDate, Integer>> instancesGenerated = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Consumer<Set<String>>> metricsInvalidated = new CopyOnWriteArrayList<>();

    /** Listener receives the schema version the migration advanced to */
    public void onMigrationCompleted(IntConsumer listener) {
        migrationCompleted.add(listener);
    }

    /** Listener receives the generation date and the number of instances created */
    public void onInstancesGenerated(BiConsumer<LocalDate, Integer> listener) {
        instancesGenerated.add(listener);
    }

    /** Listener receives the building IDs whose metrics are stale */
    public void onMetricsInvalidated(Consumer<Set<String>> listener) {
        metricsInvalidated.add(listener);
    }

    public void fireMigrationCompleted(int version) {
        for (var l : migrationCompleted) {
            deliver("migration-completed", () -> l.accept(version));
        }
    }

    public void fireInstancesGenerated(LocalDate date, int created) {
        for (var l : instancesGenerated) {
            deliver("instances-generated", () -> l.accept(date, created));
        }
    }

    public void fireMetricsInvalidated(Set<String> buildingIds) {
        Set<String> ids = Set.copyOf(buildingIds);
        for (var l : metricsInvalidated) {
            deliver("metrics-invalidated", () -> l.accept(ids));
        }
    }

    private static void deliver(String event, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("Listener for {} failed", event, e);
        }
    }
}
