package cyntientops.dailyops.migration;

/**
 * Receives migration progress updates, e.g. to drive a progress bar.
 */
@FunctionalInterface
public interface MigrationProgressListener {

    MigrationProgressListener NONE = (step, totalSteps, status) -> {
    };

    void onProgress(int step, int totalSteps, String status);
}
