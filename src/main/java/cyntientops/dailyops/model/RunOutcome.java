package cyntientops.dailyops.model;

/**
 * Result of asking the daily pipeline to run.
 */
public enum RunOutcome {
    /** Migration (if needed), generation and sweep all succeeded; marker advanced */
    COMPLETED,

    /** The run marker already holds today's date - nothing to do */
    ALREADY_RAN_TODAY,

    /** Another run holds the in-progress guard - this attempt was ignored */
    ALREADY_RUNNING,

    /** The run failed; marker untouched so the next trigger retries */
    FAILED
}
