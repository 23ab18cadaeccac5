package cyntientops.dailyops.model;

/**
 * Daily trigger state machine: IDLE -> RUNNING -> IDLE, or RUNNING -> FAILED -> IDLE
 * with the failed day retried at the next trigger.
 */
public enum TriggerState {
    IDLE,
    RUNNING,
    FAILED
}
