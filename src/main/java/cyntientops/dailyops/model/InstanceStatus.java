package cyntientops.dailyops.model;

/**
 * Task instance lifecycle status.
 */
public enum InstanceStatus {
    /** Generated for its date, not yet done */
    PENDING,
    /** Done by a worker (terminal) */
    COMPLETED;

    public boolean isTerminal() {
        return this == COMPLETED;
    }
}
