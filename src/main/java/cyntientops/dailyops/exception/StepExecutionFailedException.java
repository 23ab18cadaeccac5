package cyntientops.dailyops.exception;

/**
 * A migration step failed. Steps before it remain recorded as complete.
 */
public class StepExecutionFailedException extends DailyOpsException {

    private final String stepId;

    public StepExecutionFailedException(String stepId, Throwable cause) {
        super("STEP_FAILED", "Migration step '" + stepId + "' failed: " + cause.getMessage(), cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
