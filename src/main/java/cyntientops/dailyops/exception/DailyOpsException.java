package cyntientops.dailyops.exception;

/**
 * Base class for failures raised by the migration and daily-run pipeline.
 * Carries a stable error code so callers can branch without parsing messages.
 */
public class DailyOpsException extends RuntimeException {

    private final String errorCode;

    public DailyOpsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DailyOpsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{errorCode='" + errorCode + "', message='" + getMessage() + "'}";
    }
}
