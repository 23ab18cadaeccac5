package cyntientops.dailyops.exception;

/**
 * The storage layer rejected an operation or could not be reached.
 */
public class DatabaseException extends DailyOpsException {

    public DatabaseException(String message, Throwable cause) {
        super("DATABASE_ERROR", message, cause);
    }
}
