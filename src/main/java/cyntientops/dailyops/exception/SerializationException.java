package cyntientops.dailyops.exception;

public class SerializationException extends DailyOpsException {

    public SerializationException(String message, Throwable cause) {
        super("SERIALIZATION_ERROR", message, cause);
    }
}
