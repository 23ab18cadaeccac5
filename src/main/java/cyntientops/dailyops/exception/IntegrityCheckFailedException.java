package cyntientops.dailyops.exception;

/**
 * The source dataset drifted from its last known-good checksum, or failed
 * structural validation.
 */
public class IntegrityCheckFailedException extends DailyOpsException {

    private final String expectedChecksum;
    private final String actualChecksum;

    public IntegrityCheckFailedException(String message) {
        super("INTEGRITY_CHECK_FAILED", message);
        this.expectedChecksum = null;
        this.actualChecksum = null;
    }

    public IntegrityCheckFailedException(String expectedChecksum, String actualChecksum) {
        super("INTEGRITY_CHECK_FAILED",
                String.format("Operational data checksum mismatch: expected %s, got %s", expectedChecksum,
                        actualChecksum));
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
    }

    public String getExpectedChecksum() {
        return expectedChecksum;
    }

    public String getActualChecksum() {
        return actualChecksum;
    }
}
