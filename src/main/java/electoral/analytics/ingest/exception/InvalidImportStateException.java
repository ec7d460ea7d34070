package electoral.analytics.ingest.exception;

/**
 * An operator action was invoked on a job or batch in a state that does not allow it.
 * No state change has been made when this is thrown.
 */
public class InvalidImportStateException extends RuntimeException {

    private final String currentStatus;

    public InvalidImportStateException(String message, String currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
