package electoral.analytics.ingest.exception;

/**
 * Download or extraction of a job's source failed. Fatal to the job.
 */
public class AcquisitionException extends RuntimeException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
