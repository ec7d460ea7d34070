package electoral.analytics.ingest.exception;

/**
 * Unwinds an in-flight job once its cancellation flag has been observed.
 */
public class ImportCancelledException extends RuntimeException {

    private final Long jobId;

    public ImportCancelledException(Long jobId) {
        super("Import job " + jobId + " was cancelled");
        this.jobId = jobId;
    }

    public Long getJobId() {
        return jobId;
    }
}
