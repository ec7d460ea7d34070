package electoral.analytics.ingest.exception;

/**
 * Thrown when a job, batch or file group referenced by an operator does not exist.
 */
public class ImportNotFoundException extends RuntimeException {

    public ImportNotFoundException(String message) {
        super(message);
    }

    public static ImportNotFoundException job(Long jobId) {
        return new ImportNotFoundException("Import job not found: " + jobId);
    }

    public static ImportNotFoundException batch(Long jobId, Long batchId) {
        return new ImportNotFoundException(String.format("Batch %d not found for import job %d", batchId, jobId));
    }
}
