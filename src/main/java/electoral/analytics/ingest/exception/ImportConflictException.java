package electoral.analytics.ingest.exception;

import electoral.analytics.ingest.model.ImportJob;

/**
 * A submission matches the source of an existing job.
 */
public class ImportConflictException extends RuntimeException {

    public enum Reason {
        ALREADY_IMPORTED, IN_PROGRESS
    }

    private final Reason reason;
    private final transient ImportJob existingJob;

    public ImportConflictException(Reason reason, ImportJob existingJob, String message) {
        super(message);
        this.reason = reason;
        this.existingJob = existingJob;
    }

    public Reason getReason() {
        return reason;
    }

    public ImportJob getExistingJob() {
        return existingJob;
    }
}
