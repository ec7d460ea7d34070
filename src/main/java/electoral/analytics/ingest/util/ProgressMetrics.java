package electoral.analytics.ingest.util;

import electoral.analytics.ingest.model.ImportJob;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Progress figures derived at read time from a job's persisted counters and timestamps.
 * Nothing here is stored.
 */
public final class ProgressMetrics {

    private ProgressMetrics() {
    }

    /**
     * Percent complete for the job's current phase, or null when progress is indeterminate
     * (extracting, unknown download size, unknown row total).
     */
    public static Double percentComplete(ImportJob job) {
        switch (job.getStatus()) {
            case COMPLETED:
                return 100.0;
            case DOWNLOADING:
                return percent(job.getDownloadedBytes(), job.getFileSize());
            case PROCESSING:
                return percent(handledRows(job), job.getTotalRows());
            case PENDING:
                return 0.0;
            default:
                // extracting, awaiting selection, failed, cancelled
                return job.getTotalRows() != null && job.getTotalRows() > 0
                        ? percent(handledRows(job), job.getTotalRows())
                        : null;
        }
    }

    /**
     * Rows stored or skipped so far.
     */
    public static long handledRows(ImportJob job) {
        return nz(job.getProcessedRows()) + nz(job.getSkippedRows());
    }

    /**
     * Rows per second since the job started, or 0 before any time has elapsed.
     */
    public static double rowsPerSecond(ImportJob job, LocalDateTime now) {
        if (job.getStartedAt() == null) {
            return 0.0;
        }
        LocalDateTime end = job.getCompletedAt() != null ? job.getCompletedAt() : now;
        double elapsedSeconds = Duration.between(job.getStartedAt(), end).toMillis() / 1000.0;
        if (elapsedSeconds <= 0) {
            return 0.0;
        }
        return handledRows(job) / elapsedSeconds;
    }

    /**
     * Seconds remaining at the current speed; null while the speed or the row total is unknown.
     */
    public static Long etaSeconds(ImportJob job, LocalDateTime now) {
        if (job.getStatus() != ImportJob.Status.PROCESSING || job.getTotalRows() == null) {
            return null;
        }
        double speed = rowsPerSecond(job, now);
        if (speed <= 0) {
            return null;
        }
        long remaining = Math.max(0, job.getTotalRows() - handledRows(job) - nz(job.getErrorCount()));
        return (long) Math.ceil(remaining / speed);
    }

    static Double percent(Long done, Long total) {
        if (total == null || total <= 0) {
            return null;
        }
        double value = nz(done) * 100.0 / total;
        return Math.min(100.0, Math.round(value * 10.0) / 10.0);
    }

    private static long nz(Long value) {
        return value != null ? value : 0L;
    }
}
