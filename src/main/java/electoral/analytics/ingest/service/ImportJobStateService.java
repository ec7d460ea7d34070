package electoral.analytics.ingest.service;

import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ImportBatchRepository;
import electoral.analytics.ingest.repository.ImportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Single writer for import job rows.
 *
 * Every mutation reloads the job, applies the change under the job's lock and saves
 * immediately, so operator actions and the pipeline thread never overwrite each other
 * with stale copies and progress readers always see committed values.
 */
@Service
public class ImportJobStateService {

    private static final Logger logger = LoggerFactory.getLogger(ImportJobStateService.class);

    @Autowired
    private ImportJobRepository importJobRepository;

    @Autowired
    private ImportBatchRepository importBatchRepository;

    private static final int LOCK_STRIPES = 64;

    // Fixed set of locks shared by job id, so the lock table never grows with the job history
    private final Object[] locks = new Object[LOCK_STRIPES];

    public ImportJobStateService() {
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public ImportJob load(Long jobId) {
        return importJobRepository.findById(jobId)
                .orElseThrow(() -> ImportNotFoundException.job(jobId));
    }

    /**
     * Apply a mutation to the current persisted state of a job and save it.
     *
     * @return the saved job
     */
    public ImportJob update(Long jobId, Consumer<ImportJob> mutation) {
        synchronized (lockFor(jobId)) {
            ImportJob job = load(jobId);
            mutation.accept(job);
            return importJobRepository.save(job);
        }
    }

    /**
     * Move a job to a new status if the lifecycle allows it from its current persisted status.
     * A rejected move is logged and leaves the job untouched; this is how a pipeline thread
     * finds out that an operator cancelled the job underneath it.
     *
     * @param extra further changes applied together with the transition, may be null
     * @return the saved job, or empty if the transition was not allowed
     */
    public Optional<ImportJob> transition(Long jobId, ImportJob.Status target, Consumer<ImportJob> extra) {
        synchronized (lockFor(jobId)) {
            ImportJob job = load(jobId);
            if (!job.getStatus().canTransitionTo(target)) {
                logger.warn("Ignoring transition of import job {} from {} to {}", jobId, job.getStatus(), target);
                return Optional.empty();
            }
            ImportJob.Status previous = job.getStatus();
            job.transitionTo(target);
            if (extra != null) {
                extra.accept(job);
            }
            ImportJob saved = importJobRepository.save(job);
            logger.info("Import job {} status {} -> {}", jobId, previous, target);
            return Optional.of(saved);
        }
    }

    public Optional<ImportJob> transition(Long jobId, ImportJob.Status target) {
        return transition(jobId, target, null);
    }

    /**
     * Fail a job with a message unless it already reached a terminal status.
     */
    public Optional<ImportJob> fail(Long jobId, String errorMessage) {
        return transition(jobId, ImportJob.Status.FAILED, job -> {
            job.setErrorMessage(errorMessage);
            job.setValidationMessage(errorMessage);
        });
    }

    /**
     * Persist downloaded byte count while the job is still downloading.
     */
    public void recordDownloadProgress(Long jobId, long downloadedBytes) {
        update(jobId, job -> {
            if (job.getStatus() == ImportJob.Status.DOWNLOADING) {
                job.setDownloadedBytes(downloadedBytes);
            }
        });
    }

    /**
     * Recompute the job's aggregate counters from all of its batches.
     * processedRows is the number of rows stored by the job's batches.
     */
    public ImportJob refreshCounters(Long jobId) {
        List<Object[]> sums = importBatchRepository.sumCountersByJobId(jobId);
        Object[] row = sums.isEmpty() ? new Object[]{0L, 0L, 0L, 0L} : sums.get(0);
        long inserted = toLong(row[0]);
        long skipped = toLong(row[1]);
        long errors = toLong(row[2]);
        long duplicates = toLong(row[3]);

        return update(jobId, job -> {
            job.setProcessedRows(inserted);
            job.setSkippedRows(skipped);
            job.setErrorCount(errors);
            job.setDuplicateRows(duplicates);
        });
    }

    Object lockFor(Long jobId) {
        return locks[Math.floorMod(jobId.hashCode(), locks.length)];
    }

    private static long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
