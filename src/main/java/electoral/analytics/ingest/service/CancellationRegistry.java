package electoral.analytics.ingest.service;

import electoral.analytics.ingest.exception.ImportCancelledException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flags for running import jobs.
 *
 * Running code polls {@link #checkCancelled(Long)} between rows and between I/O chunks.
 * Cancellation never rolls back rows already written by the in-flight batch.
 */
@Component
public class CancellationRegistry {

    private final Map<Long, AtomicBoolean> flags = new ConcurrentHashMap<>();

    /**
     * Start tracking a job with a cleared flag.
     */
    public void register(Long jobId) {
        flags.put(jobId, new AtomicBoolean(false));
    }

    /**
     * Raise the flag of a running job. Jobs that are not running have nothing to stop
     * and get no flag.
     */
    public void cancel(Long jobId) {
        AtomicBoolean flag = flags.get(jobId);
        if (flag != null) {
            flag.set(true);
        }
    }

    public boolean isCancelled(Long jobId) {
        AtomicBoolean flag = flags.get(jobId);
        return flag != null && flag.get();
    }

    /**
     * @throws ImportCancelledException if cancellation was requested for the job
     */
    public void checkCancelled(Long jobId) {
        if (isCancelled(jobId)) {
            throw new ImportCancelledException(jobId);
        }
    }

    public void clear(Long jobId) {
        flags.remove(jobId);
    }
}
