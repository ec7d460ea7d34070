package electoral.analytics.ingest.service;

import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ImportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;

/**
 * Reconciles persisted jobs with the empty in-memory queue after a service start.
 * Jobs that were mid-flight cannot resume and are failed; pending jobs are queued again
 * in creation order.
 */
@Service
public class StartupRecoveryService {

    private static final Logger logger = LoggerFactory.getLogger(StartupRecoveryService.class);

    static final String INTERRUPTED_MESSAGE = "Interrupted by service restart";

    @Autowired
    private ImportJobRepository importJobRepository;

    @Autowired
    private ImportJobStateService stateService;

    @Autowired
    private ImportQueueService importQueueService;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    public void recover() {
        List<ImportJob> interrupted = importJobRepository.findByStatusInOrderByCreatedAtAsc(
                EnumSet.of(ImportJob.Status.DOWNLOADING, ImportJob.Status.EXTRACTING, ImportJob.Status.PROCESSING));
        for (ImportJob job : interrupted) {
            logger.warn("Import job {} was {} when the service stopped, marking it failed", job.getId(), job.getStatus());
            stateService.fail(job.getId(), INTERRUPTED_MESSAGE);
        }

        List<ImportJob> pending = importJobRepository.findByStatusInOrderByCreatedAtAsc(EnumSet.of(ImportJob.Status.PENDING));
        for (ImportJob job : pending) {
            importQueueService.submit(job.getId());
        }

        if (!interrupted.isEmpty() || !pending.isEmpty()) {
            logger.info("Startup recovery: {} interrupted jobs failed, {} pending jobs re-queued",
                    interrupted.size(), pending.size());
        }
    }
}
