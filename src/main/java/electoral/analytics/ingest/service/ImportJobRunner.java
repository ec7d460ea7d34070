package electoral.analytics.ingest.service;

import electoral.analytics.ingest.exception.AcquisitionException;
import electoral.analytics.ingest.exception.ImportCancelledException;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.util.CorrelationIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs one admitted import job end to end on the calling thread:
 * acquisition (download, extraction) followed by batch processing.
 *
 * Acquisition and read failures fail the job; row and batch failures do not.
 */
@Service
public class ImportJobRunner {

    private static final Logger logger = LoggerFactory.getLogger(ImportJobRunner.class);

    @Autowired
    private ImportJobStateService stateService;

    @Autowired
    private AcquisitionService acquisitionService;

    @Autowired
    private BatchProcessingService batchProcessingService;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    public void run(Long jobId) {
        CorrelationIdUtil.setJobCorrelationId(jobId);
        cancellationRegistry.register(jobId);
        try {
            ImportJob job = stateService.load(jobId);
            if (job.getStatus() != ImportJob.Status.PENDING) {
                logger.warn("Import job {} is {} and will not be run", jobId, job.getStatus());
                return;
            }

            logger.info("Starting import job {} ({} source: {})", jobId, job.getSourceType(),
                    job.isUrlSource() ? job.getSourceUrl() : job.getFilename());

            Path rowSource = acquisitionService.acquire(job);
            if (rowSource == null) {
                return;
            }

            batchProcessingService.processJob(jobId, rowSource);

        } catch (ImportCancelledException e) {
            logger.info("Import job {} stopped after cancellation", jobId);

        } catch (ImportNotFoundException e) {
            logger.warn("Import job {} was deleted before it could run", jobId);

        } catch (AcquisitionException e) {
            logger.error("Acquisition failed for import job {}: {}", jobId, e.getMessage(), e);
            failQuietly(jobId, e.getMessage());

        } catch (Exception e) {
            logger.error("Import job {} failed", jobId, e);
            failQuietly(jobId, "Import failed: " + e.getMessage());

        } finally {
            cancellationRegistry.clear(jobId);
            CorrelationIdUtil.clearCorrelationId();
        }
    }

    private void failQuietly(Long jobId, String message) {
        try {
            stateService.fail(jobId, message);
        } catch (ImportNotFoundException e) {
            logger.warn("Import job {} was deleted while failing: {}", jobId, message);
        }
    }
}
