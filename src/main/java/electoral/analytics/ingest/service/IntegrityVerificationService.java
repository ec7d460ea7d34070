package electoral.analytics.ingest.service;

import electoral.analytics.ingest.dto.VerificationResultDto;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ImportBatch;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ElectionResultRowRepository;
import electoral.analytics.ingest.repository.ImportBatchRepository;
import electoral.analytics.ingest.repository.ImportErrorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * On-demand reconciliation of a completed job.
 *
 * The row store is counted independently of the job's own counters and compared against the
 * batch accounting; batch ranges must tile [0, totalRows) and no batch may be left failed or
 * unfinished. The verdict is recorded on the job as its validation status.
 */
@Service
public class IntegrityVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(IntegrityVerificationService.class);

    @Autowired
    private ImportJobStateService stateService;

    @Autowired
    private ImportBatchRepository importBatchRepository;

    @Autowired
    private ImportErrorRepository importErrorRepository;

    @Autowired
    private ElectionResultRowRepository rowRepository;

    public VerificationResultDto verify(Long jobId) {
        ImportJob job = stateService.load(jobId);
        if (!job.isCompleted()) {
            throw new InvalidImportStateException(
                    "Only completed jobs can be verified; job " + jobId + " is " + job.getStatus(),
                    job.getStatus().name());
        }

        List<ImportBatch> batches = importBatchRepository.findByJobIdOrderByBatchIndexAsc(jobId);
        long storedRows = rowRepository.countByImportJobId(jobId);
        long batchInserted = batches.stream().mapToLong(ImportBatch::getInsertedRows).sum();
        long storedErrors = importErrorRepository.countByJobId(jobId);
        long totalRows = job.getTotalRows() != null ? job.getTotalRows() : 0L;

        List<String> discrepancies = new ArrayList<>();

        if (storedRows != batchInserted) {
            discrepancies.add(String.format("Row store holds %d rows for this job but batches report %d inserted",
                    storedRows, batchInserted));
        }
        if (storedRows != job.getProcessedRows()) {
            discrepancies.add(String.format("Row store holds %d rows for this job but the job reports %d processed",
                    storedRows, job.getProcessedRows()));
        }
        if (storedErrors != job.getErrorCount()) {
            discrepancies.add(String.format("%d error records stored but the job reports %d errors",
                    storedErrors, job.getErrorCount()));
        }
        checkRanges(batches, totalRows, discrepancies);
        for (ImportBatch batch : batches) {
            if (batch.getStatus() != ImportBatch.Status.COMPLETED) {
                discrepancies.add(String.format("Batch %d (rows %d-%d) is %s", batch.getBatchIndex(),
                        batch.firstRowNumber(), batch.lastRowNumber(), batch.getStatus()));
            }
        }
        long accounted = job.getProcessedRows() + job.getSkippedRows() + job.getErrorCount();
        if (accounted > totalRows) {
            discrepancies.add(String.format("Job accounts for %d rows but the source has only %d", accounted, totalRows));
        }

        boolean valid = discrepancies.isEmpty();
        String message = valid
                ? String.format("Verified: %d rows stored, %d skipped, %d errors out of %d source rows",
                        storedRows, job.getSkippedRows(), job.getErrorCount(), totalRows)
                : String.join("; ", discrepancies);
        LocalDateTime validatedAt = LocalDateTime.now();

        ImportJob updated = stateService.update(jobId, j -> {
            j.setValidationStatus(valid ? ImportJob.ValidationStatus.PASSED : ImportJob.ValidationStatus.FAILED);
            j.setValidationMessage(message);
            j.setValidatedAt(validatedAt);
        });

        if (valid) {
            logger.info("Import job {} verified: {}", jobId, message);
        } else {
            logger.warn("Import job {} failed verification: {}", jobId, message);
        }

        VerificationResultDto result = new VerificationResultDto();
        result.setJobId(jobId);
        result.setValid(valid);
        result.setValidationMessage(message);
        result.setStoredRowCount(storedRows);
        result.setExpectedRowCount(batchInserted);
        result.setTotalRows(updated.getTotalRows());
        result.setSkippedRows(updated.getSkippedRows());
        result.setErrorCount(updated.getErrorCount());
        result.setValidatedAt(validatedAt);
        result.setDiscrepancies(discrepancies);
        return result;
    }

    /**
     * Batch ranges must be contiguous from 0 and end exactly at totalRows.
     */
    static void checkRanges(List<ImportBatch> batches, long totalRows, List<String> discrepancies) {
        long expectedStart = 0;
        for (ImportBatch batch : batches) {
            if (batch.getRowStart() != expectedStart) {
                discrepancies.add(String.format("Batch %d starts at row offset %d, expected %d",
                        batch.getBatchIndex(), batch.getRowStart(), expectedStart));
            }
            if (batch.getRowEnd() < batch.getRowStart()) {
                discrepancies.add(String.format("Batch %d has an inverted range [%d, %d)",
                        batch.getBatchIndex(), batch.getRowStart(), batch.getRowEnd()));
            }
            expectedStart = batch.getRowEnd();
        }
        if (expectedStart != totalRows) {
            discrepancies.add(String.format("Batches cover %d rows but the source has %d", expectedStart, totalRows));
        }
    }
}
