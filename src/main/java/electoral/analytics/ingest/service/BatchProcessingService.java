package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.exception.ImportCancelledException;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ElectionResultRow;
import electoral.analytics.ingest.model.ImportBatch;
import electoral.analytics.ingest.model.ImportError;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.parser.ColumnLayout;
import electoral.analytics.ingest.parser.DelimitedLineParser;
import electoral.analytics.ingest.parser.ElectionRowParser;
import electoral.analytics.ingest.parser.RowFilter;
import electoral.analytics.ingest.parser.RowParseResult;
import electoral.analytics.ingest.parser.SourceRowReader;
import electoral.analytics.ingest.repository.ElectionResultRowRepository;
import electoral.analytics.ingest.repository.ImportBatchRepository;
import electoral.analytics.ingest.repository.ImportErrorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Batch processor for import jobs.
 *
 * A job's data rows are split into fixed-size batches that run strictly in index order over
 * one sequential reader. Row-level problems become import error records and never stop the
 * batch; a failure of the batch itself (e.g. the row store going away) marks only that batch
 * FAILED and processing moves on to the next one. Job counters are recomputed from the batch
 * table after every batch, so observers see progress advance in index order.
 */
@Service
public class BatchProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(BatchProcessingService.class);

    private static final int MAX_SUMMARY_LENGTH = 2000;

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private ImportJobStateService stateService;

    @Autowired
    private ImportBatchRepository importBatchRepository;

    @Autowired
    private ImportErrorRepository importErrorRepository;

    @Autowired
    private ElectionResultRowRepository rowRepository;

    @Autowired
    private ElectionRowStore rowStore;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    @Autowired
    private BatchPlanner batchPlanner;

    private final Set<Long> reprocessing = ConcurrentHashMap.newKeySet();

    /**
     * Process the whole row source of a job and complete it.
     *
     * @throws IOException if the source cannot be read; fatal to the job
     * @throws ImportCancelledException if the job was cancelled meanwhile
     */
    public void processJob(Long jobId, Path source) throws IOException {
        Optional<ImportJob> processing = stateService.transition(jobId, ImportJob.Status.PROCESSING,
                job -> job.setLocalFilePath(source.toString()));
        if (processing.isEmpty()) {
            return;
        }

        Charset charset = importConfig.getSourceCharset();
        boolean hasHeader = importConfig.getCsv().isHasHeader();

        long startedAt = System.currentTimeMillis();
        try (SourceRowReader reader = new SourceRowReader(source, charset, hasHeader)) {
            // an unknown layout fails the job before any batch is planned
            ElectionRowParser parser = parserFor(processing.get(), reader.getHeader(), source, charset);

            long totalRows = SourceRowReader.countRows(source, charset, hasHeader);
            List<ImportBatch> batches = importBatchRepository.saveAll(batchPlanner.plan(jobId, totalRows));
            stateService.update(jobId, j -> {
                j.setTotalRows(totalRows);
                j.setTotalFileRows(totalRows + (hasHeader ? 1 : 0));
            });
            logger.info("Import job {}: {} data rows in {} batches of up to {}", jobId, totalRows,
                    batches.size(), importConfig.getBatchSize());

            for (ImportBatch batch : batches) {
                // no batch starts after a cancellation request
                cancellationRegistry.checkCancelled(jobId);
                processBatch(jobId, batch, reader, parser);
                stateService.refreshCounters(jobId);
                if ((batch.getBatchIndex() + 1) % 10 == 0) {
                    logger.info("Import job {}: {} of {} batches done", jobId, batch.getBatchIndex() + 1, batches.size());
                }
            }

            long failed = importBatchRepository.countByJobIdAndStatus(jobId, ImportBatch.Status.FAILED);
            if (!batches.isEmpty() && failed == batches.size()) {
                stateService.fail(jobId, "All " + failed + " batches failed");
                return;
            }

            stateService.transition(jobId, ImportJob.Status.COMPLETED).ifPresent(done ->
                    logger.info("Import job {} completed in {}ms: {} stored, {} skipped, {} errors, {} failed batches",
                            jobId, System.currentTimeMillis() - startedAt, done.getProcessedRows(),
                            done.getSkippedRows(), done.getErrorCount(), failed));
        }
    }

    /**
     * Re-run one failed batch of a finished job. Rows and errors recorded earlier for the
     * batch range are removed first, so running it again yields the same outcome.
     */
    public ImportBatch reprocessBatch(Long jobId, Long batchId) {
        ImportJob job = stateService.load(jobId);
        ImportBatch batch = importBatchRepository.findByIdAndJobId(batchId, jobId)
                .orElseThrow(() -> ImportNotFoundException.batch(jobId, batchId));

        if (!job.getStatus().isTerminal()) {
            throw new InvalidImportStateException(
                    "Batches can only be reprocessed once the job has finished; job " + jobId + " is " + job.getStatus(),
                    job.getStatus().name());
        }
        if (!batch.isFailed()) {
            throw new InvalidImportStateException(
                    "Only failed batches can be reprocessed; batch " + batch.getBatchIndex() + " is " + batch.getStatus(),
                    batch.getStatus().name());
        }
        Path source = job.getLocalFilePath() != null ? Paths.get(job.getLocalFilePath()) : null;
        if (source == null || !Files.exists(source)) {
            throw new InvalidImportStateException(
                    "Source file for job " + jobId + " is no longer available; restart the job instead",
                    job.getStatus().name());
        }
        if (!reprocessing.add(jobId)) {
            throw new InvalidImportStateException("A reprocess is already running for job " + jobId,
                    job.getStatus().name());
        }

        try {
            return runReprocess(job, batch, source);
        } finally {
            reprocessing.remove(jobId);
        }
    }

    /**
     * Reprocess every failed batch of a finished job in index order.
     */
    public List<ImportBatch> reprocessFailedBatches(Long jobId) {
        ImportJob job = stateService.load(jobId);
        if (!job.getStatus().isTerminal()) {
            throw new InvalidImportStateException(
                    "Batches can only be reprocessed once the job has finished; job " + jobId + " is " + job.getStatus(),
                    job.getStatus().name());
        }

        List<ImportBatch> failed = importBatchRepository.findByJobIdAndStatusOrderByBatchIndexAsc(
                jobId, ImportBatch.Status.FAILED);
        logger.info("Reprocessing {} failed batches of import job {}", failed.size(), jobId);

        List<ImportBatch> results = new ArrayList<>();
        for (ImportBatch batch : failed) {
            results.add(reprocessBatch(jobId, batch.getId()));
        }
        return results;
    }

    public boolean isReprocessing(Long jobId) {
        return reprocessing.contains(jobId);
    }

    private ImportBatch runReprocess(ImportJob job, ImportBatch batch, Path source) {
        Long jobId = job.getId();
        logger.info("Reprocessing batch {} of import job {} (rows {}-{})", batch.getBatchIndex(), jobId,
                batch.firstRowNumber(), batch.lastRowNumber());

        int removedRows = rowRepository.deleteByImportJobIdAndSourceRowRange(
                jobId, batch.firstRowNumber(), batch.lastRowNumber());
        int removedErrors = importErrorRepository.deleteByJobIdAndRowRange(
                jobId, batch.firstRowNumber(), batch.lastRowNumber());
        logger.debug("Cleared {} rows and {} errors of batch {} before reprocessing",
                removedRows, removedErrors, batch.getBatchIndex());

        Charset charset = importConfig.getSourceCharset();
        try (SourceRowReader reader = new SourceRowReader(source, charset, importConfig.getCsv().isHasHeader())) {
            ElectionRowParser parser = parserFor(job, reader.getHeader(), source, charset);
            long skipped = reader.skip(batch.getRowStart());
            if (skipped < batch.getRowStart()) {
                batch.markAsFailed("Source file has only " + skipped + " rows, batch starts at row " + batch.firstRowNumber());
                return importBatchRepository.save(batch);
            }
            processBatch(jobId, batch, reader, parser);
        } catch (IOException e) {
            logger.error("Could not read source of import job {} for reprocessing", jobId, e);
            batch.markAsFailed("Source read failed: " + e.getMessage());
            importBatchRepository.save(batch);
        }

        stateService.refreshCounters(jobId);
        return importBatchRepository.findById(batch.getId()).orElse(batch);
    }

    /**
     * Process one batch from a reader positioned just before the batch's first row.
     * On return the reader is positioned after the batch's last row.
     */
    void processBatch(Long jobId, ImportBatch batch, SourceRowReader reader, ElectionRowParser parser)
            throws IOException {
        batch.markAsProcessing();
        importBatchRepository.save(batch);

        long inserted = 0;
        long skipped = 0;
        long duplicates = 0;
        long errors = 0;
        long processed = 0;

        try {
            for (long i = batch.getRowStart(); i < batch.getRowEnd(); i++) {
                if (cancellationRegistry.isCancelled(jobId)) {
                    throw new ImportCancelledException(jobId);
                }

                String line = reader.next();
                if (line == null) {
                    throw new IOException("Source ended at row " + reader.getRowNumber()
                            + ", batch expects rows up to " + batch.lastRowNumber());
                }
                long rowNumber = reader.getRowNumber();
                processed++;

                RowParseResult result = parser.parse(line);
                switch (result.getKind()) {
                    case VALID:
                        ElectionResultRow row = result.getRow();
                        row.setImportJobId(jobId);
                        row.setSourceRowNumber(rowNumber);
                        if (rowStore.insertIfAbsent(row)) {
                            inserted++;
                        } else {
                            skipped++;
                            duplicates++;
                        }
                        break;
                    case FILTERED:
                        skipped++;
                        break;
                    case INVALID:
                    default:
                        importErrorRepository.save(new ImportError(jobId, rowNumber, result.getErrorType(),
                                result.getMessage(), truncate(line)));
                        errors++;
                        break;
                }
            }

            applyCounters(batch, processed, inserted, skipped, duplicates, errors);
            batch.markAsCompleted();
            importBatchRepository.save(batch);
            logger.debug("Batch {} of import job {} completed: {} inserted, {} skipped ({} duplicates), {} errors",
                    batch.getBatchIndex(), jobId, inserted, skipped, duplicates, errors);

        } catch (ImportCancelledException e) {
            applyCounters(batch, processed, inserted, skipped, duplicates, errors);
            batch.markAsFailed("Cancelled at row " + (batch.getRowStart() + processed + 1));
            importBatchRepository.save(batch);
            stateService.refreshCounters(jobId);
            throw e;

        } catch (IOException e) {
            applyCounters(batch, processed, inserted, skipped, duplicates, errors);
            batch.markAsFailed(summarize(e));
            importBatchRepository.save(batch);
            throw e;

        } catch (RuntimeException e) {
            logger.error("Batch {} of import job {} failed at row {}", batch.getBatchIndex(), jobId,
                    batch.getRowStart() + processed, e);
            applyCounters(batch, processed, inserted, skipped, duplicates, errors);
            batch.markAsFailed(summarize(e));
            importBatchRepository.save(batch);

            // keep the shared reader aligned with the next batch
            long remaining = batch.getRowEnd() - reader.getRowNumber();
            if (remaining > 0) {
                reader.skip(remaining);
            }
        }
    }

    private ElectionRowParser parserFor(ImportJob job, String header, Path source, Charset charset) throws IOException {
        DelimitedLineParser lineParser = new DelimitedLineParser(importConfig.getCsv().getDelimiter());
        String sample = header;
        if (sample == null) {
            try (SourceRowReader peek = new SourceRowReader(source, charset, false)) {
                sample = peek.next();
            }
        }
        ColumnLayout layout;
        try {
            layout = sample != null ? ColumnLayout.detect(lineParser.split(sample).size()) : ColumnLayout.MODERN;
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        logger.debug("Import job {} uses the {} column layout", job.getId(), layout);
        return new ElectionRowParser(layout, lineParser, RowFilter.forJob(job));
    }

    private static void applyCounters(ImportBatch batch, long processed, long inserted, long skipped,
                                      long duplicates, long errors) {
        batch.setProcessedRows(processed);
        batch.setInsertedRows(inserted);
        batch.setSkippedRows(skipped);
        batch.setDuplicateRows(duplicates);
        batch.setErrorCount(errors);
    }

    private String truncate(String line) {
        int max = importConfig.getErrors().getRawDataMaxLength();
        return line.length() > max ? line.substring(0, max) : line;
    }

    private static String summarize(Exception e) {
        String summary = e.getClass().getSimpleName() + ": " + e.getMessage();
        return summary.length() > MAX_SUMMARY_LENGTH ? summary.substring(0, MAX_SUMMARY_LENGTH) : summary;
    }
}
