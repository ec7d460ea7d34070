package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.ArchiveEntryDto;
import electoral.analytics.ingest.dto.ImportBatchDto;
import electoral.analytics.ingest.dto.ImportErrorDto;
import electoral.analytics.ingest.dto.ImportJobDto;
import electoral.analytics.ingest.dto.UrlImportRequestDto;
import electoral.analytics.ingest.exception.ImportConflictException;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ImportBatch;
import electoral.analytics.ingest.model.ImportError;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ElectionResultRowRepository;
import electoral.analytics.ingest.repository.ImportBatchRepository;
import electoral.analytics.ingest.repository.ImportErrorRepository;
import electoral.analytics.ingest.repository.ImportJobRepository;
import electoral.analytics.ingest.util.FileValidationUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Operator actions on import jobs: submission, inspection, cancel, restart, archive file
 * selection, batch reprocessing and deletion.
 *
 * Actions invoked in the wrong state are rejected with {@link InvalidImportStateException}
 * and leave the job untouched.
 */
@Service
public class ImportJobService {

    private static final Logger logger = LoggerFactory.getLogger(ImportJobService.class);

    private static final String[] SOURCE_EXTENSIONS = {"csv", "txt", "zip"};
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private ImportJobRepository importJobRepository;

    @Autowired
    private ImportBatchRepository importBatchRepository;

    @Autowired
    private ImportErrorRepository importErrorRepository;

    @Autowired
    private ElectionResultRowRepository rowRepository;

    @Autowired
    private ImportJobStateService stateService;

    @Autowired
    private ImportQueueService importQueueService;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    @Autowired
    private BatchProcessingService batchProcessingService;

    @Autowired
    private AcquisitionService acquisitionService;

    @Autowired
    private FileCustodianService fileCustodianService;

    private final Object submissionLock = new Object();

    // ========================================
    // SUBMISSION
    // ========================================

    /**
     * Spool an uploaded file and queue a job for it.
     *
     * @throws IllegalArgumentException if the file is empty or not a csv/txt/zip file
     * @throws ImportConflictException if the same source is already imported or importing
     */
    public ImportJob submitUpload(MultipartFile file, Integer electionYear, String region, String electionType,
                                  Integer categoryCode, String selectedFile, String createdBy) throws IOException {
        FileValidationUtil.validateFile(file, SOURCE_EXTENSIONS);
        String filename = FileValidationUtil.extractFilename(FileValidationUtil.validateAndGetFilename(file));

        ImportJob job = new ImportJob(ImportJob.SourceType.UPLOAD, filename);
        applyFilters(job, electionYear, region, electionType, categoryCode, selectedFile, createdBy);
        job.setFileSize(file.getSize());

        synchronized (submissionLock) {
            checkDuplicate(job.getSourceKey());

            Path stored = fileCustodianService.storeUpload(file);
            if (FileValidationUtil.isZipFile(filename)) {
                job.setArchivePath(stored.toString());
            } else {
                job.setLocalFilePath(stored.toString());
            }
            job = importJobRepository.save(job);
        }

        logger.info("Created import job {} for upload {} ({} bytes)", job.getId(), filename, file.getSize());
        importQueueService.submit(job.getId());
        return job;
    }

    /**
     * Queue a job that downloads its source from a URL.
     *
     * @throws IllegalArgumentException if the URL is not an accepted https source
     * @throws ImportConflictException if the same source is already imported or importing
     */
    public ImportJob submitUrl(UrlImportRequestDto request) {
        URI uri = FileValidationUtil.validateSourceUrl(request.getUrl(),
                importConfig.getDownload().getAllowedHosts(), SOURCE_EXTENSIONS);

        ImportJob job = new ImportJob(ImportJob.SourceType.URL, FileValidationUtil.extractFilename(uri.getPath()));
        job.setSourceUrl(uri.toString());
        applyFilters(job, request.getElectionYear(), request.getRegion(), request.getElectionType(),
                request.getCategoryCode(), request.getSelectedFile(), request.getCreatedBy());

        synchronized (submissionLock) {
            checkDuplicate(job.getSourceKey());
            job = importJobRepository.save(job);
        }

        logger.info("Created import job {} for URL {}", job.getId(), job.getSourceUrl());
        importQueueService.submit(job.getId());
        return job;
    }

    /**
     * List the importable files of a remote archive without creating a job.
     */
    public List<ArchiveEntryDto> previewArchive(String url) {
        URI uri = FileValidationUtil.validateSourceUrl(url, importConfig.getDownload().getAllowedHosts(),
                SOURCE_EXTENSIONS);
        return acquisitionService.previewArchive(uri);
    }

    // ========================================
    // QUERIES
    // ========================================

    public List<ImportJobDto> listJobs(ImportJob.Status status) {
        List<ImportJob> jobs = status == null
                ? importJobRepository.findAllByOrderByCreatedAtDesc()
                : importJobRepository.findByStatusOrderByCreatedAtDesc(status);
        LocalDateTime now = LocalDateTime.now();
        return jobs.stream().map(job -> toDto(job, now)).collect(Collectors.toList());
    }

    public ImportJobDto getJob(Long jobId) {
        return toDto(stateService.load(jobId), LocalDateTime.now());
    }

    public ImportJobDto toDto(ImportJob job) {
        return toDto(job, LocalDateTime.now());
    }

    public List<ImportBatchDto> listBatches(Long jobId) {
        stateService.load(jobId);
        return importBatchRepository.findByJobIdOrderByBatchIndexAsc(jobId).stream()
                .map(ImportBatchDto::new)
                .collect(Collectors.toList());
    }

    public ImportBatchDto getBatch(Long jobId, Long batchId) {
        return importBatchRepository.findByIdAndJobId(batchId, jobId)
                .map(ImportBatchDto::new)
                .orElseThrow(() -> ImportNotFoundException.batch(jobId, batchId));
    }

    public Page<ImportErrorDto> listErrors(Long jobId, ImportError.ErrorType errorType, Pageable pageable) {
        stateService.load(jobId);
        Page<ImportError> errors = errorType == null
                ? importErrorRepository.findByJobId(jobId, pageable)
                : importErrorRepository.findByJobIdAndErrorType(jobId, errorType, pageable);
        return errors.map(ImportErrorDto::new);
    }

    // ========================================
    // LIFECYCLE ACTIONS
    // ========================================

    /**
     * Cancel a job that has not finished. A running job stops within one row or one I/O chunk;
     * rows already stored by the in-flight batch stay stored.
     */
    public ImportJob cancel(Long jobId) {
        ImportJob job = stateService.load(jobId);
        if (!ImportJob.Status.inProgress().contains(job.getStatus())) {
            throw new InvalidImportStateException(
                    "Job " + jobId + " is " + job.getStatus() + " and cannot be cancelled", job.getStatus().name());
        }

        ImportJob cancelled = stateService.transition(jobId, ImportJob.Status.CANCELLED,
                        j -> j.setErrorMessage("Cancelled by operator"))
                .orElseThrow(() -> {
                    ImportJob current = stateService.load(jobId);
                    return new InvalidImportStateException(
                            "Job " + jobId + " is " + current.getStatus() + " and cannot be cancelled",
                            current.getStatus().name());
                });

        // the flag is only raised once the job is really cancelled
        importQueueService.remove(jobId);
        cancellationRegistry.cancel(jobId);
        return cancelled;
    }

    /**
     * Run a failed or cancelled URL job again from the download onward. Rows, batches and
     * errors of the previous attempt are removed and the job waits at the back of the queue.
     */
    public ImportJob restart(Long jobId) {
        ImportJob job = stateService.load(jobId);
        if (!job.isUrlSource()) {
            throw new InvalidImportStateException(
                    "Only URL imports can be restarted; upload the file again to re-import it",
                    job.getStatus().name());
        }
        if (job.getStatus() != ImportJob.Status.FAILED && job.getStatus() != ImportJob.Status.CANCELLED) {
            throw new InvalidImportStateException(
                    "Only failed or cancelled jobs can be restarted; job " + jobId + " is " + job.getStatus(),
                    job.getStatus().name());
        }
        if (batchProcessingService.isReprocessing(jobId)) {
            throw new InvalidImportStateException("Job " + jobId + " is being reprocessed", job.getStatus().name());
        }

        int rows = rowRepository.deleteByImportJobId(jobId);
        int errors = importErrorRepository.deleteByJobId(jobId);
        int batches = importBatchRepository.deleteByJobId(jobId);
        logger.info("Restarting import job {}: removed {} rows, {} errors, {} batches of the previous attempt",
                jobId, rows, errors, batches);

        ImportJob restarted = stateService.update(jobId, j -> {
            j.resetForRestart();
            j.setFileSize(0L);
            j.setArchivePath(null);
            j.setLocalFilePath(null);
        });
        importQueueService.submit(jobId);
        return restarted;
    }

    /**
     * Choose the archive file of a job awaiting selection; the job is queued again and reuses
     * the archive already on disk.
     */
    public ImportJob selectFile(Long jobId, String file) {
        ImportJob job = requireAwaitingSelection(jobId);
        if (!job.getAvailableFileList().contains(file)) {
            throw new IllegalArgumentException("File '" + file + "' is not in the archive of job " + jobId);
        }

        String sourceKey = buildSourceKey(job.getFilename(), file, job.getElectionYear(), job.getRegion(),
                job.getCategoryCode());
        ImportJob selected;
        synchronized (submissionLock) {
            checkDuplicate(sourceKey);
            selected = stateService.transition(jobId, ImportJob.Status.PENDING, j -> {
                j.setSelectedFile(file);
                j.setSourceKey(sourceKey);
                j.setAvailableFiles(null);
            }).orElseThrow(() -> new InvalidImportStateException(
                    "Job " + jobId + " is no longer awaiting file selection", null));
        }

        logger.info("Import job {} will import {}", jobId, file);
        importQueueService.submit(jobId);
        return selected;
    }

    /**
     * Import every file of an archive: the job keeps the first file not imported yet and one
     * child job is queued per further file, sharing the archive. Files already imported, or
     * being imported, are left out wherever they appear in the archive.
     *
     * @return the job and its children, in queue order
     * @throws ImportConflictException if every file of the archive was already imported
     */
    public List<ImportJob> selectAll(Long jobId) {
        ImportJob job = requireAwaitingSelection(jobId);
        List<String> files = job.getAvailableFileList();

        List<ImportJob> jobs = new ArrayList<>();
        ImportConflictException lastConflict = null;
        for (String file : files) {
            if (jobs.isEmpty()) {
                try {
                    jobs.add(selectFile(jobId, file));
                } catch (ImportConflictException e) {
                    logger.warn("Skipping {} of import job {}: {}", file, jobId, e.getMessage());
                    lastConflict = e;
                }
                continue;
            }

            ImportJob child = new ImportJob(job.getSourceType(), job.getFilename());
            child.setSourceUrl(job.getSourceUrl());
            child.setArchivePath(job.getArchivePath());
            child.setFileSize(job.getFileSize());
            child.setParentJobId(jobId);
            applyFilters(child, job.getElectionYear(), job.getRegion(), job.getElectionType(),
                    job.getCategoryCode(), file, job.getCreatedBy());

            synchronized (submissionLock) {
                try {
                    checkDuplicate(child.getSourceKey());
                } catch (ImportConflictException e) {
                    logger.warn("Skipping {} of import job {}: {}", file, jobId, e.getMessage());
                    continue;
                }
                child = importJobRepository.save(child);
            }
            importQueueService.submit(child.getId());
            jobs.add(child);
        }

        // nothing left to import; the job keeps waiting for a selection
        if (jobs.isEmpty() && lastConflict != null) {
            throw lastConflict;
        }

        logger.info("Import job {} fanned out into {} jobs", jobId, jobs.size());
        return jobs;
    }

    /**
     * Delete a job with its rows, batches and error records. Temporary files are left to the
     * file custodian.
     */
    public ImportJob delete(Long jobId) {
        ImportJob job = stateService.load(jobId);
        if (job.getStatus().isActive() || importQueueService.isActive(jobId)
                || batchProcessingService.isReprocessing(jobId)) {
            throw new InvalidImportStateException(
                    "Job " + jobId + " is " + job.getStatus() + "; cancel it before deleting", job.getStatus().name());
        }

        importQueueService.remove(jobId);
        int rows = rowRepository.deleteByImportJobId(jobId);
        int errors = importErrorRepository.deleteByJobId(jobId);
        int batches = importBatchRepository.deleteByJobId(jobId);
        importJobRepository.deleteById(jobId);

        logger.info("Deleted import job {} with {} rows, {} errors and {} batches", jobId, rows, errors, batches);
        return job;
    }

    public ImportBatch reprocessBatch(Long jobId, Long batchId) {
        return batchProcessingService.reprocessBatch(jobId, batchId);
    }

    public List<ImportBatch> reprocessFailedBatches(Long jobId) {
        return batchProcessingService.reprocessFailedBatches(jobId);
    }

    // ========================================
    // HELPERS
    // ========================================

    /**
     * Key identifying "the same source" for duplicate detection: normalized file name, chosen
     * archive entry and the ingestion filters.
     */
    public static String buildSourceKey(String filename, String selectedFile, Integer electionYear, String region,
                                        Integer categoryCode) {
        return String.join("|",
                normalize(filename),
                normalize(selectedFile),
                electionYear != null ? electionYear.toString() : "*",
                region != null ? region.trim().toUpperCase(Locale.ROOT) : "*",
                categoryCode != null ? categoryCode.toString() : "*");
    }

    /**
     * @throws ImportConflictException if a completed or unfinished job has the same source key
     */
    void checkDuplicate(String sourceKey) {
        Optional<ImportJob> completed = importJobRepository.findFirstBySourceKeyAndStatusInOrderByCreatedAtDesc(
                sourceKey, EnumSet.of(ImportJob.Status.COMPLETED));
        if (completed.isPresent()) {
            ImportJob existing = completed.get();
            String when = existing.getCompletedAt() != null ? existing.getCompletedAt().format(DATE_FORMAT) : "unknown date";
            throw new ImportConflictException(ImportConflictException.Reason.ALREADY_IMPORTED, existing,
                    String.format("This source was already imported by job %d on %s (%d rows stored)",
                            existing.getId(), when, existing.getProcessedRows()));
        }

        Optional<ImportJob> running = importJobRepository.findFirstBySourceKeyAndStatusInOrderByCreatedAtDesc(
                sourceKey, ImportJob.Status.inProgress());
        if (running.isPresent()) {
            ImportJob existing = running.get();
            throw new ImportConflictException(ImportConflictException.Reason.IN_PROGRESS, existing,
                    String.format("This source is already being imported by job %d (%s)",
                            existing.getId(), existing.getStatus()));
        }
    }

    private ImportJob requireAwaitingSelection(Long jobId) {
        ImportJob job = stateService.load(jobId);
        if (job.getStatus() != ImportJob.Status.AWAITING_SELECTION) {
            throw new InvalidImportStateException(
                    "Job " + jobId + " is " + job.getStatus() + " and not awaiting file selection",
                    job.getStatus().name());
        }
        return job;
    }

    private static void applyFilters(ImportJob job, Integer electionYear, String region, String electionType,
                                     Integer categoryCode, String selectedFile, String createdBy) {
        job.setElectionYear(electionYear);
        job.setRegion(region != null && !region.isBlank() ? region.trim().toUpperCase(Locale.ROOT) : null);
        job.setElectionType(electionType);
        job.setCategoryCode(categoryCode);
        job.setSelectedFile(selectedFile != null && !selectedFile.isBlank() ? selectedFile : null);
        if (createdBy != null && !createdBy.isBlank()) {
            job.setCreatedBy(createdBy);
        }
        job.setSourceKey(buildSourceKey(job.getFilename(), job.getSelectedFile(), electionYear,
                job.getRegion(), categoryCode));
    }

    private ImportJobDto toDto(ImportJob job, LocalDateTime now) {
        long failedBatches = importBatchRepository.countByJobIdAndStatus(job.getId(), ImportBatch.Status.FAILED);
        return new ImportJobDto(job, importQueueService.positionOf(job.getId()), failedBatches, now);
    }

    private static String normalize(String value) {
        return value != null ? value.trim().toLowerCase(Locale.ROOT) : "";
    }
}
