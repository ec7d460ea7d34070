package electoral.analytics.ingest.controller;

import electoral.analytics.ingest.dto.ArchiveEntryDto;
import electoral.analytics.ingest.dto.FileSelectionRequestDto;
import electoral.analytics.ingest.dto.ImportBatchDto;
import electoral.analytics.ingest.dto.ImportErrorDto;
import electoral.analytics.ingest.dto.ImportJobDto;
import electoral.analytics.ingest.dto.UrlImportRequestDto;
import electoral.analytics.ingest.dto.VerificationResultDto;
import electoral.analytics.ingest.model.ImportBatch;
import electoral.analytics.ingest.model.ImportError;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.service.ImportErrorExportService;
import electoral.analytics.ingest.service.ImportJobService;
import electoral.analytics.ingest.service.ImportQueueService;
import electoral.analytics.ingest.service.IntegrityVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operator endpoints for the bulk import pipeline.
 * Submissions return immediately; clients poll the job or the queue for progress.
 */
@RestController
@RequestMapping("/api/v1/imports")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Imports", description = "Queued bulk import of election result files")
public class ImportJobController {

    private static final Logger logger = LoggerFactory.getLogger(ImportJobController.class);

    @Autowired
    private ImportJobService importJobService;

    @Autowired
    private ImportQueueService importQueueService;

    @Autowired
    private IntegrityVerificationService integrityVerificationService;

    @Autowired
    private ImportErrorExportService importErrorExportService;

    // ========================================
    // SUBMISSION
    // ========================================

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
        summary = "Submit an uploaded file",
        description = "Upload a CSV, TXT or ZIP file and queue it for import with optional year, region and office filters"
    )
    @ApiResponse(responseCode = "202", description = "Job created and queued")
    @ApiResponse(responseCode = "400", description = "Invalid file")
    @ApiResponse(responseCode = "409", description = "Source already imported or being imported")
    public ResponseEntity<?> submitUpload(
            @Parameter(description = "Election result file", required = true,
                    content = @Content(mediaType = MediaType.MULTIPART_FORM_DATA_VALUE))
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "election_year", required = false) Integer electionYear,
            @RequestParam(value = "region", required = false) String region,
            @RequestParam(value = "election_type", required = false) String electionType,
            @RequestParam(value = "category_code", required = false) Integer categoryCode,
            @RequestParam(value = "selected_file", required = false) String selectedFile,
            @RequestParam(value = "created_by", required = false) String createdBy) {

        logger.info("Upload submitted: {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        try {
            ImportJob job = importJobService.submitUpload(file, electionYear, region, electionType,
                    categoryCode, selectedFile, createdBy);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(importJobService.toDto(job));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "submit upload", logger);
        }
    }

    @PostMapping(value = "/url", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Submit a remote source", description = "Queue a job that downloads and imports an https URL")
    @ApiResponse(responseCode = "202", description = "Job created and queued")
    @ApiResponse(responseCode = "400", description = "Invalid URL")
    @ApiResponse(responseCode = "409", description = "Source already imported or being imported")
    public ResponseEntity<?> submitUrl(@RequestBody UrlImportRequestDto request) {
        logger.info("URL submitted: {}", request.getUrl());
        try {
            ImportJob job = importJobService.submitUrl(request);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(importJobService.toDto(job));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "submit URL", logger);
        }
    }

    @GetMapping("/preview")
    @Operation(summary = "Preview archive contents",
            description = "Download an archive to scratch space and list the importable files it contains")
    @ApiResponse(responseCode = "200", description = "Importable files")
    @ApiResponse(responseCode = "502", description = "Archive could not be downloaded or read")
    public ResponseEntity<?> previewArchive(@RequestParam("url") String url) {
        try {
            List<ArchiveEntryDto> entries = importJobService.previewArchive(url);
            return ResponseEntity.ok(entries);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "preview archive", logger);
        }
    }

    // ========================================
    // QUERIES
    // ========================================

    @GetMapping
    @Operation(summary = "List import jobs", description = "Newest first, optionally filtered by status")
    public ResponseEntity<?> listJobs(@RequestParam(value = "status", required = false) String status) {
        try {
            ImportJob.Status filter = status != null ? ImportJob.Status.valueOf(status.toUpperCase(Locale.ROOT)) : null;
            return ResponseEntity.ok(importJobService.listJobs(filter));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "list import jobs", logger);
        }
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get import job", description = "Job with derived progress percent, speed, ETA and queue position")
    @ApiResponse(responseCode = "200", description = "Job found")
    @ApiResponse(responseCode = "404", description = "Job not found")
    public ResponseEntity<?> getJob(@PathVariable Long jobId) {
        try {
            return ResponseEntity.ok(importJobService.getJob(jobId));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "get import job " + jobId, logger);
        }
    }

    @GetMapping("/{jobId}/batches")
    @Operation(summary = "List batches of a job", description = "Batch units in index order")
    public ResponseEntity<?> listBatches(@PathVariable Long jobId) {
        try {
            return ResponseEntity.ok(importJobService.listBatches(jobId));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "list batches of job " + jobId, logger);
        }
    }

    @GetMapping("/{jobId}/batches/{batchId}")
    @Operation(summary = "Get one batch of a job")
    public ResponseEntity<?> getBatch(@PathVariable Long jobId, @PathVariable Long batchId) {
        try {
            return ResponseEntity.ok(importJobService.getBatch(jobId, batchId));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "get batch " + batchId + " of job " + jobId, logger);
        }
    }

    @GetMapping("/{jobId}/errors")
    @Operation(summary = "List import errors", description = "Paged error records in source row order, optionally by type")
    public ResponseEntity<?> listErrors(@PathVariable Long jobId,
                                        @RequestParam(value = "type", required = false) String type,
                                        @RequestParam(value = "page", defaultValue = "0") int page,
                                        @RequestParam(value = "size", defaultValue = "50") int size) {
        try {
            ImportError.ErrorType errorType = type != null
                    ? ImportError.ErrorType.valueOf(type.toUpperCase(Locale.ROOT)) : null;
            PageRequest pageRequest = PageRequest.of(Math.max(0, page), Math.min(Math.max(1, size), 500),
                    Sort.by("rowNumber", "id"));
            Page<ImportErrorDto> errors = importJobService.listErrors(jobId, errorType, pageRequest);

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("content", errors.getContent());
            body.put("page", errors.getNumber());
            body.put("size", errors.getSize());
            body.put("total_elements", errors.getTotalElements());
            body.put("total_pages", errors.getTotalPages());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "list errors of job " + jobId, logger);
        }
    }

    @GetMapping("/{jobId}/errors/export")
    @Operation(summary = "Export import errors as CSV")
    public ResponseEntity<?> exportErrors(@PathVariable Long jobId) {
        try {
            // resolve the job before streaming so a missing job is a 404, not a broken download
            importJobService.getJob(jobId);
            StreamingResponseBody body = outputStream -> importErrorExportService.exportErrors(jobId, outputStream);
            return ResponseEntity.ok()
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=import-" + jobId + "-errors.csv")
                    .contentType(MediaType.parseMediaType("text/csv"))
                    .body(body);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "export errors of job " + jobId, logger);
        }
    }

    @GetMapping("/queue")
    @Operation(summary = "Scheduler status", description = "Active job and waiting jobs in admission order")
    public ResponseEntity<?> queueStatus() {
        return ResponseEntity.ok(importQueueService.status());
    }

    // ========================================
    // LIFECYCLE ACTIONS
    // ========================================

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel a job", description = "Stops a queued or running job; rows already stored are kept")
    @ApiResponse(responseCode = "200", description = "Job cancelled")
    @ApiResponse(responseCode = "400", description = "Job already finished")
    public ResponseEntity<?> cancel(@PathVariable Long jobId) {
        try {
            return ResponseEntity.ok(importJobService.toDto(importJobService.cancel(jobId)));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "cancel job " + jobId, logger);
        }
    }

    @PostMapping("/{jobId}/restart")
    @Operation(summary = "Restart a job",
            description = "Re-run a failed or cancelled URL job from the download; previous rows and errors are removed")
    @ApiResponse(responseCode = "200", description = "Job re-queued")
    @ApiResponse(responseCode = "400", description = "Job is not a failed or cancelled URL job")
    public ResponseEntity<?> restart(@PathVariable Long jobId) {
        try {
            return ResponseEntity.ok(importJobService.toDto(importJobService.restart(jobId)));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "restart job " + jobId, logger);
        }
    }

    @PostMapping(value = "/{jobId}/select", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Select archive file",
            description = "Choose one file of a multi-file archive, or import all files as one job each")
    public ResponseEntity<?> selectFile(@PathVariable Long jobId, @RequestBody FileSelectionRequestDto request) {
        try {
            if (request.isImportAll()) {
                List<ImportJobDto> jobs = importJobService.selectAll(jobId).stream()
                        .map(importJobService::toDto)
                        .collect(Collectors.toList());
                return ResponseEntity.ok(jobs);
            }
            if (request.getFile() == null || request.getFile().isBlank()) {
                throw new IllegalArgumentException("Either a file or import_all must be given");
            }
            return ResponseEntity.ok(importJobService.toDto(importJobService.selectFile(jobId, request.getFile())));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "select file for job " + jobId, logger);
        }
    }

    @PostMapping("/{jobId}/batches/{batchId}/reprocess")
    @Operation(summary = "Reprocess a failed batch", description = "Re-run one failed batch of a finished job")
    public ResponseEntity<?> reprocessBatch(@PathVariable Long jobId, @PathVariable Long batchId) {
        try {
            ImportBatch batch = importJobService.reprocessBatch(jobId, batchId);
            return ResponseEntity.ok(new ImportBatchDto(batch));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "reprocess batch " + batchId + " of job " + jobId, logger);
        }
    }

    @PostMapping("/{jobId}/reprocess-failed")
    @Operation(summary = "Reprocess all failed batches", description = "Re-run every failed batch of a finished job in order")
    public ResponseEntity<?> reprocessFailed(@PathVariable Long jobId) {
        try {
            List<ImportBatchDto> batches = importJobService.reprocessFailedBatches(jobId).stream()
                    .map(ImportBatchDto::new)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(batches);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "reprocess failed batches of job " + jobId, logger);
        }
    }

    @PostMapping("/{jobId}/verify")
    @Operation(summary = "Verify integrity", description = "Reconcile stored rows with the batch accounting of a completed job")
    public ResponseEntity<?> verify(@PathVariable Long jobId) {
        try {
            VerificationResultDto result = integrityVerificationService.verify(jobId);
            return ResponseEntity.ok(result);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "verify job " + jobId, logger);
        }
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Removes the job, its batches, error records and imported rows")
    @ApiResponse(responseCode = "200", description = "Job deleted")
    @ApiResponse(responseCode = "400", description = "Job is still running")
    public ResponseEntity<?> delete(@PathVariable Long jobId) {
        try {
            ImportJob deleted = importJobService.delete(jobId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("id", deleted.getId());
            body.put("status", deleted.getStatus().name());
            body.put("deleted", true);
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "delete job " + jobId, logger);
        }
    }
}
