package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.util.ProgressMetrics;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for import job responses, including progress figures derived at read time
 */
@Data
@NoArgsConstructor
public class ImportJobDto {

    /**
     * How a completed job should be reported
     */
    public enum Outcome {
        IMPORTED,
        ALREADY_PRESENT,
        FILTERED_OUT,
        EMPTY,
        PARTIAL
    }

    @JsonProperty("id")
    private Long id;

    @JsonProperty("source_type")
    private String sourceType;

    @JsonProperty("filename")
    private String filename;

    @JsonProperty("source_url")
    private String sourceUrl;

    @JsonProperty("selected_file")
    private String selectedFile;

    @JsonProperty("available_files")
    private List<String> availableFiles;

    @JsonProperty("parent_job_id")
    private Long parentJobId;

    @JsonProperty("file_size")
    private Long fileSize;

    @JsonProperty("election_year")
    private Integer electionYear;

    @JsonProperty("region")
    private String region;

    @JsonProperty("election_type")
    private String electionType;

    @JsonProperty("category_code")
    private Integer categoryCode;

    @JsonProperty("status")
    private String status;

    @JsonProperty("downloaded_bytes")
    private Long downloadedBytes;

    @JsonProperty("total_rows")
    private Long totalRows;

    @JsonProperty("total_file_rows")
    private Long totalFileRows;

    @JsonProperty("processed_rows")
    private Long processedRows;

    @JsonProperty("skipped_rows")
    private Long skippedRows;

    @JsonProperty("duplicate_rows")
    private Long duplicateRows;

    @JsonProperty("error_count")
    private Long errorCount;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("validation_status")
    private String validationStatus;

    @JsonProperty("validation_message")
    private String validationMessage;

    @JsonProperty("validated_at")
    private LocalDateTime validatedAt;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonProperty("created_by")
    private String createdBy;

    // Derived, never stored
    @JsonProperty("progress_percent")
    private Double progressPercent;

    @JsonProperty("indeterminate_progress")
    private boolean indeterminateProgress;

    @JsonProperty("rows_per_second")
    private Double rowsPerSecond;

    @JsonProperty("eta_seconds")
    private Long etaSeconds;

    @JsonProperty("queue_position")
    private Integer queuePosition;

    @JsonProperty("failed_batches")
    private Long failedBatches;

    @JsonProperty("outcome")
    private Outcome outcome;

    @JsonProperty("already_imported")
    private boolean alreadyImported;

    public ImportJobDto(ImportJob job, Integer queuePosition, long failedBatches, LocalDateTime now) {
        this.id = job.getId();
        this.sourceType = job.getSourceType() != null ? job.getSourceType().name() : null;
        this.filename = job.getFilename();
        this.sourceUrl = job.getSourceUrl();
        this.selectedFile = job.getSelectedFile();
        this.availableFiles = job.getAvailableFileList();
        this.parentJobId = job.getParentJobId();
        this.fileSize = job.getFileSize();
        this.electionYear = job.getElectionYear();
        this.region = job.getRegion();
        this.electionType = job.getElectionType();
        this.categoryCode = job.getCategoryCode();
        this.status = job.getStatus().name();
        this.downloadedBytes = job.getDownloadedBytes();
        this.totalRows = job.getTotalRows();
        this.totalFileRows = job.getTotalFileRows();
        this.processedRows = job.getProcessedRows();
        this.skippedRows = job.getSkippedRows();
        this.duplicateRows = job.getDuplicateRows();
        this.errorCount = job.getErrorCount();
        this.errorMessage = job.getErrorMessage();
        this.validationStatus = job.getValidationStatus().name();
        this.validationMessage = job.getValidationMessage();
        this.validatedAt = job.getValidatedAt();
        this.startedAt = job.getStartedAt();
        this.completedAt = job.getCompletedAt();
        this.createdAt = job.getCreatedAt();
        this.createdBy = job.getCreatedBy();

        this.progressPercent = ProgressMetrics.percentComplete(job);
        this.indeterminateProgress = this.progressPercent == null && !job.getStatus().isTerminal();
        this.rowsPerSecond = Math.round(ProgressMetrics.rowsPerSecond(job, now) * 10.0) / 10.0;
        this.etaSeconds = ProgressMetrics.etaSeconds(job, now);
        this.queuePosition = queuePosition;
        this.failedBatches = failedBatches;
        this.outcome = job.isCompleted() ? outcomeOf(job, failedBatches) : null;
        this.alreadyImported = this.outcome == Outcome.ALREADY_PRESENT;
    }

    public static Outcome outcomeOf(ImportJob job, long failedBatches) {
        if (failedBatches > 0) {
            return Outcome.PARTIAL;
        }
        if (job.getTotalRows() == null || job.getTotalRows() == 0) {
            return Outcome.EMPTY;
        }
        if (job.getProcessedRows() == 0 && job.getDuplicateRows() > 0) {
            return Outcome.ALREADY_PRESENT;
        }
        if (job.getProcessedRows() == 0 && job.getSkippedRows() > 0) {
            return Outcome.FILTERED_OUT;
        }
        return Outcome.IMPORTED;
    }
}
