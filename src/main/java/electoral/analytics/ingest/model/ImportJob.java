package electoral.analytics.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * One requested bulk ingestion of an election data file, either uploaded by an
 * operator or downloaded from a remote URL.
 * Maps to the import_jobs table.
 */
@Entity
@Table(name = "import_jobs", indexes = {
        @Index(name = "idx_import_jobs_status", columnList = "status"),
        @Index(name = "idx_import_jobs_source_key", columnList = "source_key")
})
@Getter
@Setter
public class ImportJob {

    /**
     * Lifecycle of a job. The legacy spelling "running" is read back as {@link #PROCESSING}
     * by {@link ImportJobStatusConverter}.
     */
    public enum Status {
        PENDING,
        DOWNLOADING,
        EXTRACTING,
        AWAITING_SELECTION,
        PROCESSING,
        COMPLETED,
        FAILED,
        CANCELLED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == CANCELLED;
        }

        /**
         * Statuses that occupy or wait for the active-processing slot.
         */
        public boolean isActive() {
            return this == DOWNLOADING || this == EXTRACTING || this == PROCESSING;
        }

        public boolean canTransitionTo(Status target) {
            switch (this) {
                case PENDING:
                    return target == DOWNLOADING || target == EXTRACTING || target == PROCESSING
                            || target == FAILED || target == CANCELLED;
                case DOWNLOADING:
                    return target == EXTRACTING || target == PROCESSING
                            || target == FAILED || target == CANCELLED;
                case EXTRACTING:
                    return target == AWAITING_SELECTION || target == PROCESSING
                            || target == FAILED || target == CANCELLED;
                case AWAITING_SELECTION:
                    // selection has not started row processing yet, so pending is still reachable
                    return target == PENDING || target == FAILED || target == CANCELLED;
                case PROCESSING:
                    return target == COMPLETED || target == FAILED || target == CANCELLED;
                case FAILED:
                case CANCELLED:
                    return target == PENDING;
                case COMPLETED:
                default:
                    return false;
            }
        }

        public static Set<Status> inProgress() {
            return EnumSet.of(PENDING, DOWNLOADING, EXTRACTING, AWAITING_SELECTION, PROCESSING);
        }
    }

    public enum SourceType {
        UPLOAD, URL
    }

    public enum ValidationStatus {
        NOT_RUN, PASSED, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", nullable = false, length = 10)
    private SourceType sourceType;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    @Column(name = "source_url", length = 1000)
    private String sourceUrl;

    // Duplicate-source detection key, see ImportJobService#buildSourceKey
    @Column(name = "source_key", nullable = false, length = 600)
    private String sourceKey;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "local_file_path", length = 1000)
    private String localFilePath;

    @Column(name = "archive_path", length = 1000)
    private String archivePath;

    @Column(name = "selected_file", length = 500)
    private String selectedFile;

    // Newline separated archive entries exposed while awaiting selection
    @Column(name = "available_files", columnDefinition = "TEXT")
    private String availableFiles;

    @Column(name = "parent_job_id")
    private Long parentJobId;

    // Filters applied at ingestion time
    @Column(name = "election_year")
    private Integer electionYear;

    @Column(name = "region", length = 2)
    private String region;

    @Column(name = "election_type", length = 100)
    private String electionType;

    @Column(name = "category_code")
    private Integer categoryCode;

    @Convert(converter = ImportJobStatusConverter.class)
    @Column(name = "status", nullable = false, length = 30)
    private Status status;

    // Counters
    @Column(name = "downloaded_bytes", nullable = false)
    private Long downloadedBytes;

    @Column(name = "total_rows")
    private Long totalRows;

    @Column(name = "total_file_rows")
    private Long totalFileRows;

    @Column(name = "processed_rows", nullable = false)
    private Long processedRows;

    /** Rows not stored: duplicates of stored rows plus rows outside the job filters */
    @Column(name = "skipped_rows", nullable = false)
    private Long skippedRows;

    @Column(name = "duplicate_rows", nullable = false)
    private Long duplicateRows;

    @Column(name = "error_count", nullable = false)
    private Long errorCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Integrity verification
    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status", nullable = false, length = 20)
    private ValidationStatus validationStatus;

    @Column(name = "validation_message", columnDefinition = "TEXT")
    private String validationMessage;

    @Column(name = "validated_at")
    private LocalDateTime validatedAt;

    // Timing information
    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    public ImportJob() {
        this.status = Status.PENDING;
        this.validationStatus = ValidationStatus.NOT_RUN;
        this.createdBy = "system";
        this.fileSize = 0L;
        this.downloadedBytes = 0L;
        this.processedRows = 0L;
        this.skippedRows = 0L;
        this.duplicateRows = 0L;
        this.errorCount = 0L;
    }

    public ImportJob(SourceType sourceType, String filename) {
        this();
        this.sourceType = sourceType;
        this.filename = filename;
    }

    /**
     * Moves the job to the given status, enforcing the lifecycle.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(Status target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    String.format("Import job %d cannot move from %s to %s", id, status, target));
        }
        this.status = target;
        if ((target == Status.DOWNLOADING || target == Status.EXTRACTING || target == Status.PROCESSING)
                && startedAt == null) {
            this.startedAt = LocalDateTime.now();
        }
        if (target.isTerminal()) {
            this.completedAt = LocalDateTime.now();
        }
    }

    public void markAsFailed(String errorMessage) {
        transitionTo(Status.FAILED);
        this.errorMessage = errorMessage;
    }

    /**
     * Clears counters and timestamps so the job can be run again from acquisition onward.
     */
    public void resetForRestart() {
        transitionTo(Status.PENDING);
        this.downloadedBytes = 0L;
        this.totalRows = null;
        this.totalFileRows = null;
        this.processedRows = 0L;
        this.skippedRows = 0L;
        this.duplicateRows = 0L;
        this.errorCount = 0L;
        this.errorMessage = null;
        this.availableFiles = null;
        this.validationStatus = ValidationStatus.NOT_RUN;
        this.validationMessage = null;
        this.validatedAt = null;
        this.startedAt = null;
        this.completedAt = null;
    }

    public List<String> getAvailableFileList() {
        if (availableFiles == null || availableFiles.isBlank()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(availableFiles.split("\n")));
    }

    public void setAvailableFileList(List<String> files) {
        this.availableFiles = (files == null || files.isEmpty()) ? null : String.join("\n", files);
    }

    public boolean isUrlSource() {
        return SourceType.URL.equals(this.sourceType);
    }

    public boolean isCompleted() {
        return Status.COMPLETED.equals(this.status);
    }

    public boolean isFailed() {
        return Status.FAILED.equals(this.status);
    }
}
