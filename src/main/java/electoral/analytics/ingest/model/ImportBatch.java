package electoral.analytics.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A contiguous, half-open range of source data rows [rowStart, rowEnd) of one job,
 * processed and accounted for as one unit.
 */
@Entity
@Table(name = "import_batches", indexes = {
        @Index(name = "idx_import_batches_job", columnList = "job_id"),
        @Index(name = "idx_import_batches_status", columnList = "status")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uq_import_batches_job_index", columnNames = {"job_id", "batch_index"})
})
@Getter
@Setter
public class ImportBatch {

    public enum Status {
        PENDING, PROCESSING, COMPLETED, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    @Column(name = "batch_index", nullable = false)
    private Integer batchIndex;

    @Column(name = "row_start", nullable = false)
    private Long rowStart;

    @Column(name = "row_end", nullable = false)
    private Long rowEnd;

    @Column(name = "total_rows", nullable = false)
    private Long totalRows;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Column(name = "processed_rows", nullable = false)
    private Long processedRows;

    @Column(name = "inserted_rows", nullable = false)
    private Long insertedRows;

    @Column(name = "skipped_rows", nullable = false)
    private Long skippedRows;

    // Part of skippedRows: rows whose natural key was already stored
    @Column(name = "duplicate_rows", nullable = false)
    private Long duplicateRows;

    @Column(name = "error_count", nullable = false)
    private Long errorCount;

    @Column(name = "error_summary", columnDefinition = "TEXT")
    private String errorSummary;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ImportBatch() {
        this.status = Status.PENDING;
        resetCounters();
    }

    public ImportBatch(Long jobId, int batchIndex, long rowStart, long rowEnd) {
        this();
        this.jobId = jobId;
        this.batchIndex = batchIndex;
        this.rowStart = rowStart;
        this.rowEnd = rowEnd;
        this.totalRows = rowEnd - rowStart;
    }

    public void resetCounters() {
        this.processedRows = 0L;
        this.insertedRows = 0L;
        this.skippedRows = 0L;
        this.duplicateRows = 0L;
        this.errorCount = 0L;
        this.errorSummary = null;
        this.completedAt = null;
    }

    public void markAsProcessing() {
        resetCounters();
        this.status = Status.PROCESSING;
        this.startedAt = LocalDateTime.now();
    }

    public void markAsCompleted() {
        this.status = Status.COMPLETED;
        this.completedAt = LocalDateTime.now();
    }

    public void markAsFailed(String errorSummary) {
        this.status = Status.FAILED;
        this.errorSummary = errorSummary;
        this.completedAt = LocalDateTime.now();
    }

    /**
     * 1-based source row number of the first row in this range.
     */
    public long firstRowNumber() {
        return rowStart + 1;
    }

    /**
     * 1-based source row number of the last row in this range.
     */
    public long lastRowNumber() {
        return rowEnd;
    }

    public boolean isFailed() {
        return Status.FAILED.equals(this.status);
    }
}
