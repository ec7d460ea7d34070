package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import electoral.analytics.ingest.model.ImportBatch;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DTO for one batch unit of an import job
 */
@Data
@NoArgsConstructor
public class ImportBatchDto {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("job_id")
    private Long jobId;

    @JsonProperty("batch_index")
    private Integer batchIndex;

    @JsonProperty("row_start")
    private Long rowStart;

    @JsonProperty("row_end")
    private Long rowEnd;

    @JsonProperty("total_rows")
    private Long totalRows;

    @JsonProperty("status")
    private String status;

    @JsonProperty("processed_rows")
    private Long processedRows;

    @JsonProperty("inserted_rows")
    private Long insertedRows;

    @JsonProperty("skipped_rows")
    private Long skippedRows;

    @JsonProperty("duplicate_rows")
    private Long duplicateRows;

    @JsonProperty("error_count")
    private Long errorCount;

    @JsonProperty("error_summary")
    private String errorSummary;

    @JsonProperty("started_at")
    private LocalDateTime startedAt;

    @JsonProperty("completed_at")
    private LocalDateTime completedAt;

    public ImportBatchDto(ImportBatch batch) {
        this.id = batch.getId();
        this.jobId = batch.getJobId();
        this.batchIndex = batch.getBatchIndex();
        this.rowStart = batch.getRowStart();
        this.rowEnd = batch.getRowEnd();
        this.totalRows = batch.getTotalRows();
        this.status = batch.getStatus().name();
        this.processedRows = batch.getProcessedRows();
        this.insertedRows = batch.getInsertedRows();
        this.skippedRows = batch.getSkippedRows();
        this.duplicateRows = batch.getDuplicateRows();
        this.errorCount = batch.getErrorCount();
        this.errorSummary = batch.getErrorSummary();
        this.startedAt = batch.getStartedAt();
        this.completedAt = batch.getCompletedAt();
    }
}
