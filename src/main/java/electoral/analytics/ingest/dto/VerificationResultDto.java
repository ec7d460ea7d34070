package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of an on-demand integrity verification of a completed job
 */
@Data
@NoArgsConstructor
public class VerificationResultDto {

    @JsonProperty("job_id")
    private Long jobId;

    @JsonProperty("is_valid")
    private boolean valid;

    @JsonProperty("validation_message")
    private String validationMessage;

    @JsonProperty("stored_row_count")
    private long storedRowCount;

    @JsonProperty("expected_row_count")
    private long expectedRowCount;

    @JsonProperty("total_rows")
    private Long totalRows;

    @JsonProperty("skipped_rows")
    private Long skippedRows;

    @JsonProperty("error_count")
    private Long errorCount;

    @JsonProperty("validated_at")
    private LocalDateTime validatedAt;

    @JsonProperty("discrepancies")
    private List<String> discrepancies = new ArrayList<>();
}
