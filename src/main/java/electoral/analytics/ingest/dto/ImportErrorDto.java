package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import electoral.analytics.ingest.model.ImportError;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
public class ImportErrorDto {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("job_id")
    private Long jobId;

    @JsonProperty("row_number")
    private Long rowNumber;

    @JsonProperty("error_type")
    private String errorType;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("raw_data")
    private String rawData;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public ImportErrorDto(ImportError error) {
        this.id = error.getId();
        this.jobId = error.getJobId();
        this.rowNumber = error.getRowNumber();
        this.errorType = error.getErrorType().name();
        this.errorMessage = error.getErrorMessage();
        this.rawData = error.getRawData();
        this.createdAt = error.getCreatedAt();
    }
}
