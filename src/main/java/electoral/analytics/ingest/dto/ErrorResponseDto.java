package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Simple DTO for error responses.
 * Used for validation errors, rejected operator actions and conflicts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponseDto {

    @JsonProperty("error")
    private String error;

    @JsonProperty("message")
    private String message;

    @JsonProperty("timestamp")
    private LocalDateTime timestamp;

    /**
     * Extra context for the caller, e.g. the current job status or the conflicting job id
     */
    @JsonProperty("details")
    private Map<String, Object> details;

    /**
     * Create error response with current timestamp
     */
    public ErrorResponseDto(String error, String message) {
        this.error = error;
        this.message = message;
        this.timestamp = LocalDateTime.now();
    }

    public ErrorResponseDto(String error, String message, Map<String, Object> details) {
        this(error, message);
        this.details = details;
    }
}
