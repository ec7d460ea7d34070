package electoral.analytics.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A source row that failed parsing or validation. Written once by the batch
 * processor and kept for operator review until its job is deleted.
 */
@Entity
@Table(name = "import_errors", indexes = {
        @Index(name = "idx_import_errors_job", columnList = "job_id"),
        @Index(name = "idx_import_errors_job_row", columnList = "job_id, row_number"),
        @Index(name = "idx_import_errors_type", columnList = "error_type")
})
@Getter
@Setter
@NoArgsConstructor
public class ImportError {

    public enum ErrorType {
        PARSE_ERROR,
        INVALID_FORMAT,
        MISSING_FIELD,
        DUPLICATE_ENTRY,
        INVALID_NUMBER,
        ENCODING_ERROR,
        OTHER
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "job_id", nullable = false)
    private Long jobId;

    // 1-based data row number, null when the failure is not line-addressable
    @Column(name = "row_number")
    private Long rowNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_type", nullable = false, length = 30)
    private ErrorType errorType;

    @Column(name = "error_message", nullable = false, columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "raw_data", columnDefinition = "TEXT")
    private String rawData;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public ImportError(Long jobId, Long rowNumber, ErrorType errorType, String errorMessage, String rawData) {
        this.jobId = jobId;
        this.rowNumber = rowNumber;
        this.errorType = errorType;
        this.errorMessage = errorMessage;
        this.rawData = rawData;
    }
}
