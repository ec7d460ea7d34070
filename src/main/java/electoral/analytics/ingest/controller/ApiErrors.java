package electoral.analytics.ingest.controller;

import electoral.analytics.ingest.dto.ErrorResponseDto;
import electoral.analytics.ingest.exception.AcquisitionException;
import electoral.analytics.ingest.exception.ImportConflictException;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import org.slf4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps import exceptions to error responses for the controllers' catch blocks.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<ErrorResponseDto> toResponse(Exception e, String action, Logger logger) {
        if (e instanceof ImportNotFoundException) {
            logger.warn("Cannot {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(new ErrorResponseDto("Not Found", e.getMessage()));
        }
        if (e instanceof ImportConflictException) {
            ImportConflictException conflict = (ImportConflictException) e;
            logger.warn("Cannot {}: {}", action, e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", conflict.getReason().name());
            if (conflict.getExistingJob() != null) {
                details.put("existing_job_id", conflict.getExistingJob().getId());
                details.put("existing_job_status", conflict.getExistingJob().getStatus().name());
            }
            String error = conflict.getReason() == ImportConflictException.Reason.ALREADY_IMPORTED
                    ? "Already Imported" : "Import In Progress";
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ErrorResponseDto(error, e.getMessage(), details));
        }
        if (e instanceof InvalidImportStateException) {
            InvalidImportStateException invalid = (InvalidImportStateException) e;
            logger.warn("Rejected {}: {}", action, e.getMessage());
            Map<String, Object> details = new LinkedHashMap<>();
            if (invalid.getCurrentStatus() != null) {
                details.put("current_status", invalid.getCurrentStatus());
            }
            return ResponseEntity.badRequest()
                    .body(new ErrorResponseDto("Invalid State", e.getMessage(), details.isEmpty() ? null : details));
        }
        if (e instanceof IllegalArgumentException) {
            logger.warn("Validation error on {}: {}", action, e.getMessage());
            return ResponseEntity.badRequest()
                    .body(new ErrorResponseDto("Validation Error", e.getMessage()));
        }
        if (e instanceof AcquisitionException) {
            logger.warn("Source could not be fetched during {}: {}", action, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponseDto("Acquisition Error", e.getMessage()));
        }
        logger.error("Failed to {}", action, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponseDto("Processing Error", "Failed to " + action + ": " + e.getMessage()));
    }
}
