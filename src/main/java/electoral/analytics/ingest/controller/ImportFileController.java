package electoral.analytics.ingest.controller;

import electoral.analytics.ingest.service.FileCustodianService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Temporary file groups left by imports: downloads, extracted files and spooled uploads.
 */
@RestController
@RequestMapping("/api/v1/imports/files")
@CrossOrigin(origins = "*", maxAge = 3600)
@Tag(name = "Import Files", description = "Inspect and reclaim temporary import storage")
public class ImportFileController {

    private static final Logger logger = LoggerFactory.getLogger(ImportFileController.class);

    @Autowired
    private FileCustodianService fileCustodianService;

    @GetMapping
    @Operation(summary = "List temporary file groups",
            description = "One group per job directory plus the shared uploads bucket (job_id 0)")
    public ResponseEntity<?> listGroups() {
        try {
            return ResponseEntity.ok(fileCustodianService.listGroups());
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "list temporary files", logger);
        }
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a temporary file group",
            description = "Deletes the files of a job, or of the uploads bucket with job id 0. Imported rows are not touched.")
    @ApiResponse(responseCode = "200", description = "Files deleted")
    @ApiResponse(responseCode = "400", description = "Files still needed by an unfinished job")
    @ApiResponse(responseCode = "404", description = "No such file group")
    public ResponseEntity<?> deleteGroup(@PathVariable Long jobId) {
        try {
            return ResponseEntity.ok(fileCustodianService.deleteGroup(jobId));
        } catch (Exception e) {
            return ApiErrors.toResponse(e, "delete temporary files of " + jobId, logger);
        }
    }
}
