package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator choice for a job awaiting archive file selection
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileSelectionRequestDto {

    @JsonProperty("file")
    private String file;

    /**
     * Import every candidate file, one job per file
     */
    @JsonProperty("import_all")
    private boolean importAll;
}
