package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for submitting a remote source
 */
@Data
@NoArgsConstructor
public class UrlImportRequestDto {

    @JsonProperty("url")
    private String url;

    @JsonProperty("election_year")
    private Integer electionYear;

    @JsonProperty("region")
    private String region;

    @JsonProperty("election_type")
    private String electionType;

    @JsonProperty("category_code")
    private Integer categoryCode;

    /**
     * Archive entry to import; optional, see archive file selection
     */
    @JsonProperty("selected_file")
    private String selectedFile;

    @JsonProperty("created_by")
    private String createdBy;
}
