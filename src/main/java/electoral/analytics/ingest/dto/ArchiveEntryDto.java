package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One importable file inside an archive
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveEntryDto {

    @JsonProperty("name")
    private String name;

    @JsonProperty("size")
    private long size;

    @JsonProperty("is_consolidated")
    private boolean consolidated;
}
