package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Temporary artifacts of one job, or of the shared uploads bucket (job id 0)
 */
@Data
@NoArgsConstructor
public class TempFileGroupDto {

    public static final long UPLOADS_BUCKET_ID = 0L;

    @JsonProperty("job_id")
    private Long jobId;

    @JsonProperty("directory")
    private String directory;

    @JsonProperty("files")
    private List<FileEntry> files = new ArrayList<>();

    @JsonProperty("total_size")
    private long totalSize;

    @JsonProperty("job_status")
    private String jobStatus;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileEntry {

        @JsonProperty("name")
        private String name;

        @JsonProperty("size")
        private long size;

        @JsonProperty("modified_at")
        private LocalDateTime modifiedAt;
    }

    public TempFileGroupDto(Long jobId, String directory) {
        this.jobId = jobId;
        this.directory = directory;
    }

    public void addFile(FileEntry entry) {
        files.add(entry);
        totalSize += entry.getSize();
    }

    @JsonProperty("is_uploads_bucket")
    public boolean isUploadsBucket() {
        return Long.valueOf(UPLOADS_BUCKET_ID).equals(jobId);
    }
}
