package electoral.analytics.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time snapshot of the import scheduler
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusDto {

    @JsonProperty("is_processing")
    private boolean processing;

    /**
     * Id of the first active job, null when idle
     */
    @JsonProperty("current_job")
    private Long currentJob;

    @JsonProperty("queue_length")
    private int queueLength;

    @JsonProperty("queue")
    private List<Entry> queue = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {

        /**
         * 0 for active jobs, 1.. for waiting jobs in admission order
         */
        @JsonProperty("position")
        private int position;

        @JsonProperty("job_id")
        private Long jobId;

        @JsonProperty("is_processing")
        private boolean processing;
    }
}
