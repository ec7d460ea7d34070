package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.model.ImportBatch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Divides a job's data rows into contiguous, non-overlapping batch ranges covering [0, totalRows).
 */
@Component
public class BatchPlanner {

    @Autowired
    private ImportConfig importConfig;

    public List<ImportBatch> plan(Long jobId, long totalRows) {
        return plan(jobId, totalRows, importConfig.getBatchSize());
    }

    public static List<ImportBatch> plan(Long jobId, long totalRows, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<ImportBatch> batches = new ArrayList<>();
        int index = 0;
        for (long start = 0; start < totalRows; start += batchSize) {
            long end = Math.min(start + batchSize, totalRows);
            batches.add(new ImportBatch(jobId, index++, start, end));
        }
        return batches;
    }
}
