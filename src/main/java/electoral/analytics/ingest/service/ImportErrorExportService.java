package electoral.analytics.ingest.service;

import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import electoral.analytics.ingest.model.ImportError;
import electoral.analytics.ingest.repository.ImportErrorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Streams the import error records of a job as CSV for offline review.
 */
@Service
public class ImportErrorExportService {

    private static final Logger logger = LoggerFactory.getLogger(ImportErrorExportService.class);

    private static final String[] EXPORT_HEADERS = {"row_number", "error_type", "error_message", "raw_data", "created_at"};
    private static final int PAGE_SIZE = 1000;

    @Autowired
    private ImportErrorRepository importErrorRepository;

    @Autowired
    private ImportJobStateService stateService;

    public void exportErrors(Long jobId, OutputStream outputStream) {
        // fail with 404 semantics before any byte is written
        stateService.load(jobId);

        CsvWriterSettings settings = new CsvWriterSettings();
        settings.setNullValue("");

        long written = 0;
        try (OutputStreamWriter writer = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8)) {
            // CsvWriter is not AutoCloseable; closing it flushes and closes the writer
            CsvWriter csvWriter = new CsvWriter(writer, settings);
            csvWriter.writeHeaders(EXPORT_HEADERS);

            PageRequest pageRequest = PageRequest.of(0, PAGE_SIZE, Sort.by("rowNumber", "id"));
            Page<ImportError> page;
            do {
                page = importErrorRepository.findByJobId(jobId, pageRequest);
                for (ImportError error : page.getContent()) {
                    csvWriter.writeRow(error.getRowNumber(), error.getErrorType().name(), error.getErrorMessage(),
                            error.getRawData(), error.getCreatedAt());
                    written++;
                }
                pageRequest = pageRequest.next();
            } while (page.hasNext());

            csvWriter.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to export errors of import job " + jobId, e);
        }

        logger.info("Exported {} error records of import job {}", written, jobId);
    }
}
