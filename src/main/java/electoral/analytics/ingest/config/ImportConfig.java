package electoral.analytics.ingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the bulk import pipeline
 *
 * Maps directly to properties in application.properties:
 * - ingest.batch-size
 * - ingest.max-active-jobs
 * - ingest.scheduler.*
 * - ingest.csv.*
 * - ingest.storage.*
 * - ingest.download.*
 * - ingest.archive.*
 * - ingest.errors.*
 */
@Configuration
@ConfigurationProperties(prefix = "ingest")
@Data
public class ImportConfig {

    /** Source rows per batch unit (ingest.batch-size) */
    private int batchSize = 2000;

    /** Jobs allowed in download/extract/processing at the same time (ingest.max-active-jobs) */
    private int maxActiveJobs = 1;

    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Scheduler {
        /** Safety-net admission tick in milliseconds */
        private long tickIntervalMs = 5000;
    }

    // ========================================
    // SOURCE FILE FORMAT (ingest.csv.*)
    // ========================================

    private Csv csv = new Csv();

    @Data
    public static class Csv {
        /** Government result files are semicolon delimited */
        private char delimiter = ';';

        /** Government result files are published in Latin-1 */
        private String charset = "ISO-8859-1";

        private boolean hasHeader = true;
    }

    // ========================================
    // TEMPORARY STORAGE (ingest.storage.*)
    // ========================================

    private Storage storage = new Storage();

    @Data
    public static class Storage {
        private String baseDir = System.getProperty("java.io.tmpdir") + "/electoral-ingest";

        /** Directory prefix for per-job artifacts: import-{jobId} */
        private String jobDirPrefix = "import-";

        /** Shared bucket for spooled uploads */
        private String uploadsBucket = "uploads";
    }

    // ========================================
    // DOWNLOAD (ingest.download.*)
    // ========================================

    private Download download = new Download();

    @Data
    public static class Download {
        private int connectTimeoutSeconds = 30;

        /** Large archives take a while, be generous */
        private int requestTimeoutMinutes = 30;

        /** Minimum interval between persisted downloaded-bytes updates */
        private long progressIntervalMs = 2000;

        private int bufferSize = 65536;

        /** Hosts accepted for URL submissions; empty allows any host */
        private List<String> allowedHosts = new ArrayList<>();
    }

    // ========================================
    // ARCHIVES (ingest.archive.*)
    // ========================================

    private Archive archive = new Archive();

    @Data
    public static class Archive {
        /** Pick the country-wide consolidated file automatically when an archive holds one file per region */
        private boolean preferConsolidatedFile = true;

        private String consolidatedMarker = "_BRASIL";
    }

    // ========================================
    // ERROR RECORDS (ingest.errors.*)
    // ========================================

    private Errors errors = new Errors();

    @Data
    public static class Errors {
        /** Raw offending text is truncated to this many characters */
        private int rawDataMaxLength = 1000;
    }

    // ========================================
    // HELPER METHODS
    // ========================================

    public Path getBaseDirPath() {
        return Paths.get(storage.getBaseDir());
    }

    public Path getJobDir(Long jobId) {
        return getBaseDirPath().resolve(storage.getJobDirPrefix() + jobId);
    }

    public Path getUploadsDir() {
        return getBaseDirPath().resolve(storage.getUploadsBucket());
    }

    public Charset getSourceCharset() {
        return Charset.forName(csv.getCharset());
    }
}
