package electoral.analytics.ingest.service;

import com.sun.net.httpserver.HttpServer;
import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.ImportJobDto;
import electoral.analytics.ingest.dto.VerificationResultDto;
import electoral.analytics.ingest.exception.ImportConflictException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ElectionResultRow;
import electoral.analytics.ingest.model.ImportBatch;
import electoral.analytics.ingest.model.ImportError;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ElectionResultRowRepository;
import electoral.analytics.ingest.repository.ImportBatchRepository;
import electoral.analytics.ingest.repository.ImportErrorRepository;
import electoral.analytics.ingest.repository.ImportJobRepository;
import electoral.analytics.ingest.util.TestDataFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.verify;

/**
 * Runs import jobs end to end on the test thread against an in-memory database.
 * No surrounding test transaction: every repository call commits, as it does in production.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ImportConfig.class, ImportJobRunner.class, ImportJobStateService.class, AcquisitionService.class,
        SourceDownloader.class, ArchiveExtractor.class, FileCustodianService.class, BatchProcessingService.class,
        BatchPlanner.class, ElectionRowStore.class, CancellationRegistry.class, IntegrityVerificationService.class,
        ImportJobService.class, ImportErrorExportService.class, StartupRecoveryService.class})
class ImportPipelineTest {

    private static final String HEADER = TestDataFactory.modernHeader();

    @TempDir
    Path storageDir;

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private ImportJobRunner runner;

    @Autowired
    private ImportJobService importJobService;

    @Autowired
    private IntegrityVerificationService verificationService;

    @Autowired
    private ImportErrorExportService exportService;

    @Autowired
    private StartupRecoveryService startupRecoveryService;

    @Autowired
    private ImportJobRepository jobRepository;

    @Autowired
    private ImportBatchRepository batchRepository;

    @Autowired
    private ImportErrorRepository errorRepository;

    @Autowired
    private ElectionResultRowRepository rowRepository;

    @MockBean
    private ImportQueueService importQueueService;

    @SpyBean
    private ElectionRowStore rowStore;

    @SpyBean
    private ImportJobStateService stateService;

    private HttpServer server;

    @BeforeEach
    void setUp() {
        rowRepository.deleteAllInBatch();
        errorRepository.deleteAllInBatch();
        batchRepository.deleteAllInBatch();
        jobRepository.deleteAllInBatch();

        importConfig.setBatchSize(2500);
        importConfig.getStorage().setBaseDir(storageDir.toString());
        importConfig.getDownload().setAllowedHosts(new ArrayList<>());
        importConfig.getArchive().setPreferConsolidatedFile(true);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private ImportJob upload(String filename, List<String> rows) throws IOException {
        MockMultipartFile file = TestDataFactory.sourceUpload(filename, HEADER, rows);
        return importJobService.submitUpload(file, null, null, null, null, null, "tester");
    }

    private ImportJob runUpload(String filename, List<String> rows) throws IOException {
        ImportJob job = upload(filename, rows);
        runner.run(job.getId());
        return reload(job.getId());
    }

    private ImportJob reload(Long jobId) {
        return jobRepository.findById(jobId).orElseThrow();
    }

    private ImportJob urlJob(String url) {
        ImportJob job = new ImportJob(ImportJob.SourceType.URL, url.substring(url.lastIndexOf('/') + 1));
        job.setSourceUrl(url);
        job.setSourceKey(ImportJobService.buildSourceKey(job.getFilename(), null, null, null, null));
        return jobRepository.save(job);
    }

    private String serve(String path, byte[] body, AtomicInteger hits, AtomicBoolean broken) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext(path, exchange -> {
            hits.incrementAndGet();
            if (broken.get()) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
                return;
            }
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort() + path;
    }

    // ========================================
    // UPLOADS
    // ========================================

    @Test
    void testCleanImportStoresEveryRowInFourBatches() throws IOException {
        // Given: 10,000 valid rows and batches of 2,500
        ImportJob job = runUpload("votacao_candidato_munzona_2022_SP.csv", TestDataFactory.modernRows(10_000));

        // Then
        assertThat(job.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(job.getTotalRows()).isEqualTo(10_000L);
        assertThat(job.getTotalFileRows()).isEqualTo(10_001L);
        assertThat(job.getProcessedRows()).isEqualTo(10_000L);
        assertThat(job.getSkippedRows()).isZero();
        assertThat(job.getErrorCount()).isZero();
        assertThat(job.getStartedAt()).isNotNull();
        assertThat(job.getCompletedAt()).isNotNull();

        List<ImportBatch> batches = batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId());
        assertThat(batches).hasSize(4);
        assertThat(batches).allSatisfy(batch -> {
            assertThat(batch.getStatus()).isEqualTo(ImportBatch.Status.COMPLETED);
            assertThat(batch.getInsertedRows()).isEqualTo(2500L);
        });
        assertThat(rowRepository.countByImportJobId(job.getId())).isEqualTo(10_000L);

        ImportJobDto dto = importJobService.getJob(job.getId());
        assertThat(dto.getOutcome()).isEqualTo(ImportJobDto.Outcome.IMPORTED);
        assertThat(dto.getProgressPercent()).isEqualTo(100.0);

        VerificationResultDto verification = verificationService.verify(job.getId());
        assertThat(verification.isValid()).isTrue();
        assertThat(reload(job.getId()).getValidationStatus()).isEqualTo(ImportJob.ValidationStatus.PASSED);
    }

    @Test
    void testMalformedRowsBecomeErrorRecordsAndTheRestIsStored() throws IOException {
        // Given: rows 5001-5010 are too short for the layout
        ImportJob job = runUpload("votacao_candidato_munzona_2022_SP.csv",
                TestDataFactory.modernRows(10_000, 5001, 5010));

        // Then
        assertThat(job.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(job.getProcessedRows()).isEqualTo(9_990L);
        assertThat(job.getErrorCount()).isEqualTo(10L);
        assertThat(job.getSkippedRows()).isZero();

        List<ImportError> errors = errorRepository.findByJobIdOrderByRowNumberAsc(job.getId());
        assertThat(errors).hasSize(10);
        assertThat(errors).extracting(ImportError::getRowNumber)
                .containsExactly(5001L, 5002L, 5003L, 5004L, 5005L, 5006L, 5007L, 5008L, 5009L, 5010L);
        assertThat(errors).allSatisfy(error -> {
            assertThat(error.getErrorType()).isEqualTo(ImportError.ErrorType.INVALID_FORMAT);
            assertThat(error.getRawData()).contains("broken row");
        });

        ImportBatch third = batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId()).get(2);
        assertThat(third.getStatus()).isEqualTo(ImportBatch.Status.COMPLETED);
        assertThat(third.getErrorCount()).isEqualTo(10L);
        assertThat(third.getInsertedRows()).isEqualTo(2490L);

        assertThat(verificationService.verify(job.getId()).isValid()).isTrue();

        // errors export as CSV in row order
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exportService.exportErrors(job.getId(), out);
        String[] lines = out.toString(StandardCharsets.UTF_8).split("\\r?\\n");
        assertThat(lines).hasSize(11);
        assertThat(lines[0]).isEqualTo("row_number,error_type,error_message,raw_data,created_at");
        assertThat(lines[1]).startsWith("5001,INVALID_FORMAT,");
        assertThat(lines[10]).startsWith("5010,INVALID_FORMAT,");
    }

    @Test
    void testReimportingTheSameRowsSkipsThemAll() throws IOException {
        importConfig.setBatchSize(250);
        List<String> rows = TestDataFactory.modernRows(1000);
        ImportJob first = runUpload("votacao_2022_SP.csv", rows);
        assertThat(first.getProcessedRows()).isEqualTo(1000L);

        // When: the same data arrives under another file name
        ImportJob second = runUpload("votacao_2022_SP_copia.csv", rows);

        // Then: nothing new is stored
        assertThat(second.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(second.getProcessedRows()).isZero();
        assertThat(second.getSkippedRows()).isEqualTo(1000L);
        assertThat(second.getDuplicateRows()).isEqualTo(1000L);
        assertThat(rowRepository.count()).isEqualTo(1000L);
        assertThat(importJobService.getJob(second.getId()).getOutcome()).isEqualTo(ImportJobDto.Outcome.ALREADY_PRESENT);
        assertThat(importJobService.getJob(second.getId()).isAlreadyImported()).isTrue();
    }

    @Test
    void testSameSourceCannotBeSubmittedTwice() throws IOException {
        importConfig.setBatchSize(250);
        List<String> rows = TestDataFactory.modernRows(10);
        ImportJob first = runUpload("votacao_2022_SP.csv", rows);

        assertThatThrownBy(() -> upload("votacao_2022_SP.csv", rows))
                .isInstanceOf(ImportConflictException.class)
                .satisfies(e -> {
                    ImportConflictException conflict = (ImportConflictException) e;
                    assertThat(conflict.getReason()).isEqualTo(ImportConflictException.Reason.ALREADY_IMPORTED);
                    assertThat(conflict.getExistingJob().getId()).isEqualTo(first.getId());
                });
        assertThat(jobRepository.count()).isEqualTo(1L);
    }

    @Test
    void testFiltersSkipRowsOutsideTheSelection() throws IOException {
        List<String> rows = new ArrayList<>();
        for (int i = 1; i <= 30; i++) {
            rows.add(TestDataFactory.modernRow(2022, i <= 10 ? "RJ" : "SP", 6, i));
        }
        MockMultipartFile file = TestDataFactory.sourceUpload("votacao_2022_BRASIL.csv", HEADER, rows);
        ImportJob job = importJobService.submitUpload(file, 2022, "sp", null, null, null, null);

        runner.run(job.getId());

        ImportJob done = reload(job.getId());
        assertThat(done.getProcessedRows()).isEqualTo(20L);
        assertThat(done.getSkippedRows()).isEqualTo(10L);
        assertThat(done.getDuplicateRows()).isZero();
        assertThat(done.getRegion()).isEqualTo("SP");
        assertThat(importJobService.getJob(job.getId()).getOutcome()).isEqualTo(ImportJobDto.Outcome.IMPORTED);
    }

    @Test
    void testFilterMatchingNoRowIsNotReportedAsAlreadyImported() throws IOException {
        // Given: a Rio de Janeiro file imported with a Sao Paulo filter
        List<String> rows = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            rows.add(TestDataFactory.modernRow(2022, "RJ", 6, i));
        }
        MockMultipartFile file = TestDataFactory.sourceUpload("votacao_2022_RJ.csv", HEADER, rows);
        ImportJob job = importJobService.submitUpload(file, null, "sp", null, null, null, null);

        runner.run(job.getId());

        // Then: nothing stored, and nothing was a duplicate either
        ImportJob done = reload(job.getId());
        assertThat(done.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(done.getProcessedRows()).isZero();
        assertThat(done.getSkippedRows()).isEqualTo(10L);
        assertThat(done.getDuplicateRows()).isZero();
        ImportJobDto dto = importJobService.getJob(job.getId());
        assertThat(dto.getOutcome()).isEqualTo(ImportJobDto.Outcome.FILTERED_OUT);
        assertThat(dto.isAlreadyImported()).isFalse();
    }

    @Test
    void testFileBetweenTheKnownLayoutsFailsTheJob() throws IOException {
        // Given: 45 columns, more than the legacy layout and fewer than the modern one
        String header = firstFields(HEADER, 45);
        List<String> rows = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            rows.add(firstFields(TestDataFactory.modernRow(i), 45));
        }
        MockMultipartFile file = TestDataFactory.sourceUpload("votacao_2022_SP.csv", header, rows);
        ImportJob job = importJobService.submitUpload(file, null, null, null, null, null, null);

        runner.run(job.getId());

        // Then: no row is parsed against the wrong column positions
        ImportJob failed = reload(job.getId());
        assertThat(failed.getStatus()).isEqualTo(ImportJob.Status.FAILED);
        assertThat(failed.getErrorMessage()).contains("Unrecognized column layout: 45 columns");
        assertThat(batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId())).isEmpty();
        assertThat(rowRepository.countByImportJobId(job.getId())).isZero();
        assertThat(errorRepository.countByJobId(job.getId())).isZero();
    }

    private static String firstFields(String line, int count) {
        String[] fields = line.split(";", -1);
        return String.join(";", Arrays.copyOf(fields, count));
    }

    @Test
    void testHeaderOnlyFileCompletesEmpty() throws IOException {
        ImportJob job = runUpload("votacao_vazia.csv", List.of());

        assertThat(job.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(job.getTotalRows()).isZero();
        assertThat(batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId())).isEmpty();
        assertThat(importJobService.getJob(job.getId()).getOutcome()).isEqualTo(ImportJobDto.Outcome.EMPTY);
    }

    // ========================================
    // BATCH FAILURE AND REPROCESSING
    // ========================================

    @Test
    void testFailedBatchCanBeReprocessedWithoutDuplicates() throws IOException {
        // Given: the row store fails once at row 300, inside batch 1 (rows 251-500)
        importConfig.setBatchSize(250);
        AtomicBoolean storeDown = new AtomicBoolean(true);
        doAnswer(invocation -> {
            ElectionResultRow row = invocation.getArgument(0);
            if (row.getSourceRowNumber() == 300L && storeDown.getAndSet(false)) {
                throw new DataAccessResourceFailureException("row store unavailable");
            }
            return invocation.callRealMethod();
        }).when(rowStore).insertIfAbsent(any());

        ImportJob job = runUpload("votacao_2022_SP.csv", TestDataFactory.modernRows(1000));

        // Then: only that batch failed; the job still completed
        assertThat(job.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        List<ImportBatch> batches = batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId());
        assertThat(batches).extracting(ImportBatch::getStatus).containsExactly(
                ImportBatch.Status.COMPLETED, ImportBatch.Status.FAILED,
                ImportBatch.Status.COMPLETED, ImportBatch.Status.COMPLETED);
        ImportBatch failed = batches.get(1);
        assertThat(failed.getErrorSummary()).contains("row store unavailable");
        assertThat(failed.getInsertedRows()).isEqualTo(49L);
        assertThat(job.getProcessedRows()).isEqualTo(799L);
        assertThat(importJobService.getJob(job.getId()).getOutcome()).isEqualTo(ImportJobDto.Outcome.PARTIAL);
        assertThat(verificationService.verify(job.getId()).isValid()).isFalse();

        // When: the failed batch is reprocessed
        ImportBatch reprocessed = importJobService.reprocessBatch(job.getId(), failed.getId());

        // Then: the range is complete and no row was stored twice
        assertThat(reprocessed.getStatus()).isEqualTo(ImportBatch.Status.COMPLETED);
        assertThat(reprocessed.getInsertedRows()).isEqualTo(250L);
        assertThat(rowRepository.countByImportJobId(job.getId())).isEqualTo(1000L);
        assertThat(reload(job.getId()).getProcessedRows()).isEqualTo(1000L);
        assertThat(verificationService.verify(job.getId()).isValid()).isTrue();

        // a completed batch is not reprocessed again
        assertThatThrownBy(() -> importJobService.reprocessBatch(job.getId(), failed.getId()))
                .isInstanceOf(InvalidImportStateException.class);
    }

    @Test
    void testReprocessFailedBatchesKeepsErrorRecordsSingle() throws IOException {
        // Given: a batch with bad rows that then fails on the row store
        importConfig.setBatchSize(100);
        AtomicBoolean storeDown = new AtomicBoolean(true);
        doAnswer(invocation -> {
            ElectionResultRow row = invocation.getArgument(0);
            if (row.getSourceRowNumber() == 150L && storeDown.getAndSet(false)) {
                throw new DataAccessResourceFailureException("row store unavailable");
            }
            return invocation.callRealMethod();
        }).when(rowStore).insertIfAbsent(any());

        ImportJob job = runUpload("votacao_2022_SP.csv", TestDataFactory.modernRows(300, 120, 125));
        assertThat(errorRepository.countByJobId(job.getId())).isEqualTo(6L);

        // When
        List<ImportBatch> results = importJobService.reprocessFailedBatches(job.getId());

        // Then
        assertThat(results).hasSize(1);
        assertThat(results.get(0).getStatus()).isEqualTo(ImportBatch.Status.COMPLETED);
        assertThat(errorRepository.countByJobId(job.getId())).isEqualTo(6L);
        ImportJob done = reload(job.getId());
        assertThat(done.getProcessedRows()).isEqualTo(294L);
        assertThat(done.getErrorCount()).isEqualTo(6L);
        assertThat(verificationService.verify(job.getId()).isValid()).isTrue();
    }

    @Test
    void testReprocessRequiresAFinishedJob() throws IOException {
        ImportJob job = upload("votacao_2022_SP.csv", TestDataFactory.modernRows(5));

        assertThatThrownBy(() -> importJobService.reprocessFailedBatches(job.getId()))
                .isInstanceOf(InvalidImportStateException.class)
                .hasMessageContaining("PENDING");
    }

    // ========================================
    // CANCEL, DELETE, RECOVERY
    // ========================================

    @Test
    void testCancelDuringProcessingKeepsStoredRows() throws IOException {
        importConfig.setBatchSize(250);
        ImportJob job = upload("votacao_2022_SP.csv", TestDataFactory.modernRows(1000));

        // the operator cancels while row 100 is being stored
        doAnswer(invocation -> {
            ElectionResultRow row = invocation.getArgument(0);
            if (row.getSourceRowNumber() == 100L) {
                importJobService.cancel(job.getId());
            }
            return invocation.callRealMethod();
        }).when(rowStore).insertIfAbsent(any());

        runner.run(job.getId());

        ImportJob cancelled = reload(job.getId());
        assertThat(cancelled.getStatus()).isEqualTo(ImportJob.Status.CANCELLED);
        assertThat(cancelled.getErrorMessage()).isEqualTo("Cancelled by operator");
        assertThat(cancelled.getProcessedRows()).isEqualTo(100L);
        assertThat(rowRepository.countByImportJobId(job.getId())).isEqualTo(100L);

        List<ImportBatch> batches = batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId());
        assertThat(batches.get(0).getStatus()).isEqualTo(ImportBatch.Status.FAILED);
        assertThat(batches.get(0).getErrorSummary()).isEqualTo("Cancelled at row 101");
        assertThat(batches.get(1).getStatus()).isEqualTo(ImportBatch.Status.PENDING);
        verify(importQueueService).remove(job.getId());
    }

    @Test
    void testDeleteRemovesRowsErrorsAndBatches() throws IOException {
        importConfig.setBatchSize(50);
        ImportJob job = runUpload("votacao_2022_SP.csv", TestDataFactory.modernRows(200, 10, 12));
        assertThat(rowRepository.countByImportJobId(job.getId())).isEqualTo(197L);

        importJobService.delete(job.getId());

        assertThat(jobRepository.findById(job.getId())).isEmpty();
        assertThat(rowRepository.countByImportJobId(job.getId())).isZero();
        assertThat(errorRepository.countByJobId(job.getId())).isZero();
        assertThat(batchRepository.findByJobIdOrderByBatchIndexAsc(job.getId())).isEmpty();
    }

    @Test
    void testStartupRecoveryFailsInterruptedJobsAndRequeuesPending() {
        ImportJob interrupted = urlJob("https://cdn.tse.jus.br/a/votacao_2018.zip");
        interrupted.setStatus(ImportJob.Status.PROCESSING);
        interrupted = jobRepository.save(interrupted);
        ImportJob pending = urlJob("https://cdn.tse.jus.br/a/votacao_2020.zip");

        startupRecoveryService.recover();

        ImportJob failed = reload(interrupted.getId());
        assertThat(failed.getStatus()).isEqualTo(ImportJob.Status.FAILED);
        assertThat(failed.getErrorMessage()).isEqualTo(StartupRecoveryService.INTERRUPTED_MESSAGE);
        verify(importQueueService).submit(pending.getId());
    }

    // ========================================
    // URL SOURCES
    // ========================================

    @Test
    void testUrlArchiveIsDownloadedExtractedAndImported() throws IOException {
        // Given: a 10,000-row archive behind a URL and batches of 2,500
        byte[] zip = TestDataFactory.zip(Map.of("votacao_candidato_munzona_2022_SP.csv",
                TestDataFactory.content(HEADER, TestDataFactory.modernRows(10_000))));
        AtomicInteger hits = new AtomicInteger();
        ImportJob job = urlJob(serve("/votacao_candidato_munzona_2022.zip", zip, hits, new AtomicBoolean(false)));

        List<ImportJob.Status> transitions = new ArrayList<>();
        doAnswer(invocation -> {
            Optional<?> result = (Optional<?>) invocation.callRealMethod();
            if (result.isPresent()) {
                transitions.add(invocation.getArgument(1));
            }
            return result;
        }).when(stateService).transition(any(), any(), any());

        // counters seen after every batch stay within the rows of the file
        List<Long> storedAfterBatch = new ArrayList<>();
        List<String> overCounted = new ArrayList<>();
        doAnswer(invocation -> {
            ImportJob progress = (ImportJob) invocation.callRealMethod();
            long counted = progress.getProcessedRows() + progress.getSkippedRows() + progress.getErrorCount();
            if (progress.getStatus() != ImportJob.Status.PROCESSING || counted > progress.getTotalRows()) {
                overCounted.add(progress.getStatus() + ": " + counted + " of " + progress.getTotalRows());
            }
            storedAfterBatch.add(progress.getProcessedRows());
            return progress;
        }).when(stateService).refreshCounters(any());

        runner.run(job.getId());

        assertThat(transitions).containsExactly(ImportJob.Status.DOWNLOADING, ImportJob.Status.EXTRACTING,
                ImportJob.Status.PROCESSING, ImportJob.Status.COMPLETED);
        assertThat(overCounted).isEmpty();
        assertThat(storedAfterBatch).containsExactly(2500L, 5000L, 7500L, 10_000L);

        ImportJob done = reload(job.getId());
        assertThat(done.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(done.getDownloadedBytes()).isEqualTo((long) zip.length);
        assertThat(done.getFileSize()).isEqualTo((long) zip.length);
        assertThat(done.getSelectedFile()).isEqualTo("votacao_candidato_munzona_2022_SP.csv");
        assertThat(done.getArchivePath()).startsWith(storageDir.toString());
        assertThat(done.getProcessedRows()).isEqualTo(10_000L);
        assertThat(done.getErrorCount()).isZero();
        assertThat(batchRepository.findByJobIdOrderByBatchIndexAsc(done.getId())).hasSize(4);
        assertThat(hits.get()).isEqualTo(1);
    }

    @Test
    void testArchiveWithSeveralFilesWaitsForSelection() throws IOException {
        importConfig.setBatchSize(100);
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("votacao_2022_AC.csv", TestDataFactory.content(HEADER, List.of(TestDataFactory.modernRow(2022, "AC", 6, 1))));
        entries.put("votacao_2022_SP.csv", TestDataFactory.content(HEADER, TestDataFactory.modernRows(20)));
        AtomicInteger hits = new AtomicInteger();
        ImportJob job = urlJob(serve("/votacao_2022.zip", TestDataFactory.zip(entries), hits, new AtomicBoolean(false)));

        runner.run(job.getId());

        ImportJob awaiting = reload(job.getId());
        assertThat(awaiting.getStatus()).isEqualTo(ImportJob.Status.AWAITING_SELECTION);
        assertThat(awaiting.getAvailableFileList()).containsExactly("votacao_2022_AC.csv", "votacao_2022_SP.csv");

        // When: the operator picks a file and the job runs again
        importJobService.selectFile(job.getId(), "votacao_2022_SP.csv");
        verify(importQueueService).submit(job.getId());
        runner.run(job.getId());

        // Then: the archive on disk is reused
        ImportJob done = reload(job.getId());
        assertThat(done.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(done.getSelectedFile()).isEqualTo("votacao_2022_SP.csv");
        assertThat(done.getProcessedRows()).isEqualTo(20L);
        assertThat(hits.get()).isEqualTo(1);
    }

    @Test
    void testFailedDownloadCanBeRestarted() throws IOException {
        importConfig.setBatchSize(100);
        byte[] zip = TestDataFactory.zip(Map.of("votacao_2022_SP.csv",
                TestDataFactory.content(HEADER, TestDataFactory.modernRows(50))));
        AtomicInteger hits = new AtomicInteger();
        AtomicBoolean broken = new AtomicBoolean(true);
        ImportJob job = urlJob(serve("/votacao_2022.zip", zip, hits, broken));

        runner.run(job.getId());

        ImportJob failed = reload(job.getId());
        assertThat(failed.getStatus()).isEqualTo(ImportJob.Status.FAILED);
        assertThat(failed.getErrorMessage()).startsWith("Download failed: HTTP 500 from");

        // When: the server recovers and the operator restarts the job
        broken.set(false);
        ImportJob restarted = importJobService.restart(job.getId());
        assertThat(restarted.getStatus()).isEqualTo(ImportJob.Status.PENDING);
        runner.run(job.getId());

        ImportJob done = reload(job.getId());
        assertThat(done.getStatus()).isEqualTo(ImportJob.Status.COMPLETED);
        assertThat(done.getProcessedRows()).isEqualTo(50L);
        assertThat(done.getErrorMessage()).isNull();
        assertThat(hits.get()).isEqualTo(2);
    }
}
