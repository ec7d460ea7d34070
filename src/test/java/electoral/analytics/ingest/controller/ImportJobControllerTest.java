package electoral.analytics.ingest.controller;

import electoral.analytics.ingest.dto.ImportJobDto;
import electoral.analytics.ingest.dto.QueueStatusDto;
import electoral.analytics.ingest.dto.UrlImportRequestDto;
import electoral.analytics.ingest.exception.AcquisitionException;
import electoral.analytics.ingest.exception.ImportConflictException;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.service.ImportErrorExportService;
import electoral.analytics.ingest.service.ImportJobService;
import electoral.analytics.ingest.service.ImportQueueService;
import electoral.analytics.ingest.service.IntegrityVerificationService;
import electoral.analytics.ingest.util.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ImportJobController.class)
class ImportJobControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ImportJobService importJobService;

    @MockBean
    private ImportQueueService importQueueService;

    @MockBean
    private IntegrityVerificationService integrityVerificationService;

    @MockBean
    private ImportErrorExportService importErrorExportService;

    private static ImportJob job(Long id, ImportJob.Status status) {
        ImportJob job = new ImportJob(ImportJob.SourceType.UPLOAD, "votacao_2022_SP.csv");
        job.setId(id);
        job.setStatus(status);
        job.setSourceKey("votacao_2022_sp.csv||*|*|*");
        job.setCreatedAt(LocalDateTime.now());
        return job;
    }

    private static ImportJobDto dto(ImportJob job, Integer queuePosition) {
        return new ImportJobDto(job, queuePosition, 0, LocalDateTime.now());
    }

    @Test
    void testUploadIsAcceptedAndQueued() throws Exception {
        // Given
        MockMultipartFile file = TestDataFactory.sourceUpload("votacao_2022_SP.csv",
                TestDataFactory.modernHeader(), TestDataFactory.modernRows(3));
        ImportJob created = job(7L, ImportJob.Status.PENDING);
        when(importJobService.submitUpload(any(), eq(2022), eq("SP"), isNull(), isNull(), isNull(), isNull()))
                .thenReturn(created);
        when(importJobService.toDto(created)).thenReturn(dto(created, 1));

        // When / Then
        mockMvc.perform(multipart("/api/v1/imports/upload")
                .file(file)
                .param("election_year", "2022")
                .param("region", "SP"))
                .andExpect(status().isAccepted())
                .andExpect(header().exists("X-Correlation-ID"))
                .andExpect(jsonPath("$.id").value(7))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.source_type").value("UPLOAD"))
                .andExpect(jsonPath("$.queue_position").value(1))
                .andExpect(jsonPath("$.progress_percent").value(0.0));
    }

    @Test
    void testDuplicateUploadIsConflictWithExistingJob() throws Exception {
        MockMultipartFile file = TestDataFactory.sourceUpload("votacao_2022_SP.csv",
                TestDataFactory.modernHeader(), TestDataFactory.modernRows(3));
        ImportJob existing = job(3L, ImportJob.Status.COMPLETED);
        when(importJobService.submitUpload(any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new ImportConflictException(ImportConflictException.Reason.ALREADY_IMPORTED, existing,
                        "This source was already imported by job 3"));

        mockMvc.perform(multipart("/api/v1/imports/upload").file(file))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Already Imported"))
                .andExpect(jsonPath("$.details.reason").value("ALREADY_IMPORTED"))
                .andExpect(jsonPath("$.details.existing_job_id").value(3))
                .andExpect(jsonPath("$.details.existing_job_status").value("COMPLETED"));
    }

    @Test
    void testInvalidUploadIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.pdf", "application/pdf", new byte[]{1, 2, 3});
        when(importJobService.submitUpload(any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("Invalid file type"));

        mockMvc.perform(multipart("/api/v1/imports/upload").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation Error"));
    }

    @Test
    void testUrlSubmissionReadsSnakeCaseBody() throws Exception {
        ImportJob created = job(8L, ImportJob.Status.PENDING);
        when(importJobService.submitUrl(any(UrlImportRequestDto.class))).thenReturn(created);
        when(importJobService.toDto(created)).thenReturn(dto(created, null));

        mockMvc.perform(post("/api/v1/imports/url")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"url\":\"https://cdn.tse.jus.br/votacao_2022.zip\",\"election_year\":2022,\"category_code\":6}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(8));

        verify(importJobService).submitUrl(argThat(request ->
                request.getUrl().equals("https://cdn.tse.jus.br/votacao_2022.zip")
                        && request.getElectionYear() == 2022
                        && request.getCategoryCode() == 6));
    }

    @Test
    void testPreviewFailureIsBadGateway() throws Exception {
        when(importJobService.previewArchive("https://cdn.tse.jus.br/missing.zip"))
                .thenThrow(new AcquisitionException("Download failed: HTTP 404 from https://cdn.tse.jus.br/missing.zip"));

        mockMvc.perform(get("/api/v1/imports/preview").param("url", "https://cdn.tse.jus.br/missing.zip"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Acquisition Error"));
    }

    @Test
    void testUnknownJobIsNotFound() throws Exception {
        when(importJobService.getJob(99L)).thenThrow(ImportNotFoundException.job(99L));

        mockMvc.perform(get("/api/v1/imports/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Import job not found: 99"));
    }

    @Test
    void testCancelOfFinishedJobIsBadRequestWithStatus() throws Exception {
        when(importJobService.cancel(5L)).thenThrow(
                new InvalidImportStateException("Job 5 is COMPLETED and cannot be cancelled", "COMPLETED"));

        mockMvc.perform(post("/api/v1/imports/5/cancel"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid State"))
                .andExpect(jsonPath("$.details.current_status").value("COMPLETED"));
    }

    @Test
    void testSelectWithoutFileIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/imports/5/select")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Either a file or import_all must be given"));
    }

    @Test
    void testSelectAllReturnsEveryJob() throws Exception {
        ImportJob parent = job(5L, ImportJob.Status.PENDING);
        ImportJob child = job(6L, ImportJob.Status.PENDING);
        child.setParentJobId(5L);
        when(importJobService.selectAll(5L)).thenReturn(List.of(parent, child));
        when(importJobService.toDto(parent)).thenReturn(dto(parent, 1));
        when(importJobService.toDto(child)).thenReturn(dto(child, 2));

        mockMvc.perform(post("/api/v1/imports/5/select")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"import_all\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].parent_job_id").value(5));
    }

    @Test
    void testQueueStatus() throws Exception {
        QueueStatusDto queue = new QueueStatusDto(true, 4L, 1,
                List.of(new QueueStatusDto.Entry(0, 4L, true), new QueueStatusDto.Entry(1, 9L, false)));
        when(importQueueService.status()).thenReturn(queue);

        mockMvc.perform(get("/api/v1/imports/queue"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.is_processing").value(true))
                .andExpect(jsonPath("$.current_job").value(4))
                .andExpect(jsonPath("$.queue_length").value(1))
                .andExpect(jsonPath("$.queue[1].job_id").value(9));
    }

    @Test
    void testDeleteReturnsDeletedJob() throws Exception {
        when(importJobService.delete(3L)).thenReturn(job(3L, ImportJob.Status.COMPLETED));

        mockMvc.perform(delete("/api/v1/imports/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.deleted").value(true));
    }

    @Test
    void testUnknownStatusFilterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/imports").param("status", "sleeping"))
                .andExpect(status().isBadRequest());
    }
}
