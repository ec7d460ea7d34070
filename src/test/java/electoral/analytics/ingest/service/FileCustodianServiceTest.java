package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.TempFileGroupDto;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ImportJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FileCustodianServiceTest {

    @TempDir
    Path baseDir;

    @Mock
    private ImportJobRepository importJobRepository;

    @InjectMocks
    private FileCustodianService custodian;

    @BeforeEach
    void setUp() {
        ImportConfig importConfig = new ImportConfig();
        importConfig.getStorage().setBaseDir(baseDir.toString());
        ReflectionTestUtils.setField(custodian, "importConfig", importConfig);
    }

    private Path file(String relative, int size) throws IOException {
        Path file = baseDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.write(file, new byte[size]);
        return file;
    }

    private ImportJob job(Long id, ImportJob.Status status) {
        ImportJob job = new ImportJob(ImportJob.SourceType.URL, "votacao.zip");
        job.setId(id);
        job.setStatus(status);
        return job;
    }

    @Test
    void testStoreUpload_WritesIntoUploadsBucket() throws IOException {
        MockMultipartFile upload = new MockMultipartFile("file", "votacao_2022.csv", "text/csv", "H\nrow\n".getBytes());

        Path stored = custodian.storeUpload(upload);

        assertThat(stored.getParent()).isEqualTo(baseDir.resolve("uploads"));
        assertThat(stored.getFileName().toString()).endsWith("-votacao_2022.csv");
        assertThat(Files.readString(stored)).isEqualTo("H\nrow\n");
    }

    @Test
    void testListGroups_UploadsFirstThenJobsByNumber() throws IOException {
        file("uploads/a.csv", 10);
        file("import-10/votacao.zip", 100);
        file("import-2/votacao.zip", 50);
        file("import-2/extracted/votacao_SP.csv", 25);
        file("preview-123/whatever.zip", 5);
        when(importJobRepository.findById(anyLong())).thenReturn(Optional.empty());
        when(importJobRepository.findById(2L)).thenReturn(Optional.of(job(2L, ImportJob.Status.COMPLETED)));

        List<TempFileGroupDto> groups = custodian.listGroups();

        assertThat(groups).extracting(TempFileGroupDto::getJobId).containsExactly(0L, 2L, 10L);
        assertThat(groups.get(0).isUploadsBucket()).isTrue();
        TempFileGroupDto job2 = groups.get(1);
        assertThat(job2.getTotalSize()).isEqualTo(75L);
        assertThat(job2.getFiles()).hasSize(2);
        assertThat(job2.getJobStatus()).isEqualTo("COMPLETED");
        assertThat(groups.get(2).getJobStatus()).isNull();
    }

    @Test
    void testListGroups_NoStorageYet() {
        ImportConfig importConfig = new ImportConfig();
        importConfig.getStorage().setBaseDir(baseDir.resolve("absent").toString());
        ReflectionTestUtils.setField(custodian, "importConfig", importConfig);

        assertThat(custodian.listGroups()).isEmpty();
    }

    @Test
    void testDeleteGroup_FinishedJob() throws IOException {
        file("import-3/votacao.zip", 100);
        when(importJobRepository.findByStatusInOrderByCreatedAtAsc(any())).thenReturn(Collections.emptyList());

        TempFileGroupDto deleted = custodian.deleteGroup(3L);

        assertThat(deleted.getTotalSize()).isEqualTo(100L);
        assertThat(Files.exists(baseDir.resolve("import-3"))).isFalse();
    }

    @Test
    void testDeleteGroup_UnfinishedJobBlocksDeletion() throws IOException {
        file("import-3/votacao.zip", 100);
        when(importJobRepository.findByStatusInOrderByCreatedAtAsc(any()))
                .thenReturn(List.of(job(3L, ImportJob.Status.AWAITING_SELECTION)));

        assertThatThrownBy(() -> custodian.deleteGroup(3L))
                .isInstanceOf(InvalidImportStateException.class)
                .hasMessageContaining("still needed by import job 3 (AWAITING_SELECTION)");
        assertThat(Files.exists(baseDir.resolve("import-3/votacao.zip"))).isTrue();
    }

    @Test
    void testDeleteGroup_ChildJobSharingTheArchiveBlocksDeletion() throws IOException {
        Path archive = file("import-3/votacao.zip", 100);
        ImportJob child = job(4L, ImportJob.Status.PENDING);
        child.setParentJobId(3L);
        child.setArchivePath(archive.toString());
        when(importJobRepository.findByStatusInOrderByCreatedAtAsc(any())).thenReturn(List.of(child));

        assertThatThrownBy(() -> custodian.deleteGroup(3L))
                .isInstanceOf(InvalidImportStateException.class)
                .hasMessageContaining("import job 4");
    }

    @Test
    void testDeleteGroup_SimilarDirectoryNameDoesNotBlock() throws IOException {
        file("import-1/votacao.zip", 10);
        Path other = file("import-10/votacao.zip", 10);
        ImportJob running = job(10L, ImportJob.Status.PROCESSING);
        running.setLocalFilePath(other.toString());
        when(importJobRepository.findByStatusInOrderByCreatedAtAsc(any())).thenReturn(List.of(running));

        custodian.deleteGroup(1L);

        assertThat(Files.exists(baseDir.resolve("import-1"))).isFalse();
        assertThat(Files.exists(other)).isTrue();
    }

    @Test
    void testDeleteGroup_UploadsBucketInUse() throws IOException {
        Path spooled = file("uploads/abc-votacao.csv", 10);
        ImportJob pending = job(5L, ImportJob.Status.PENDING);
        pending.setLocalFilePath(spooled.toString());
        when(importJobRepository.findByStatusInOrderByCreatedAtAsc(any())).thenReturn(List.of(pending));

        assertThatThrownBy(() -> custodian.deleteGroup(0L))
                .isInstanceOf(InvalidImportStateException.class)
                .hasMessageContaining("the uploads bucket");
    }

    @Test
    void testDeleteGroup_Missing() {
        lenient().when(importJobRepository.findByStatusInOrderByCreatedAtAsc(any())).thenReturn(Collections.emptyList());

        assertThatThrownBy(() -> custodian.deleteGroup(77L))
                .isInstanceOf(ImportNotFoundException.class)
                .hasMessage("No temporary files for import job 77");
    }
}
