package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.ArchiveEntryDto;
import electoral.analytics.ingest.exception.AcquisitionException;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.util.FileValidationUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Obtains the local row source of a job: downloads URL sources into the job directory,
 * extracts the selected entry of archives, and decides which archive entry to import.
 */
@Service
public class AcquisitionService {

    private static final Logger logger = LoggerFactory.getLogger(AcquisitionService.class);

    private static final String EXTRACTED_DIR = "extracted";

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private ImportJobStateService stateService;

    @Autowired
    private SourceDownloader sourceDownloader;

    @Autowired
    private ArchiveExtractor archiveExtractor;

    @Autowired
    private FileCustodianService fileCustodianService;

    /**
     * Acquire the row source of a PENDING job.
     *
     * @return path of the delimited file to process, or null when the job stopped without a
     *         file to process (awaiting archive file selection, or cancelled meanwhile)
     * @throws AcquisitionException if the source cannot be obtained; fatal to the job
     */
    public Path acquire(ImportJob job) {
        Long jobId = job.getId();
        Path jobDir = fileCustodianService.ensureJobDir(jobId);

        Path artifact;
        if (job.isUrlSource()) {
            artifact = acquireRemote(job, jobDir);
        } else {
            artifact = acquireUpload(job);
        }
        if (artifact == null) {
            return null;
        }

        if (!FileValidationUtil.isZipFile(artifact.getFileName().toString())) {
            return artifact;
        }
        return extract(job, artifact, jobDir);
    }

    private Path acquireRemote(ImportJob job, Path jobDir) {
        Long jobId = job.getId();

        // Re-queued after file selection, or a child job sharing its parent's archive
        if (job.getArchivePath() != null && Files.exists(Paths.get(job.getArchivePath()))) {
            logger.info("Reusing downloaded archive {} for import job {}", job.getArchivePath(), jobId);
            return Paths.get(job.getArchivePath());
        }

        if (stateService.transition(jobId, ImportJob.Status.DOWNLOADING, j -> j.setDownloadedBytes(0L)).isEmpty()) {
            return null;
        }

        URI uri = URI.create(job.getSourceUrl());
        Path target = jobDir.resolve(FileValidationUtil.extractFilename(job.getSourceUrl()));

        long bytes = sourceDownloader.download(uri, target, jobId, new SourceDownloader.ProgressListener() {
            @Override
            public void onStart(long contentLength) {
                stateService.update(jobId, j -> j.setFileSize(Math.max(0L, contentLength)));
            }

            @Override
            public void onProgress(long downloadedBytes) {
                stateService.recordDownloadProgress(jobId, downloadedBytes);
            }
        });

        boolean archive = FileValidationUtil.isZipFile(target.getFileName().toString());
        stateService.update(jobId, j -> {
            j.setDownloadedBytes(bytes);
            if (j.getFileSize() == null || j.getFileSize() == 0) {
                j.setFileSize(bytes);
            }
            if (archive) {
                j.setArchivePath(target.toString());
            } else {
                j.setLocalFilePath(target.toString());
            }
        });
        return target;
    }

    private Path acquireUpload(ImportJob job) {
        String stored = job.getArchivePath() != null ? job.getArchivePath() : job.getLocalFilePath();
        if (stored == null || !Files.exists(Paths.get(stored))) {
            throw new AcquisitionException("Uploaded file for import job " + job.getId() + " is no longer available");
        }
        return Paths.get(stored);
    }

    private Path extract(ImportJob job, Path archive, Path jobDir) {
        Long jobId = job.getId();
        if (stateService.transition(jobId, ImportJob.Status.EXTRACTING).isEmpty()) {
            return null;
        }

        List<ArchiveEntryDto> candidates = archiveExtractor.listCandidates(archive);
        if (candidates.isEmpty()) {
            throw new AcquisitionException("No CSV or TXT file found in archive " + archive.getFileName());
        }

        Optional<String> chosen = chooseEntry(job.getSelectedFile(), candidates);
        if (chosen.isEmpty()) {
            List<String> names = candidates.stream().map(ArchiveEntryDto::getName).collect(Collectors.toList());
            stateService.transition(jobId, ImportJob.Status.AWAITING_SELECTION, j -> j.setAvailableFileList(names));
            logger.info("Import job {} awaiting selection among {} files", jobId, names.size());
            return null;
        }

        String entryName = chosen.get();
        Path extracted = archiveExtractor.extractEntry(archive, entryName, jobDir.resolve(EXTRACTED_DIR), jobId);
        stateService.update(jobId, j -> {
            j.setSelectedFile(entryName);
            j.setLocalFilePath(extracted.toString());
        });
        return extracted;
    }

    /**
     * Pick the archive entry to import: the explicit selection, the only candidate, or the
     * consolidated country-wide file. Empty when the operator has to choose.
     *
     * @throws AcquisitionException if the explicit selection is not in the archive
     */
    Optional<String> chooseEntry(String selectedFile, List<ArchiveEntryDto> candidates) {
        if (selectedFile != null && !selectedFile.isBlank()) {
            return Optional.of(candidates.stream()
                    .map(ArchiveEntryDto::getName)
                    .filter(selectedFile::equals)
                    .findFirst()
                    .orElseThrow(() -> new AcquisitionException(
                            "Selected file '" + selectedFile + "' not found in archive")));
        }
        if (candidates.size() == 1) {
            return Optional.of(candidates.get(0).getName());
        }
        if (importConfig.getArchive().isPreferConsolidatedFile()) {
            Optional<String> consolidated = candidates.stream()
                    .filter(ArchiveEntryDto::isConsolidated)
                    .map(ArchiveEntryDto::getName)
                    .findFirst();
            if (consolidated.isPresent()) {
                logger.info("Using consolidated file {}", consolidated.get());
                return consolidated;
            }
        }
        return Optional.empty();
    }

    /**
     * Download an archive to a scratch directory, list its importable files and remove it again.
     */
    public List<ArchiveEntryDto> previewArchive(URI uri) {
        Path scratch = importConfig.getBaseDirPath().resolve("preview-" + UUID.randomUUID());
        try {
            Files.createDirectories(scratch);
            Path target = scratch.resolve(FileValidationUtil.extractFilename(uri.toString()));
            sourceDownloader.download(uri, target, null, SourceDownloader.ProgressListener.NONE);
            if (!FileValidationUtil.isZipFile(target.getFileName().toString())) {
                return List.of(new ArchiveEntryDto(target.getFileName().toString(), Files.size(target), false));
            }
            return archiveExtractor.listCandidates(target);
        } catch (IOException e) {
            throw new AcquisitionException("Preview failed: " + e.getMessage(), e);
        } finally {
            fileCustodianService.deleteDirectory(scratch);
        }
    }
}
