package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.TempFileGroupDto;
import electoral.analytics.ingest.exception.ImportNotFoundException;
import electoral.analytics.ingest.exception.InvalidImportStateException;
import electoral.analytics.ingest.model.ImportJob;
import electoral.analytics.ingest.repository.ImportJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns the temporary storage area: one directory per job (import-{jobId}) for downloads and
 * extracted files, plus the shared uploads bucket for spooled uploads.
 *
 * Deleting a group never touches imported rows or error records. Groups are kept after a job
 * finishes so failed batches can be reprocessed from the same file.
 */
@Service
public class FileCustodianService {

    private static final Logger logger = LoggerFactory.getLogger(FileCustodianService.class);

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private ImportJobRepository importJobRepository;

    public Path ensureJobDir(Long jobId) {
        Path jobDir = importConfig.getJobDir(jobId);
        try {
            Files.createDirectories(jobDir);
            return jobDir;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create directory for import job " + jobId, e);
        }
    }

    /**
     * Spool an uploaded file into the shared uploads bucket.
     *
     * @return path of the stored copy
     */
    public Path storeUpload(MultipartFile file) throws IOException {
        Path uploads = importConfig.getUploadsDir();
        Files.createDirectories(uploads);

        String safeName = Path.of(file.getOriginalFilename()).getFileName().toString();
        Path target = uploads.resolve(UUID.randomUUID() + "-" + safeName);
        file.transferTo(target);

        logger.info("Stored upload {} ({} bytes) at {}", safeName, file.getSize(), target);
        return target;
    }

    /**
     * All temporary file groups currently on disk, uploads bucket first, then by job id.
     */
    public List<TempFileGroupDto> listGroups() {
        Path baseDir = importConfig.getBaseDirPath();
        List<TempFileGroupDto> groups = new ArrayList<>();
        if (!Files.isDirectory(baseDir)) {
            return groups;
        }

        Path uploads = importConfig.getUploadsDir();
        if (Files.isDirectory(uploads)) {
            groups.add(describe(TempFileGroupDto.UPLOADS_BUCKET_ID, uploads));
        }

        String prefix = importConfig.getStorage().getJobDirPrefix();
        try (Stream<Path> dirs = Files.list(baseDir)) {
            List<Path> jobDirs = dirs.filter(Files::isDirectory)
                    .filter(dir -> parseJobId(dir.getFileName().toString(), prefix) != null)
                    .sorted(Comparator.comparing(dir -> parseJobId(dir.getFileName().toString(), prefix)))
                    .collect(Collectors.toList());

            for (Path dir : jobDirs) {
                Long jobId = parseJobId(dir.getFileName().toString(), prefix);
                TempFileGroupDto group = describe(jobId, dir);
                importJobRepository.findById(jobId).ifPresent(job -> group.setJobStatus(job.getStatus().name()));
                groups.add(group);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list temporary files under " + baseDir, e);
        }
        return groups;
    }

    /**
     * Delete the temporary files of a job, or of the uploads bucket when jobId is 0.
     *
     * @throws ImportNotFoundException if there is no such group on disk
     * @throws InvalidImportStateException if a job still needs the files
     */
    public TempFileGroupDto deleteGroup(Long jobId) {
        Path dir = TempFileGroupDto.UPLOADS_BUCKET_ID == jobId
                ? importConfig.getUploadsDir()
                : importConfig.getJobDir(jobId);

        if (!Files.isDirectory(dir)) {
            throw new ImportNotFoundException("No temporary files for " + describeOwner(jobId));
        }

        Optional<ImportJob> blocking = findJobNeedingFiles(jobId, dir);
        if (blocking.isPresent()) {
            ImportJob job = blocking.get();
            throw new InvalidImportStateException(
                    String.format("Temporary files of %s are still needed by import job %d (%s)",
                            describeOwner(jobId), job.getId(), job.getStatus()),
                    job.getStatus().name());
        }

        TempFileGroupDto deleted = describe(jobId, dir);
        deleteDirectory(dir);
        logger.info("Deleted {} temporary files ({} bytes) of {}", deleted.getFiles().size(),
                deleted.getTotalSize(), describeOwner(jobId));
        return deleted;
    }

    /**
     * Remove a directory tree; failures are logged, not thrown.
     */
    public void deleteDirectory(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder())
                    .map(Path::toFile)
                    .forEach(File::delete);
            logger.debug("Cleaned up directory: {}", dir);
        } catch (IOException e) {
            logger.warn("Could not fully clean up directory: {}", dir, e);
        }
    }

    private Optional<ImportJob> findJobNeedingFiles(Long jobId, Path dir) {
        Set<ImportJob.Status> inProgress = ImportJob.Status.inProgress();
        Path normalizedDir = dir.toAbsolutePath().normalize();

        // any unfinished job whose stored source lives in this directory, children of the job included
        return importJobRepository.findByStatusInOrderByCreatedAtAsc(inProgress).stream()
                .filter(job -> jobId.equals(job.getId())
                        || livesUnder(job.getArchivePath(), normalizedDir)
                        || livesUnder(job.getLocalFilePath(), normalizedDir))
                .findFirst();
    }

    private static boolean livesUnder(String path, Path dir) {
        return path != null && Path.of(path).toAbsolutePath().normalize().startsWith(dir);
    }

    private TempFileGroupDto describe(Long jobId, Path dir) {
        TempFileGroupDto group = new TempFileGroupDto(jobId, dir.toString());
        try (Stream<Path> files = Files.walk(dir)) {
            files.filter(Files::isRegularFile)
                    .sorted()
                    .forEach(file -> group.addFile(entryFor(dir, file)));
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list files under " + dir, e);
        }
        return group;
    }

    private static TempFileGroupDto.FileEntry entryFor(Path dir, Path file) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            LocalDateTime modifiedAt = LocalDateTime.ofInstant(
                    attributes.lastModifiedTime().toInstant(), ZoneId.systemDefault());
            return new TempFileGroupDto.FileEntry(dir.relativize(file).toString(), attributes.size(), modifiedAt);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read attributes of " + file, e);
        }
    }

    private static Long parseJobId(String dirName, String prefix) {
        if (!dirName.startsWith(prefix)) {
            return null;
        }
        try {
            return Long.parseLong(dirName.substring(prefix.length()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String describeOwner(Long jobId) {
        return TempFileGroupDto.UPLOADS_BUCKET_ID == jobId ? "the uploads bucket" : "import job " + jobId;
    }
}
