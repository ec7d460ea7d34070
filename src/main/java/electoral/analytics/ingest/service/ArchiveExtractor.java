package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.dto.ArchiveEntryDto;
import electoral.analytics.ingest.exception.AcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Lists and extracts the data files of a ZIP archive.
 * Candidates are .csv/.txt entries outside macOS resource-fork folders.
 */
@Service
public class ArchiveExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ArchiveExtractor.class);

    private static final String MACOS_METADATA_DIR = "__MACOSX";

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    /**
     * Importable entries in archive order.
     *
     * @throws AcquisitionException if the archive cannot be read
     */
    public List<ArchiveEntryDto> listCandidates(Path archive) {
        List<ArchiveEntryDto> candidates = new ArrayList<>();

        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zipFile.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (isCandidate(entry)) {
                    candidates.add(new ArchiveEntryDto(entry.getName(), Math.max(0, entry.getSize()),
                            isConsolidated(entry.getName())));
                }
            }
        } catch (IOException e) {
            throw new AcquisitionException("Corrupt or unreadable archive " + archive.getFileName()
                    + ": " + e.getMessage(), e);
        }

        logger.info("Found {} data files in archive {}", candidates.size(), archive.getFileName());
        return candidates;
    }

    /**
     * Extract one entry below the target directory.
     *
     * @param jobId job whose cancellation flag is polled per chunk
     * @return path of the extracted file
     */
    public Path extractEntry(Path archive, String entryName, Path targetDir, Long jobId) {
        try (ZipFile zipFile = new ZipFile(archive.toFile())) {
            ZipEntry entry = zipFile.getEntry(entryName);
            if (entry == null || entry.isDirectory()) {
                throw new AcquisitionException("File '" + entryName + "' not found in archive " + archive.getFileName());
            }

            Path normalizedTarget = targetDir.toAbsolutePath().normalize();
            Path filePath = normalizedTarget.resolve(entryName).normalize();
            if (!filePath.startsWith(normalizedTarget)) {
                throw new AcquisitionException("Archive entry escapes extraction directory: " + entryName);
            }
            Files.createDirectories(filePath.getParent());

            byte[] buffer = new byte[importConfig.getDownload().getBufferSize()];
            long written = 0;
            try (InputStream in = zipFile.getInputStream(entry); OutputStream out = Files.newOutputStream(filePath)) {
                int length;
                while ((length = in.read(buffer)) != -1) {
                    if (jobId != null) {
                        cancellationRegistry.checkCancelled(jobId);
                    }
                    out.write(buffer, 0, length);
                    written += length;
                }
            }

            logger.info("Extracted {} ({} bytes) to {}", entryName, written, filePath);
            return filePath;

        } catch (IOException e) {
            throw new AcquisitionException("Failed to extract '" + entryName + "' from archive "
                    + archive.getFileName() + ": " + e.getMessage(), e);
        }
    }

    public boolean isConsolidated(String entryName) {
        String marker = importConfig.getArchive().getConsolidatedMarker();
        return marker != null && !marker.isEmpty()
                && entryName.toUpperCase(Locale.ROOT).contains(marker.toUpperCase(Locale.ROOT));
    }

    static boolean isCandidate(ZipEntry entry) {
        if (entry.isDirectory() || entry.getName().startsWith(MACOS_METADATA_DIR)) {
            return false;
        }
        String lower = entry.getName().toLowerCase(Locale.ROOT);
        return lower.endsWith(".csv") || lower.endsWith(".txt");
    }
}
