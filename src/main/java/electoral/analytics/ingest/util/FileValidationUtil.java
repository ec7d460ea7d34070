package electoral.analytics.ingest.util;

import org.springframework.web.multipart.MultipartFile;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for validating import sources.
 * Provides reusable checks for uploaded files and remote source URLs.
 */
public class FileValidationUtil {

    private FileValidationUtil() {
        // Private constructor to prevent instantiation
    }

    /**
     * Validates that the file is not null and not empty.
     *
     * @param file the file to validate
     * @throws IllegalArgumentException if file is null or empty
     */
    public static void validateFileNotEmpty(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty or not provided");
        }
    }

    /**
     * Validates that the file has a valid filename.
     *
     * @param file the file to validate
     * @return the filename
     * @throws IllegalArgumentException if filename is null or empty
     */
    public static String validateAndGetFilename(MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Invalid filename");
        }
        return filename;
    }

    /**
     * Validates that the file has one of the allowed extensions.
     *
     * @param file              the file to validate
     * @param allowedExtensions allowed file extensions (without dot, e.g. "csv", "zip")
     * @throws IllegalArgumentException if file extension is not allowed
     */
    public static void validateFileExtension(MultipartFile file, String... allowedExtensions) {
        String filename = validateAndGetFilename(file);
        if (!hasAllowedExtension(filename, allowedExtensions)) {
            throw new IllegalArgumentException(
                    String.format("Invalid file type. Expected %s file but received '%s'. Please upload a valid file.",
                            describe(allowedExtensions), filename));
        }
    }

    /**
     * Comprehensive file validation: checks if file is not empty and has correct extension.
     *
     * @param file              the file to validate
     * @param allowedExtensions allowed file extensions (without dot)
     * @throws IllegalArgumentException if validation fails
     */
    public static void validateFile(MultipartFile file, String... allowedExtensions) {
        validateFileNotEmpty(file);
        validateFileExtension(file, allowedExtensions);
    }

    /**
     * Validates a remote source URL: https only, host in the allow-list when one is
     * configured, and a path ending with one of the allowed extensions.
     *
     * @param url               the URL to validate
     * @param allowedHosts      accepted hosts; null or empty accepts any host
     * @param allowedExtensions allowed extensions for the last path segment (without dot)
     * @return the parsed URI
     * @throws IllegalArgumentException if validation fails
     */
    public static URI validateSourceUrl(String url, List<String> allowedHosts, String... allowedExtensions) {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("URL is required");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid URL: " + url);
        }

        if (!"https".equalsIgnoreCase(uri.getScheme())) {
            throw new IllegalArgumentException("Only HTTPS URLs are accepted: " + url);
        }

        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("URL has no host: " + url);
        }
        if (allowedHosts != null && !allowedHosts.isEmpty()
                && allowedHosts.stream().noneMatch(allowed -> allowed.equalsIgnoreCase(host))) {
            throw new IllegalArgumentException(
                    String.format("Host '%s' is not an allowed import source. Allowed hosts: %s",
                            host, String.join(", ", allowedHosts)));
        }

        String path = uri.getPath();
        if (path == null || !hasAllowedExtension(path, allowedExtensions)) {
            throw new IllegalArgumentException(
                    String.format("URL must point to a %s file: %s", describe(allowedExtensions), url));
        }

        return uri;
    }

    /**
     * Last path segment of a URL or file path.
     */
    public static String extractFilename(String pathOrUrl) {
        String path = pathOrUrl;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public static boolean isZipFile(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".zip");
    }

    private static boolean hasAllowedExtension(String filename, String... allowedExtensions) {
        String lowerCaseFilename = filename.toLowerCase(Locale.ROOT);
        return Arrays.stream(allowedExtensions)
                .anyMatch(ext -> lowerCaseFilename.endsWith("." + ext.toLowerCase(Locale.ROOT)));
    }

    private static String describe(String... allowedExtensions) {
        return Arrays.stream(allowedExtensions)
                .map(ext -> ext.toUpperCase(Locale.ROOT))
                .reduce((a, b) -> a + ", " + b)
                .orElse("unknown");
    }
}
