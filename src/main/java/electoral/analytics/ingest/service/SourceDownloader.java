package electoral.analytics.ingest.service;

import electoral.analytics.ingest.config.ImportConfig;
import electoral.analytics.ingest.exception.AcquisitionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Streams a remote source to local storage.
 *
 * The body is copied chunk by chunk; the content length (when the server sends one) and
 * the running byte count are reported to a {@link ProgressListener}, at most once per
 * ingest.download.progress-interval-ms plus once at the end. Partial downloads are never
 * resumed, a new attempt starts from byte zero.
 */
@Service
public class SourceDownloader {

    private static final Logger logger = LoggerFactory.getLogger(SourceDownloader.class);

    /**
     * Receives download progress. Implementations must be cheap, they run on the download thread.
     */
    public interface ProgressListener {

        ProgressListener NONE = new ProgressListener() {
        };

        default void onStart(long contentLength) {
        }

        default void onProgress(long downloadedBytes) {
        }
    }

    @Autowired
    private ImportConfig importConfig;

    @Autowired
    private CancellationRegistry cancellationRegistry;

    private volatile HttpClient httpClient;

    /**
     * Download a URL to the target file, replacing any previous content.
     *
     * @param jobId    job whose cancellation flag is polled per chunk; null for ad hoc downloads
     * @return number of bytes written
     * @throws AcquisitionException on network failure or non-success HTTP status
     */
    public long download(URI uri, Path target, Long jobId, ProgressListener listener) {
        ImportConfig.Download settings = importConfig.getDownload();
        logger.info("Downloading {} to {}", uri, target);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofMinutes(settings.getRequestTimeoutMinutes()))
                .GET()
                .build();

        try {
            HttpResponse<InputStream> response = client().send(request, HttpResponse.BodyHandlers.ofInputStream());

            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                response.body().close();
                throw new AcquisitionException("Download failed: HTTP " + response.statusCode() + " from " + uri);
            }

            long contentLength = response.headers().firstValueAsLong("Content-Length").orElse(0L);
            listener.onStart(contentLength);
            if (contentLength <= 0) {
                logger.info("Server did not report a content length for {}, progress is indeterminate", uri);
            }

            Files.createDirectories(target.toAbsolutePath().getParent());
            long total = copy(response.body(), target, jobId, listener, settings);

            listener.onProgress(total);
            logger.info("Downloaded {} bytes from {}", total, uri);
            return total;

        } catch (IOException e) {
            throw new AcquisitionException("Download failed: " + describe(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionException("Download interrupted: " + uri, e);
        }
    }

    private long copy(InputStream body, Path target, Long jobId, ProgressListener listener,
                      ImportConfig.Download settings) throws IOException {
        byte[] buffer = new byte[settings.getBufferSize()];
        long total = 0;
        long lastReport = System.currentTimeMillis();

        try (InputStream in = body; OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (jobId != null) {
                    cancellationRegistry.checkCancelled(jobId);
                }
                out.write(buffer, 0, read);
                total += read;

                long now = System.currentTimeMillis();
                if (now - lastReport >= settings.getProgressIntervalMs()) {
                    listener.onProgress(total);
                    lastReport = now;
                    logger.debug("Downloaded {} bytes so far", total);
                }
            }
        }
        return total;
    }

    private HttpClient client() {
        HttpClient client = httpClient;
        if (client == null) {
            synchronized (this) {
                if (httpClient == null) {
                    httpClient = HttpClient.newBuilder()
                            .connectTimeout(Duration.ofSeconds(importConfig.getDownload().getConnectTimeoutSeconds()))
                            .followRedirects(HttpClient.Redirect.NORMAL)
                            .build();
                }
                client = httpClient;
            }
        }
        return client;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
