package electoral.analytics.ingest.parser;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sequential reader over the data rows of a source file. The header line (when present)
 * and blank lines are not data rows; data rows are numbered from 1 in file order.
 */
public class SourceRowReader implements Closeable {

    private final BufferedReader reader;
    private final String header;
    private long rowNumber;

    public SourceRowReader(Path file, Charset charset, boolean hasHeader) throws IOException {
        // InputStreamReader substitutes undecodable bytes instead of failing the whole read
        this.reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), charset));
        String firstLine = null;
        if (hasHeader) {
            firstLine = reader.readLine();
            if (firstLine != null && !firstLine.isEmpty() && firstLine.charAt(0) == '\uFEFF') {
                firstLine = firstLine.substring(1);
            }
        }
        this.header = firstLine;
        this.rowNumber = 0;
    }

    /**
     * Next data row, or null at end of file.
     */
    public String next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.trim().isEmpty()) {
                rowNumber++;
                return line;
            }
        }
        return null;
    }

    /**
     * Advance past the given number of data rows.
     *
     * @return rows actually skipped; fewer than requested at end of file
     */
    public long skip(long rows) throws IOException {
        long skipped = 0;
        while (skipped < rows && next() != null) {
            skipped++;
        }
        return skipped;
    }

    /**
     * 1-based number of the row last returned by {@link #next()}.
     */
    public long getRowNumber() {
        return rowNumber;
    }

    public String getHeader() {
        return header;
    }

    /**
     * Number of data rows in a file.
     */
    public static long countRows(Path file, Charset charset, boolean hasHeader) throws IOException {
        try (SourceRowReader rows = new SourceRowReader(file, charset, hasHeader)) {
            while (rows.next() != null) {
                // counting only
            }
            return rows.getRowNumber();
        }
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
