package electoral.analytics.ingest.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * JPA AttributeConverter for the import job status column.
 *
 * Older rows were written with both "running" and "processing" for the same
 * state; both are read back as {@link ImportJob.Status#PROCESSING} and only the
 * canonical lowercase name is ever written.
 */
@Converter(autoApply = false)
public class ImportJobStatusConverter implements AttributeConverter<ImportJob.Status, String> {

    private static final String LEGACY_RUNNING = "running";

    /**
     * Convert Java enum to its lowercase column value
     * @param status Java enum value
     * @return column value
     */
    @Override
    public String convertToDatabaseColumn(ImportJob.Status status) {
        if (status == null) {
            return null;
        }
        return status.name().toLowerCase();
    }

    /**
     * Convert a stored column value to the enum, accepting legacy spellings
     * @param dbData Database value (String)
     * @return Java enum value
     */
    @Override
    public ImportJob.Status convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        String normalized = dbData.trim();
        if (LEGACY_RUNNING.equalsIgnoreCase(normalized)) {
            return ImportJob.Status.PROCESSING;
        }
        return ImportJob.Status.valueOf(normalized.toUpperCase());
    }
}
