package electoral.analytics.ingest.parser;

import electoral.analytics.ingest.model.ElectionResultRow;
import electoral.analytics.ingest.model.ImportError;

/**
 * Outcome of parsing one source line: a typed row, a row excluded by the job filters,
 * or a structured error.
 */
public class RowParseResult {

    public enum Kind {
        VALID, FILTERED, INVALID
    }

    private final Kind kind;
    private final ElectionResultRow row;
    private final ImportError.ErrorType errorType;
    private final String message;

    private RowParseResult(Kind kind, ElectionResultRow row, ImportError.ErrorType errorType, String message) {
        this.kind = kind;
        this.row = row;
        this.errorType = errorType;
        this.message = message;
    }

    public static RowParseResult valid(ElectionResultRow row) {
        return new RowParseResult(Kind.VALID, row, null, null);
    }

    public static RowParseResult filtered(String reason) {
        return new RowParseResult(Kind.FILTERED, null, null, reason);
    }

    public static RowParseResult invalid(ImportError.ErrorType errorType, String message) {
        return new RowParseResult(Kind.INVALID, null, errorType, message);
    }

    public Kind getKind() {
        return kind;
    }

    public ElectionResultRow getRow() {
        return row;
    }

    public ImportError.ErrorType getErrorType() {
        return errorType;
    }

    public String getMessage() {
        return message;
    }

    public boolean isValid() {
        return kind == Kind.VALID;
    }

    public boolean isFiltered() {
        return kind == Kind.FILTERED;
    }

    public boolean isInvalid() {
        return kind == Kind.INVALID;
    }
}
