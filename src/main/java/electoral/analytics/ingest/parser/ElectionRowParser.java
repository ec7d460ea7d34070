package electoral.analytics.ingest.parser;

import electoral.analytics.ingest.model.ElectionResultRow;
import electoral.analytics.ingest.model.ImportError.ErrorType;

import java.util.List;

/**
 * Converts one line of a candidate vote file into an {@link ElectionResultRow} or a
 * structured error. Stateless apart from its layout, delimiter and filter; safe to share.
 */
public class ElectionRowParser {

    private static final char REPLACEMENT_CHAR = '\uFFFD';

    private final ColumnLayout layout;
    private final DelimitedLineParser lineParser;
    private final RowFilter filter;

    public ElectionRowParser(ColumnLayout layout, DelimitedLineParser lineParser, RowFilter filter) {
        this.layout = layout;
        this.lineParser = lineParser;
        this.filter = filter != null ? filter : RowFilter.none();
    }

    /**
     * Parse a single data line.
     *
     * @param line raw line text
     * @return valid, filtered or invalid result; never null
     */
    public RowParseResult parse(String line) {
        if (line.indexOf(REPLACEMENT_CHAR) >= 0) {
            return RowParseResult.invalid(ErrorType.ENCODING_ERROR,
                    "Line contains bytes that cannot be decoded in the configured charset");
        }
        if (!DelimitedLineParser.hasBalancedQuotes(line)) {
            return RowParseResult.invalid(ErrorType.PARSE_ERROR, "Unbalanced quotes in line");
        }

        List<String> fields = lineParser.split(line);
        if (fields.size() < layout.getRequiredFields()) {
            return RowParseResult.invalid(ErrorType.INVALID_FORMAT,
                    String.format("Expected at least %d fields for %s layout but found %d",
                            layout.getRequiredFields(), layout, fields.size()));
        }

        try {
            Integer year = requiredInt(fields, ColumnLayout.ELECTION_YEAR, "election year");
            Integer candidateNumber = requiredInt(fields, ColumnLayout.CANDIDATE_NUMBER, "candidate number");
            String region = text(fields, ColumnLayout.REGION);
            Integer officeCode = optionalInt(fields, ColumnLayout.OFFICE_CODE, "office code");

            if (!filter.accepts(year, region, officeCode)) {
                return RowParseResult.filtered("Row outside " + filter);
            }

            ElectionResultRow row = new ElectionResultRow();
            row.setElectionYear(year);
            row.setRoundNumber(optionalInt(fields, ColumnLayout.ROUND_NUMBER, "round number"));
            row.setElectionCode(optionalInt(fields, ColumnLayout.ELECTION_CODE, "election code"));
            row.setRegion(region);
            row.setElectoralUnit(text(fields, ColumnLayout.ELECTORAL_UNIT));
            row.setMunicipalityCode(optionalInt(fields, ColumnLayout.MUNICIPALITY_CODE, "municipality code"));
            row.setMunicipalityName(text(fields, ColumnLayout.MUNICIPALITY_NAME));
            row.setZoneNumber(optionalInt(fields, ColumnLayout.ZONE_NUMBER, "zone number"));
            row.setOfficeCode(officeCode);
            row.setOfficeName(text(fields, ColumnLayout.OFFICE_NAME));
            row.setCandidateSequence(text(fields, ColumnLayout.CANDIDATE_SEQUENCE));
            row.setCandidateNumber(candidateNumber);
            row.setCandidateName(text(fields, ColumnLayout.CANDIDATE_NAME));
            row.setBallotName(text(fields, ColumnLayout.BALLOT_NAME));
            row.setPartyNumber(optionalInt(fields, layout.getPartyNumber(), "party number"));
            row.setPartyAcronym(text(fields, layout.getPartyAcronym()));
            Long votes = optionalLong(fields, layout.getNominalVotes(), "nominal votes");
            row.setNominalVotes(votes != null ? votes : 0L);
            row.setResultStatus(text(fields, layout.getResultStatus()));

            row.setNaturalKey(ElectionResultRow.buildNaturalKey(row.getElectionYear(), row.getRoundNumber(),
                    row.getRegion(), row.getMunicipalityCode(), row.getZoneNumber(), row.getOfficeCode(),
                    row.getCandidateSequence(), row.getCandidateNumber()));

            return RowParseResult.valid(row);

        } catch (FieldException e) {
            return RowParseResult.invalid(e.errorType, e.getMessage());
        }
    }

    public ColumnLayout getLayout() {
        return layout;
    }

    /**
     * Field value with the published null markers (#NULO, #NE) and empty text mapped to null.
     */
    static String text(List<String> fields, int index) {
        String value = fields.get(index);
        if (value.isEmpty() || "#NULO".equals(value) || "#NE".equals(value)) {
            return null;
        }
        return value;
    }

    private static Integer requiredInt(List<String> fields, int index, String name) {
        Integer value = optionalInt(fields, index, name);
        if (value == null) {
            throw new FieldException(ErrorType.MISSING_FIELD, "Missing required field: " + name);
        }
        return value;
    }

    private static Integer optionalInt(List<String> fields, int index, String name) {
        Long value = optionalLong(fields, index, name);
        if (value == null) {
            return null;
        }
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new FieldException(ErrorType.INVALID_NUMBER, "Field '" + name + "' is out of range: " + value);
        }
        return value.intValue();
    }

    private static Long optionalLong(List<String> fields, int index, String name) {
        String value = text(fields, index);
        if (value == null) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new FieldException(ErrorType.INVALID_NUMBER,
                    "Field '" + name + "' is not a number: '" + value + "'");
        }
    }

    private static class FieldException extends RuntimeException {
        private final ErrorType errorType;

        FieldException(ErrorType errorType, String message) {
            super(message);
            this.errorType = errorType;
        }
    }
}
