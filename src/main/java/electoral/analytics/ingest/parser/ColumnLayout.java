package electoral.analytics.ingest.parser;

/**
 * Column positions of the two published layouts of the candidate vote-by-zone files.
 *
 * LEGACY covers the 2002-2014 files (up to 38 columns), MODERN the 2016+ files (50 columns).
 * Both share positions up to the candidate ballot name. Field counts between the two match
 * neither layout.
 */
public enum ColumnLayout {

    LEGACY(38, 28, 29, 35, 37),
    MODERN(50, 34, 35, 49, 45);

    public static final int ELECTION_YEAR = 2;
    public static final int ROUND_NUMBER = 5;
    public static final int ELECTION_CODE = 6;
    public static final int REGION = 10;
    public static final int ELECTORAL_UNIT = 11;
    public static final int MUNICIPALITY_CODE = 13;
    public static final int MUNICIPALITY_NAME = 14;
    public static final int ZONE_NUMBER = 15;
    public static final int OFFICE_CODE = 16;
    public static final int OFFICE_NAME = 17;
    public static final int CANDIDATE_SEQUENCE = 18;
    public static final int CANDIDATE_NUMBER = 19;
    public static final int CANDIDATE_NAME = 20;
    public static final int BALLOT_NAME = 21;

    private final int requiredFields;
    private final int partyNumber;
    private final int partyAcronym;
    private final int resultStatus;
    private final int nominalVotes;

    ColumnLayout(int requiredFields, int partyNumber, int partyAcronym, int resultStatus, int nominalVotes) {
        this.requiredFields = requiredFields;
        this.partyNumber = partyNumber;
        this.partyAcronym = partyAcronym;
        this.resultStatus = resultStatus;
        this.nominalVotes = nominalVotes;
    }

    /**
     * Picks the layout from the field count of the header (or first data row).
     *
     * @throws IllegalArgumentException if the count lies between the two layouts
     */
    public static ColumnLayout detect(int fieldCount) {
        if (fieldCount <= LEGACY.requiredFields) {
            return LEGACY;
        }
        if (fieldCount >= MODERN.requiredFields) {
            return MODERN;
        }
        throw new IllegalArgumentException("Unrecognized column layout: " + fieldCount + " columns, expected up to "
                + LEGACY.requiredFields + " or at least " + MODERN.requiredFields);
    }

    public int getRequiredFields() {
        return requiredFields;
    }

    public int getPartyNumber() {
        return partyNumber;
    }

    public int getPartyAcronym() {
        return partyAcronym;
    }

    public int getResultStatus() {
        return resultStatus;
    }

    public int getNominalVotes() {
        return nominalVotes;
    }
}
