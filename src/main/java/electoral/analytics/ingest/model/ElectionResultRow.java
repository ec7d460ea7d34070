package electoral.analytics.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A typed candidate vote row imported from a government result file.
 *
 * The natural key (year, round, region, municipality, zone, office, candidate)
 * is unique across all jobs; a row whose key is already present is counted as
 * skipped instead of inserted.
 */
@Entity
@Table(name = "election_result_rows", indexes = {
        @Index(name = "idx_result_rows_job", columnList = "import_job_id"),
        @Index(name = "idx_result_rows_job_source_row", columnList = "import_job_id, source_row_number")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uq_result_rows_natural_key", columnNames = {"natural_key"})
})
@Getter
@Setter
@NoArgsConstructor
public class ElectionResultRow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "import_job_id", nullable = false)
    private Long importJobId;

    @Column(name = "source_row_number", nullable = false)
    private Long sourceRowNumber;

    @Column(name = "natural_key", nullable = false, length = 255)
    private String naturalKey;

    @Column(name = "election_year", nullable = false)
    private Integer electionYear;

    @Column(name = "round_number")
    private Integer roundNumber;

    @Column(name = "election_code")
    private Integer electionCode;

    @Column(name = "region", length = 2)
    private String region;

    @Column(name = "electoral_unit", length = 10)
    private String electoralUnit;

    @Column(name = "municipality_code")
    private Integer municipalityCode;

    @Column(name = "municipality_name", length = 255)
    private String municipalityName;

    @Column(name = "zone_number")
    private Integer zoneNumber;

    @Column(name = "office_code")
    private Integer officeCode;

    @Column(name = "office_name", length = 255)
    private String officeName;

    @Column(name = "candidate_sequence", length = 30)
    private String candidateSequence;

    @Column(name = "candidate_number", nullable = false)
    private Integer candidateNumber;

    @Column(name = "candidate_name", length = 255)
    private String candidateName;

    @Column(name = "ballot_name", length = 255)
    private String ballotName;

    @Column(name = "party_number")
    private Integer partyNumber;

    @Column(name = "party_acronym", length = 50)
    private String partyAcronym;

    @Column(name = "nominal_votes")
    private Long nominalVotes;

    @Column(name = "result_status", length = 100)
    private String resultStatus;

    /**
     * Builds the deduplication key for this row from its identifying columns.
     */
    public static String buildNaturalKey(Integer electionYear, Integer roundNumber, String region,
                                         Integer municipalityCode, Integer zoneNumber, Integer officeCode,
                                         String candidateSequence, Integer candidateNumber) {
        // sequence is absent in some legacy files; the ballot number identifies the candidate there
        String candidate = candidateSequence != null ? candidateSequence : "n" + candidateNumber;
        return String.join("|",
                String.valueOf(electionYear),
                String.valueOf(roundNumber),
                String.valueOf(region),
                String.valueOf(municipalityCode),
                String.valueOf(zoneNumber),
                String.valueOf(officeCode),
                candidate);
    }
}
