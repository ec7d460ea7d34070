package electoral.analytics.ingest.parser;

import electoral.analytics.ingest.model.ImportJob;

/**
 * Ingestion-time filters of a job. A null criterion accepts every value.
 */
public class RowFilter {

    private static final RowFilter NONE = new RowFilter(null, null, null);

    private final Integer electionYear;
    private final String region;
    private final Integer officeCode;

    public RowFilter(Integer electionYear, String region, Integer officeCode) {
        this.electionYear = electionYear;
        this.region = region;
        this.officeCode = officeCode;
    }

    public static RowFilter none() {
        return NONE;
    }

    public static RowFilter forJob(ImportJob job) {
        return new RowFilter(job.getElectionYear(), job.getRegion(), job.getCategoryCode());
    }

    public boolean accepts(Integer rowYear, String rowRegion, Integer rowOfficeCode) {
        if (electionYear != null && !electionYear.equals(rowYear)) {
            return false;
        }
        if (region != null && !region.equalsIgnoreCase(rowRegion)) {
            return false;
        }
        return officeCode == null || officeCode.equals(rowOfficeCode);
    }

    @Override
    public String toString() {
        return "RowFilter{year=" + electionYear + ", region=" + region + ", office=" + officeCode + "}";
    }
}
