package electoral.analytics.ingest.repository;

import electoral.analytics.ingest.model.ImportBatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface ImportBatchRepository extends JpaRepository<ImportBatch, Long> {

    List<ImportBatch> findByJobIdOrderByBatchIndexAsc(Long jobId);

    List<ImportBatch> findByJobIdAndStatusOrderByBatchIndexAsc(Long jobId, ImportBatch.Status status);

    Optional<ImportBatch> findByIdAndJobId(Long id, Long jobId);

    long countByJobIdAndStatus(Long jobId, ImportBatch.Status status);

    /**
     * Aggregate counters over all batches of a job:
     * inserted, skipped, errors, duplicates
     */
    @Query("""
        SELECT
            COALESCE(SUM(b.insertedRows), 0),
            COALESCE(SUM(b.skippedRows), 0),
            COALESCE(SUM(b.errorCount), 0),
            COALESCE(SUM(b.duplicateRows), 0)
        FROM ImportBatch b
        WHERE b.jobId = :jobId
    """)
    List<Object[]> sumCountersByJobId(@Param("jobId") Long jobId);

    @Modifying
    @Transactional
    @Query("DELETE FROM ImportBatch b WHERE b.jobId = :jobId")
    int deleteByJobId(@Param("jobId") Long jobId);
}
