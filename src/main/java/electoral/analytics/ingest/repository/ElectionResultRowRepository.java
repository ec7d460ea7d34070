package electoral.analytics.ingest.repository;

import electoral.analytics.ingest.model.ElectionResultRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface ElectionResultRowRepository extends JpaRepository<ElectionResultRow, Long> {

    boolean existsByNaturalKey(String naturalKey);

    long countByImportJobId(Long importJobId);

    @Modifying
    @Transactional
    @Query("DELETE FROM ElectionResultRow r WHERE r.importJobId = :jobId")
    int deleteByImportJobId(@Param("jobId") Long jobId);

    @Modifying
    @Transactional
    @Query("""
        DELETE FROM ElectionResultRow r
        WHERE r.importJobId = :jobId
          AND r.sourceRowNumber >= :firstRow
          AND r.sourceRowNumber <= :lastRow
    """)
    int deleteByImportJobIdAndSourceRowRange(@Param("jobId") Long jobId,
                                            @Param("firstRow") Long firstRow,
                                            @Param("lastRow") Long lastRow);
}
