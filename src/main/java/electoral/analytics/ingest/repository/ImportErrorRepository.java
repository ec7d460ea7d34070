package electoral.analytics.ingest.repository;

import electoral.analytics.ingest.model.ImportError;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface ImportErrorRepository extends JpaRepository<ImportError, Long> {

    /**
     * Find all errors for a job in source order
     */
    List<ImportError> findByJobIdOrderByRowNumberAsc(Long jobId);

    Page<ImportError> findByJobId(Long jobId, Pageable pageable);

    Page<ImportError> findByJobIdAndErrorType(Long jobId, ImportError.ErrorType errorType, Pageable pageable);

    long countByJobId(Long jobId);

    /**
     * Remove the errors recorded for a row range before it is reprocessed
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM ImportError e WHERE e.jobId = :jobId AND e.rowNumber >= :firstRow AND e.rowNumber <= :lastRow")
    int deleteByJobIdAndRowRange(@Param("jobId") Long jobId,
                                 @Param("firstRow") Long firstRow,
                                 @Param("lastRow") Long lastRow);

    @Modifying
    @Transactional
    @Query("DELETE FROM ImportError e WHERE e.jobId = :jobId")
    int deleteByJobId(@Param("jobId") Long jobId);
}
