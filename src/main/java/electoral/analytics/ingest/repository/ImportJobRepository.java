package electoral.analytics.ingest.repository;

import electoral.analytics.ingest.model.ImportJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for ImportJob entity
 */
@Repository
public interface ImportJobRepository extends JpaRepository<ImportJob, Long> {

    /**
     * Most recent job for a source key in one of the given statuses (duplicate-source detection)
     */
    Optional<ImportJob> findFirstBySourceKeyAndStatusInOrderByCreatedAtDesc(String sourceKey,
                                                                           Collection<ImportJob.Status> statuses);

    List<ImportJob> findAllByOrderByCreatedAtDesc();

    List<ImportJob> findByStatusOrderByCreatedAtDesc(ImportJob.Status status);

    /**
     * Jobs in any of the statuses, oldest first (startup recovery)
     */
    List<ImportJob> findByStatusInOrderByCreatedAtAsc(Collection<ImportJob.Status> statuses);

    List<ImportJob> findByParentJobIdOrderByIdAsc(Long parentJobId);
}
