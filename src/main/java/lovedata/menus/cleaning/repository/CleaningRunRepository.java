package lovedata.menus.cleaning.repository;

import lovedata.menus.cleaning.model.CleaningRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for CleaningRun entity
 */
@Repository
public interface CleaningRunRepository extends JpaRepository<CleaningRun, Long> {

    Optional<CleaningRun> findByRunId(UUID runId);

    /**
     * Most recent run of a file with this checksum in the given status.
     * With COMPLETED this is the idempotency check for re-uploads.
     */
    Optional<CleaningRun> findFirstByFileChecksumAndStatusOrderByCreatedAtDesc(String fileChecksum, CleaningRun.Status status);

    List<CleaningRun> findByStatusOrderByCreatedAtDesc(CleaningRun.Status status);
}
