package lovedata.menus.cleaning.repository;

import lovedata.menus.cleaning.model.UnmappedValueEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface UnmappedValueEntryRepository extends JpaRepository<UnmappedValueEntry, Long> {

    /**
     * Unmapped values of a run, most frequent first within each field.
     */
    List<UnmappedValueEntry> findByRunIdOrderByFieldNameAscOccurrenceCountDesc(UUID runId);
}
