package lovedata.menus.cleaning.repository;

import lovedata.menus.cleaning.model.FieldAuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface FieldAuditEntryRepository extends JpaRepository<FieldAuditEntry, Long> {

    List<FieldAuditEntry> findByRunIdOrderByFieldName(UUID runId);
}
