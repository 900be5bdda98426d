package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.model.AuditReport;
import lovedata.menus.cleaning.model.CleaningRun;
import lovedata.menus.cleaning.model.FieldAuditEntry;
import lovedata.menus.cleaning.model.UnmappedValueEntry;
import lovedata.menus.cleaning.repository.CleaningRunRepository;
import lovedata.menus.cleaning.repository.FieldAuditEntryRepository;
import lovedata.menus.cleaning.repository.UnmappedValueEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Service for cleaning run records and their persisted audit, using Spring Data JPA
 */
@Service
@Transactional
public class CleaningRunService {

    private static final Logger logger = LoggerFactory.getLogger(CleaningRunService.class);

    @Autowired
    private CleaningRunRepository runRepository;

    @Autowired
    private FieldAuditEntryRepository fieldAuditRepository;

    @Autowired
    private UnmappedValueEntryRepository unmappedValueRepository;

    public CleaningRun save(CleaningRun run) {
        CleaningRun saved = runRepository.save(run);
        logger.info("Saved cleaning run {} for file {}", saved.getRunId(), saved.getSourceFileName());
        return saved;
    }

    public CleaningRun update(CleaningRun run) {
        CleaningRun updated = runRepository.save(run);
        logger.debug("Updated cleaning run {} with status {}", updated.getRunId(), updated.getStatus());
        return updated;
    }

    @Transactional(readOnly = true)
    public CleaningRun findByRunId(UUID runId) {
        return runRepository.findByRunId(runId).orElse(null);
    }

    /**
     * Latest COMPLETED run of a file with this checksum (idempotency check).
     */
    @Transactional(readOnly = true)
    public CleaningRun findCompletedByChecksum(String checksum) {
        try {
            return runRepository.findFirstByFileChecksumAndStatusOrderByCreatedAtDesc(
                    checksum, CleaningRun.Status.COMPLETED).orElse(null);
        } catch (RuntimeException e) {
            // Treated as not yet processed
            logger.warn("Could not search for existing run by checksum: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Store one row per audited field and one row per distinct unmapped value.
     */
    public void saveAuditReport(UUID runId, AuditReport auditReport) {
        List<FieldAuditEntry> fieldEntries = new ArrayList<>();
        List<UnmappedValueEntry> unmappedEntries = new ArrayList<>();

        auditReport.getFields().forEach((field, audit) -> {
            fieldEntries.add(FieldAuditEntry.of(runId, field, audit));
            audit.getUnmappedValues().forEach((rawValue, count) ->
                    unmappedEntries.add(UnmappedValueEntry.of(runId, field, rawValue, count)));
        });

        fieldAuditRepository.saveAll(fieldEntries);
        unmappedValueRepository.saveAll(unmappedEntries);
        logger.info("Saved audit for run {}: {} fields, {} distinct unmapped values",
                runId, fieldEntries.size(), unmappedEntries.size());
    }

    @Transactional(readOnly = true)
    public List<FieldAuditEntry> findFieldAudit(UUID runId) {
        return fieldAuditRepository.findByRunIdOrderByFieldName(runId);
    }

    @Transactional(readOnly = true)
    public List<UnmappedValueEntry> findUnmappedValues(UUID runId) {
        return unmappedValueRepository.findByRunIdOrderByFieldNameAscOccurrenceCountDesc(runId);
    }
}
