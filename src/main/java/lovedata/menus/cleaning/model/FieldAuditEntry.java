package lovedata.menus.cleaning.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Persisted audit counters of one field in one cleaning run.
 */
@Entity
@Table(name = "cleaning_field_audit", indexes = {
        @Index(name = "idx_field_audit_run", columnList = "run_id")
})
@Getter
@Setter
public class FieldAuditEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, columnDefinition = "UUID")
    private UUID runId;

    @Column(name = "field_name", nullable = false, length = 64)
    private String fieldName;

    @Column(name = "total_count", nullable = false)
    private Long totalCount;

    @Column(name = "nulled_count", nullable = false)
    private Long nulledCount;

    @Column(name = "fallback_count", nullable = false)
    private Long fallbackCount;

    @Column(name = "changed_count", nullable = false)
    private Long changedCount;

    @Column(name = "unmapped_count", nullable = false)
    private Long unmappedCount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static FieldAuditEntry of(UUID runId, String fieldName, FieldAudit audit) {
        FieldAuditEntry entry = new FieldAuditEntry();
        entry.setRunId(runId);
        entry.setFieldName(fieldName);
        entry.setTotalCount(audit.getTotal());
        entry.setNulledCount(audit.getNulled());
        entry.setFallbackCount(audit.getFallbackCount());
        entry.setChangedCount(audit.getChanged());
        entry.setUnmappedCount(audit.getUnmappedValues().values().stream().mapToLong(Long::longValue).sum());
        return entry;
    }
}
