package lovedata.menus.cleaning.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A raw value no mapping table knew, with how often it occurred in a run.
 * Feeds the follow-up work of extending the mapping tables.
 */
@Entity
@Table(name = "cleaning_unmapped_values", indexes = {
        @Index(name = "idx_unmapped_run", columnList = "run_id"),
        @Index(name = "idx_unmapped_field", columnList = "field_name")
})
@Getter
@Setter
public class UnmappedValueEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, columnDefinition = "UUID")
    private UUID runId;

    @Column(name = "field_name", nullable = false, length = 64)
    private String fieldName;

    @Column(name = "raw_value", nullable = false, length = 500)
    private String rawValue;

    @Column(name = "occurrence_count", nullable = false)
    private Long occurrenceCount;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public static UnmappedValueEntry of(UUID runId, String fieldName, String rawValue, long occurrenceCount) {
        UnmappedValueEntry entry = new UnmappedValueEntry();
        entry.setRunId(runId);
        entry.setFieldName(fieldName);
        entry.setRawValue(rawValue);
        entry.setOccurrenceCount(occurrenceCount);
        return entry;
    }
}
