package lovedata.menus.cleaning.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Status and metadata of one cleaning run.
 * Maps to the cleaning_runs table in the default schema.
 */
@Entity
@Table(name = "cleaning_runs", indexes = {
        @Index(name = "idx_cleaning_runs_checksum", columnList = "file_checksum"),
        @Index(name = "idx_cleaning_runs_status", columnList = "status")
})
@Getter
@Setter
public class CleaningRun {

    public enum Status {
        PROCESSING, COMPLETED, FAILED, DUPLICATE
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, unique = true, columnDefinition = "UUID")
    private UUID runId;

    @Column(name = "source_file_name", nullable = false, length = 255)
    private String sourceFileName;

    @Column(name = "file_size_bytes", nullable = false)
    private Long fileSizeBytes;

    @Column(name = "file_checksum", nullable = false, length = 64)
    private String fileChecksum;

    @Column(name = "target_table", length = 128)
    private String targetTable;

    @Column(name = "run_date")
    private LocalDate runDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Column(name = "input_records")
    private Long inputRecords;

    @Column(name = "cleaned_records")
    private Long cleanedRecords;

    @Column(name = "loaded_records")
    private Long loadedRecords;

    // Data quality summary
    @Column(name = "unique_ids")
    private Long uniqueIds;

    @Column(name = "missing_names")
    private Long missingNames;

    @Column(name = "missing_dates")
    private Long missingDates;

    @Column(name = "earliest_date")
    private LocalDate earliestDate;

    @Column(name = "latest_date")
    private LocalDate latestDate;

    // Timing information
    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Earlier COMPLETED run of the same file, set on DUPLICATE runs
    @Column(name = "duplicate_of_run_id", columnDefinition = "UUID")
    private UUID duplicateOfRunId;

    @Column(name = "correlation_id", length = 64)
    private String correlationId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // Set when an idempotency check returned an earlier run; not persisted
    @Transient
    private boolean alreadyProcessed = false;

    public CleaningRun() {
        this.runId = UUID.randomUUID();
        this.status = Status.PROCESSING;
        this.inputRecords = 0L;
        this.cleanedRecords = 0L;
        this.loadedRecords = 0L;
    }

    public CleaningRun(String sourceFileName, Long fileSizeBytes, String fileChecksum) {
        this();
        this.sourceFileName = sourceFileName;
        this.fileSizeBytes = fileSizeBytes;
        this.fileChecksum = fileChecksum;
    }

    public void markAsProcessing() {
        this.status = Status.PROCESSING;
        this.startedAt = LocalDateTime.now();
    }

    public void markAsCompleted() {
        this.status = Status.COMPLETED;
        this.completedAt = LocalDateTime.now();
        updateDuration();
    }

    public void markAsFailed(String errorMessage) {
        this.status = Status.FAILED;
        this.completedAt = LocalDateTime.now();
        this.errorMessage = errorMessage;
        updateDuration();
    }

    /**
     * Record a re-upload of a file that an earlier run already cleaned.
     */
    public void markAsDuplicateOf(CleaningRun original) {
        this.status = Status.DUPLICATE;
        this.duplicateOfRunId = original.getRunId();
        this.runDate = original.getRunDate();
        this.targetTable = original.getTargetTable();
        this.completedAt = LocalDateTime.now();
        this.alreadyProcessed = true;
    }

    public void applySummary(DataQualitySummary summary) {
        this.cleanedRecords = summary.getTotalRows();
        this.uniqueIds = summary.getUniqueIds();
        this.missingNames = summary.getMissingNames();
        this.missingDates = summary.getMissingDates();
        this.earliestDate = summary.getEarliestDate();
        this.latestDate = summary.getLatestDate();
    }

    public boolean isCompleted() {
        return Status.COMPLETED.equals(this.status);
    }

    public boolean isFailed() {
        return Status.FAILED.equals(this.status);
    }

    private void updateDuration() {
        if (this.startedAt != null) {
            this.processingDurationMs = Duration.between(startedAt, completedAt).toMillis();
        }
    }
}
