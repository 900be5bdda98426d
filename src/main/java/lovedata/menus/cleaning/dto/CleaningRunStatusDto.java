package lovedata.menus.cleaning.dto;

import lombok.Data;
import lombok.NoArgsConstructor;
import lovedata.menus.cleaning.model.CleaningRun;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for cleaning run status responses
 */
@Data
@NoArgsConstructor
public class CleaningRunStatusDto {

    private UUID runId;
    private String fileName;
    private String targetTable;
    private String status;
    private LocalDate runDate;
    private Long inputRecords;
    private Long cleanedRecords;
    private Long loadedRecords;
    private Long uniqueIds;
    private Long missingNames;
    private Long missingDates;
    private LocalDate earliestDate;
    private LocalDate latestDate;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long processingDurationMs;
    private UUID duplicateOfRunId;
    private String errorMessage;

    public CleaningRunStatusDto(CleaningRun run) {
        this.runId = run.getRunId();
        this.fileName = run.getSourceFileName();
        this.targetTable = run.getTargetTable();
        this.status = run.getStatus().name();
        this.runDate = run.getRunDate();
        this.inputRecords = run.getInputRecords();
        this.cleanedRecords = run.getCleanedRecords();
        this.loadedRecords = run.getLoadedRecords();
        this.uniqueIds = run.getUniqueIds();
        this.missingNames = run.getMissingNames();
        this.missingDates = run.getMissingDates();
        this.earliestDate = run.getEarliestDate();
        this.latestDate = run.getLatestDate();
        this.startedAt = run.getStartedAt();
        this.completedAt = run.getCompletedAt();
        this.processingDurationMs = run.getProcessingDurationMs();
        this.duplicateOfRunId = run.getDuplicateOfRunId();
        this.errorMessage = run.getErrorMessage();
    }
}
