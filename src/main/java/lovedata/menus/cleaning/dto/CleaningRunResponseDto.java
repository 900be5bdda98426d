package lovedata.menus.cleaning.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lovedata.menus.cleaning.model.AuditReport;
import lovedata.menus.cleaning.model.CleaningRun;
import lovedata.menus.cleaning.model.DataQualitySummary;
import lovedata.menus.cleaning.service.MenuCleaningService.CleaningOutcome;

import java.util.UUID;

/**
 * Response of a cleaning upload.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CleaningRunResponseDto {

    @JsonProperty("run_id")
    private UUID runId;

    @JsonProperty("file_name")
    private String fileName;

    @JsonProperty("target_table")
    private String targetTable;

    @JsonProperty("file_size_bytes")
    private Long fileSizeBytes;

    @JsonProperty("status")
    private String status;

    @JsonProperty("message")
    private String message;

    @JsonProperty("duplicate_of_run_id")
    private UUID duplicateOfRunId;

    @JsonProperty("loaded_records")
    private Long loadedRecords;

    @JsonProperty("summary")
    private DataQualitySummary summary;

    @JsonProperty("audit")
    private AuditReport audit;

    public static CleaningRunResponseDto from(CleaningOutcome outcome) {
        CleaningRun run = outcome.getRun();
        CleaningRunResponseDto dto = new CleaningRunResponseDto();
        dto.setRunId(run.getRunId());
        dto.setFileName(run.getSourceFileName());
        dto.setTargetTable(run.getTargetTable());
        dto.setFileSizeBytes(run.getFileSizeBytes());
        dto.setStatus(run.getStatus().name());

        if (outcome.isDuplicate()) {
            dto.setDuplicateOfRunId(run.getDuplicateOfRunId());
            dto.setMessage(String.format(
                    "File already cleaned by run %s. No duplicate data was loaded.", run.getDuplicateOfRunId()));
        } else {
            dto.setLoadedRecords(run.getLoadedRecords());
            dto.setSummary(outcome.getResult().getSummary());
            dto.setAudit(outcome.getResult().getAuditReport());
            dto.setMessage("Menu file cleaned and loaded successfully");
        }
        return dto;
    }
}
