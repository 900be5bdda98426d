package lovedata.menus.cleaning.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lovedata.menus.cleaning.model.AuditReport;
import lovedata.menus.cleaning.model.CleanedMenuRecord;
import lovedata.menus.cleaning.model.CleaningResult;
import lovedata.menus.cleaning.model.DataQualitySummary;

import java.time.LocalDate;
import java.util.List;

/**
 * Cleaned records and audit for a preview request; nothing is persisted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleaningPreviewResponseDto {

    @JsonProperty("run_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    private LocalDate runDate;

    @JsonProperty("record_count")
    private int recordCount;

    @JsonProperty("records")
    private List<CleanedMenuRecord> records;

    @JsonProperty("audit")
    private AuditReport audit;

    @JsonProperty("summary")
    private DataQualitySummary summary;

    public static CleaningPreviewResponseDto from(CleaningResult result) {
        return new CleaningPreviewResponseDto(
                result.getRunDate(),
                result.getRecordCount(),
                result.getRecords(),
                result.getAuditReport(),
                result.getSummary());
    }
}
