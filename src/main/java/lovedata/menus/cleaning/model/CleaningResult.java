package lovedata.menus.cleaning.model;

import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * Output of one pipeline run: cleaned records in input order plus the audit.
 */
@Getter
@ToString(exclude = "records")
public class CleaningResult {

    private final List<CleanedMenuRecord> records;
    private final AuditReport auditReport;
    private final LocalDate runDate;
    private final DataQualitySummary summary;

    public CleaningResult(List<CleanedMenuRecord> records, AuditReport auditReport, LocalDate runDate) {
        this.records = List.copyOf(records);
        this.auditReport = auditReport;
        this.runDate = runDate;
        this.summary = DataQualitySummary.from(this.records);
    }

    public int getRecordCount() {
        return records.size();
    }
}
