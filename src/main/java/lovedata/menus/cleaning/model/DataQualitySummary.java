package lovedata.menus.cleaning.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Final data-quality snapshot of a cleaned record set.
 */
@Value
@Builder
public class DataQualitySummary {

    @JsonProperty("total_rows")
    long totalRows;

    @JsonProperty("unique_ids")
    long uniqueIds;

    @JsonProperty("missing_names")
    long missingNames;

    @JsonProperty("missing_dates")
    long missingDates;

    @JsonProperty("earliest_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate earliestDate;

    @JsonProperty("latest_date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate latestDate;

    public static DataQualitySummary from(List<CleanedMenuRecord> records) {
        Set<Integer> ids = new HashSet<>();
        long missingNames = 0;
        long missingDates = 0;
        LocalDate earliest = null;
        LocalDate latest = null;

        for (CleanedMenuRecord record : records) {
            ids.add(record.getId());
            if (record.getName() == null) {
                missingNames++;
            }
            LocalDate date = record.getDate();
            if (date == null) {
                missingDates++;
                continue;
            }
            if (earliest == null || date.isBefore(earliest)) {
                earliest = date;
            }
            if (latest == null || date.isAfter(latest)) {
                latest = date;
            }
        }

        return DataQualitySummary.builder()
                .totalRows(records.size())
                .uniqueIds(ids.size())
                .missingNames(missingNames)
                .missingDates(missingDates)
                .earliestDate(earliest)
                .latestDate(latest)
                .build();
    }
}
