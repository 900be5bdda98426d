package lovedata.menus.cleaning.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import lovedata.menus.cleaning.model.FieldAuditEntry;
import lovedata.menus.cleaning.model.UnmappedValueEntry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted audit of one run, assembled from the field and unmapped value rows.
 */
@Data
@NoArgsConstructor
public class RunAuditDto {

    @JsonProperty("run_id")
    private UUID runId;

    @JsonProperty("fields")
    private List<FieldAuditDto> fields = new ArrayList<>();

    public static RunAuditDto of(UUID runId, List<FieldAuditEntry> fieldEntries,
                                 List<UnmappedValueEntry> unmappedEntries) {
        RunAuditDto dto = new RunAuditDto();
        dto.setRunId(runId);

        Map<String, FieldAuditDto> byField = new LinkedHashMap<>();
        for (FieldAuditEntry entry : fieldEntries) {
            byField.put(entry.getFieldName(), new FieldAuditDto(entry));
        }
        for (UnmappedValueEntry entry : unmappedEntries) {
            FieldAuditDto field = byField.get(entry.getFieldName());
            if (field != null) {
                field.getUnmappedValues().put(entry.getRawValue(), entry.getOccurrenceCount());
            }
        }
        dto.setFields(new ArrayList<>(byField.values()));
        return dto;
    }
}
