package lovedata.menus.cleaning.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lovedata.menus.cleaning.model.FieldAuditEntry;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FieldAuditDto {

    @JsonProperty("field")
    private String field;

    @JsonProperty("total")
    private long total;

    @JsonProperty("nulled")
    private long nulled;

    @JsonProperty("fallback_count")
    private long fallbackCount;

    @JsonProperty("changed")
    private long changed;

    @JsonProperty("unmapped_count")
    private long unmappedCount;

    // raw value -> occurrences, most frequent first
    @JsonProperty("unmapped_values")
    private Map<String, Long> unmappedValues = new LinkedHashMap<>();

    public FieldAuditDto(FieldAuditEntry entry) {
        this.field = entry.getFieldName();
        this.total = entry.getTotalCount();
        this.nulled = entry.getNulledCount();
        this.fallbackCount = entry.getFallbackCount();
        this.changed = entry.getChangedCount();
        this.unmappedCount = entry.getUnmappedCount();
    }
}
