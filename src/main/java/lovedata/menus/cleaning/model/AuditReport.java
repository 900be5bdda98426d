package lovedata.menus.cleaning.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import lovedata.menus.cleaning.transformer.FieldResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-field audit of one cleaning run: field name -> {@link FieldAudit}.
 * Fields keep the order in which they were first recorded.
 */
@ToString
@EqualsAndHashCode
public class AuditReport {

    private final Map<String, FieldAudit> fields = new LinkedHashMap<>();

    public void record(String field, FieldResult<?> result) {
        fields.computeIfAbsent(field, key -> new FieldAudit()).record(result);
    }

    /**
     * Add another report's counters into this one.
     */
    public AuditReport merge(AuditReport other) {
        other.fields.forEach((field, audit) ->
                fields.computeIfAbsent(field, key -> new FieldAudit()).merge(audit));
        return this;
    }

    /**
     * @return the field's counters, or an all-zero audit if the field was never recorded
     */
    public FieldAudit getField(String field) {
        FieldAudit audit = fields.get(field);
        return audit != null ? audit : new FieldAudit();
    }

    @JsonValue
    public Map<String, FieldAudit> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }
}
