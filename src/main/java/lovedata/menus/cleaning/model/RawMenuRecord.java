package lovedata.menus.cleaning.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One menu as it arrives from the source: a loosely typed map of column
 * name to raw text. Immutable; transformers read from it and never write.
 *
 * Absent columns and empty cells both read as {@code null}.
 */
@ToString
@EqualsAndHashCode
public final class RawMenuRecord {

    private final Map<String, String> fields;

    private RawMenuRecord(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawMenuRecord of(Map<String, String> fields) {
        if (fields == null) {
            throw new IllegalArgumentException("Raw record fields must not be null");
        }
        return new RawMenuRecord(fields);
    }

    public String get(String field) {
        return fields.get(field);
    }

    /**
     * Whether the source carried this column at all (even if the cell was empty).
     */
    public boolean hasColumn(String field) {
        return fields.containsKey(field);
    }

    public Set<String> columnNames() {
        return fields.keySet();
    }

    public Map<String, String> asMap() {
        return fields;
    }
}
