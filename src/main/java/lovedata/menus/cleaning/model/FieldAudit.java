package lovedata.menus.cleaning.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lovedata.menus.cleaning.transformer.FieldResult;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counters for one field over a set of records. Counters only ever grow,
 * and {@link #merge(FieldAudit)} is plain addition, so shard audits can be
 * combined in any order.
 *
 * Not thread-safe; each shard fills its own instance.
 */
@Getter
@ToString
@EqualsAndHashCode
public class FieldAudit {

    @JsonProperty("total")
    private long total;

    @JsonProperty("nulled")
    private long nulled;

    @JsonProperty("fallback_count")
    private long fallbackCount;

    @JsonProperty("changed")
    private long changed;

    private final Map<String, Long> unmappedValues = new TreeMap<>();

    public void record(FieldResult<?> result) {
        total++;
        if (result.isNulled()) {
            nulled++;
        }
        if (result.isFallback()) {
            fallbackCount++;
        }
        if (result.isChanged()) {
            changed++;
        }
        if (result.isUnmapped()) {
            unmappedValues.merge(result.getUnmappedValue(), 1L, Long::sum);
        }
    }

    public FieldAudit merge(FieldAudit other) {
        total += other.total;
        nulled += other.nulled;
        fallbackCount += other.fallbackCount;
        changed += other.changed;
        other.unmappedValues.forEach((value, count) -> unmappedValues.merge(value, count, Long::sum));
        return this;
    }

    /**
     * Unmapped raw value -> occurrence count, sorted by value.
     */
    @JsonProperty("unmapped_values")
    public Map<String, Long> getUnmappedValues() {
        return Collections.unmodifiableMap(unmappedValues);
    }

    public long getUnmappedCount(String rawValue) {
        return unmappedValues.getOrDefault(rawValue, 0L);
    }
}
