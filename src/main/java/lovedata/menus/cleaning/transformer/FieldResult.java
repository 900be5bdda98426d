package lovedata.menus.cleaning.transformer;

import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * Outcome of one column transformer on one record.
 *
 * Carries the raw source text next to the new value so the audit report can
 * diff before/after without touching the input record. {@code fallback} marks
 * a content defect that was resolved to a defined default; {@code unmappedValue}
 * names the lookup key a mapping table did not know.
 */
@Getter
@ToString
public final class FieldResult<T> {

    private final String rawValue;
    private final T value;
    private final boolean fallback;
    private final String unmappedValue;

    private FieldResult(String rawValue, T value, boolean fallback, String unmappedValue) {
        this.rawValue = rawValue;
        this.value = value;
        this.fallback = fallback;
        this.unmappedValue = unmappedValue;
    }

    public static <T> FieldResult<T> of(String rawValue, T value) {
        return new FieldResult<>(rawValue, value, false, null);
    }

    public static <T> FieldResult<T> fallback(String rawValue, T value) {
        return new FieldResult<>(rawValue, value, true, null);
    }

    public static <T> FieldResult<T> unmapped(String rawValue, T value, String unmappedValue) {
        return new FieldResult<>(rawValue, value, true, unmappedValue);
    }

    /**
     * Source had content but the output is null.
     */
    public boolean isNulled() {
        return NormalizationPrimitives.blankToNull(rawValue) != null && getValueAsText() == null;
    }

    public boolean isChanged() {
        return !Objects.equals(rawValue, getValueAsText());
    }

    public boolean isUnmapped() {
        return unmappedValue != null;
    }

    public String getValueAsText() {
        return value == null ? null : value.toString();
    }
}
