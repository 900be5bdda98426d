package lovedata.menus.cleaning.transformer;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits the collection marker off the library call number.
 *
 * "1900-2822_wotm" -> normalized "1900-2822", wotm = true.
 * A call number that is nothing but the marker ("*wotm") normalizes to NULL.
 */
public class CallNumberTransformer implements ColumnTransformer<CallNumberTransformer.CallNumberSplit> {

    private final String marker;
    private final Pattern markerOnly;
    private final Pattern markerSuffix;

    public CallNumberTransformer(String marker, String suffixSeparator) {
        if (marker == null || marker.trim().isEmpty()) {
            throw new IllegalArgumentException("Call number marker must not be blank");
        }
        this.marker = marker.trim().toLowerCase(Locale.ROOT);
        String separator = suffixSeparator == null ? "" : suffixSeparator;
        this.markerOnly = Pattern.compile("^[*\\s]*" + Pattern.quote(this.marker) + "$", Pattern.CASE_INSENSITIVE);
        this.markerSuffix = Pattern.compile(Pattern.quote(separator + this.marker) + "$", Pattern.CASE_INSENSITIVE);
    }

    @Override
    public String getFieldName() {
        return MenuFields.CALL_NUMBER;
    }

    @Override
    public FieldResult<CallNumberSplit> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.CALL_NUMBER);
        String value = NormalizationPrimitives.blankToNull(raw);
        if (value == null) {
            return FieldResult.of(raw, new CallNumberSplit(null, false));
        }

        boolean wotm = value.toLowerCase(Locale.ROOT).contains(marker);
        if (markerOnly.matcher(value).matches()) {
            return FieldResult.of(raw, new CallNumberSplit(null, true));
        }
        String normalized = NormalizationPrimitives.blankToNull(markerSuffix.matcher(value).replaceFirst(""));
        return FieldResult.of(raw, new CallNumberSplit(normalized, wotm));
    }

    /**
     * Normalized call number plus the derived collection flag. Renders as
     * the normalized call number so audit diffs compare text to text.
     */
    @Getter
    @EqualsAndHashCode
    public static final class CallNumberSplit {

        private final String normalized;
        private final boolean wotm;

        public CallNumberSplit(String normalized, boolean wotm) {
            this.normalized = normalized;
            this.wotm = wotm;
        }

        @Override
        public String toString() {
            return normalized;
        }
    }
}
