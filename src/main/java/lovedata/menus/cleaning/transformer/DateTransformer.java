package lovedata.menus.cleaning.transformer;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the menu date against a fixed list of formats.
 *
 * - Strict resolution: "1900-02-30" is rejected, not rolled over
 * - Only dates inside [minDate, maxDate] are kept; anything else -> NULL
 *   (placeholder years such as 2928 and 0190 fall out here)
 */
@Slf4j
public class DateTransformer implements ColumnTransformer<LocalDate> {

    private final List<DateTimeFormatter> formats;
    private final LocalDate minDate;
    private final LocalDate maxDate;

    public DateTransformer(List<String> patterns, LocalDate minDate, LocalDate maxDate) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("At least one date format is required");
        }
        if (minDate == null || maxDate == null || minDate.isAfter(maxDate)) {
            throw new IllegalArgumentException("Invalid date bounds: [" + minDate + ", " + maxDate + "]");
        }
        List<DateTimeFormatter> compiled = new ArrayList<>();
        for (String pattern : patterns) {
            compiled.add(DateTimeFormatter.ofPattern(pattern.trim()).withResolverStyle(ResolverStyle.STRICT));
        }
        this.formats = List.copyOf(compiled);
        this.minDate = minDate;
        this.maxDate = maxDate;
    }

    @Override
    public String getFieldName() {
        return MenuFields.DATE;
    }

    @Override
    public FieldResult<LocalDate> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.DATE);
        if (NormalizationPrimitives.blankToNull(raw) == null) {
            return FieldResult.of(raw, null);
        }

        LocalDate parsed = NormalizationPrimitives.parseDateMulti(raw, formats, minDate, maxDate);
        if (parsed == null) {
            log.debug("Menu {}: date '{}' is unparseable or outside [{}, {}], set to NULL",
                    record.get(MenuFields.ID), raw, minDate, maxDate);
            return FieldResult.fallback(raw, null);
        }
        return FieldResult.of(raw, parsed);
    }

    public LocalDate getMinDate() {
        return minDate;
    }

    public LocalDate getMaxDate() {
        return maxDate;
    }
}
