package lovedata.menus.cleaning.transformer;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.math.BigDecimal;

/**
 * Integer counters (page_count, dish_count). Whole-number text such as
 * "12" or "12.0" is kept; anything else becomes NULL.
 */
@Slf4j
public class CountTransformer implements ColumnTransformer<Integer> {

    private final String fieldName;

    public CountTransformer(String fieldName) {
        this.fieldName = fieldName;
    }

    @Override
    public String getFieldName() {
        return fieldName;
    }

    @Override
    public FieldResult<Integer> transform(RawMenuRecord record) {
        String raw = record.get(fieldName);
        String value = NormalizationPrimitives.blankToNull(raw);
        if (value == null) {
            return FieldResult.of(raw, null);
        }
        try {
            return FieldResult.of(raw, new BigDecimal(value).intValueExact());
        } catch (NumberFormatException | ArithmeticException e) {
            log.debug("Menu {}: {} '{}' is not a whole number, set to NULL", record.get(MenuFields.ID), fieldName, raw);
            return FieldResult.fallback(raw, null);
        }
    }
}
