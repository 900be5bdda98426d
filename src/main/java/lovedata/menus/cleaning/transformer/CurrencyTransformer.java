package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

/**
 * Currency name passes through trimmed; a missing one becomes the sentinel.
 */
public class CurrencyTransformer implements ColumnTransformer<String> {

    private final String unknownSentinel;

    public CurrencyTransformer(String unknownSentinel) {
        if (unknownSentinel == null || unknownSentinel.trim().isEmpty()) {
            throw new IllegalArgumentException("Currency sentinel must not be blank");
        }
        this.unknownSentinel = unknownSentinel.trim();
    }

    @Override
    public String getFieldName() {
        return MenuFields.CURRENCY;
    }

    @Override
    public FieldResult<String> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.CURRENCY);
        String value = NormalizationPrimitives.blankToNull(raw);
        if (value == null) {
            return FieldResult.fallback(raw, unknownSentinel);
        }
        return FieldResult.of(raw, value);
    }
}
