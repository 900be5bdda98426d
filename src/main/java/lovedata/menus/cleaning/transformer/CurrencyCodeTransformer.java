package lovedata.menus.cleaning.transformer;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.mapping.MappingTable;
import lovedata.menus.cleaning.model.CurrencyCode;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.List;

/**
 * Turns the raw {@code currency_symbol} into an ISO-style code.
 *
 * Symbol lookup is exact ("F" and "f" are both NLG, "FF" is FRF). Values
 * that already are one of the known codes map to themselves.
 */
@Slf4j
public class CurrencyCodeTransformer implements ColumnTransformer<String> {

    private final MappingTable symbolTable;
    private final UnmappedSymbolPolicy unmappedPolicy;

    public CurrencyCodeTransformer(MappingTable symbolTable, UnmappedSymbolPolicy unmappedPolicy) {
        if (symbolTable == null) {
            throw new IllegalArgumentException("Currency symbol table is required");
        }
        symbolTable.entries().forEach((symbol, code) -> {
            if (code == null || !CurrencyCode.isValid(code)) {
                throw new IllegalArgumentException(String.format(
                        "Currency symbol '%s' maps to '%s', which is not a known currency code", symbol, code));
            }
        });
        this.symbolTable = symbolTable;
        this.unmappedPolicy = unmappedPolicy == null ? UnmappedSymbolPolicy.PASS_THROUGH : unmappedPolicy;
    }

    @Override
    public String getFieldName() {
        return MenuFields.CURRENCY_CODE;
    }

    @Override
    public List<String> getSourceFields() {
        return List.of(MenuFields.CURRENCY_SYMBOL);
    }

    @Override
    public FieldResult<String> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.CURRENCY_SYMBOL);
        String symbol = NormalizationPrimitives.stripBracketedNoise(raw);
        if (symbol == null) {
            return FieldResult.of(raw, null);
        }

        if (symbolTable.contains(symbol)) {
            return FieldResult.of(raw, symbolTable.get(symbol));
        }
        if (CurrencyCode.isValid(symbol)) {
            return FieldResult.of(raw, symbol);
        }

        log.debug("Menu {}: currency symbol '{}' not in {} ({})",
                record.get(MenuFields.ID), symbol, symbolTable.getName(), unmappedPolicy);
        String value = unmappedPolicy == UnmappedSymbolPolicy.PASS_THROUGH ? symbol : null;
        return FieldResult.unmapped(raw, value, symbol);
    }

    public UnmappedSymbolPolicy getUnmappedPolicy() {
        return unmappedPolicy;
    }
}
