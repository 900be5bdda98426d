package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.mapping.MappingTable;
import lovedata.menus.cleaning.model.MenuFields;
import org.junit.jupiter.api.Test;

import static lovedata.menus.cleaning.util.TestDataFactory.field;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CurrencyTransformer and CurrencyCodeTransformer
 */
class CurrencyTransformerTest {

    private static final MappingTable SYMBOLS = MappingTable.builder("currency")
            .put("$", "USD")
            .put("Fr", "FRF")
            .put("FF", "FRF")
            .put("f", "NLG")
            .put("F", "NLG")
            .build();

    // ========== currency ==========

    @Test
    void testCurrency_Missing_UnknownSentinel() {
        CurrencyTransformer transformer = new CurrencyTransformer("Unknown");

        FieldResult<String> result = transformer.transform(field(MenuFields.CURRENCY, null));

        assertThat(result.getValue()).isEqualTo("Unknown");
        assertThat(result.isFallback()).isTrue();
        assertThat(result.isNulled()).isFalse();
    }

    @Test
    void testCurrency_PresentValueTrimmed() {
        CurrencyTransformer transformer = new CurrencyTransformer("Unknown");

        assertThat(transformer.transform(field(MenuFields.CURRENCY, " Dollars ")).getValue()).isEqualTo("Dollars");
    }

    // ========== currency_code ==========

    @Test
    void testCurrencyCode_ManySymbolsToOneCode() {
        CurrencyCodeTransformer transformer = new CurrencyCodeTransformer(SYMBOLS, UnmappedSymbolPolicy.PASS_THROUGH);

        assertThat(transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "Fr")).getValue()).isEqualTo("FRF");
        assertThat(transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "FF")).getValue()).isEqualTo("FRF");
    }

    @Test
    void testCurrencyCode_LookupIsCaseSensitive() {
        CurrencyCodeTransformer transformer = new CurrencyCodeTransformer(SYMBOLS, UnmappedSymbolPolicy.PASS_THROUGH);

        assertThat(transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "f")).getValue()).isEqualTo("NLG");
        assertThat(transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "[$]")).getValue()).isEqualTo("USD");
    }

    @Test
    void testCurrencyCode_IsoCodeIdentity() {
        CurrencyCodeTransformer transformer = new CurrencyCodeTransformer(SYMBOLS, UnmappedSymbolPolicy.PASS_THROUGH);

        FieldResult<String> result = transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "GBP"));

        assertThat(result.getValue()).isEqualTo("GBP");
        assertThat(result.isUnmapped()).isFalse();
    }

    @Test
    void testCurrencyCode_UnmappedPassThrough() {
        CurrencyCodeTransformer transformer = new CurrencyCodeTransformer(SYMBOLS, UnmappedSymbolPolicy.PASS_THROUGH);

        FieldResult<String> result = transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "Rs"));

        assertThat(result.getValue()).isEqualTo("Rs");
        assertThat(result.isUnmapped()).isTrue();
        assertThat(result.getUnmappedValue()).isEqualTo("Rs");
    }

    @Test
    void testCurrencyCode_UnmappedRejectToNull() {
        CurrencyCodeTransformer transformer = new CurrencyCodeTransformer(SYMBOLS, UnmappedSymbolPolicy.REJECT_TO_NULL);

        FieldResult<String> result = transformer.transform(field(MenuFields.CURRENCY_SYMBOL, "Rs"));

        assertThat(result.getValue()).isNull();
        assertThat(result.isUnmapped()).isTrue();
        assertThat(result.isNulled()).isTrue();
    }

    @Test
    void testCurrencyCode_ReadsCurrencySymbolColumn() {
        CurrencyCodeTransformer transformer = new CurrencyCodeTransformer(SYMBOLS, null);

        assertThat(transformer.getFieldName()).isEqualTo(MenuFields.CURRENCY_CODE);
        assertThat(transformer.getSourceFields()).containsExactly(MenuFields.CURRENCY_SYMBOL);
        assertThat(transformer.getUnmappedPolicy()).isEqualTo(UnmappedSymbolPolicy.PASS_THROUGH);
    }

    @Test
    void testCurrencyCode_TableWithUnknownCode_Throws() {
        MappingTable bad = MappingTable.builder("currency").put("R", "ZAR").build();

        assertThatThrownBy(() -> new CurrencyCodeTransformer(bad, UnmappedSymbolPolicy.PASS_THROUGH))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ZAR");
    }
}
