package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.model.MenuFields;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static lovedata.menus.cleaning.util.TestDataFactory.field;
import static org.assertj.core.api.Assertions.assertThat;

class PlaceTransformerTest {

    private final PlaceTransformer transformer = new PlaceTransformer(abbreviations(), "unknown");

    private static Map<String, String> abbreviations() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("ny", "NY");
        map.put("ca", "CA");
        map.put("cal", "CA");
        map.put("fla", "FL");
        return map;
    }

    private String clean(String raw) {
        return transformer.transform(field(MenuFields.PLACE, raw)).getValue();
    }

    @Test
    void testTransform_StateAbbreviationCanonicalized() {
        assertThat(clean("Albany, ny")).isEqualTo("Albany, NY");
        assertThat(clean("San Francisco,cal.")).isEqualTo("San Francisco, CA");
        assertThat(clean("Palm Beach, Fla;")).isEqualTo("Palm Beach, FL");
    }

    @Test
    void testTransform_AbbreviationOnlyAfterComma() {
        assertThat(clean("Albany ny")).isEqualTo("Albany ny");
    }

    @Test
    void testTransform_NoiseAndCurlyQuotesRemoved() {
        assertThat(clean("“[Hot Springs], Ark?”")).isEqualTo("Hot Springs, Ark");
    }

    @Test
    void testTransform_Unknown_FallbackNull() {
        FieldResult<String> result = transformer.transform(field(MenuFields.PLACE, "UNKNOWN"));

        assertThat(result.getValue()).isNull();
        assertThat(result.isFallback()).isTrue();
        assertThat(result.isNulled()).isTrue();
    }

    @Test
    void testTransform_UnknownInsideValue_Kept() {
        assertThat(clean("unknown hotel, ny")).isEqualTo("unknown hotel, NY");
    }

    @Test
    void testTransform_IdempotentOnOwnOutput() {
        String once = clean("Albany, ny;");
        assertThat(clean(once)).isEqualTo(once);
    }
}
