package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Occasion text: OCR repair and title casing.
 *
 * Transformations applied, in order:
 * 1. Lower-case
 * 2. OCR rules, in configured order ("0ther" -> "other", "aniv..." -> "anniv", ...)
 * 3. Brackets, quotes and "?" removed
 * 4. Title case, possessive "'S" back to "'s"
 * 5. Comma spacing normalized to ", "
 * 6. Trailing commas/semicolons removed
 * 7. Ordinal fix: "50nth" -> "50th"
 * 8. Whitespace collapsed, empty -> NULL
 */
public class OccasionTransformer implements ColumnTransformer<String> {

    private static final Pattern OCCASION_NOISE = Pattern.compile("[\\[\\]\"()?]+");
    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("\\s+,");
    private static final Pattern COMMA_SPACING = Pattern.compile(",\\s*");
    private static final Pattern TRAILING_SEPARATORS = Pattern.compile("[\\s,;]+$");
    private static final Pattern ORDINAL_NTH = Pattern.compile("(\\d+)nth\\b", Pattern.CASE_INSENSITIVE);

    private final List<OcrCorrectionRule> ocrRules;

    public OccasionTransformer(List<OcrCorrectionRule> ocrRules) {
        this.ocrRules = ocrRules == null ? List.of() : List.copyOf(ocrRules);
    }

    @Override
    public String getFieldName() {
        return MenuFields.OCCASION;
    }

    @Override
    public FieldResult<String> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.OCCASION);
        if (NormalizationPrimitives.blankToNull(raw) == null) {
            return FieldResult.of(raw, null);
        }

        String value = NormalizationPrimitives.lowercaseFold(raw);
        value = NormalizationPrimitives.ocrCorrect(value, ocrRules);
        value = OCCASION_NOISE.matcher(value).replaceAll("");
        value = NormalizationPrimitives.titleCaseFix(value);
        value = SPACE_BEFORE_COMMA.matcher(value).replaceAll(",");
        value = COMMA_SPACING.matcher(value).replaceAll(", ");
        value = NormalizationPrimitives.stripTrailing(value, TRAILING_SEPARATORS);
        if (value != null) {
            value = ORDINAL_NTH.matcher(value).replaceAll("$1th");
        }
        value = NormalizationPrimitives.blankToNull(NormalizationPrimitives.collapseWhitespace(value));
        return FieldResult.of(raw, value);
    }

    public List<OcrCorrectionRule> getOcrRules() {
        return ocrRules;
    }
}
