package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Place of the menu event.
 *
 * Transformations applied:
 * 1. Brackets, parentheses, straight and curly quotes, "?" removed
 * 2. Whitespace collapsed, trailing ";.," removed
 * 3. "unknown" (whole value, any case) -> NULL
 * 4. Trailing state abbreviation after a comma canonicalized: "Albany, ny" -> "Albany, NY"
 */
public class PlaceTransformer implements ColumnTransformer<String> {

    private static final Pattern PLACE_NOISE = Pattern.compile("[\\[\\]()\"“”?]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[;.,]+$");

    private final String unknownMarker;
    private final List<StateAbbreviation> abbreviations;

    public PlaceTransformer(Map<String, String> stateAbbreviations, String unknownMarker) {
        this.unknownMarker = unknownMarker == null ? null : unknownMarker.trim();
        List<StateAbbreviation> compiled = new ArrayList<>();
        if (stateAbbreviations != null) {
            stateAbbreviations.forEach((abbreviation, code) -> compiled.add(new StateAbbreviation(abbreviation, code)));
        }
        // "cal" before "ca"
        compiled.sort(Comparator.comparingInt((StateAbbreviation a) -> a.abbreviation.length()).reversed());
        this.abbreviations = List.copyOf(compiled);
    }

    @Override
    public String getFieldName() {
        return MenuFields.PLACE;
    }

    @Override
    public FieldResult<String> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.PLACE);

        String value = NormalizationPrimitives.stripNoise(raw, PLACE_NOISE);
        value = NormalizationPrimitives.stripTrailing(value, TRAILING_PUNCTUATION);
        if (value == null) {
            return NormalizationPrimitives.blankToNull(raw) == null
                    ? FieldResult.of(raw, null)
                    : FieldResult.fallback(raw, null);
        }
        if (unknownMarker != null && value.equalsIgnoreCase(unknownMarker)) {
            return FieldResult.fallback(raw, null);
        }

        for (StateAbbreviation abbreviation : abbreviations) {
            String replaced = abbreviation.apply(value);
            if (!replaced.equals(value)) {
                value = replaced;
                break;
            }
        }
        return FieldResult.of(raw, value);
    }

    private static final class StateAbbreviation {

        private final String abbreviation;
        private final Pattern pattern;
        private final String replacement;

        StateAbbreviation(String abbreviation, String code) {
            if (abbreviation == null || abbreviation.trim().isEmpty() || code == null || code.trim().isEmpty()) {
                throw new IllegalArgumentException("Invalid state abbreviation: " + abbreviation + " -> " + code);
            }
            this.abbreviation = abbreviation.trim().toLowerCase(Locale.ROOT);
            this.pattern = Pattern.compile(",\\s*" + Pattern.quote(this.abbreviation) + "$", Pattern.CASE_INSENSITIVE);
            this.replacement = ", " + code.trim().toUpperCase(Locale.ROOT);
        }

        String apply(String value) {
            return pattern.matcher(value).replaceFirst(replacement);
        }
    }
}
