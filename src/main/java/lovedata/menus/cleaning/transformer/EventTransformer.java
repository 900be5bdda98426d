package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Event labels: noise stripped, upper-cased, known misspellings fixed.
 * "[?]'christman dinner" becomes "CHRISTMAS DINNER".
 */
public class EventTransformer implements ColumnTransformer<String> {

    private static final Pattern LEADING_APOSTROPHES = Pattern.compile("^'+");

    private final List<TypoFix> typoFixes;

    public EventTransformer(Map<String, String> typoFixes) {
        List<TypoFix> fixes = new ArrayList<>();
        if (typoFixes != null) {
            typoFixes.forEach((wrong, right) -> fixes.add(new TypoFix(wrong, right)));
        }
        this.typoFixes = List.copyOf(fixes);
    }

    @Override
    public String getFieldName() {
        return MenuFields.EVENT;
    }

    @Override
    public FieldResult<String> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.EVENT);

        String value = NormalizationPrimitives.stripBracketedNoise(raw);
        if (value != null) {
            value = LEADING_APOSTROPHES.matcher(value).replaceFirst("");
        }
        value = NormalizationPrimitives.uppercaseFold(value);
        for (TypoFix fix : typoFixes) {
            value = fix.apply(value);
        }
        return FieldResult.of(raw, NormalizationPrimitives.blankToNull(value));
    }

    private static final class TypoFix {

        private final Pattern pattern;
        private final String replacement;

        TypoFix(String wrong, String right) {
            if (wrong == null || wrong.trim().isEmpty() || right == null) {
                throw new IllegalArgumentException("Invalid event typo fix: " + wrong + " -> " + right);
            }
            this.pattern = Pattern.compile(Pattern.quote(wrong.trim()), Pattern.CASE_INSENSITIVE);
            this.replacement = Matcher.quoteReplacement(NormalizationPrimitives.uppercaseFold(right.trim()));
        }

        String apply(String value) {
            return value == null ? null : pattern.matcher(value).replaceAll(replacement);
        }
    }
}
