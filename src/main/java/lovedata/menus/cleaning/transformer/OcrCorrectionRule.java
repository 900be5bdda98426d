package lovedata.menus.cleaning.transformer;

import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One regex substitution used to repair OCR noise. Rules are matched
 * case-insensitively and applied in list order by
 * {@link NormalizationPrimitives#ocrCorrect(String, java.util.List)}.
 */
@Getter
public final class OcrCorrectionRule {

    private static final Pattern GROUP_REFERENCE = Pattern.compile("\\$(\\d+)");

    private final String name;
    private final Pattern pattern;
    private final String replacement;

    private OcrCorrectionRule(String name, Pattern pattern, String replacement) {
        this.name = name;
        this.pattern = pattern;
        this.replacement = replacement;
    }

    /**
     * @throws IllegalArgumentException if the regex does not compile, or the
     *         replacement is malformed or refers to a group the regex does not have
     */
    public static OcrCorrectionRule of(String name, String regex, String replacement) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("OCR rule name must not be blank");
        }
        if (regex == null || regex.isEmpty()) {
            throw new IllegalArgumentException("OCR rule '" + name + "' has no pattern");
        }
        Pattern compiled;
        try {
            compiled = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("OCR rule '" + name + "' has an invalid pattern: " + e.getDescription(), e);
        }
        String safeReplacement = replacement == null ? "" : replacement;
        if (safeReplacement.contains("${")) {
            throw new IllegalArgumentException("OCR rule '" + name + "' uses a named group reference");
        }
        int trailingBackslashes = 0;
        for (int i = safeReplacement.length() - 1; i >= 0 && safeReplacement.charAt(i) == '\\'; i--) {
            trailingBackslashes++;
        }
        if (trailingBackslashes % 2 != 0) {
            throw new IllegalArgumentException("OCR rule '" + name + "' ends with an unescaped backslash");
        }
        int groupCount = compiled.matcher("").groupCount();
        Matcher references = GROUP_REFERENCE.matcher(safeReplacement);
        while (references.find()) {
            if (Integer.parseInt(references.group(1)) > groupCount) {
                throw new IllegalArgumentException(String.format(
                        "OCR rule '%s' refers to group %s but the pattern has %d group(s)",
                        name, references.group(1), groupCount));
            }
        }
        return new OcrCorrectionRule(name.trim(), compiled, safeReplacement);
    }

    public String apply(String value) {
        if (value == null) {
            return null;
        }
        return pattern.matcher(value).replaceAll(replacement);
    }

    @Override
    public String toString() {
        return name + " [" + pattern.pattern() + " -> " + replacement + "]";
    }
}
