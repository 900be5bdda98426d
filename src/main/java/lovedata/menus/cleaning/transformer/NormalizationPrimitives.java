package lovedata.menus.cleaning.transformer;

import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless string and date helpers shared by every column transformer.
 *
 * Every method accepts {@code null} and returns {@code null} for it; none of
 * them throws on content.
 */
@Slf4j
public class NormalizationPrimitives {

    /** Brackets, parentheses, double quotes, question marks and backslashes. */
    public static final Pattern BRACKETED_NOISE = Pattern.compile("[\\[\\]()\"?\\\\]+");

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    // Letter after ' or ’ that title-casing wrongly capitalized
    private static final Pattern POSSESSIVE_S = Pattern.compile("(['’])S\\b");

    private NormalizationPrimitives() {
    }

    /**
     * Remove bracket/quote/question-mark clusters, collapse whitespace, trim.
     *
     * @return cleaned text, or null when nothing is left
     */
    public static String stripBracketedNoise(String value) {
        return stripNoise(value, BRACKETED_NOISE);
    }

    /**
     * Same as {@link #stripBracketedNoise(String)} with a caller-supplied noise class.
     */
    public static String stripNoise(String value, Pattern noise) {
        if (value == null) {
            return null;
        }
        return blankToNull(collapseWhitespace(noise.matcher(value).replaceAll("")));
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        return WHITESPACE_RUN.matcher(value).replaceAll(" ").trim();
    }

    /**
     * @return the trimmed value, or null if it is null or blank
     */
    public static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static String uppercaseFold(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    public static String lowercaseFold(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    /**
     * Title-case every word (a letter following a non-alphanumeric character
     * is upper-cased, every other letter lower-cased), then put the
     * {@code S} after a possessive apostrophe back to lower case:
     * "MARY'S dinner" becomes "Mary's Dinner", not "Mary'S Dinner".
     */
    public static String titleCaseFix(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder result = new StringBuilder(value.length());
        boolean startOfWord = true;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                result.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                result.append(c);
                startOfWord = true;
            }
        }
        return POSSESSIVE_S.matcher(result).replaceAll("$1s");
    }

    /**
     * Apply OCR substitution rules one after another, in list order.
     * Order is significant: each rule sees the output of the previous one.
     */
    public static String ocrCorrect(String value, List<OcrCorrectionRule> rules) {
        if (value == null || rules == null) {
            return value;
        }
        String corrected = value;
        for (OcrCorrectionRule rule : rules) {
            corrected = rule.apply(corrected);
        }
        return corrected;
    }

    /**
     * @return null if the value contains any of the patterns (case-insensitive),
     *         otherwise the value unchanged
     */
    public static String placeholderToNull(String value, List<String> patterns) {
        if (value == null || patterns == null) {
            return value;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String pattern : patterns) {
            if (pattern != null && !pattern.isEmpty() && lower.contains(pattern.toLowerCase(Locale.ROOT))) {
                return null;
            }
        }
        return value;
    }

    /**
     * Try each formatter in order; the first strict parse that lands inside
     * [minDate, maxDate] wins. Out-of-range dates are rejected, never clamped.
     */
    public static LocalDate parseDateMulti(String value, List<DateTimeFormatter> formats,
                                           LocalDate minDate, LocalDate maxDate) {
        String text = blankToNull(value);
        if (text == null || formats == null) {
            return null;
        }
        for (DateTimeFormatter format : formats) {
            LocalDate parsed;
            try {
                parsed = LocalDate.parse(text, format);
            } catch (DateTimeParseException e) {
                continue;
            }
            if (!parsed.isBefore(minDate) && !parsed.isAfter(maxDate)) {
                return parsed;
            }
            log.debug("Date '{}' parsed to {} but lies outside [{}, {}]", text, parsed, minDate, maxDate);
        }
        return null;
    }

    /**
     * Remove enclosing double quotes ({@code "The Dakota"} becomes {@code The Dakota}).
     * Values that are not wrapped on both sides are only trimmed.
     */
    public static String stripEnclosingQuotes(String value) {
        String text = blankToNull(value);
        if (text == null) {
            return null;
        }
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            int start = 0;
            int end = text.length();
            while (start < end && text.charAt(start) == '"') {
                start++;
            }
            while (end > start && text.charAt(end - 1) == '"') {
                end--;
            }
            return blankToNull(text.substring(start, end));
        }
        return text;
    }

    /**
     * Remove a trailing run of characters matched by {@code trailing}, then trim.
     */
    public static String stripTrailing(String value, Pattern trailing) {
        if (value == null) {
            return null;
        }
        return blankToNull(trailing.matcher(value.trim()).replaceAll(""));
    }

    /**
     * Catalogue-style inversion fix: "Dakota; The" becomes "The Dakota".
     */
    public static String moveTrailingArticle(String value, String article) {
        if (value == null) {
            return null;
        }
        Pattern inverted = Pattern.compile("^(.+);\\s*" + Pattern.quote(article) + "$", Pattern.CASE_INSENSITIVE);
        Matcher matcher = inverted.matcher(value);
        if (matcher.matches()) {
            return blankToNull(article + " " + matcher.group(1).trim());
        }
        return value;
    }
}
