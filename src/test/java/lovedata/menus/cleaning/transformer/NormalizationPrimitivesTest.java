package lovedata.menus.cleaning.transformer;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for NormalizationPrimitives
 */
class NormalizationPrimitivesTest {

    private static final LocalDate MIN = LocalDate.of(1840, 1, 1);
    private static final LocalDate MAX = LocalDate.of(2025, 6, 1);

    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT),
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT));

    @Test
    void testNullInput_ReturnsNullEverywhere() {
        assertThat(NormalizationPrimitives.stripBracketedNoise(null)).isNull();
        assertThat(NormalizationPrimitives.collapseWhitespace(null)).isNull();
        assertThat(NormalizationPrimitives.blankToNull(null)).isNull();
        assertThat(NormalizationPrimitives.uppercaseFold(null)).isNull();
        assertThat(NormalizationPrimitives.lowercaseFold(null)).isNull();
        assertThat(NormalizationPrimitives.titleCaseFix(null)).isNull();
        assertThat(NormalizationPrimitives.ocrCorrect(null, List.of())).isNull();
        assertThat(NormalizationPrimitives.placeholderToNull(null, List.of("not given"))).isNull();
        assertThat(NormalizationPrimitives.parseDateMulti(null, FORMATS, MIN, MAX)).isNull();
        assertThat(NormalizationPrimitives.stripEnclosingQuotes(null)).isNull();
        assertThat(NormalizationPrimitives.moveTrailingArticle(null, "The")).isNull();
    }

    @Test
    void testStripBracketedNoise_RemovesClustersAndCollapsesWhitespace() {
        assertThat(NormalizationPrimitives.stripBracketedNoise("[?] Hotel  (Eastman) ?")).isEqualTo("Hotel Eastman");
        assertThat(NormalizationPrimitives.stripBracketedNoise("\"Waldorf\\\"")).isEqualTo("Waldorf");
    }

    @Test
    void testStripBracketedNoise_OnlyNoise_ReturnsNull() {
        assertThat(NormalizationPrimitives.stripBracketedNoise("[?]")).isNull();
        assertThat(NormalizationPrimitives.stripBracketedNoise("   ")).isNull();
    }

    @Test
    void testCollapseWhitespace_TabsAndNewlines() {
        assertThat(NormalizationPrimitives.collapseWhitespace("  a \t b\n c  ")).isEqualTo("a b c");
    }

    @Test
    void testBlankToNull() {
        assertThat(NormalizationPrimitives.blankToNull(" \t ")).isNull();
        assertThat(NormalizationPrimitives.blankToNull(" x ")).isEqualTo("x");
    }

    @Test
    void testTitleCaseFix_PossessiveStaysLowerCase() {
        assertThat(NormalizationPrimitives.titleCaseFix("mary's DINNER")).isEqualTo("Mary's Dinner");
        assertThat(NormalizationPrimitives.titleCaseFix("ST. PATRICK’S DAY")).isEqualTo("St. Patrick’s Day");
    }

    @Test
    void testTitleCaseFix_IsIdempotent() {
        String once = NormalizationPrimitives.titleCaseFix("annual banquet, 50th anniv");
        assertThat(NormalizationPrimitives.titleCaseFix(once)).isEqualTo(once);
    }

    @Test
    void testOcrCorrect_AppliesRulesInOrder() {
        // Given: the second rule only matches what the first produced
        List<OcrCorrectionRule> rules = List.of(
                OcrCorrectionRule.of("zero", "0ther", "other"),
                OcrCorrectionRule.of("other-to-misc", "other", "misc"));

        // When / Then
        assertThat(NormalizationPrimitives.ocrCorrect("0ther", rules)).isEqualTo("misc");
        assertThat(NormalizationPrimitives.ocrCorrect("0ther", List.of(rules.get(1), rules.get(0))))
                .isEqualTo("other");
    }

    @Test
    void testOcrCorrect_CaseInsensitiveRules() {
        List<OcrCorrectionRule> rules = List.of(OcrCorrectionRule.of("annual", "amnnual|annu al", "annual"));
        assertThat(NormalizationPrimitives.ocrCorrect("AMNNUAL dinner", rules)).isEqualTo("annual dinner");
    }

    @Test
    void testPlaceholderToNull_CaseInsensitiveContains() {
        List<String> patterns = List.of("not given");
        assertThat(NormalizationPrimitives.placeholderToNull("Restaurant Name NOT GIVEN", patterns)).isNull();
        assertThat(NormalizationPrimitives.placeholderToNull("Delmonico's", patterns)).isEqualTo("Delmonico's");
    }

    @Test
    void testParseDateMulti_FirstFormatWithinBoundsWins() {
        assertThat(NormalizationPrimitives.parseDateMulti("1900-04-15", FORMATS, MIN, MAX))
                .isEqualTo(LocalDate.of(1900, 4, 15));
        assertThat(NormalizationPrimitives.parseDateMulti("4/15/1900", FORMATS, MIN, MAX))
                .isEqualTo(LocalDate.of(1900, 4, 15));
    }

    @Test
    void testParseDateMulti_OutOfRange_ReturnsNull() {
        assertThat(NormalizationPrimitives.parseDateMulti("2928-01-01", FORMATS, MIN, MAX)).isNull();
        assertThat(NormalizationPrimitives.parseDateMulti("0190-03-06", FORMATS, MIN, MAX)).isNull();
    }

    @Test
    void testParseDateMulti_BoundsAreInclusive() {
        assertThat(NormalizationPrimitives.parseDateMulti("1840-01-01", FORMATS, MIN, MAX)).isEqualTo(MIN);
        assertThat(NormalizationPrimitives.parseDateMulti("2025-06-01", FORMATS, MIN, MAX)).isEqualTo(MAX);
    }

    @Test
    void testParseDateMulti_InvalidCalendarDate_ReturnsNull() {
        assertThat(NormalizationPrimitives.parseDateMulti("1900-02-30", FORMATS, MIN, MAX)).isNull();
        assertThat(NormalizationPrimitives.parseDateMulti("April 1900", FORMATS, MIN, MAX)).isNull();
    }

    @Test
    void testParseDateMulti_NoGuessingBeyondConfiguredFormats() {
        // Day-first reading is not configured, so 13/01/1900 has no valid parse
        assertThat(NormalizationPrimitives.parseDateMulti("13/01/1900", FORMATS, MIN, MAX)).isNull();
        assertThat(NormalizationPrimitives.parseDateMulti("01/02/1900", FORMATS, MIN, MAX))
                .isEqualTo(LocalDate.of(1900, 1, 2));
    }

    @Test
    void testStripEnclosingQuotes() {
        assertThat(NormalizationPrimitives.stripEnclosingQuotes("\"The Dakota\"")).isEqualTo("The Dakota");
        assertThat(NormalizationPrimitives.stripEnclosingQuotes("\"\"The Dakota\"\"")).isEqualTo("The Dakota");
        assertThat(NormalizationPrimitives.stripEnclosingQuotes("Say \"cheese\"")).isEqualTo("Say \"cheese\"");
        assertThat(NormalizationPrimitives.stripEnclosingQuotes("\"\"")).isNull();
    }

    @Test
    void testStripTrailing() {
        Pattern trailing = Pattern.compile("[;.,]+$");
        assertThat(NormalizationPrimitives.stripTrailing("Albany, NY;.", trailing)).isEqualTo("Albany, NY");
        assertThat(NormalizationPrimitives.stripTrailing(";", trailing)).isNull();
    }

    @Test
    void testMoveTrailingArticle() {
        assertThat(NormalizationPrimitives.moveTrailingArticle("Dakota; The", "The")).isEqualTo("The Dakota");
        assertThat(NormalizationPrimitives.moveTrailingArticle("Dakota;the", "The")).isEqualTo("The Dakota");
        assertThat(NormalizationPrimitives.moveTrailingArticle("Theatre", "The")).isEqualTo("Theatre");
    }
}
