package lovedata.menus.cleaning.config;

import lombok.Data;
import lovedata.menus.cleaning.transformer.UnmappedSymbolPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cleaning pipeline configuration.
 *
 * Maps directly to properties in application.properties:
 * - cleaning.name.*
 * - cleaning.date.*
 * - cleaning.event.*
 * - cleaning.place.*
 * - cleaning.currency.*
 * - cleaning.call-number.*
 * - cleaning.mappings.*
 * - cleaning.processing.*
 * - cleaning.target.*
 */
@Configuration
@ConfigurationProperties(prefix = "cleaning")
@Data
public class CleaningConfig {

    // ========================================
    // NAME CONSOLIDATION (cleaning.name.*)
    // ========================================

    private Name name = new Name();

    @Data
    public static class Name {
        /** Source columns in priority order; the first usable one becomes the name */
        private List<String> priority = new ArrayList<>(List.of("location", "name", "sponsor"));

        /** Case-insensitive substrings that mark a name as "not given" */
        private List<String> placeholders = new ArrayList<>(
                List.of("not given", "restaurant name and/or location not given"));
    }

    // ========================================
    // DATES (cleaning.date.*)
    // ========================================

    private DateSettings date = new DateSettings();

    @Data
    public static class DateSettings {
        /** java.time patterns tried in order, strict resolution */
        private List<String> formats = new ArrayList<>(List.of("uuuu-MM-dd", "M/d/uuuu"));

        /** Earliest plausible menu date (ISO). The upper bound is the run date. */
        private String minDate = "1840-01-01";

        public LocalDate getMinDateValue() {
            try {
                return LocalDate.parse(minDate);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("cleaning.date.min-date is not an ISO date: " + minDate, e);
            }
        }
    }

    // ========================================
    // EVENT (cleaning.event.*)
    // ========================================

    private Event event = new Event();

    @Data
    public static class Event {
        /** Whole-word misspelling -> correction, applied after upper-casing */
        private Map<String, String> typoFixes = new LinkedHashMap<>(Map.of("CHRISTMAN", "CHRISTMAS"));
    }

    // ========================================
    // PLACE (cleaning.place.*)
    // ========================================

    private Place place = new Place();

    @Data
    public static class Place {
        /** Whole value that means "place unknown" */
        private String unknownMarker = "unknown";

        /** Trailing abbreviation after a comma -> state code */
        private Map<String, String> stateAbbreviations = new LinkedHashMap<>();
    }

    // ========================================
    // CURRENCY (cleaning.currency.*)
    // ========================================

    private Currency currency = new Currency();

    @Data
    public static class Currency {
        /** Replaces a missing currency name */
        private String unknownSentinel = "Unknown";

        /** What to emit for a symbol the symbol table does not know */
        private UnmappedSymbolPolicy unmappedSymbolPolicy = UnmappedSymbolPolicy.PASS_THROUGH;
    }

    // ========================================
    // CALL NUMBER (cleaning.call-number.*)
    // ========================================

    private CallNumber callNumber = new CallNumber();

    @Data
    public static class CallNumber {
        /** Collection marker carried by some call numbers */
        private String marker = "wotm";

        /** Separator in front of the marker suffix */
        private String suffixSeparator = "_";
    }

    // ========================================
    // MAPPING RESOURCES (cleaning.mappings.*)
    // ========================================

    private Mappings mappings = new Mappings();

    @Data
    public static class Mappings {
        /** Classpath TSV: raw venue -> category */
        private String venueTable = "mappings/venue-mapping.tsv";

        /** Classpath TSV: currency symbol -> code */
        private String currencySymbolTable = "mappings/currency-symbol-mapping.tsv";

        /** Classpath TSV: ordered occasion OCR rules */
        private String occasionOcrRules = "mappings/occasion-ocr-rules.tsv";
    }

    // ========================================
    // PROCESSING (cleaning.processing.*)
    // ========================================

    private Processing processing = new Processing();

    @Data
    public static class Processing {
        /** Shard the record set over the cleaning executor */
        private boolean parallelEnabled = true;

        /** Records per shard */
        private int shardSize = 1000;

        /** Cleaning executor pool size */
        private int workerThreads = 4;
    }

    // ========================================
    // TARGET TABLE (cleaning.target.*)
    // ========================================

    private Target target = new Target();

    @Data
    public static class Target {
        /** Table the cleaned records are copied into */
        private String table = "menus_clean";

        /** Skip files whose checksum already completed a run */
        private boolean enableIdempotency = true;

        /** Socket timeout for the COPY connection */
        private int copyTimeoutSeconds = 600;
    }
}
