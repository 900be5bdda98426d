package lovedata.menus.cleaning.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Analysis-ready menu row. sponsor and location are retired into {@code name};
 * {@code wotm} is derived from the raw call number and has no setter path of
 * its own.
 */
@Value
@Builder(toBuilder = true)
public class CleanedMenuRecord {

    @JsonProperty("id")
    int id;

    @JsonProperty("name")
    String name;

    @JsonProperty("date")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd")
    LocalDate date;

    @JsonProperty("place")
    String place;

    @JsonProperty("event")
    String event;

    @JsonProperty("venue")
    VenueCategory venue;

    @JsonProperty("occasion")
    String occasion;

    @JsonProperty("currency")
    String currency;

    @JsonProperty("currency_code")
    String currencyCode;

    @JsonProperty("call_number_normalized")
    String callNumberNormalized;

    @JsonProperty("is_wotm")
    boolean wotm;

    @JsonProperty("physical_description")
    String physicalDescription;

    @JsonProperty("page_count")
    Integer pageCount;

    @JsonProperty("dish_count")
    Integer dishCount;

    @JsonProperty("status")
    String status;

    @JsonProperty("notes")
    String notes;

    /**
     * Feed this row back in as source data. Used to check that a second
     * cleaning pass leaves already-clean values alone.
     *
     * @param marker          collection marker re-appended to the call number
     * @param suffixSeparator separator in front of the marker
     */
    public RawMenuRecord toRawRecord(String marker, String suffixSeparator) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(MenuFields.ID, String.valueOf(id));
        fields.put(MenuFields.NAME, name);
        fields.put(MenuFields.SPONSOR, null);
        fields.put(MenuFields.LOCATION, null);
        fields.put(MenuFields.DATE, date == null ? null : date.toString());
        fields.put(MenuFields.PLACE, place);
        fields.put(MenuFields.EVENT, event);
        fields.put(MenuFields.VENUE, venue == null ? null : venue.name());
        fields.put(MenuFields.OCCASION, occasion);
        fields.put(MenuFields.CURRENCY, currency);
        fields.put(MenuFields.CURRENCY_SYMBOL, currencyCode);
        fields.put(MenuFields.CALL_NUMBER, rawCallNumber(marker, suffixSeparator));
        fields.put(MenuFields.PHYSICAL_DESCRIPTION, physicalDescription);
        fields.put(MenuFields.PAGE_COUNT, pageCount == null ? null : pageCount.toString());
        fields.put(MenuFields.DISH_COUNT, dishCount == null ? null : dishCount.toString());
        fields.put(MenuFields.STATUS, status);
        fields.put(MenuFields.NOTES, notes);
        return RawMenuRecord.of(fields);
    }

    private String rawCallNumber(String marker, String suffixSeparator) {
        if (!wotm) {
            return callNumberNormalized;
        }
        String separator = suffixSeparator == null ? "" : suffixSeparator;
        return callNumberNormalized == null ? marker : callNumberNormalized + separator + marker;
    }
}
