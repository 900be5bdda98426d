package lovedata.menus.cleaning.model;

/**
 * Source and output column names of the menu dataset.
 * Raw CSV headers are sanitized to these lower-case forms on load.
 */
public final class MenuFields {

    public static final String ID = "id";
    public static final String NAME = "name";
    public static final String SPONSOR = "sponsor";
    public static final String LOCATION = "location";
    public static final String DATE = "date";
    public static final String PLACE = "place";
    public static final String EVENT = "event";
    public static final String VENUE = "venue";
    public static final String OCCASION = "occasion";
    public static final String CURRENCY = "currency";
    public static final String CURRENCY_SYMBOL = "currency_symbol";
    public static final String CURRENCY_CODE = "currency_code";
    public static final String CALL_NUMBER = "call_number";
    public static final String PHYSICAL_DESCRIPTION = "physical_description";
    public static final String PAGE_COUNT = "page_count";
    public static final String DISH_COUNT = "dish_count";
    public static final String STATUS = "status";
    public static final String NOTES = "notes";

    private MenuFields() {
        // Constants only
    }
}
