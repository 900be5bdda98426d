package lovedata.menus.cleaning.transformer;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.mapping.MappingTable;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;
import lovedata.menus.cleaning.model.VenueCategory;

import java.util.regex.Pattern;

/**
 * Maps free-text venue abbreviations onto {@link VenueCategory}.
 *
 * Lookup key: punctuation {@code [ ] ( ) " ? . ,} removed, spaces around
 * {@code ;} removed, upper-cased, whitespace collapsed. Keys missing from the
 * venue table (and not already a category name) become NULL and are reported
 * as unmapped.
 */
@Slf4j
public class VenueTransformer implements ColumnTransformer<VenueCategory> {

    private static final Pattern VENUE_NOISE = Pattern.compile("[\\[\\]()\"?.,]+");
    private static final Pattern SEMICOLON_SPACING = Pattern.compile("\\s*;\\s*");

    private final MappingTable venueTable;

    public VenueTransformer(MappingTable venueTable) {
        if (venueTable == null) {
            throw new IllegalArgumentException("Venue mapping table is required");
        }
        venueTable.entries().forEach((raw, standard) -> {
            if (standard != null && !VenueCategory.isValid(standard)) {
                throw new IllegalArgumentException(String.format(
                        "Venue mapping '%s' -> '%s' does not name a venue category", raw, standard));
            }
        });
        this.venueTable = venueTable;
    }

    @Override
    public String getFieldName() {
        return MenuFields.VENUE;
    }

    @Override
    public FieldResult<VenueCategory> transform(RawMenuRecord record) {
        String raw = record.get(MenuFields.VENUE);
        String key = lookupKey(raw);
        if (key == null) {
            return FieldResult.of(raw, null);
        }

        if (venueTable.contains(key)) {
            String standard = venueTable.get(key);
            return FieldResult.of(raw, standard == null ? null : VenueCategory.valueOf(standard));
        }
        if (VenueCategory.isValid(key)) {
            return FieldResult.of(raw, VenueCategory.valueOf(key));
        }

        log.debug("Menu {}: venue '{}' not in {}", record.get(MenuFields.ID), key, venueTable.getName());
        return FieldResult.unmapped(raw, null, key);
    }

    static String lookupKey(String raw) {
        String key = NormalizationPrimitives.stripNoise(raw, VENUE_NOISE);
        if (key == null) {
            return null;
        }
        key = SEMICOLON_SPACING.matcher(key).replaceAll(";");
        return NormalizationPrimitives.blankToNull(NormalizationPrimitives.uppercaseFold(key));
    }
}
