package lovedata.menus.cleaning.transformer;

import lombok.Builder;
import lombok.Getter;
import lovedata.menus.cleaning.model.MenuFields;

import java.util.List;

/**
 * The full transformer set for one cleaning run, in audit order.
 */
@Getter
@Builder
public class MenuTransformers {

    private final NameConsolidationTransformer name;
    private final DateTransformer date;
    private final PlaceTransformer place;
    private final EventTransformer event;
    private final VenueTransformer venue;
    private final OccasionTransformer occasion;
    private final CurrencyTransformer currency;
    private final CurrencyCodeTransformer currencyCode;
    private final CallNumberTransformer callNumber;
    @Builder.Default
    private final CountTransformer pageCount = new CountTransformer(MenuFields.PAGE_COUNT);
    @Builder.Default
    private final CountTransformer dishCount = new CountTransformer(MenuFields.DISH_COUNT);

    /**
     * Every transformer, in the order the audit report lists fields.
     */
    public List<ColumnTransformer<?>> all() {
        return List.of(name, date, place, event, venue, occasion, currency, currencyCode,
                callNumber, pageCount, dishCount);
    }
}
