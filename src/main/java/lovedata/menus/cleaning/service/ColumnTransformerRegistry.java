package lovedata.menus.cleaning.service;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.config.CleaningConfig;
import lovedata.menus.cleaning.exception.StructuralDefectException;
import lovedata.menus.cleaning.mapping.MappingTables;
import lovedata.menus.cleaning.transformer.CallNumberTransformer;
import lovedata.menus.cleaning.transformer.CurrencyCodeTransformer;
import lovedata.menus.cleaning.transformer.CurrencyTransformer;
import lovedata.menus.cleaning.transformer.DateTransformer;
import lovedata.menus.cleaning.transformer.EventTransformer;
import lovedata.menus.cleaning.transformer.MenuTransformers;
import lovedata.menus.cleaning.transformer.NameConsolidationTransformer;
import lovedata.menus.cleaning.transformer.OccasionTransformer;
import lovedata.menus.cleaning.transformer.PlaceTransformer;
import lovedata.menus.cleaning.transformer.VenueTransformer;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Builds the column transformer set from {@code cleaning.*} configuration and
 * the loaded mapping tables.
 *
 * All transformers except the date transformer are independent of the run,
 * so they are built once. The date transformer's upper bound is the run
 * date; only the set for the most recent run date is cached.
 */
@Service
@Slf4j
public class ColumnTransformerRegistry {

    private final CleaningConfig cleaningConfig;
    private final MappingTables mappingTables;

    private volatile CachedTransformers cached;

    public ColumnTransformerRegistry(CleaningConfig cleaningConfig, MappingTables mappingTables) {
        this.cleaningConfig = cleaningConfig;
        this.mappingTables = mappingTables;
    }

    /**
     * @param runDate upper bound for menu dates
     * @return transformers for a run on that date (never null)
     * @throws StructuralDefectException if configuration or a mapping table is invalid
     */
    public MenuTransformers getTransformers(LocalDate runDate) {
        CachedTransformers current = cached;
        if (current != null && current.runDate.equals(runDate)) {
            return current.transformers;
        }
        MenuTransformers transformers = createTransformers(runDate);
        cached = new CachedTransformers(runDate, transformers);
        return transformers;
    }

    MenuTransformers createTransformers(LocalDate runDate) {
        try {
            CleaningConfig.Name name = cleaningConfig.getName();
            CleaningConfig.DateSettings date = cleaningConfig.getDate();
            CleaningConfig.Place place = cleaningConfig.getPlace();
            CleaningConfig.Currency currency = cleaningConfig.getCurrency();
            CleaningConfig.CallNumber callNumber = cleaningConfig.getCallNumber();

            MenuTransformers transformers = MenuTransformers.builder()
                    .name(new NameConsolidationTransformer(name.getPriority(), name.getPlaceholders()))
                    .date(new DateTransformer(date.getFormats(), date.getMinDateValue(), runDate))
                    .place(new PlaceTransformer(place.getStateAbbreviations(), place.getUnknownMarker()))
                    .event(new EventTransformer(cleaningConfig.getEvent().getTypoFixes()))
                    .venue(new VenueTransformer(mappingTables.getVenueTable()))
                    .occasion(new OccasionTransformer(mappingTables.getOccasionOcrRules()))
                    .currency(new CurrencyTransformer(currency.getUnknownSentinel()))
                    .currencyCode(new CurrencyCodeTransformer(
                            mappingTables.getCurrencySymbolTable(), currency.getUnmappedSymbolPolicy()))
                    .callNumber(new CallNumberTransformer(callNumber.getMarker(), callNumber.getSuffixSeparator()))
                    .build();

            log.info("Built {} column transformers for run date {}", transformers.all().size(), runDate);
            return transformers;

        } catch (IllegalArgumentException e) {
            log.error("Invalid cleaning configuration: {}", e.getMessage(), e);
            throw new StructuralDefectException("Invalid cleaning configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Drop the cached transformer set.
     */
    public void clearCache() {
        CachedTransformers current = cached;
        if (current != null) {
            log.info("Clearing transformers cached for run date {}", current.runDate);
        }
        cached = null;
    }

    private static final class CachedTransformers {

        private final LocalDate runDate;
        private final MenuTransformers transformers;

        CachedTransformers(LocalDate runDate, MenuTransformers transformers) {
            this.runDate = runDate;
            this.transformers = transformers;
        }
    }
}
