package lovedata.menus.cleaning.mapping;

import lombok.Getter;
import lovedata.menus.cleaning.transformer.OcrCorrectionRule;

import java.util.List;

/**
 * Static lookup data loaded once at startup and shared read-only by every run.
 */
@Getter
public class MappingTables {

    private final MappingTable venueTable;
    private final MappingTable currencySymbolTable;
    private final List<OcrCorrectionRule> occasionOcrRules;

    public MappingTables(MappingTable venueTable, MappingTable currencySymbolTable,
                         List<OcrCorrectionRule> occasionOcrRules) {
        this.venueTable = venueTable;
        this.currencySymbolTable = currencySymbolTable;
        this.occasionOcrRules = List.copyOf(occasionOcrRules);
    }
}
