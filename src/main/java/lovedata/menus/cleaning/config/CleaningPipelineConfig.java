package lovedata.menus.cleaning.config;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.mapping.MappingTableLoader;
import lovedata.menus.cleaning.mapping.MappingTables;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the mapping resources named in {@code cleaning.mappings.*}. A missing
 * or malformed resource fails startup.
 */
@Configuration
@Slf4j
public class CleaningPipelineConfig {

    @Bean
    public MappingTables mappingTables(MappingTableLoader loader, CleaningConfig cleaningConfig) {
        CleaningConfig.Mappings mappings = cleaningConfig.getMappings();
        MappingTables tables = new MappingTables(
                loader.loadTable(mappings.getVenueTable()),
                loader.loadTable(mappings.getCurrencySymbolTable()),
                loader.loadOcrRules(mappings.getOccasionOcrRules()));
        log.info("Mapping tables ready: {} venue entries, {} currency symbols, {} OCR rules",
                tables.getVenueTable().size(),
                tables.getCurrencySymbolTable().size(),
                tables.getOccasionOcrRules().size());
        return tables;
    }
}
