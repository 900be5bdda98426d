package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.config.CleaningConfig;
import lovedata.menus.cleaning.exception.StructuralDefectException;
import lovedata.menus.cleaning.mapping.MappingTables;
import lovedata.menus.cleaning.transformer.MenuTransformers;
import lovedata.menus.cleaning.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColumnTransformerRegistryTest {

    private CleaningConfig config;
    private MappingTables mappingTables;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.defaultConfig();
        mappingTables = TestDataFactory.loadMappingTables(config);
    }

    @Test
    void testGetTransformers_BuildsOnePerColumn() {
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);

        MenuTransformers transformers = registry.getTransformers(TestDataFactory.RUN_DATE);

        assertThat(transformers.all()).hasSize(11);
        assertThat(transformers.getDate().getMinDate()).isEqualTo(LocalDate.of(1840, 1, 1));
        assertThat(transformers.getDate().getMaxDate()).isEqualTo(TestDataFactory.RUN_DATE);
    }

    @Test
    void testGetTransformers_CachedForLatestRunDate() {
        // Given
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);

        // When
        MenuTransformers first = registry.getTransformers(TestDataFactory.RUN_DATE);
        MenuTransformers again = registry.getTransformers(TestDataFactory.RUN_DATE);
        MenuTransformers nextDay = registry.getTransformers(TestDataFactory.RUN_DATE.plusDays(1));

        // Then
        assertThat(again).isSameAs(first);
        assertThat(nextDay).isNotSameAs(first);
        assertThat(nextDay.getDate().getMaxDate()).isEqualTo(TestDataFactory.RUN_DATE.plusDays(1));
    }

    @Test
    void testGetTransformers_NewRunDateEvictsOlderSet() {
        // Given
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);
        MenuTransformers first = registry.getTransformers(TestDataFactory.RUN_DATE);

        // When
        MenuTransformers nextDay = registry.getTransformers(TestDataFactory.RUN_DATE.plusDays(1));
        MenuTransformers backAgain = registry.getTransformers(TestDataFactory.RUN_DATE);

        // Then: only one set is kept, so the earlier date is rebuilt
        assertThat(backAgain).isNotSameAs(first);
        assertThat(backAgain.getDate().getMaxDate()).isEqualTo(TestDataFactory.RUN_DATE);
        assertThat(registry.getTransformers(TestDataFactory.RUN_DATE)).isSameAs(backAgain);
        assertThat(registry.getTransformers(TestDataFactory.RUN_DATE.plusDays(1))).isNotSameAs(nextDay);
    }

    @Test
    void testClearCache_RebuildsTransformers() {
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);
        MenuTransformers first = registry.getTransformers(TestDataFactory.RUN_DATE);

        registry.clearCache();

        assertThat(registry.getTransformers(TestDataFactory.RUN_DATE)).isNotSameAs(first);
    }

    @Test
    void testGetTransformers_RunDateBeforeMinDate_IsStructuralDefect() {
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);

        assertThatThrownBy(() -> registry.getTransformers(LocalDate.of(1800, 1, 1)))
                .isInstanceOf(StructuralDefectException.class)
                .hasMessageContaining("Invalid cleaning configuration");
    }

    @Test
    void testGetTransformers_BadMinDate_IsStructuralDefect() {
        config.getDate().setMinDate("first of January 1840");
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);

        assertThatThrownBy(() -> registry.getTransformers(TestDataFactory.RUN_DATE))
                .isInstanceOf(StructuralDefectException.class)
                .hasMessageContaining("min-date");
    }

    @Test
    void testGetTransformers_UnsupportedNameColumn_IsStructuralDefect() {
        config.getName().setPriority(List.of("location", "venue"));
        ColumnTransformerRegistry registry = new ColumnTransformerRegistry(config, mappingTables);

        assertThatThrownBy(() -> registry.getTransformers(TestDataFactory.RUN_DATE))
                .isInstanceOf(StructuralDefectException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }
}
