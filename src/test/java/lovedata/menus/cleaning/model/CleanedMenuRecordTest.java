package lovedata.menus.cleaning.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CleanedMenuRecordTest {

    @Test
    void testToRawRecord_ReappendsCollectionMarker() {
        CleanedMenuRecord record = CleanedMenuRecord.builder()
                .id(7)
                .callNumberNormalized("1900-2822")
                .wotm(true)
                .build();

        assertThat(record.toRawRecord("wotm", "_").get(MenuFields.CALL_NUMBER)).isEqualTo("1900-2822_wotm");
    }

    @Test
    void testToRawRecord_MarkerOnlyCallNumber() {
        CleanedMenuRecord record = CleanedMenuRecord.builder().id(7).wotm(true).build();

        assertThat(record.toRawRecord("wotm", "_").get(MenuFields.CALL_NUMBER)).isEqualTo("wotm");
    }

    @Test
    void testToRawRecord_ConfiguredMarkerAndSeparator() {
        CleanedMenuRecord record = CleanedMenuRecord.builder()
                .id(7)
                .callNumberNormalized("1900-2822")
                .wotm(true)
                .build();

        assertThat(record.toRawRecord("nypl", "-").get(MenuFields.CALL_NUMBER)).isEqualTo("1900-2822-nypl");
        assertThat(record.toRawRecord("nypl", null).get(MenuFields.CALL_NUMBER)).isEqualTo("1900-2822nypl");
    }

    @Test
    void testToRawRecord_CarriesEverySourceColumn() {
        CleanedMenuRecord record = CleanedMenuRecord.builder()
                .id(12463)
                .name("Hotel Eastman")
                .date(LocalDate.of(1900, 4, 15))
                .venue(VenueCategory.COMMERCIAL)
                .currencyCode("USD")
                .pageCount(2)
                .build();

        RawMenuRecord raw = record.toRawRecord("wotm", "_");

        assertThat(raw.get(MenuFields.ID)).isEqualTo("12463");
        assertThat(raw.get(MenuFields.DATE)).isEqualTo("1900-04-15");
        assertThat(raw.get(MenuFields.VENUE)).isEqualTo("COMMERCIAL");
        assertThat(raw.get(MenuFields.CURRENCY_SYMBOL)).isEqualTo("USD");
        assertThat(raw.get(MenuFields.PAGE_COUNT)).isEqualTo("2");
        assertThat(raw.columnNames()).contains(MenuFields.SPONSOR, MenuFields.LOCATION, MenuFields.DISH_COUNT);
    }

    @Test
    void testDataQualitySummary() {
        List<CleanedMenuRecord> records = List.of(
                CleanedMenuRecord.builder().id(1).name("A").date(LocalDate.of(1901, 1, 1)).build(),
                CleanedMenuRecord.builder().id(2).date(LocalDate.of(1899, 5, 5)).build(),
                CleanedMenuRecord.builder().id(3).name("C").build());

        DataQualitySummary summary = DataQualitySummary.from(records);

        assertThat(summary.getTotalRows()).isEqualTo(3);
        assertThat(summary.getUniqueIds()).isEqualTo(3);
        assertThat(summary.getMissingNames()).isEqualTo(1);
        assertThat(summary.getMissingDates()).isEqualTo(1);
        assertThat(summary.getEarliestDate()).isEqualTo(LocalDate.of(1899, 5, 5));
        assertThat(summary.getLatestDate()).isEqualTo(LocalDate.of(1901, 1, 1));
    }
}
