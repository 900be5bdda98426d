package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;
import lovedata.menus.cleaning.util.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.mock.web.MockMultipartFile;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for MenuCsvParsingService
 * Tests header sanitizing, RFC 4180 quoting and record assembly
 */
class MenuCsvParsingServiceTest {

    private MenuCsvParsingService csvParsingService;

    @Mock
    private FileChecksumService fileChecksumService;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        csvParsingService = new MenuCsvParsingService();

        Field field = MenuCsvParsingService.class.getDeclaredField("fileChecksumService");
        field.setAccessible(true);
        field.set(csvParsingService, fileChecksumService);
    }

    // ========== readRecords Tests ==========

    @Test
    void testReadRecords_SampleExport() throws IOException {
        // Given: three raw rows of the menu export
        String csv = TestDataFactory.sampleCsv();

        // When
        List<RawMenuRecord> records = csvParsingService.readRecords(new StringReader(csv));

        // Then: one record per row, empty cells are null
        assertEquals(3, records.size());
        RawMenuRecord first = records.get(0);
        assertEquals("12463", first.get(MenuFields.ID));
        assertNull(first.get(MenuFields.NAME));
        assertEquals("HOT SPRINGS, AR", first.get(MenuFields.PLACE));
        assertEquals("CARD; 4.75X7.5;", first.get(MenuFields.PHYSICAL_DESCRIPTION));
        assertEquals("67", first.get(MenuFields.DISH_COUNT));
        assertEquals(TestDataFactory.SOURCE_COLUMNS.size(), first.columnNames().size());

        RawMenuRecord third = records.get(2);
        assertEquals("\"The Dakota\"", third.get(MenuFields.LOCATION));
        assertEquals("*wotm", third.get(MenuFields.CALL_NUMBER));
        assertNull(third.get(MenuFields.DISH_COUNT));
    }

    @Test
    void testReadRecords_QuotedFieldSpanningLines() throws IOException {
        String csv = "id,notes\n1,\"line one\nline two\"\n2,plain\n";

        List<RawMenuRecord> records = csvParsingService.readRecords(new StringReader(csv));

        assertEquals(2, records.size());
        assertEquals("line one\nline two", records.get(0).get("notes"));
        assertEquals("2", records.get(1).get("id"));
    }

    @Test
    void testReadRecords_ByteOrderMarkAndHeaderSanitized() throws IOException {
        String csv = "\uFEFFId,Currency Symbol,physical-description\n1,$,CARD\n";

        List<RawMenuRecord> records = csvParsingService.readRecords(new StringReader(csv));

        assertEquals(1, records.size());
        assertEquals("1", records.get(0).get("id"));
        assertEquals("$", records.get(0).get("currency_symbol"));
        assertEquals("CARD", records.get(0).get("physical_description"));
    }

    @Test
    void testReadRecords_ShortRowAndBlankLines() throws IOException {
        String csv = "id,name,sponsor\n\n1,Dinner\n   \n2,,HOTEL\n";

        List<RawMenuRecord> records = csvParsingService.readRecords(new StringReader(csv));

        assertEquals(2, records.size());
        assertEquals("Dinner", records.get(0).get("name"));
        assertTrue(records.get(0).hasColumn("sponsor"));
        assertNull(records.get(0).get("sponsor"));
        assertNull(records.get(1).get("name"));
        assertEquals("HOTEL", records.get(1).get("sponsor"));
    }

    @Test
    void testReadRecords_HeaderOnly_ReturnsNoRecords() throws IOException {
        List<RawMenuRecord> records = csvParsingService.readRecords(new StringReader(TestDataFactory.CSV_HEADER + "\n"));

        assertTrue(records.isEmpty());
    }

    @Test
    void testReadRecords_EmptyInput_Throws() {
        assertThatThrownBy(() -> csvParsingService.readRecords(new StringReader("")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("CSV file is empty or has no header");
    }

    @Test
    void testReadRecords_HeaderWithoutUsableNames_Throws() {
        assertThatThrownBy(() -> csvParsingService.readRecords(new StringReader("#,$$\n1,2\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No valid headers found in CSV file");
    }

    @Test
    void testReadRecords_FromUpload_UsesDecompressedStream() throws IOException {
        // Given
        MockMultipartFile file = TestDataFactory.createSampleCsvFile();
        when(fileChecksumService.getDecompressedInputStream(any()))
                .thenReturn(new ByteArrayInputStream(TestDataFactory.sampleCsv().getBytes(StandardCharsets.UTF_8)));

        // When
        List<RawMenuRecord> records = csvParsingService.readRecords(file);

        // Then
        assertEquals(3, records.size());
        verify(fileChecksumService).getDecompressedInputStream(file);
    }

    // ========== parseCsvRow Tests ==========

    @Test
    void testParseCsvRow_QuotedComma() {
        List<String> values = csvParsingService.parseCsvRow("2,\"Hotel Eastman, Hot Springs\",1900");

        assertEquals(List.of("2", "Hotel Eastman, Hot Springs", "1900"), values);
    }

    @Test
    void testParseCsvRow_EscapedQuotesAndEmptyCells() {
        List<String> values = csvParsingService.parseCsvRow("3,,\"\"\"The Dakota\"\"\",");

        assertEquals(List.of("3", "", "\"The Dakota\"", ""), values);
    }

    // ========== sanitizeColumnName Tests ==========

    @Test
    void testSanitizeColumnName() {
        assertEquals("currency_symbol", csvParsingService.sanitizeColumnName("Currency Symbol"));
        assertEquals("physical_description", csvParsingService.sanitizeColumnName("  Physical-Description "));
        assertEquals("weird_name", csvParsingService.sanitizeColumnName("__Weird  Name__"));
        assertEquals("dish_count", csvParsingService.sanitizeColumnName("dish_count"));
    }
}
