package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.model.RawMenuRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for turning a menu CSV export into raw records.
 *
 * Features:
 * - Header row becomes the column names (sanitized: "Currency Symbol" → "currency_symbol")
 * - Quoted fields with commas, doubled quotes and embedded newlines
 * - Empty cells read as null
 * - Compressed uploads (via FileChecksumService)
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class MenuCsvParsingService {

    private static final Logger logger = LoggerFactory.getLogger(MenuCsvParsingService.class);

    @Autowired
    private FileChecksumService fileChecksumService;

    /**
     * Read every data row of an uploaded CSV (plain, .gz or .zip).
     *
     * @throws IllegalArgumentException if the file has no header row
     */
    public List<RawMenuRecord> readRecords(MultipartFile file) throws IOException {
        logger.debug("Reading menu records from file: {}", file.getOriginalFilename());
        try (InputStream inputStream = fileChecksumService.getDecompressedInputStream(file);
             Reader reader = new InputStreamReader(inputStream, StandardCharsets.UTF_8)) {
            List<RawMenuRecord> records = readRecords(reader);
            logger.info("Read {} menu records from {}", records.size(), file.getOriginalFilename());
            return records;
        }
    }

    public List<RawMenuRecord> readRecords(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);

        String headerLine = readLogicalRow(reader);
        if (headerLine != null && headerLine.startsWith("\uFEFF")) {
            headerLine = headerLine.substring(1);
        }
        if (headerLine == null || headerLine.trim().isEmpty()) {
            throw new IllegalArgumentException("CSV file is empty or has no header");
        }

        List<String> headers = new ArrayList<>();
        for (String header : parseCsvRow(headerLine)) {
            headers.add(sanitizeColumnName(header));
        }
        if (headers.stream().allMatch(String::isEmpty)) {
            throw new IllegalArgumentException("No valid headers found in CSV file");
        }

        List<RawMenuRecord> records = new ArrayList<>();
        String row;
        long rowNumber = 1;
        while ((row = readLogicalRow(reader)) != null) {
            rowNumber++;
            if (row.trim().isEmpty()) {
                continue;
            }
            List<String> values = parseCsvRow(row);
            if (values.size() > headers.size()) {
                logger.warn("Row {}: {} values for {} columns, extra values ignored",
                        rowNumber, values.size(), headers.size());
            }

            Map<String, String> fields = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                String header = headers.get(i);
                if (header.isEmpty()) {
                    continue;
                }
                String value = i < values.size() ? values.get(i) : null;
                fields.put(header, value == null || value.isEmpty() ? null : value);
            }
            records.add(RawMenuRecord.of(fields));
        }
        return records;
    }

    /**
     * Read one CSV row, joining physical lines while a quoted field is open.
     *
     * @return the row text, or null at end of input
     */
    String readLogicalRow(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) {
            return null;
        }
        StringBuilder row = new StringBuilder(line);
        while (hasOpenQuote(row)) {
            String next = reader.readLine();
            if (next == null) {
                logger.warn("Unterminated quoted field at end of input");
                break;
            }
            row.append('\n').append(next);
        }
        return row.toString();
    }

    private boolean hasOpenQuote(CharSequence row) {
        int quotes = 0;
        for (int i = 0; i < row.length(); i++) {
            if (row.charAt(i) == '"') {
                quotes++;
            }
        }
        return quotes % 2 != 0;
    }

    /**
     * Parse CSV row handling quoted fields and commas within quotes (RFC 4180 quoting).
     *
     * Examples:
     *   "1,Dinner,1900-04-15" → ["1", "Dinner", "1900-04-15"]
     *   "2,\"Hotel Eastman, Hot Springs\",1900" → ["2", "Hotel Eastman, Hot Springs", "1900"]
     *   "3,\"\"\"The Dakota\"\"\"" → ["3", "\"The Dakota\""]
     */
    public List<String> parseCsvRow(String csvLine) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder currentValue = new StringBuilder();

        for (int i = 0; i < csvLine.length(); i++) {
            char c = csvLine.charAt(i);

            if (c == '"') {
                // "" inside quotes is a literal quote
                if (inQuotes && i + 1 < csvLine.length() && csvLine.charAt(i + 1) == '"') {
                    currentValue.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == ',' && !inQuotes) {
                values.add(currentValue.toString().trim());
                currentValue = new StringBuilder();
            } else {
                currentValue.append(c);
            }
        }
        values.add(currentValue.toString().trim());
        return values;
    }

    /**
     * Sanitize a header into a column name:
     * lower-case, non-alphanumerics to "_", repeated "_" collapsed, leading/trailing "_" removed.
     *
     * Examples:
     *   "Currency Symbol" → "currency_symbol"
     *   "physical-description" → "physical_description"
     */
    public String sanitizeColumnName(String name) {
        return name.trim()
                .toLowerCase()
                .replaceAll("[^a-z0-9_]", "_")
                .replaceAll("_{2,}", "_")
                .replaceAll("^_|_$", "");
    }
}
