package lovedata.menus.cleaning.mapping;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.exception.StructuralDefectException;
import lovedata.menus.cleaning.transformer.OcrCorrectionRule;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads mapping tables and OCR rules from tab-separated classpath resources.
 *
 * Format: one entry per line, columns separated by a tab, lines starting
 * with {@code #} and blank lines ignored. Any problem (missing resource,
 * wrong column count, duplicate key, bad regex) is a structural defect.
 */
@Component
@Slf4j
public class MappingTableLoader {

    private static final String COMMENT_PREFIX = "#";

    /**
     * Load a two-column {@code raw<TAB>standard} table. An empty standard column maps to null.
     */
    public MappingTable loadTable(String resourcePath) {
        MappingTable.Builder builder = MappingTable.builder(resourcePath);
        for (TsvLine line : readLines(resourcePath)) {
            if (line.columns.length < 1 || line.columns.length > 2) {
                throw malformed(resourcePath, line, "expected raw<TAB>standard");
            }
            String standard = line.columns.length == 2 ? line.columns[1].trim() : "";
            try {
                builder.put(line.columns[0].trim(), standard);
            } catch (IllegalArgumentException e) {
                throw new StructuralDefectException(resourcePath + " line " + line.number + ": " + e.getMessage(), e);
            }
        }
        MappingTable table = builder.build();
        log.info("Loaded mapping table {} ({} entries)", resourcePath, table.size());
        return table;
    }

    /**
     * Load {@code name<TAB>pattern<TAB>replacement} OCR rules, keeping file order.
     */
    public List<OcrCorrectionRule> loadOcrRules(String resourcePath) {
        List<OcrCorrectionRule> rules = new ArrayList<>();
        for (TsvLine line : readLines(resourcePath)) {
            if (line.columns.length != 3) {
                throw malformed(resourcePath, line, "expected name<TAB>pattern<TAB>replacement");
            }
            try {
                rules.add(OcrCorrectionRule.of(line.columns[0], line.columns[1], line.columns[2]));
            } catch (IllegalArgumentException e) {
                throw new StructuralDefectException(resourcePath + " line " + line.number + ": " + e.getMessage(), e);
            }
        }
        log.info("Loaded {} OCR rules from {}", rules.size(), resourcePath);
        return rules;
    }

    private List<TsvLine> readLines(String resourcePath) {
        Resource resource = new ClassPathResource(resourcePath);
        if (!resource.exists()) {
            throw new StructuralDefectException("Mapping resource not found on classpath: " + resourcePath);
        }

        List<TsvLine> lines = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String text;
            int number = 0;
            while ((text = reader.readLine()) != null) {
                number++;
                // Strip BOM
                if (number == 1 && text.startsWith("\uFEFF")) {
                    text = text.substring(1);
                }
                if (text.trim().isEmpty() || text.startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                if (!text.contains("\t")) {
                    throw new StructuralDefectException(String.format(
                            "%s line %d: no tab separator in '%s'", resourcePath, number, text));
                }
                lines.add(new TsvLine(number, text.split("\t", -1)));
            }
        } catch (IOException e) {
            log.error("Failed to read mapping resource {}: {}", resourcePath, e.getMessage(), e);
            throw new StructuralDefectException("Failed to read mapping resource " + resourcePath, e);
        }

        if (lines.isEmpty()) {
            throw new StructuralDefectException("Mapping resource " + resourcePath + " has no entries");
        }
        return lines;
    }

    private static StructuralDefectException malformed(String resourcePath, TsvLine line, String expected) {
        return new StructuralDefectException(String.format(
                "%s line %d: %s, found %d column(s)", resourcePath, line.number, expected, line.columns.length));
    }

    private static final class TsvLine {

        private final int number;
        private final String[] columns;

        TsvLine(int number, String[] columns) {
            this.number = number;
            this.columns = columns;
        }
    }
}
