package lovedata.menus.cleaning.service;

import lovedata.menus.cleaning.model.CleanedMenuRecord;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;

/**
 * Service responsible for bulk loading cleaned menus with PostgreSQL COPY.
 *
 * Handles:
 * - CopyManager API integration (unwrapping the HikariCP proxy)
 * - Cleaned record to tab-delimited CSV line conversion
 * - Streaming, one record per chunk, so the full payload is never buffered
 *
 * The load is atomic: all records of a run succeed or none do.
 */
@Service
public class CleanedMenuCopyService {

    private static final Logger logger = LoggerFactory.getLogger(CleanedMenuCopyService.class);

    /** Target columns, in the order every COPY line writes them. */
    public static final List<String> COLUMNS = List.of(
            "run_id", "id", "name", "date", "place", "event", "venue", "occasion",
            "currency", "currency_code", "call_number_normalized", "is_wotm",
            "physical_description", "page_count", "dish_count", "status", "notes");

    private final DataSource dataSource;

    @Autowired
    public CleanedMenuCopyService(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * COPY the cleaned records of one run into the target table.
     *
     * @return number of rows PostgreSQL reports as loaded
     */
    public long executeCopy(UUID runId, List<CleanedMenuRecord> records, String tableName)
            throws SQLException, IOException {
        if (records.isEmpty()) {
            logger.info("No cleaned records to load into {}", tableName);
            return 0;
        }

        long recordCount;
        try (Connection connection = dataSource.getConnection()) {
            CopyManager copyManager = new CopyManager(unwrapConnection(connection));

            String copyCommand = buildCopyCommand(tableName);
            logger.info("Using COPY command: {}", copyCommand);

            try (InputStream copyInputStream = createCopyInputStream(runId, records)) {
                recordCount = copyManager.copyIn(copyCommand, copyInputStream);
            }
        }

        logger.info("COPY command inserted {} cleaned menus into table {} for run {}", recordCount, tableName, runId);
        return recordCount;
    }

    private BaseConnection unwrapConnection(Connection connection) throws SQLException {
        if (connection.isWrapperFor(BaseConnection.class)) {
            return connection.unwrap(BaseConnection.class);
        }
        throw new SQLException("Unable to unwrap connection to PostgreSQL BaseConnection");
    }

    /**
     * COPY ... FROM STDIN, CSV format with tab delimiter; an unquoted empty value is NULL.
     */
    public String buildCopyCommand(String tableName) {
        return "COPY " + tableName + " (" + String.join(", ", COLUMNS)
                + ") FROM STDIN WITH (FORMAT CSV, DELIMITER E'\\t', NULL '')";
    }

    /**
     * Streaming adapter producing one COPY line per cleaned record.
     */
    public InputStream createCopyInputStream(UUID runId, List<CleanedMenuRecord> records) {
        Iterator<CleanedMenuRecord> iterator = records.iterator();
        return new InputStream() {
            private ByteArrayInputStream currentChunk = null;

            @Override
            public int read() throws IOException {
                if (currentChunk == null || currentChunk.available() == 0) {
                    if (!iterator.hasNext()) {
                        return -1;
                    }
                    currentChunk = new ByteArrayInputStream(
                            toCopyLine(runId, iterator.next()).getBytes(StandardCharsets.UTF_8));
                }
                return currentChunk.read();
            }
        };
    }

    /**
     * One tab-delimited CSV line, terminated by a newline. Nulls are written
     * as nothing; every other value is quoted so tabs, quotes and newlines
     * inside text survive.
     */
    public String toCopyLine(UUID runId, CleanedMenuRecord record) {
        Object[] values = {
                runId,
                record.getId(),
                record.getName(),
                record.getDate(),
                record.getPlace(),
                record.getEvent(),
                record.getVenue() == null ? null : record.getVenue().name(),
                record.getOccasion(),
                record.getCurrency(),
                record.getCurrencyCode(),
                record.getCallNumberNormalized(),
                record.isWotm(),
                record.getPhysicalDescription(),
                record.getPageCount(),
                record.getDishCount(),
                record.getStatus(),
                record.getNotes()
        };

        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                line.append('\t');
            }
            if (values[i] != null) {
                line.append('"').append(values[i].toString().replace("\"", "\"\"")).append('"');
            }
        }
        return line.append('\n').toString();
    }
}
