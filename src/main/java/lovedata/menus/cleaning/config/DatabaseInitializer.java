package lovedata.menus.cleaning.config;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.Statement;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Database initialization component that runs at application startup.
 * Validates the connection and makes sure the cleaned-menu target table exists.
 * Run metadata tables are managed by JPA.
 */
@Component
public class DatabaseInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseInitializer.class);

    // ANSI Color codes for console output
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_BOLD = "\u001B[1m";

    private static final String[] REQUIRED_COLUMNS = { "run_id", "id", "name", "date", "venue", "currency_code" };

    @Autowired
    private DataSource dataSource;

    @Autowired
    private CleaningConfig cleaningConfig;

    /**
     * Runs after the application is fully started.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void initializeDatabase() {
        String tableName = cleaningConfig.getTarget().getTable();
        logger.info(ANSI_CYAN + ANSI_BOLD + "DATABASE INITIALIZATION - Starting validation" + ANSI_RESET);

        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            logger.info(ANSI_GREEN + "[SUCCESS] Database connection: {} {} as {}" + ANSI_RESET,
                    metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion(), metaData.getUserName());

            if (!checkTableExists(connection, tableName)) {
                logger.warn(ANSI_YELLOW + "[WARNING] Table '{}' does not exist, creating it" + ANSI_RESET, tableName);
                try (Statement statement = connection.createStatement()) {
                    statement.execute(buildCreateTableSql(tableName));
                    statement.execute(String.format(
                            "CREATE INDEX IF NOT EXISTS %s_date_idx ON %s(date)", tableName, tableName));
                }
                logger.info(ANSI_GREEN + "[SUCCESS] Table '{}' created" + ANSI_RESET, tableName);
            }

            if (!verifyTableStructure(metaData, tableName)) {
                logger.warn(ANSI_YELLOW + "[WARNING] Table '{}' is missing cleaned-menu columns; COPY may fail"
                        + ANSI_RESET, tableName);
            } else {
                logger.info(ANSI_GREEN + "[SUCCESS] Table '{}' structure: OK" + ANSI_RESET, tableName);
            }

            logger.info(ANSI_GREEN + ANSI_BOLD + "DATABASE INITIALIZATION - COMPLETED SUCCESSFULLY" + ANSI_RESET);

        } catch (Exception e) {
            logger.error(ANSI_RED + ANSI_BOLD + "DATABASE INITIALIZATION - FAILED" + ANSI_RESET, e);
            throw new IllegalStateException("Database initialization failed - Application cannot start safely", e);
        }
    }

    /**
     * DDL for the cleaned-menu table. One row per menu per run.
     */
    public static String buildCreateTableSql(String tableName) {
        return String.format("""
                CREATE TABLE IF NOT EXISTS %s (
                    run_id UUID NOT NULL,
                    id INTEGER NOT NULL,
                    name TEXT,
                    date DATE,
                    place TEXT,
                    event TEXT,
                    venue VARCHAR(20),
                    occasion TEXT,
                    currency TEXT NOT NULL,
                    currency_code VARCHAR(10),
                    call_number_normalized TEXT,
                    is_wotm BOOLEAN NOT NULL DEFAULT FALSE,
                    physical_description TEXT,
                    page_count INTEGER,
                    dish_count INTEGER,
                    status TEXT,
                    notes TEXT,
                    loaded_at TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                    PRIMARY KEY (run_id, id)
                )
                """, tableName);
    }

    private boolean checkTableExists(Connection connection, String tableName) throws Exception {
        String checkSQL = """
                SELECT EXISTS (
                    SELECT FROM information_schema.tables
                    WHERE table_name = ?
                )
                """;

        try (var preparedStatement = connection.prepareStatement(checkSQL)) {
            preparedStatement.setString(1, tableName.toLowerCase());
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (resultSet.next()) {
                    return resultSet.getBoolean(1);
                }
            }
        }
        return false;
    }

    private boolean verifyTableStructure(DatabaseMetaData metaData, String tableName) throws Exception {
        int foundColumns = 0;
        try (ResultSet resultSet = metaData.getColumns(null, null, tableName.toLowerCase(), null)) {
            while (resultSet.next()) {
                String columnName = resultSet.getString("COLUMN_NAME");
                for (String required : REQUIRED_COLUMNS) {
                    if (required.equalsIgnoreCase(columnName)) {
                        foundColumns++;
                        break;
                    }
                }
            }
        }
        if (foundColumns < REQUIRED_COLUMNS.length) {
            logger.warn("   Found {}/{} required columns", foundColumns, REQUIRED_COLUMNS.length);
            return false;
        }
        return true;
    }
}
