package lovedata.menus.cleaning.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Connection pool shared by run tracking (JPA), table setup and the COPY load.
 *
 * A cleaning upload holds one connection for the whole COPY of its records,
 * so the pool is sized for concurrent uploads, not for the cleaning workers.
 */
@Configuration
public class DatabaseConfig {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

    @Value("${spring.datasource.url}")
    private String jdbcUrl;

    @Value("${spring.datasource.schema:}")
    private String schema;

    @Value("${spring.datasource.username}")
    private String username;

    @Value("${spring.datasource.password}")
    private String password;

    @Value("${spring.datasource.driver-class-name}")
    private String driverClassName;

    @Value("${spring.datasource.hikari.maximum-pool-size:5}")
    private int maximumPoolSize;

    @Value("${spring.datasource.hikari.minimum-idle:1}")
    private int minimumIdle;

    @Value("${spring.datasource.hikari.connection-timeout:30000}")
    private long connectionTimeout;

    // COPY of a large export can run for minutes
    @Value("${cleaning.target.copy-timeout-seconds:600}")
    private int copyTimeoutSeconds;

    @Bean
    @Primary
    public DataSource dataSource() {
        HikariConfig config = new HikariConfig();
        config.setPoolName("menu-cleaning");
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName(driverClassName);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeout);
        if (!schema.isBlank()) {
            config.setSchema(schema);
        }

        // shows up as application_name in pg_stat_activity
        config.addDataSourceProperty("ApplicationName", "menu-cleaning");
        config.addDataSourceProperty("socketTimeout", String.valueOf(copyTimeoutSeconds));

        logger.info("Connection pool for {} (schema: {}, max {} connections)",
                jdbcUrl, schema.isBlank() ? "default" : schema, maximumPoolSize);
        return new HikariDataSource(config);
    }
}
