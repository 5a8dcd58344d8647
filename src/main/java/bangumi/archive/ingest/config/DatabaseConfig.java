package bangumi.archive.ingest.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import javax.sql.DataSource;

/**
 * Database configuration with HikariCP settings for sequential batch upserts.
 * The loader is single-threaded, so the pool only needs room for one processor
 * connection plus a spare.
 */
@Configuration
public class DatabaseConfig {

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

    @Value("${spring.datasource.hikari.maximum-pool-size:2}")
    private int maximumPoolSize;

    @Value("${spring.datasource.hikari.minimum-idle:0}")
    private int minimumIdle;

    @Value("${spring.datasource.hikari.connection-timeout:30000}")
    private long connectionTimeout;

    @Bean
    @Primary
    public DataSource dataSource() {
        HikariConfig config = new HikariConfig();

        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName(driverClassName);

        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(minimumIdle);
        config.setConnectionTimeout(connectionTimeout);

        if (schema != null && !schema.isEmpty()) {
            config.setSchema(schema);
        }

        // Processors manage their own transactions, one per batch
        config.setAutoCommit(false);
        config.setValidationTimeout(5000);
        config.setMaxLifetime(1800000); // 30 minutes

        // Start even if the database is down; processors report the failure on connect
        config.setInitializationFailTimeout(-1);

        config.addDataSourceProperty("reWriteBatchedInserts", "true");
        config.addDataSourceProperty("prepareThreshold", "3");

        config.setPoolName("Stats-Loader-Pool");

        return new HikariDataSource(config);
    }
}
