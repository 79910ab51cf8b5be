package com.identity.engine.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.identity.engine.config.EngineConfiguration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.util.UUID;

/**
 * Fresh in-memory database with the production schema, one per test instance.
 */
public final class H2Database {

    private final DriverManagerDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final DataSourceTransactionManager transactionManager;

    private H2Database(String name) {
        dataSource = new DriverManagerDataSource(
            "jdbc:h2:mem:" + name
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH"
                + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
            "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
        transactionManager = new DataSourceTransactionManager(dataSource);
    }

    public static H2Database create() {
        return new H2Database("identity-" + UUID.randomUUID());
    }

    public JdbcTemplate jdbcTemplate() {
        return jdbcTemplate;
    }

    public DataSourceTransactionManager transactionManager() {
        return transactionManager;
    }

    public void shutdown() {
        jdbcTemplate.execute("SHUTDOWN");
    }

    /**
     * Same mapper setup as the engine configuration.
     */
    public static ObjectMapper objectMapper() {
        return new EngineConfiguration().identityObjectMapper();
    }
}
