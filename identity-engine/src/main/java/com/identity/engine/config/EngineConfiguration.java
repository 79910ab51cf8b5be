package com.identity.engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.identity.core.crypto.BCryptPasswordHasher;
import com.identity.core.crypto.PasswordHasher;
import com.identity.core.crypto.SecretGenerator;
import com.identity.core.model.EventMappers;
import com.identity.core.repository.EventStore;
import com.identity.engine.command.CommandExecutor;
import com.identity.engine.command.UserCommands;
import com.identity.engine.dispatch.AsyncEventDispatcher;
import com.identity.engine.dispatch.BackgroundJobs;
import com.identity.engine.health.EventStoreHealthIndicator;
import com.identity.engine.lifecycle.GracefulShutdownHandler;
import com.identity.engine.metrics.EventStoreMetrics;
import com.identity.engine.metrics.MetricsConfiguration;
import com.identity.engine.persistence.jdbc.JdbcEventStore;
import com.identity.engine.query.UserProjector;
import com.identity.engine.query.jdbc.JdbcOidcClientRepository;
import com.identity.engine.query.jdbc.JdbcUserProjectionRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Wires the identity engine on top of a data source provided by the application.
 * Expects a {@link JdbcTemplate} and a {@link PlatformTransactionManager} in the context.
 */
@Configuration
@EnableConfigurationProperties(EventStoreProperties.class)
@Import(MetricsConfiguration.class)
public class EngineConfiguration {

    /**
     * Mapper for event payloads and projection documents. Kept separate from any
     * web-facing mapper so persisted formats do not change with API settings.
     */
    @Bean
    public ObjectMapper identityObjectMapper() {
        return JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    @Bean
    public EventMappers eventMappers(@Qualifier("identityObjectMapper") ObjectMapper objectMapper) {
        return EventMappers.userMappers(objectMapper);
    }

    @Bean
    public EventStore eventStore(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            EventMappers eventMappers,
            EventStoreProperties properties,
            EventStoreMetrics metrics) {
        return new JdbcEventStore(jdbcTemplate, transactionManager, eventMappers, properties, metrics);
    }

    // ========== Side Effects ==========

    @Bean
    public ThreadPoolTaskExecutor sideEffectExecutor(EventStoreProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatcherThreads());
        executor.setMaxPoolSize(properties.getDispatcherThreads());
        executor.setQueueCapacity(properties.getDispatcherQueueCapacity());
        executor.setThreadNamePrefix("side-effect-");
        executor.initialize();
        return executor;
    }

    @Bean
    public AsyncEventDispatcher eventDispatcher(
            EventStore eventStore,
            @Qualifier("sideEffectExecutor") ThreadPoolTaskExecutor executor,
            EventStoreProperties properties,
            EventStoreMetrics metrics) {
        return new AsyncEventDispatcher(
            eventStore, new BackgroundJobs(executor), properties.getShutdownTimeout(), metrics);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(AsyncEventDispatcher dispatcher) {
        return new GracefulShutdownHandler(dispatcher);
    }

    // ========== Commands ==========

    @Bean
    public PasswordHasher passwordHasher(EventStoreProperties properties) {
        return new BCryptPasswordHasher(properties.getSecretHashStrength());
    }

    @Bean
    public CommandExecutor commandExecutor(EventStore eventStore) {
        return new CommandExecutor(eventStore);
    }

    @Bean
    public UserCommands userCommands(
            CommandExecutor executor,
            AsyncEventDispatcher dispatcher,
            PasswordHasher passwordHasher,
            EventStoreProperties properties) {
        return new UserCommands(executor, dispatcher, passwordHasher,
            new SecretGenerator(properties.getGeneratedSecretLength()));
    }

    // ========== Queries ==========

    @Bean
    public JdbcUserProjectionRepository userProjectionRepository(
            JdbcTemplate jdbcTemplate,
            PlatformTransactionManager transactionManager,
            @Qualifier("identityObjectMapper") ObjectMapper objectMapper) {
        return new JdbcUserProjectionRepository(jdbcTemplate, transactionManager, objectMapper);
    }

    @Bean
    public JdbcOidcClientRepository oidcClientRepository(
            JdbcTemplate jdbcTemplate, @Qualifier("identityObjectMapper") ObjectMapper objectMapper) {
        return new JdbcOidcClientRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    public UserProjector userProjector(JdbcUserProjectionRepository userProjectionRepository) {
        return new UserProjector(userProjectionRepository);
    }

    @Bean
    public EventStoreHealthIndicator eventStoreHealthIndicator(
            JdbcTemplate jdbcTemplate, AsyncEventDispatcher dispatcher) {
        return new EventStoreHealthIndicator(jdbcTemplate, dispatcher);
    }
}
