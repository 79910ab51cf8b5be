package com.identity.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the identity engine.
 *
 * Configures:
 * - Common tags for all metrics
 * - The event store meter binder
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "identity-engine");
    }

    @Bean
    public EventStoreMetrics eventStoreMetrics() {
        return new EventStoreMetrics();
    }
}
