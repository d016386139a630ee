package com.rulesim.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer registry for backtest metrics.
 *
 * <p>Batch runs have no scrape endpoint, so an in-memory {@link SimpleMeterRegistry} is
 * provided unless another registry is already configured. All meters carry the common
 * {@code application=rulesim} tag. Metric definitions live in
 * {@link com.rulesim.observability.BacktestMetrics}.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        MeterRegistry registry = new SimpleMeterRegistry();
        registry.config().commonTags("application", "rulesim");
        return registry;
    }
}
