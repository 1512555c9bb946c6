package io.proxysql.exporter.http;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MetricsRegistryFactory {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsRegistryFactory.class);

    private MetricsRegistryFactory() {}

    /**
     * Registry backing the {@code /metrics} endpoint. Its Prometheus {@code CollectorRegistry} is
     * private to this instance, so several exporters can live in one JVM (tests do).
     */
    public static PrometheusMeterRegistry create() {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        LOG.info("Prometheus meter registry initialized");
        return registry;
    }
}
