package io.proxysql.exporter.http;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.Collector;
import io.proxysql.exporter.scraper.ProxySqlExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything served on {@code /metrics}: the ProxySQL samples followed by the exporter's own
 * meters. The scrape runs first, so {@code proxysql_up} and the scrape counters always describe
 * the samples in the same response.
 */
class ExpositionCollector extends Collector implements Collector.Describable {

    private final ProxySqlExporter exporter;
    private final PrometheusMeterRegistry meterRegistry;

    ExpositionCollector(ProxySqlExporter exporter, PrometheusMeterRegistry meterRegistry) {
        this.exporter = exporter;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public List<MetricFamilySamples> describe() {
        return exporter.describe();
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<MetricFamilySamples> families = new ArrayList<>(exporter.collect());
        families.addAll(Collections.list(meterRegistry.getPrometheusRegistry().metricFamilySamples()));
        return families;
    }
}
