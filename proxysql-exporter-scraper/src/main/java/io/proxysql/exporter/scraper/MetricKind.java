package io.proxysql.exporter.scraper;

import io.prometheus.client.Collector;

public enum MetricKind {
    GAUGE(Collector.Type.GAUGE),
    COUNTER(Collector.Type.COUNTER),
    /** Only used for stats_mysql_global variables the registry does not document. */
    UNTYPED(Collector.Type.UNKNOWN);

    private final Collector.Type prometheusType;

    MetricKind(Collector.Type prometheusType) {
        this.prometheusType = prometheusType;
    }

    public Collector.Type prometheusType() {
        return prometheusType;
    }
}
