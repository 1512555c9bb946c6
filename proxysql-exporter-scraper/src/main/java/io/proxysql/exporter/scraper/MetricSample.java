package io.proxysql.exporter.scraper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One value of a fully-qualified metric family with its labels, in descriptor label order.
 */
public record MetricSample(MetricDescriptor descriptor, Map<String, String> labels, double value) {

    public MetricSample {
        Objects.requireNonNull(descriptor, "descriptor");
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public String name() {
        return descriptor.name();
    }

    public MetricKind kind() {
        return descriptor.kind();
    }
}
