package io.proxysql.exporter.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps admin field names to metric descriptors, one map per {@link TableGroup}.
 *
 * <p>Keys, metric names and label names must be lowercase; this is checked when the registry is
 * built. Lookups lowercase the raw column name first since ProxySQL reports mixed case columns
 * such as {@code ConnUsed} or {@code Active_Transactions}. Fields without an entry are simply
 * not exported.</p>
 *
 * <p>Instances are immutable and handed to each exporter, so tests can run exporters with
 * reduced or altered registries side by side.</p>
 */
public final class MetricRegistry {

    private final Map<TableGroup, Map<String, MetricDescriptor>> groups;

    private MetricRegistry(Map<TableGroup, Map<String, MetricDescriptor>> groups) {
        this.groups = groups;
    }

    public static MetricRegistry defaults() {
        return DefaultMetrics.registry();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<MetricDescriptor> lookup(TableGroup group, String fieldName) {
        if (fieldName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(groups.get(group).get(fieldName.toLowerCase(Locale.ROOT)));
    }

    public Map<String, MetricDescriptor> fields(TableGroup group) {
        return groups.get(group);
    }

    /**
     * Every usable descriptor of every group, qualified with the group prefix, in registration order.
     * Aliased fields (several columns feeding one metric) appear once.
     */
    public List<MetricDescriptor> descriptors() {
        Map<String, MetricDescriptor> result = new LinkedHashMap<>();
        for (TableGroup group : TableGroup.values()) {
            for (MetricDescriptor d : groups.get(group).values()) {
                if (!d.isPlaceholder()) {
                    MetricDescriptor qualified = d.qualify(group.metricPrefix());
                    result.putIfAbsent(qualified.name(), qualified);
                }
            }
        }
        return new ArrayList<>(result.values());
    }

    public static final class Builder {
        private final Map<TableGroup, Map<String, MetricDescriptor>> groups = new EnumMap<>(TableGroup.class);

        private Builder() {
            for (TableGroup group : TableGroup.values()) {
                groups.put(group, new LinkedHashMap<>());
            }
        }

        public Builder register(TableGroup group, String fieldName, MetricDescriptor descriptor) {
            groups.get(group).put(fieldName, descriptor);
            return this;
        }

        public Builder placeholder(TableGroup group, String fieldName) {
            return register(group, fieldName, MetricDescriptor.placeholder());
        }

        public MetricRegistry build() {
            Map<TableGroup, Map<String, MetricDescriptor>> copy = new EnumMap<>(TableGroup.class);
            groups.forEach((group, fields) -> {
                fields.forEach((key, d) -> validate(group, key, d));
                copy.put(group, Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
            });
            return new MetricRegistry(Collections.unmodifiableMap(copy));
        }

        private static void validate(TableGroup group, String key, MetricDescriptor d) {
            requireLowercase(group, "field name", key);
            requireLowercase(group, "metric name", d.name());
            for (String label : d.labelNames()) {
                requireLowercase(group, "label name", label);
            }
        }

        private static void requireLowercase(TableGroup group, String what, String value) {
            if (!value.equals(value.toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException(
                        "%s '%s' registered for %s is not lowercase".formatted(what, value, group.collectorName()));
            }
        }
    }
}
