package io.proxysql.exporter.scraper;

import java.util.List;
import java.util.Objects;

/**
 * Static metadata of one metric family.
 *
 * <p>A descriptor with an empty name is a placeholder: the field is registered but there is
 * nothing usable to emit for it. Scrapers report such fields as malformed instead of
 * producing a nameless metric.</p>
 */
public record MetricDescriptor(String name, MetricKind kind, String help, List<String> labelNames) {

    private static final MetricDescriptor PLACEHOLDER = new MetricDescriptor("", MetricKind.UNTYPED, "", List.of());

    public MetricDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        help = help == null ? "" : help;
        labelNames = labelNames == null ? List.of() : List.copyOf(labelNames);
    }

    public static MetricDescriptor gauge(String name, String help, String... labelNames) {
        return new MetricDescriptor(name, MetricKind.GAUGE, help, List.of(labelNames));
    }

    public static MetricDescriptor counter(String name, String help, String... labelNames) {
        return new MetricDescriptor(name, MetricKind.COUNTER, help, List.of(labelNames));
    }

    public static MetricDescriptor placeholder() {
        return PLACEHOLDER;
    }

    public boolean isPlaceholder() {
        return name.isEmpty();
    }

    /**
     * Same descriptor with its name prefixed by the table group namespace.
     */
    public MetricDescriptor qualify(String prefix) {
        if (isPlaceholder()) {
            throw new IllegalStateException("placeholder descriptor cannot be qualified");
        }
        return new MetricDescriptor(prefix + name, kind, help, labelNames);
    }
}
