package io.proxysql.exporter.scraper;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scrapes {@code stats_mysql_global}, a key/value table: every row is one variable.
 */
public class GlobalStatusScraper extends AbstractTableScraper {

    static final String UNDOCUMENTED_HELP = "Undocumented stats_mysql_global metric.";

    private final boolean exposeUndocumented;

    public GlobalStatusScraper(MetricRegistry registry, Duration queryTimeout) {
        this(registry, queryTimeout, false);
    }

    /**
     * @param exposeUndocumented export variables missing from the registry as untyped samples
     */
    public GlobalStatusScraper(MetricRegistry registry, Duration queryTimeout, boolean exposeUndocumented) {
        super(TableGroup.MYSQL_STATUS, registry, queryTimeout);
        this.exposeUndocumented = exposeUndocumented;
    }

    @Override
    protected void processRow(Row row, List<MetricSample> out, ScrapeSink sink) {
        if (row.size() < 2) {
            reject(sink, new MalformedValueException(null, null,
                    "Expected a name/value row from stats_mysql_global, got " + row.columns()));
            return;
        }
        String name = row.value(0);
        String raw = row.value(1);
        if (name == null) {
            reject(sink, new MalformedValueException(null, raw, "Variable name is NULL"));
            return;
        }
        try {
            MetricDescriptor descriptor = descriptor(name, raw);
            if (descriptor == null) {
                if (!exposeUndocumented) {
                    return;
                }
                descriptor = new MetricDescriptor(getGroup().metricPrefix() + name.toLowerCase(Locale.ROOT),
                        MetricKind.UNTYPED, UNDOCUMENTED_HELP, List.of());
            }
            out.add(new MetricSample(descriptor, Map.of(), ValueCoercion.parseNumber(name, raw)));
        } catch (MalformedValueException e) {
            reject(sink, e);
        }
    }
}
