package io.proxysql.exporter.scraper;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static io.proxysql.exporter.scraper.DefaultMetrics.LABEL_ENDPOINT;
import static io.proxysql.exporter.scraper.DefaultMetrics.LABEL_HOSTGROUP;

/**
 * Scrapes {@code stats_mysql_connection_pool}: one row per backend server and hostgroup.
 * Every sample of a row carries the same {@code hostgroup} and {@code endpoint} labels.
 */
public class ConnectionPoolScraper extends AbstractTableScraper {

    public ConnectionPoolScraper(MetricRegistry registry, Duration queryTimeout) {
        super(TableGroup.MYSQL_CONNECTION_POOL, registry, queryTimeout);
    }

    @Override
    protected void processRow(Row row, List<MetricSample> out, ScrapeSink sink) {
        Map<String, String> labels;
        try {
            labels = labels(row);
        } catch (MalformedValueException e) {
            reject(sink, e);
            return;
        }

        for (int i = 0; i < row.size(); i++) {
            String field = row.column(i).toLowerCase(Locale.ROOT);
            if (ValueCoercion.isLabel(field)) {
                continue;
            }
            String raw = row.value(i);
            try {
                MetricDescriptor descriptor = descriptor(field, raw);
                if (descriptor == null) {
                    continue;
                }
                out.add(new MetricSample(descriptor, labels, ValueCoercion.parse(field, raw).value()));
            } catch (MalformedValueException e) {
                reject(sink, e);
            }
        }
    }

    static Map<String, String> labels(Row row) throws MalformedValueException {
        String hostgroup = required(row, ValueCoercion.FIELD_HOSTGROUP);
        String host = required(row, ValueCoercion.FIELD_SRV_HOST);
        String port = required(row, ValueCoercion.FIELD_SRV_PORT);
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_HOSTGROUP, hostgroup);
        labels.put(LABEL_ENDPOINT, ValueCoercion.endpoint(host, port));
        return labels;
    }

    private static String required(Row row, String field) throws MalformedValueException {
        String value = row.get(field);
        if (value == null) {
            throw new MalformedValueException(field, null, "Connection pool row without " + field + ": " + row.values());
        }
        return value;
    }
}
