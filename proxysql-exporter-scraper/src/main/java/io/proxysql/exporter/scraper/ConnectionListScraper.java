package io.proxysql.exporter.scraper;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static io.proxysql.exporter.scraper.DefaultMetrics.CLIENT_CONNECTION_LIST;
import static io.proxysql.exporter.scraper.DefaultMetrics.LABEL_CLIENT_HOST;
import static io.proxysql.exporter.scraper.DefaultMetrics.LABEL_SERVER_HOST;
import static io.proxysql.exporter.scraper.DefaultMetrics.SERVER_CONNECTION_LIST;

/**
 * Scrapes {@code stats_mysql_processlist}. Each row yields a presence sample (value 1) for its
 * client host and one for its backend host. Hosts seen on several rows are emitted once per row.
 */
public class ConnectionListScraper extends AbstractTableScraper {

    static final double PRESENT = 1;

    public ConnectionListScraper(MetricRegistry registry, Duration queryTimeout) {
        super(TableGroup.MYSQL_CONNECTION_LIST, registry, queryTimeout);
    }

    @Override
    protected void processRow(Row row, List<MetricSample> out, ScrapeSink sink) {
        emit(row, ValueCoercion.FIELD_CLI_HOST, CLIENT_CONNECTION_LIST, LABEL_CLIENT_HOST, out, sink);
        emit(row, ValueCoercion.FIELD_SRV_HOST, SERVER_CONNECTION_LIST, LABEL_SERVER_HOST, out, sink);
    }

    private void emit(Row row, String column, String metric, String label, List<MetricSample> out, ScrapeSink sink) {
        String host = row.get(column);
        try {
            MetricDescriptor descriptor = descriptor(metric, host);
            if (descriptor == null) {
                return;
            }
            if (host == null) {
                throw new MalformedValueException(column, null, "Connection list row without " + column);
            }
            out.add(new MetricSample(descriptor, Map.of(label, host), PRESENT));
        } catch (MalformedValueException e) {
            reject(sink, e);
        }
    }
}
