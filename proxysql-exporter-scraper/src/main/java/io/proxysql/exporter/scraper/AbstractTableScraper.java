package io.proxysql.exporter.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the fixed query of a {@link TableGroup} and hands every row to {@link #processRow}.
 *
 * <p>Samples are staged while rows are read and only published once the whole result set was
 * consumed, so a failure in the middle of the result leaves nothing of the group in the sink.</p>
 */
public abstract class AbstractTableScraper implements TableScraper {

    private static final Logger log = LoggerFactory.getLogger(AbstractTableScraper.class);

    protected final MetricRegistry registry;
    private final TableGroup group;
    private final Duration queryTimeout;

    protected AbstractTableScraper(TableGroup group, MetricRegistry registry, Duration queryTimeout) {
        this.group = group;
        this.registry = registry;
        this.queryTimeout = queryTimeout;
    }

    @Override
    public TableGroup getGroup() {
        return group;
    }

    @Override
    public void scrape(Connection connection, ScrapeSink sink) throws QueryException {
        List<MetricSample> staged = new ArrayList<>();
        int rows = 0;
        try (Statement statement = connection.createStatement()) {
            applyTimeout(statement);
            try (ResultSet rs = statement.executeQuery(group.query())) {
                List<String> columns = Row.columns(rs.getMetaData());
                while (rs.next()) {
                    processRow(Row.read(columns, rs), staged, sink);
                    rows++;
                }
            }
        } catch (SQLException e) {
            throw new QueryException(group, e);
        }
        log.debug("Scraped {} rows into {} samples from {}", rows, staged.size(), group.collectorName());
        sink.acceptAll(staged);
    }

    /**
     * Convert one row. Samples go to {@code out}; skipped fields are reported to {@code sink}.
     */
    protected abstract void processRow(Row row, List<MetricSample> out, ScrapeSink sink);

    /**
     * Registry entry of {@code field} qualified with the group prefix, or null when the field is
     * not exported.
     *
     * @throws MalformedValueException if the field is registered as a placeholder
     */
    protected MetricDescriptor descriptor(String field, String rawValue) throws MalformedValueException {
        var registered = registry.lookup(group, field);
        if (registered.isEmpty()) {
            return null;
        }
        if (registered.get().isPlaceholder()) {
            throw new MalformedValueException(field, rawValue,
                    "No usable descriptor registered for " + group.collectorName() + " field " + field);
        }
        return registered.get().qualify(group.metricPrefix());
    }

    protected void reject(ScrapeSink sink, MalformedValueException e) {
        log.debug("Skipping {} field {}: {}", group.collectorName(), e.getField(), e.getMessage());
        sink.reject(group, e);
    }

    private void applyTimeout(Statement statement) throws SQLException {
        int seconds = timeoutSeconds(queryTimeout);
        try {
            statement.setQueryTimeout(seconds);
        } catch (SQLFeatureNotSupportedException e) {
            log.debug("Driver does not support query timeouts, running {} without one", group.collectorName());
        }
    }

    /**
     * JDBC timeouts are whole seconds; partial seconds round up and the minimum is one second.
     */
    static int timeoutSeconds(Duration timeout) {
        return (int) Math.max(1, Math.ceil(timeout.toMillis() / 1000.0));
    }
}
