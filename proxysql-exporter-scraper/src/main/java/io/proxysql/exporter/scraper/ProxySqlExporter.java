package io.proxysql.exporter.scraper;

import io.prometheus.client.Collector;
import io.proxysql.exporter.common.AdminConnectionProvider;
import io.proxysql.exporter.common.ExporterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus collector exposing the ProxySQL admin statistics.
 *
 * <p>{@link #describe()} lists the registry descriptors and never touches the database.
 * {@link #collect()} runs one scrape cycle: it obtains the cached admin connection, runs every
 * table scraper (in parallel unless configured otherwise) and converts what they emitted.
 * A failing group is logged and counted but does not affect the others; only a missing
 * connection yields an empty scrape.</p>
 */
public class ProxySqlExporter extends Collector implements Collector.Describable, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProxySqlExporter.class);

    private static final Duration SCRAPER_GRACE = Duration.ofSeconds(5);

    private final AdminConnectionProvider connectionProvider;
    private final MetricRegistry registry;
    private final List<TableScraper> scrapers;
    private final Duration queryTimeout;
    private final Duration scraperGrace;
    private final ScrapeStatistics statistics;
    private final ExecutorService executor;

    private final Object connectionLock = new Object();
    private Connection connection;

    public ProxySqlExporter(AdminConnectionProvider connectionProvider,
                            MetricRegistry registry,
                            List<TableScraper> scrapers,
                            Duration queryTimeout,
                            boolean concurrent,
                            ScrapeStatistics statistics) {
        this(connectionProvider, registry, scrapers, queryTimeout, concurrent, statistics, SCRAPER_GRACE);
    }

    ProxySqlExporter(AdminConnectionProvider connectionProvider,
                     MetricRegistry registry,
                     List<TableScraper> scrapers,
                     Duration queryTimeout,
                     boolean concurrent,
                     ScrapeStatistics statistics,
                     Duration scraperGrace) {
        this.connectionProvider = connectionProvider;
        this.registry = registry;
        this.scrapers = List.copyOf(scrapers);
        this.queryTimeout = queryTimeout;
        this.scraperGrace = scraperGrace;
        this.statistics = statistics;
        this.executor = concurrent && this.scrapers.size() > 1
                ? Executors.newFixedThreadPool(this.scrapers.size(), new ScraperThreadFactory())
                : null;
    }

    /**
     * Exporter with the scrapers enabled in {@code config}.
     */
    public static ProxySqlExporter create(ExporterConfig config,
                                         AdminConnectionProvider connectionProvider,
                                         MetricRegistry registry,
                                         ScrapeStatistics statistics) {
        List<TableScraper> scrapers = new ArrayList<>();
        if (config.collectStatus()) {
            scrapers.add(new GlobalStatusScraper(registry, config.queryTimeout(), config.collectUndocumented()));
        }
        if (config.collectPool()) {
            scrapers.add(new ConnectionPoolScraper(registry, config.queryTimeout()));
        }
        if (config.collectList()) {
            scrapers.add(new ConnectionListScraper(registry, config.queryTimeout()));
        }
        log.info("ProxySQL exporter created: collectors={}, concurrent={}, queryTimeout={}",
                scrapers.stream().map(s -> s.getGroup().collectorName()).toList(),
                config.concurrentScrape(), config.queryTimeout());
        return new ProxySqlExporter(connectionProvider, registry, scrapers, config.queryTimeout(),
                config.concurrentScrape(), statistics);
    }

    @Override
    public List<MetricFamilySamples> describe() {
        List<MetricFamilySamples> result = new ArrayList<>();
        for (MetricDescriptor d : registry.descriptors()) {
            result.add(new MetricFamilySamples(d.name(), d.kind().prometheusType(), d.help(), new ArrayList<>()));
        }
        return result;
    }

    @Override
    public List<MetricFamilySamples> collect() {
        return toFamilies(scrape().samples());
    }

    /**
     * Run one scrape cycle. Cycles are serialised; this method never throws for scrape failures.
     */
    public synchronized ScrapeResult scrape() {
        long start = System.nanoTime();
        ScrapeResult result;
        Connection conn;
        try {
            conn = connection();
        } catch (ConnectionException e) {
            log.error("Cannot connect to ProxySQL admin interface: {}", e.getMessage());
            result = ScrapeResult.connectionFailed(e, Duration.ofNanos(System.nanoTime() - start));
            statistics.record(result);
            return result;
        }

        SampleBuffer buffer = new SampleBuffer();
        Map<TableGroup, QueryException> failures = executor == null
                ? runSequentially(conn, buffer)
                : runConcurrently(conn, buffer);
        buffer.close();

        result = new ScrapeResult(buffer.getSamples(), failures, buffer.getRejected(), null,
                Duration.ofNanos(System.nanoTime() - start));
        result.rejected().forEach((group, list) ->
                log.warn("Skipped {} malformed fields in {}", list.size(), group.collectorName()));
        log.debug("Scrape finished: samples={}, failedGroups={}, duration={}",
                result.samples().size(), failures.keySet(), result.duration());
        statistics.record(result);
        return result;
    }

    private Map<TableGroup, QueryException> runSequentially(Connection conn, SampleBuffer buffer) {
        Map<TableGroup, QueryException> failures = new EnumMap<>(TableGroup.class);
        for (TableScraper scraper : scrapers) {
            try {
                scraper.scrape(conn, buffer.sink(scraper.getGroup()));
            } catch (QueryException e) {
                failed(failures, buffer, scraper, e);
            } catch (RuntimeException e) {
                failed(failures, buffer, scraper, new QueryException(scraper.getGroup(), e));
            }
        }
        return failures;
    }

    private Map<TableGroup, QueryException> runConcurrently(Connection conn, SampleBuffer buffer) {
        Map<TableScraper, Future<?>> futures = new LinkedHashMap<>();
        for (TableScraper scraper : scrapers) {
            futures.put(scraper, executor.submit(() -> {
                scraper.scrape(conn, buffer.sink(scraper.getGroup()));
                return null;
            }));
        }

        Map<TableGroup, QueryException> failures = new EnumMap<>(TableGroup.class);
        Duration limit = queryTimeout.plus(scraperGrace);
        long deadline = System.nanoTime() + limit.toNanos();
        for (Map.Entry<TableScraper, Future<?>> entry : futures.entrySet()) {
            TableScraper scraper = entry.getKey();
            Future<?> future = entry.getValue();
            try {
                future.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                failed(failures, buffer, scraper, cause instanceof QueryException qe
                        ? qe
                        : new QueryException(scraper.getGroup(), cause));
            } catch (TimeoutException e) {
                failed(failures, buffer, scraper, new QueryException(scraper.getGroup(), "Timed out after " + limit));
                future.cancel(true);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failed(failures, buffer, scraper, new QueryException(scraper.getGroup(), e));
                future.cancel(true);
            }
        }
        return failures;
    }

    private static void failed(Map<TableGroup, QueryException> failures, SampleBuffer buffer,
                               TableScraper scraper, QueryException e) {
        log.warn("Error scraping {}: {}", scraper.getGroup().collectorName(), e.getMessage());
        buffer.discard(scraper.getGroup());
        failures.put(scraper.getGroup(), e);
    }

    /**
     * The cached admin connection, reopened when it is no longer valid.
     */
    Connection connection() throws ConnectionException {
        synchronized (connectionLock) {
            if (connection != null) {
                if (isValid(connection)) {
                    return connection;
                }
                log.info("Admin connection is no longer valid, reconnecting");
                closeConnection();
            }
            try {
                connection = connectionProvider.getConnection();
            } catch (SQLException | RuntimeException e) {
                throw new ConnectionException("Failed to connect to ProxySQL: " + e.getMessage(), e);
            }
            if (connection == null) {
                throw new ConnectionException("Connection provider returned no connection", null);
            }
            return connection;
        }
    }

    private boolean isValid(Connection conn) {
        try {
            return conn.isValid(AbstractTableScraper.timeoutSeconds(queryTimeout));
        } catch (SQLException e) {
            log.debug("Admin connection validation failed: {}", e.getMessage());
            return false;
        }
    }

    private void closeConnection() {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Error closing admin connection: {}", e.getMessage());
        } finally {
            connection = null;
        }
    }

    /**
     * Group samples into families in first-seen order. A label set already present in a family
     * is dropped since the exposition format does not allow repeated series; counter samples
     * get the {@code _total} suffix the Prometheus text format expects.
     */
    static List<MetricFamilySamples> toFamilies(List<MetricSample> samples) {
        Map<String, MetricDescriptor> descriptors = new LinkedHashMap<>();
        Map<String, List<MetricFamilySamples.Sample>> byFamily = new LinkedHashMap<>();
        Map<String, Set<List<String>>> seen = new LinkedHashMap<>();

        for (MetricSample sample : samples) {
            MetricDescriptor d = sample.descriptor();
            descriptors.putIfAbsent(d.name(), d);
            List<String> labelNames = new ArrayList<>(sample.labels().keySet());
            List<String> labelValues = new ArrayList<>(sample.labels().values());
            if (!seen.computeIfAbsent(d.name(), n -> new HashSet<>()).add(labelValues)) {
                continue;
            }
            String sampleName = d.kind() == MetricKind.COUNTER ? d.name() + "_total" : d.name();
            byFamily.computeIfAbsent(d.name(), n -> new ArrayList<>())
                    .add(new MetricFamilySamples.Sample(sampleName, labelNames, labelValues, sample.value()));
        }

        List<MetricFamilySamples> families = new ArrayList<>();
        byFamily.forEach((name, list) -> {
            MetricDescriptor d = descriptors.get(name);
            families.add(new MetricFamilySamples(name, d.kind().prometheusType(), d.help(), list));
        });
        return families;
    }

    public List<TableScraper> getScrapers() {
        return scrapers;
    }

    public MetricRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
        synchronized (connectionLock) {
            closeConnection();
        }
        log.info("ProxySQL exporter closed");
    }

    private static final class ScraperThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "proxysql-scraper-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
