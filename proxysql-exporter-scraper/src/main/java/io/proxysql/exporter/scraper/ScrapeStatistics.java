package io.proxysql.exporter.scraper;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Health of the exporter itself, published as Micrometer meters.
 *
 * <p>With the Prometheus registry these show up as {@code proxysql_up},
 * {@code proxysql_exporter_scrapes_total}, {@code proxysql_exporter_scrape_errors_total},
 * {@code proxysql_exporter_malformed_values_total}, {@code proxysql_exporter_last_scrape_error}
 * and {@code proxysql_exporter_last_scrape_duration_seconds}.</p>
 */
public class ScrapeStatistics {

    static final String CONNECTION_COLLECTOR = "connection";
    static final String TAG_COLLECTOR = "collector";

    private final MeterRegistry registry;
    private final Counter scrapes;
    private final AtomicInteger up = new AtomicInteger();
    private final AtomicInteger lastScrapeError = new AtomicInteger();
    private final AtomicLong lastScrapeDurationNanos = new AtomicLong();

    public ScrapeStatistics(MeterRegistry registry) {
        this.registry = registry;
        this.scrapes = Counter.builder("proxysql.exporter.scrapes")
                .description("Total number of times ProxySQL was scraped for metrics.")
                .register(registry);
        Gauge.builder("proxysql.up", up, AtomicInteger::get)
                .description("Whether ProxySQL is up.")
                .strongReference(true)
                .register(registry);
        Gauge.builder("proxysql.exporter.last.scrape.error", lastScrapeError, AtomicInteger::get)
                .description("Whether the last scrape of metrics from ProxySQL resulted in an error (1 for error, 0 for success).")
                .strongReference(true)
                .register(registry);
        Gauge.builder("proxysql.exporter.last.scrape.duration.seconds", lastScrapeDurationNanos, n -> n.get() / 1e9)
                .description("Duration of the last scrape of metrics from ProxySQL.")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Statistics that are recorded nowhere.
     */
    public static ScrapeStatistics noop() {
        return new ScrapeStatistics(new CompositeMeterRegistry());
    }

    public void record(ScrapeResult result) {
        scrapes.increment();
        up.set(result.isConnected() ? 1 : 0);
        lastScrapeError.set(result.hasErrors() ? 1 : 0);
        lastScrapeDurationNanos.set(result.duration().toNanos());

        if (!result.isConnected()) {
            errors(CONNECTION_COLLECTOR).increment();
        }
        result.failures().keySet().forEach(group -> errors(group.collectorName()).increment());
        result.rejected().forEach((group, list) -> malformed(group.collectorName()).increment(list.size()));
    }

    private Counter errors(String collector) {
        return Counter.builder("proxysql.exporter.scrape.errors")
                .description("Total number of times an error occurred scraping ProxySQL.")
                .tag(TAG_COLLECTOR, collector)
                .register(registry);
    }

    private Counter malformed(String collector) {
        return Counter.builder("proxysql.exporter.malformed.values")
                .description("Total number of admin fields skipped because their value could not be converted.")
                .tag(TAG_COLLECTOR, collector)
                .register(registry);
    }
}
