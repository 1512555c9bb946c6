package io.proxysql.exporter.scraper;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ScrapeStatisticsTest {

    @Test
    void testSuccessfulScrape() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScrapeStatistics statistics = new ScrapeStatistics(registry);

        statistics.record(new ScrapeResult(List.of(), Map.of(), Map.of(), null, Duration.ofMillis(250)));

        assertEquals(1, registry.get("proxysql.exporter.scrapes").counter().count());
        assertEquals(1, registry.get("proxysql.up").gauge().value());
        assertEquals(0, registry.get("proxysql.exporter.last.scrape.error").gauge().value());
        assertEquals(0.25, registry.get("proxysql.exporter.last.scrape.duration.seconds").gauge().value(), 1e-9);
    }

    @Test
    void testPartialFailure() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScrapeStatistics statistics = new ScrapeStatistics(registry);

        statistics.record(new ScrapeResult(List.of(),
                Map.of(TableGroup.MYSQL_CONNECTION_LIST, new QueryException(TableGroup.MYSQL_CONNECTION_LIST, "boom")),
                Map.of(TableGroup.MYSQL_STATUS, List.of(
                        new MalformedValueException("a", "x", "bad"),
                        new MalformedValueException("b", "y", "bad"))),
                null, Duration.ZERO));

        assertEquals(1, registry.get("proxysql.up").gauge().value());
        assertEquals(1, registry.get("proxysql.exporter.last.scrape.error").gauge().value());
        assertEquals(1, registry.get("proxysql.exporter.scrape.errors")
                .tag("collector", "mysql_connection_list").counter().count());
        assertEquals(2, registry.get("proxysql.exporter.malformed.values")
                .tag("collector", "mysql_status").counter().count());
    }

    @Test
    void testConnectionFailure() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        ScrapeStatistics statistics = new ScrapeStatistics(registry);

        statistics.record(ScrapeResult.connectionFailed(
                new ConnectionException("refused", null), Duration.ofMillis(3)));

        assertEquals(0, registry.get("proxysql.up").gauge().value());
        assertEquals(1, registry.get("proxysql.exporter.last.scrape.error").gauge().value());
        assertEquals(1, registry.get("proxysql.exporter.scrape.errors")
                .tag("collector", "connection").counter().count());
    }

    @Test
    void testNoopDoesNotThrow() {
        assertDoesNotThrow(() -> ScrapeStatistics.noop()
                .record(new ScrapeResult(List.of(), Map.of(), Map.of(), null, Duration.ZERO)));
    }
}
