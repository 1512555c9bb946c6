package io.proxysql.exporter.scraper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionPoolScraperTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private Connection connection;

    @BeforeEach
    void setup() throws Exception {
        connection = AdminFixture.open();
    }

    @AfterEach
    void tearDown() throws Exception {
        connection.close();
    }

    private static Map<String, String> labels(String hostgroup, String endpoint) {
        return Map.of("hostgroup", hostgroup, "endpoint", endpoint);
    }

    @Test
    void testScrapeConnectionPool() throws Exception {
        AdminFixture.createPool(connection, AdminFixture.POOL_COLUMNS, AdminFixture.POOL_ROWS);
        RecordingSink sink = new RecordingSink();

        new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(4 * 9, sink.samples.size());
        assertTrue(sink.rejected.isEmpty());

        var first = labels("0", "10.91.142.80:3306");
        MetricSample status = sink.find("proxysql_connection_pool_status", first);
        assertEquals(1, status.value());
        assertEquals(MetricKind.GAUGE, status.kind());
        assertEquals(0, sink.find("proxysql_connection_pool_conn_used", first).value());
        assertEquals(45, sink.find("proxysql_connection_pool_conn_free", first).value());
        assertEquals(1895677, sink.find("proxysql_connection_pool_conn_ok", first).value());
        assertEquals(MetricKind.COUNTER, sink.find("proxysql_connection_pool_conn_ok", first).kind());
        assertEquals(46, sink.find("proxysql_connection_pool_conn_err", first).value());
        assertEquals(197941647, sink.find("proxysql_connection_pool_queries", first).value());
        assertEquals(10984550806d, sink.find("proxysql_connection_pool_bytes_data_sent", first).value());
        assertEquals(321063484988d, sink.find("proxysql_connection_pool_bytes_data_recv", first).value());
        assertEquals(163, sink.find("proxysql_connection_pool_latency_us", first).value());

        assertEquals(2, sink.find("proxysql_connection_pool_status", labels("0", "10.91.142.82:3306")).value());
        assertEquals(3, sink.find("proxysql_connection_pool_status", labels("1", "10.91.142.88:3306")).value());
        assertEquals(4, sink.find("proxysql_connection_pool_status", labels("2", "10.91.142.89:3306")).value());
    }

    @Test
    void testLabelsAreInDescriptorOrder() throws Exception {
        AdminFixture.createPool(connection, AdminFixture.POOL_COLUMNS, AdminFixture.POOL_ROWS);
        RecordingSink sink = new RecordingSink();

        new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        for (MetricSample sample : sink.samples) {
            assertEquals(List.of("hostgroup", "endpoint"), List.copyOf(sample.labels().keySet()));
            assertEquals(sample.descriptor().labelNames(), List.copyOf(sample.labels().keySet()));
        }
    }

    @Test
    void testUnknownStatusSkipsOnlyStatus() throws Exception {
        AdminFixture.createPool(connection, AdminFixture.POOL_COLUMNS, new String[][]{
                {"0", "10.91.142.80", "3306", "MAINTENANCE", "0", "45", "1895677", "46", "197941647", "10984550806", "321063484988", "163"},
        });
        RecordingSink sink = new RecordingSink();

        new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(8, sink.samples.size());
        assertEquals(1, sink.rejected.size());
        assertInstanceOf(UnknownStatusException.class, sink.rejected.get(0));
        assertTrue(sink.samples.stream().noneMatch(s -> s.name().equals("proxysql_connection_pool_status")));
    }

    @Test
    void testPlaceholderIsReportedNotEmitted() throws Exception {
        AdminFixture.createPool(connection, AdminFixture.POOL_COLUMNS, new String[][]{AdminFixture.POOL_ROWS[0]});
        MetricRegistry drifted = MetricRegistry.builder()
                .placeholder(TableGroup.MYSQL_CONNECTION_POOL, "connused")
                .register(TableGroup.MYSQL_CONNECTION_POOL, "latency_us", MetricDescriptor.gauge("latency_us",
                        "The currently ping time in microseconds, as reported from Monitor.", "hostgroup", "endpoint"))
                .register(TableGroup.MYSQL_CONNECTION_POOL, "latency_ms", MetricDescriptor.gauge("latency_us",
                        "The currently ping time in microseconds, as reported from Monitor.", "hostgroup", "endpoint"))
                .build();
        RecordingSink sink = new RecordingSink();

        new ConnectionPoolScraper(drifted, TIMEOUT).scrape(connection, sink);

        assertEquals(1, sink.samples.size());
        MetricSample latency = sink.samples.get(0);
        assertEquals("proxysql_connection_pool_latency_us", latency.name());
        assertEquals(labels("0", "10.91.142.80:3306"), latency.labels());
        assertEquals(163, latency.value());

        assertEquals(1, sink.rejected.size());
        assertEquals("connused", sink.rejected.get(0).getField());
    }

    @Test
    void testLegacyLatencyColumn() throws Exception {
        AdminFixture.createPool(connection,
                new String[]{"hostgroup", "srv_host", "srv_port", "status", "Latency_ms"},
                new String[][]{{"1", "mysql", "3306", "ONLINE", "2"}});
        RecordingSink sink = new RecordingSink();

        new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(2, sink.find("proxysql_connection_pool_latency_us", labels("1", "mysql:3306")).value());
    }

    @Test
    void testRowWithoutEndpointIsRejected() throws Exception {
        AdminFixture.createPool(connection,
                new String[]{"hostgroup", "srv_host", "status", "ConnUsed"},
                new String[][]{{"1", "mysql", "ONLINE", "2"}});
        RecordingSink sink = new RecordingSink();

        new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertTrue(sink.samples.isEmpty());
        assertEquals(1, sink.rejected.size());
        assertEquals("srv_port", sink.rejected.get(0).getField());
    }

    @Test
    void testQueryErrorEmitsNothing() {
        RecordingSink sink = new RecordingSink();

        QueryException e = assertThrows(QueryException.class,
                () -> new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink));

        assertEquals(TableGroup.MYSQL_CONNECTION_POOL, e.getGroup());
        assertTrue(sink.samples.isEmpty());
    }

    @Test
    void testProcessRowWithoutDatabase() {
        Row row = Row.of(List.of("hostgroup", "srv_host", "srv_port", "status", "ConnFree"),
                "3", "db1", "3307", "OFFLINE_SOFT", "7");
        RecordingSink sink = new RecordingSink();
        var out = new ArrayList<MetricSample>();

        new ConnectionPoolScraper(MetricRegistry.defaults(), TIMEOUT).processRow(row, out, sink);

        assertEquals(2, out.size());
        assertEquals(3, out.get(0).value());
        assertEquals(7, out.get(1).value());
        assertEquals(labels("3", "db1:3307"), out.get(1).labels());
    }
}
