package io.proxysql.exporter.scraper;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionListScraperTest {

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

    @Test
    void testScrapeConnectionList() throws Exception {
        AdminFixture.createList(connection, AdminFixture.LIST_ROWS);
        RecordingSink sink = new RecordingSink();

        new ConnectionListScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(8, sink.samples.size());
        for (String[] row : AdminFixture.LIST_ROWS) {
            MetricSample client = sink.find("proxysql_processlist_client_connection_list", Map.of("client_host", row[0]));
            assertEquals(1, client.value());
            assertEquals(MetricKind.GAUGE, client.kind());
            MetricSample server = sink.find("proxysql_processlist_server_connection_list", Map.of("server_host", row[1]));
            assertEquals(1, server.value());
        }
    }

    @Test
    void testTwoRowsYieldFourSamples() throws Exception {
        AdminFixture.createList(connection, new String[][]{{"A", "X"}, {"B", "Y"}});
        RecordingSink sink = new RecordingSink();

        new ConnectionListScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(4, sink.samples.size());
        sink.find("proxysql_processlist_client_connection_list", Map.of("client_host", "A"));
        sink.find("proxysql_processlist_client_connection_list", Map.of("client_host", "B"));
        sink.find("proxysql_processlist_server_connection_list", Map.of("server_host", "X"));
        sink.find("proxysql_processlist_server_connection_list", Map.of("server_host", "Y"));
    }

    @Test
    void testRepeatedHostsAreNotDeduplicated() throws Exception {
        AdminFixture.createList(connection, new String[][]{{"A", "X"}, {"A", "X"}, {"A", "Y"}});
        RecordingSink sink = new RecordingSink();

        new ConnectionListScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(6, sink.samples.size());
        assertEquals(3, sink.samples.stream()
                .filter(s -> s.labels().equals(Map.of("client_host", "A"))).count());
        assertTrue(sink.samples.stream().allMatch(s -> s.value() == 1));
    }

    @Test
    void testPlaceholdersAreReported() throws Exception {
        AdminFixture.createList(connection, new String[][]{{"10.91.142.80", "10.91.142.90"}});
        MetricRegistry placeholders = MetricRegistry.builder()
                .placeholder(TableGroup.MYSQL_CONNECTION_LIST, "client_connection_list")
                .placeholder(TableGroup.MYSQL_CONNECTION_LIST, "server_connection_list")
                .build();
        RecordingSink sink = new RecordingSink();

        new ConnectionListScraper(placeholders, TIMEOUT).scrape(connection, sink);

        assertTrue(sink.samples.isEmpty());
        assertEquals(2, sink.rejected.size());
    }

    @Test
    void testNullHostIsReported() throws Exception {
        AdminFixture.createList(connection, new String[][]{{"10.91.142.80", null}});
        RecordingSink sink = new RecordingSink();

        new ConnectionListScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink);

        assertEquals(1, sink.samples.size());
        assertEquals(1, sink.rejected.size());
        assertEquals("srv_host", sink.rejected.get(0).getField());
    }

    @Test
    void testQueryErrorEmitsNothing() {
        RecordingSink sink = new RecordingSink();

        assertThrows(QueryException.class,
                () -> new ConnectionListScraper(MetricRegistry.defaults(), TIMEOUT).scrape(connection, sink));
        assertTrue(sink.samples.isEmpty());
    }
}
