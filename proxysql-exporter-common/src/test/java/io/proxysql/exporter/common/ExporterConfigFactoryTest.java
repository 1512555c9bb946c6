package io.proxysql.exporter.common;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExporterConfigFactoryTest {

    @Test
    void testDefaults() {
        ExporterConfig config = ExporterConfigFactory.createConfig(new String[]{"--conf", "dsn=\"admin:admin@tcp(127.0.0.1:6032)/\""});

        assertEquals("admin:admin@tcp(127.0.0.1:6032)/", config.dsn());
        assertEquals(Duration.ofSeconds(10), config.queryTimeout());
        assertTrue(config.concurrentScrape());
        assertTrue(config.collectStatus());
        assertFalse(config.collectUndocumented());
        assertTrue(config.collectPool());
        assertTrue(config.collectList());
        assertEquals("0.0.0.0", config.httpHost());
        assertEquals(42004, config.httpPort());
    }

    @Test
    void testCommandLineOverrides() {
        ExporterConfig config = ExporterConfigFactory.createConfig(new String[]{
                "--conf", "dsn=\"jdbc:duckdb:\"",
                "--conf", "query_timeout_ms=2500",
                "--conf", "proxysql_exporter.collect.mysql_connection_list=false",
                "--conf", "scrape.concurrent=false",
                "--conf", "http.port=9104"
        });

        assertEquals("jdbc:duckdb:", config.dsn());
        assertEquals(Duration.ofMillis(2500), config.queryTimeout());
        assertFalse(config.collectList());
        assertFalse(config.concurrentScrape());
        assertEquals(9104, config.httpPort());
    }

    @Test
    void testConfigLines() {
        assertEquals(List.of("proxysql_exporter.http.port=1", "proxysql_exporter.dsn=x"),
                ExporterConfigFactory.toConfigLines(new String[]{"--conf", "http.port=1", "--conf", "proxysql_exporter.dsn=x"}));
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> ExporterConfigFactory.toConfigLines(new String[]{"--port", "1"}));
        assertThrows(IllegalArgumentException.class, () -> ExporterConfigFactory.toConfigLines(new String[]{"--conf"}));
        assertThrows(IllegalArgumentException.class, () -> ExporterConfigFactory.toConfigLines(new String[]{"--conf", "http.port"}));
    }

    @Test
    void testInvalidValues() {
        var base = ConfigFactory.parseString("""
                dsn = "jdbc:duckdb:"
                query_timeout_ms = 0
                scrape.concurrent = true
                collect {
                  mysql_status = true
                  mysql_status_undocumented = false
                  mysql_connection_pool = true
                  mysql_connection_list = true
                }
                http { host = "localhost", port = 42004 }
                """);
        assertThrows(IllegalArgumentException.class, () -> ExporterConfigFactory.createConfig(base));
        assertThrows(IllegalArgumentException.class, () -> ExporterConfigFactory.createConfig(
                ConfigFactory.parseString("query_timeout_ms = 10, http.port = 70000").withFallback(base)));
    }
}
