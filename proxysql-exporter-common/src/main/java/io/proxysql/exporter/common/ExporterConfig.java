package io.proxysql.exporter.common;

import java.time.Duration;

/**
 * Resolved settings of one exporter process.
 *
 * @param dsn                  admin interface DSN, either a JDBC URL or {@code user:pass@tcp(host:port)/}
 * @param queryTimeout         per query timeout applied to every admin statement
 * @param concurrentScrape     run the table scrapers in parallel
 * @param collectStatus        scrape {@code stats_mysql_global}
 * @param collectUndocumented  expose unregistered {@code stats_mysql_global} variables as untyped samples
 * @param collectPool          scrape {@code stats_mysql_connection_pool}
 * @param collectList          scrape {@code stats_mysql_processlist}
 * @param httpHost             bind address of the metrics endpoint
 * @param httpPort             port of the metrics endpoint
 */
public record ExporterConfig(
        String dsn,
        Duration queryTimeout,
        boolean concurrentScrape,
        boolean collectStatus,
        boolean collectUndocumented,
        boolean collectPool,
        boolean collectList,
        String httpHost,
        int httpPort
) {
    public ExporterConfig {
        if (dsn == null || dsn.isBlank()) {
            throw new IllegalArgumentException("dsn must not be empty");
        }
        if (queryTimeout == null || queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("query timeout must be positive: " + queryTimeout);
        }
        if (httpPort < 0 || httpPort > 65535) {
            throw new IllegalArgumentException("invalid http port: " + httpPort);
        }
    }
}
