package io.proxysql.exporter.scraper;

import java.sql.Connection;

/**
 * Scrapes one admin table group and emits its samples.
 *
 * <p>Implementations only read from the connection and may run concurrently with the scrapers
 * of the other groups on the same connection.</p>
 */
public interface TableScraper {

    TableGroup getGroup();

    /**
     * Run the group query and write its samples to {@code sink}.
     *
     * @throws QueryException if the query fails; nothing has been written to the sink for this group
     */
    void scrape(Connection connection, ScrapeSink sink) throws QueryException;
}
