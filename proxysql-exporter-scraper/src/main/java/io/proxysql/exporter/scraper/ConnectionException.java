package io.proxysql.exporter.scraper;

/**
 * The admin connection could not be obtained. Fatal to the scrape cycle.
 */
public class ConnectionException extends ScrapeException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
