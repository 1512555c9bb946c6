package io.proxysql.exporter.scraper;

/**
 * Base of every failure raised while scraping the admin interface.
 */
public class ScrapeException extends Exception {

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
