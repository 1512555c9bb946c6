package io.proxysql.exporter.scraper;

/**
 * The query of one table group failed. The group contributes no samples to the scrape.
 */
public class QueryException extends ScrapeException {

    private final TableGroup group;

    public QueryException(TableGroup group, String message) {
        super(message);
        this.group = group;
    }

    public QueryException(TableGroup group, Throwable cause) {
        super("Failed to scrape " + group.collectorName() + ": " + cause.getMessage(), cause);
        this.group = group;
    }

    public TableGroup getGroup() {
        return group;
    }
}
