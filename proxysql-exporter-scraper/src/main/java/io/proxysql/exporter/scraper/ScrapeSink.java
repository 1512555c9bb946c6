package io.proxysql.exporter.scraper;

import java.util.Collection;

/**
 * Outbound stream of one scrape cycle. Implementations must accept calls from several scraper threads.
 */
public interface ScrapeSink {

    void accept(MetricSample sample);

    default void acceptAll(Collection<MetricSample> samples) {
        samples.forEach(this::accept);
    }

    /**
     * A field or row of {@code group} was skipped.
     */
    void reject(TableGroup group, MalformedValueException e);
}
