package io.proxysql.exporter.scraper;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one scrape cycle.
 *
 * @param samples           samples of every group that succeeded, in completion order
 * @param failures          groups whose query failed
 * @param rejected          skipped fields per group
 * @param connectionFailure set when no admin connection could be obtained; samples is then empty
 * @param duration          wall time of the cycle
 */
public record ScrapeResult(
        List<MetricSample> samples,
        Map<TableGroup, QueryException> failures,
        Map<TableGroup, List<MalformedValueException>> rejected,
        ConnectionException connectionFailure,
        Duration duration
) {
    public ScrapeResult {
        samples = List.copyOf(samples);
        failures = Map.copyOf(failures);
        rejected = Map.copyOf(rejected);
    }

    static ScrapeResult connectionFailed(ConnectionException e, Duration duration) {
        return new ScrapeResult(List.of(), Map.of(), Map.of(), e, duration);
    }

    public boolean isConnected() {
        return connectionFailure == null;
    }

    public boolean hasErrors() {
        return connectionFailure != null || !failures.isEmpty();
    }
}
