package io.proxysql.exporter.scraper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link ScrapeSink} shared by the scrapers of one cycle. Writes are serialised on the
 * buffer; once closed no further writes are accepted.
 *
 * <p>Scrapers write through {@link #sink(TableGroup)} so that a group which failed can be
 * {@link #discard(TableGroup) discarded}: its samples are removed and its later writes refused.</p>
 */
public class SampleBuffer implements ScrapeSink {

    private record Staged(TableGroup group, MetricSample sample) {}

    private final List<Staged> samples = new ArrayList<>();
    private final Map<TableGroup, List<MalformedValueException>> rejected = new EnumMap<>(TableGroup.class);
    private final Set<TableGroup> discarded = EnumSet.noneOf(TableGroup.class);
    private boolean closed;

    @Override
    public void accept(MetricSample sample) {
        add(null, List.of(sample));
    }

    @Override
    public void acceptAll(Collection<MetricSample> batch) {
        add(null, batch);
    }

    @Override
    public synchronized void reject(TableGroup group, MalformedValueException e) {
        ensureWritable(group);
        rejected.computeIfAbsent(group, g -> new ArrayList<>()).add(e);
    }

    /**
     * View of this buffer that tags every sample with {@code group}.
     */
    public ScrapeSink sink(TableGroup group) {
        return new ScrapeSink() {
            @Override
            public void accept(MetricSample sample) {
                add(group, List.of(sample));
            }

            @Override
            public void acceptAll(Collection<MetricSample> batch) {
                add(group, batch);
            }

            @Override
            public void reject(TableGroup rejectedGroup, MalformedValueException e) {
                SampleBuffer.this.reject(rejectedGroup, e);
            }
        };
    }

    /**
     * Drop everything {@code group} wrote so far and refuse its further writes.
     */
    public synchronized void discard(TableGroup group) {
        discarded.add(group);
        samples.removeIf(s -> s.group() == group);
        rejected.remove(group);
    }

    public synchronized void close() {
        closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized List<MetricSample> getSamples() {
        return samples.stream().map(Staged::sample).toList();
    }

    public synchronized Map<TableGroup, List<MalformedValueException>> getRejected() {
        Map<TableGroup, List<MalformedValueException>> copy = new EnumMap<>(TableGroup.class);
        rejected.forEach((g, list) -> copy.put(g, List.copyOf(list)));
        return copy;
    }

    private synchronized void add(TableGroup group, Collection<MetricSample> batch) {
        ensureWritable(group);
        for (MetricSample sample : batch) {
            samples.add(new Staged(group, sample));
        }
    }

    private void ensureWritable(TableGroup group) {
        if (closed) {
            throw new IllegalStateException("sample buffer is closed");
        }
        if (group != null && discarded.contains(group)) {
            throw new IllegalStateException("samples of " + group.collectorName() + " were discarded");
        }
    }
}
