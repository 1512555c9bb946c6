package io.proxysql.exporter.http;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import io.proxysql.exporter.common.AdminConnectionProvider;
import io.proxysql.exporter.common.ExporterConfig;
import io.proxysql.exporter.scraper.MetricRegistry;
import io.proxysql.exporter.scraper.ProxySqlExporter;
import io.proxysql.exporter.scraper.ScrapeStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * The exporter together with the HTTP endpoint serving it.
 */
public class ExporterServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExporterServer.class);

    private final PrometheusMeterRegistry meterRegistry;
    private final ProxySqlExporter exporter;
    private final HTTPServer httpServer;

    private ExporterServer(PrometheusMeterRegistry meterRegistry, ProxySqlExporter exporter, HTTPServer httpServer) {
        this.meterRegistry = meterRegistry;
        this.exporter = exporter;
        this.httpServer = httpServer;
    }

    public static ExporterServer start(ExporterConfig config, AdminConnectionProvider connectionProvider) throws IOException {
        PrometheusMeterRegistry meterRegistry = MetricsRegistryFactory.create();
        ProxySqlExporter exporter = ProxySqlExporter.create(config, connectionProvider,
                MetricRegistry.defaults(), new ScrapeStatistics(meterRegistry));
        // the meter registry is read by the exposition collector, never served on its own
        CollectorRegistry collectorRegistry = new CollectorRegistry();
        new ExpositionCollector(exporter, meterRegistry).register(collectorRegistry);

        HTTPServer httpServer;
        try {
            httpServer = new HTTPServer.Builder()
                    .withHostname(config.httpHost())
                    .withPort(config.httpPort())
                    .withRegistry(collectorRegistry)
                    .build();
        } catch (IOException e) {
            exporter.close();
            meterRegistry.close();
            throw e;
        }
        log.info("Serving ProxySQL metrics on http://{}:{}/metrics", config.httpHost(), httpServer.getPort());
        return new ExporterServer(meterRegistry, exporter, httpServer);
    }

    public int getPort() {
        return httpServer.getPort();
    }

    public ProxySqlExporter getExporter() {
        return exporter;
    }

    public PrometheusMeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    @Override
    public void close() {
        httpServer.close();
        exporter.close();
        meterRegistry.close();
        log.info("Exporter server stopped");
    }
}
