package io.proxysql.exporter.http;

import com.typesafe.config.Config;
import io.proxysql.exporter.common.AdminConnectionProvider;
import io.proxysql.exporter.common.ConfigConstants;
import io.proxysql.exporter.common.DataSourceName;
import io.proxysql.exporter.common.ExporterConfig;
import io.proxysql.exporter.common.ExporterConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        var server = start(args);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down ProxySQL exporter");
            server.close();
        }));
    }

    public static ExporterServer start(String[] args) throws Exception {
        Config config = ExporterConfigFactory.load(args).getConfig(ConfigConstants.CONFIG_ROOT);
        ExporterConfig exporterConfig = ExporterConfigFactory.createConfig(config);
        AdminConnectionProvider connectionProvider = AdminConnectionProvider.load(config);
        log.info("Starting ProxySQL exporter for {}", DataSourceName.parse(exporterConfig.dsn()));
        return ExporterServer.start(exporterConfig, connectionProvider);
    }
}
