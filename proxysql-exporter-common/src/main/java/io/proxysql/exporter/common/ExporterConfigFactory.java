package io.proxysql.exporter.common;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds {@link ExporterConfig} from application.conf / reference.conf.
 *
 * <p>Expected configuration format:</p>
 * <pre>{@code
 * proxysql_exporter {
 *   dsn = "stats:stats@tcp(localhost:6032)/"
 *   dsn = ${?DATA_SOURCE_NAME}
 *   query_timeout_ms = 10000
 *   scrape.concurrent = true
 *   collect {
 *     mysql_status = true
 *     mysql_status_undocumented = false
 *     mysql_connection_pool = true
 *     mysql_connection_list = true
 *   }
 *   http { host = "0.0.0.0", port = 42004 }
 * }
 * }</pre>
 *
 * <p>Any key can be overridden on the command line with {@code --conf key=value}, the key
 * being relative to the {@code proxysql_exporter} block or fully qualified.</p>
 */
public final class ExporterConfigFactory {

    private ExporterConfigFactory() {}

    public static Config load(String[] args) {
        Config overrides = ConfigFactory.parseString(String.join("\n", toConfigLines(args)));
        return overrides.withFallback(ConfigFactory.load()).resolve();
    }

    public static ExporterConfig createConfig(String[] args) {
        return createConfig(load(args).getConfig(ConfigConstants.CONFIG_ROOT));
    }

    public static ExporterConfig createConfig(Config config) {
        return new ExporterConfig(
                config.getString(ConfigConstants.DSN_KEY),
                Duration.ofMillis(config.getLong(ConfigConstants.QUERY_TIMEOUT_MS_KEY)),
                config.getBoolean(ConfigConstants.SCRAPE_CONCURRENT_KEY),
                config.getBoolean(ConfigConstants.COLLECT_MYSQL_STATUS_KEY),
                config.getBoolean(ConfigConstants.COLLECT_MYSQL_STATUS_UNDOCUMENTED_KEY),
                config.getBoolean(ConfigConstants.COLLECT_MYSQL_CONNECTION_POOL_KEY),
                config.getBoolean(ConfigConstants.COLLECT_MYSQL_CONNECTION_LIST_KEY),
                config.getString(ConfigConstants.HTTP_HOST_KEY),
                config.getInt(ConfigConstants.HTTP_PORT_KEY));
    }

    static List<String> toConfigLines(String[] args) {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if (!ConfigConstants.CONF_ARG.equals(args[i])) {
                throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value after " + ConfigConstants.CONF_ARG);
            }
            String value = args[++i];
            if (!value.contains("=")) {
                throw new IllegalArgumentException("Expected key=value after " + ConfigConstants.CONF_ARG + ": " + value);
            }
            lines.add(value.startsWith(ConfigConstants.CONFIG_ROOT + ".") ? value : ConfigConstants.CONFIG_ROOT + "." + value);
        }
        return lines;
    }
}
