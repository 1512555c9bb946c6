package io.proxysql.exporter.common;

import com.typesafe.config.Config;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Source of connections to the ProxySQL admin interface.
 */
public interface AdminConnectionProvider {
    String CONNECTION_PROVIDER_CLASS_KEY = "provider-class";

    void loadInner(Config config);

    Connection getConnection() throws SQLException;

    /**
     * Instantiates the provider named by {@code connection.provider-class}, defaulting to
     * {@link JdbcConnectionProvider}. The whole exporter block is handed to {@link #loadInner}.
     */
    static AdminConnectionProvider load(Config config) throws Exception {
        AdminConnectionProvider provider;
        var key = ConfigConstants.CONNECTION_PREFIX + "." + CONNECTION_PROVIDER_CLASS_KEY;
        if (config.hasPath(key)) {
            var clazz = Class.forName(config.getString(key));
            provider = (AdminConnectionProvider) clazz.getConstructor().newInstance();
        } else {
            provider = new JdbcConnectionProvider();
        }
        provider.loadInner(config);
        return provider;
    }
}
