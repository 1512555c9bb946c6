package io.proxysql.exporter.common;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens admin connections through {@link DriverManager}. The MySQL driver speaks the protocol
 * ProxySQL exposes on its admin port.
 */
public class JdbcConnectionProvider implements AdminConnectionProvider {

    private static final Logger log = LoggerFactory.getLogger(JdbcConnectionProvider.class);

    private DataSourceName dataSourceName;

    public JdbcConnectionProvider() {
    }

    public JdbcConnectionProvider(DataSourceName dataSourceName) {
        this.dataSourceName = dataSourceName;
    }

    @Override
    public void loadInner(Config config) {
        this.dataSourceName = DataSourceName.parse(config.getString(ConfigConstants.DSN_KEY));
    }

    @Override
    public Connection getConnection() throws SQLException {
        if (dataSourceName == null) {
            throw new IllegalStateException("JdbcConnectionProvider is not configured");
        }
        Properties props = new Properties();
        if (dataSourceName.username() != null) {
            props.setProperty("user", dataSourceName.username());
        }
        if (dataSourceName.password() != null) {
            props.setProperty("password", dataSourceName.password());
        }
        log.debug("Opening admin connection to {}", dataSourceName.jdbcUrl());
        return DriverManager.getConnection(dataSourceName.jdbcUrl(), props);
    }

    public DataSourceName getDataSourceName() {
        return dataSourceName;
    }
}
