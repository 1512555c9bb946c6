package io.proxysql.exporter.common;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Admin interface DSN translated into JDBC terms.
 *
 * <p>Accepts either a plain JDBC URL or the go-sql-driver form
 * {@code user:password@tcp(host:port)/dbname}, which is what ProxySQL deployments usually
 * export in {@code DATA_SOURCE_NAME}.</p>
 */
public record DataSourceName(String jdbcUrl, String username, String password) {

    private static final Pattern GO_DSN = Pattern.compile(
            "^(?:([^:@]*)(?::(.*))?@)?(?:tcp|unix)\\(([^)]*)\\)/([^?]*)(?:\\?(.*))?$");

    private static final String DEFAULT_ADDRESS = "127.0.0.1:6032";

    public static DataSourceName parse(String dsn) {
        if (dsn == null || dsn.isBlank()) {
            throw new IllegalArgumentException("dsn must not be empty");
        }
        if (dsn.startsWith("jdbc:")) {
            return new DataSourceName(dsn, null, null);
        }
        Matcher m = GO_DSN.matcher(dsn.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Unsupported dsn, expected user:password@tcp(host:port)/ or a jdbc url");
        }
        String address = m.group(3).isEmpty() ? DEFAULT_ADDRESS : m.group(3);
        String url = "jdbc:mysql://" + address + "/" + m.group(4);
        if (m.group(5) != null && !m.group(5).isEmpty()) {
            url = url + "?" + m.group(5);
        }
        return new DataSourceName(url, emptyToNull(m.group(1)), m.group(2));
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    @Override
    public String toString() {
        // never log the password
        return "DataSourceName[jdbcUrl=" + jdbcUrl + ", username=" + username + "]";
    }
}
