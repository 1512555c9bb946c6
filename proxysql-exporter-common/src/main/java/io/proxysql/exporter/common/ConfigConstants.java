package io.proxysql.exporter.common;

public final class ConfigConstants {

    public static final String CONFIG_ROOT = "proxysql_exporter";

    public static final String DSN_KEY = "dsn";
    public static final String CONNECTION_PREFIX = "connection";
    public static final String QUERY_TIMEOUT_MS_KEY = "query_timeout_ms";
    public static final String SCRAPE_CONCURRENT_KEY = "scrape.concurrent";

    public static final String COLLECT_PREFIX = "collect";
    public static final String COLLECT_MYSQL_STATUS_KEY = "collect.mysql_status";
    public static final String COLLECT_MYSQL_STATUS_UNDOCUMENTED_KEY = "collect.mysql_status_undocumented";
    public static final String COLLECT_MYSQL_CONNECTION_POOL_KEY = "collect.mysql_connection_pool";
    public static final String COLLECT_MYSQL_CONNECTION_LIST_KEY = "collect.mysql_connection_list";

    public static final String HTTP_HOST_KEY = "http.host";
    public static final String HTTP_PORT_KEY = "http.port";

    public static final String CONF_ARG = "--conf";

    private ConfigConstants() {}
}
