package io.proxysql.exporter.scraper;

/**
 * The admin tables scraped on every cycle. Query text and registry have to be changed
 * together whenever ProxySQL renames a table or column.
 */
public enum TableGroup {
    MYSQL_STATUS("mysql_status", "proxysql_mysql_status_",
            "SELECT Variable_Name, Variable_Value FROM stats_mysql_global"),
    MYSQL_CONNECTION_POOL("mysql_connection_pool", "proxysql_connection_pool_",
            "SELECT * FROM stats_mysql_connection_pool"),
    MYSQL_CONNECTION_LIST("mysql_connection_list", "proxysql_processlist_",
            "SELECT cli_host, srv_host FROM stats_mysql_processlist");

    private final String collectorName;
    private final String metricPrefix;
    private final String query;

    TableGroup(String collectorName, String metricPrefix, String query) {
        this.collectorName = collectorName;
        this.metricPrefix = metricPrefix;
        this.query = query;
    }

    public String collectorName() {
        return collectorName;
    }

    public String metricPrefix() {
        return metricPrefix;
    }

    public String query() {
        return query;
    }
}
