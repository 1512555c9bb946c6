package io.proxysql.exporter.scraper;

import static io.proxysql.exporter.scraper.MetricDescriptor.counter;
import static io.proxysql.exporter.scraper.MetricDescriptor.gauge;
import static io.proxysql.exporter.scraper.TableGroup.MYSQL_CONNECTION_LIST;
import static io.proxysql.exporter.scraper.TableGroup.MYSQL_CONNECTION_POOL;
import static io.proxysql.exporter.scraper.TableGroup.MYSQL_STATUS;

/**
 * Field to metric table for the admin tables of ProxySQL 1.3+.
 */
final class DefaultMetrics {

    static final String LABEL_HOSTGROUP = "hostgroup";
    static final String LABEL_ENDPOINT = "endpoint";
    static final String LABEL_CLIENT_HOST = "client_host";
    static final String LABEL_SERVER_HOST = "server_host";

    static final String CLIENT_CONNECTION_LIST = "client_connection_list";
    static final String SERVER_CONNECTION_LIST = "server_connection_list";

    private DefaultMetrics() {}

    static MetricRegistry registry() {
        MetricRegistry.Builder b = MetricRegistry.builder();

        // stats_mysql_global
        b.register(MYSQL_STATUS, "active_transactions", gauge("active_transactions",
                "Current number of active transactions."));
        b.register(MYSQL_STATUS, "client_connections_aborted", counter("client_connections_aborted",
                "Total number of frontend connections aborted due to invalid credential or max_connections reached."));
        b.register(MYSQL_STATUS, "client_connections_connected", gauge("client_connections_connected",
                "Current number of client connections."));
        b.register(MYSQL_STATUS, "client_connections_created", counter("client_connections_created",
                "Total number of client connections created."));
        b.register(MYSQL_STATUS, "client_connections_non_idle", gauge("client_connections_non_idle",
                "Number of client connections that are currently handled by the main worker threads."));
        b.register(MYSQL_STATUS, "proxysql_uptime", counter("proxysql_uptime",
                "Total uptime of ProxySQL in seconds."));
        b.register(MYSQL_STATUS, "questions", counter("questions",
                "Total number of client requests / statements executed."));
        b.register(MYSQL_STATUS, "slow_queries", counter("slow_queries",
                "Total number of queries with an execution time greater than mysql-long_query_time milliseconds."));
        b.register(MYSQL_STATUS, "server_connections_aborted", counter("server_connections_aborted",
                "Total number of backend connections that failed to be established or were closed on error."));
        b.register(MYSQL_STATUS, "server_connections_connected", gauge("server_connections_connected",
                "Number of backend connections currently connected."));
        b.register(MYSQL_STATUS, "server_connections_created", counter("server_connections_created",
                "Total number of backend connections created."));
        b.register(MYSQL_STATUS, "mysql_backend_buffers_bytes", gauge("mysql_backend_buffers_bytes",
                "Buffers related to backend connections if fast_forward is used."));
        b.register(MYSQL_STATUS, "mysql_frontend_buffers_bytes", gauge("mysql_frontend_buffers_bytes",
                "Buffers related to frontend connections (read/write buffers and other queues)."));
        b.register(MYSQL_STATUS, "mysql_session_internal_bytes", gauge("mysql_session_internal_bytes",
                "Other memory used by ProxySQL to handle MySQL sessions."));
        b.register(MYSQL_STATUS, "mysql_thread_workers", gauge("mysql_thread_workers",
                "Number of MySQL thread workers."));
        b.register(MYSQL_STATUS, "mysql_monitor_workers", gauge("mysql_monitor_workers",
                "Number of monitor threads."));
        b.register(MYSQL_STATUS, "connpool_get_conn_success", counter("connpool_get_conn_success",
                "Total number of requests for which a connection was already available in the connection pool."));
        b.register(MYSQL_STATUS, "connpool_get_conn_failure", counter("connpool_get_conn_failure",
                "Total number of requests for which a connection was not available in the connection pool."));
        b.register(MYSQL_STATUS, "connpool_get_conn_immediate", counter("connpool_get_conn_immediate",
                "Total number of connections that a MySQL thread obtained from its own local connection pool cache."));
        b.register(MYSQL_STATUS, "com_autocommit", counter("com_autocommit",
                "Total number of autocommit statements."));
        b.register(MYSQL_STATUS, "com_commit", counter("com_commit",
                "Total number of COMMIT statements."));
        b.register(MYSQL_STATUS, "com_rollback", counter("com_rollback",
                "Total number of ROLLBACK statements."));
        b.register(MYSQL_STATUS, "query_processor_time_nsec", counter("query_processor_time_nsec",
                "Time spent inside the query processor in nanoseconds."));
        b.register(MYSQL_STATUS, "query_cache_memory_bytes", gauge("query_cache_memory_bytes",
                "Memory currently used by the query cache."));
        b.register(MYSQL_STATUS, "query_cache_entries", gauge("query_cache_entries",
                "Number of entries currently stored in the query cache."));
        b.register(MYSQL_STATUS, "query_cache_count_get", counter("query_cache_count_get",
                "Total number of read requests sent to the query cache."));
        b.register(MYSQL_STATUS, "query_cache_count_get_ok", counter("query_cache_count_get_ok",
                "Total number of successful read requests served by the query cache."));
        b.register(MYSQL_STATUS, "query_cache_count_set", counter("query_cache_count_set",
                "Total number of write requests sent to the query cache."));
        b.register(MYSQL_STATUS, "query_cache_purged", counter("query_cache_purged",
                "Total number of entries purged by the query cache."));

        // stats_mysql_connection_pool
        b.register(MYSQL_CONNECTION_POOL, "status", gauge("status",
                "The status of the backend server (1 - ONLINE, 2 - SHUNNED, 3 - OFFLINE_SOFT, 4 - OFFLINE_HARD).",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "connused", gauge("conn_used",
                "How many connections are currently used by ProxySQL for sending queries to the backend server.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "connfree", gauge("conn_free",
                "How many connections are currently free.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "connok", counter("conn_ok",
                "How many connections were established successfully.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "connerr", counter("conn_err",
                "How many connections weren't established successfully.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "queries", counter("queries",
                "The number of queries routed towards this particular backend server.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "bytes_data_sent", counter("bytes_data_sent",
                "The amount of data sent to the backend, excluding metadata.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "bytes_data_recv", counter("bytes_data_recv",
                "The amount of data received from the backend, excluding metadata.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        // ProxySQL 1.3 reported the ping time in milliseconds under a different column name
        b.register(MYSQL_CONNECTION_POOL, "latency_us", gauge("latency_us",
                "The currently ping time in microseconds, as reported from Monitor.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));
        b.register(MYSQL_CONNECTION_POOL, "latency_ms", gauge("latency_us",
                "The currently ping time in microseconds, as reported from Monitor.",
                LABEL_HOSTGROUP, LABEL_ENDPOINT));

        // stats_mysql_processlist
        b.register(MYSQL_CONNECTION_LIST, CLIENT_CONNECTION_LIST, gauge(CLIENT_CONNECTION_LIST,
                "Client host present in the current connection list.", LABEL_CLIENT_HOST));
        b.register(MYSQL_CONNECTION_LIST, SERVER_CONNECTION_LIST, gauge(SERVER_CONNECTION_LIST,
                "Backend host present in the current connection list.", LABEL_SERVER_HOST));

        return b.build();
    }
}
