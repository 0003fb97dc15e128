package com.di.ledger.util;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;

/**
 * Logs HikariCP pool statistics: at pool creation, after schema initialization and on
 * shutdown.
 */
@Slf4j
public final class ConnectionPoolLogger {

    public static final String CONNECTION_LOG_SEPARATOR =
            "================================================================================";

    private ConnectionPoolLogger() {}

    public static void logDatasourceSectionStart(String title) {
        log.info(CONNECTION_LOG_SEPARATOR);
        log.info("[POOL] LEDGER DATASOURCE  |  {}", title != null ? title : "");
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    public static void logDatasourceSectionEnd() {
        log.info(CONNECTION_LOG_SEPARATOR);
    }

    /**
     * Logs pool statistics if the DataSource is a HikariCP pool.
     *
     * @param dataSource the DataSource
     * @param phase      when this is being logged (e.g. "created", "after schema")
     */
    public static void logPoolStats(DataSource dataSource, String phase) {
        if (dataSource == null) {
            return;
        }
        if (!(dataSource instanceof com.zaxxer.hikari.HikariDataSource hikari)) {
            log.debug("[POOL] stats not available (not HikariCP): phase={}", phase);
            return;
        }
        if (hikari.getHikariPoolMXBean() == null) {
            log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | not started",
                    phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle());
            return;
        }
        log.info("[POOL] {} | pool={} | maxSize={}, minIdle={} | active={}, idle={}, total={}, waiting={}",
                phase, hikari.getPoolName(), hikari.getMaximumPoolSize(), hikari.getMinimumIdle(),
                hikari.getHikariPoolMXBean().getActiveConnections(),
                hikari.getHikariPoolMXBean().getIdleConnections(),
                hikari.getHikariPoolMXBean().getTotalConnections(),
                hikari.getHikariPoolMXBean().getThreadsAwaitingConnection());
    }
}
