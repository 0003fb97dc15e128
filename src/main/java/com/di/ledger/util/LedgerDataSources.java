package com.di.ledger.util;

import com.di.ledger.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide HikariCP pools for the ledger store, one per JDBC URL and user.
 *
 * <p>Connections are handed out in auto-commit mode; {@code JdbcTransactionScope} switches a
 * connection off auto-commit only between begin and commit/rollback.
 */
@Slf4j
public enum LedgerDataSources {

    INSTANCE;

    private final ConcurrentMap<String, HikariDataSource> dataSourceCache = new ConcurrentHashMap<>();

    /** Stable, positive pool IDs for monitoring. */
    private static final AtomicInteger poolIdCounter = new AtomicInteger(0);

    /**
     * Gets or creates the pool for the given configuration.
     *
     * @param snapshot datasource settings
     * @return pooled DataSource shared by every caller with the same URL and user
     */
    public DataSource getOrInit(DbConfigSnapshot snapshot) {
        String connectionKey = generateConnectionKey(snapshot);

        return dataSourceCache.computeIfAbsent(connectionKey, key -> {
            int effectiveMinIdle = Math.min(snapshot.minimumIdle(), snapshot.maximumPoolSize());

            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(snapshot.jdbcUrl());
            hikariConfig.setUsername(snapshot.username());
            hikariConfig.setPassword(snapshot.password());
            if (snapshot.driverClassName() != null && !snapshot.driverClassName().isBlank()) {
                hikariConfig.setDriverClassName(snapshot.driverClassName());
            }
            hikariConfig.setMaximumPoolSize(snapshot.maximumPoolSize());
            hikariConfig.setMinimumIdle(effectiveMinIdle);
            hikariConfig.setIdleTimeout(snapshot.idleTimeoutMs());
            hikariConfig.setConnectionTimeout(snapshot.connectionTimeoutMs());
            hikariConfig.setMaxLifetime(snapshot.maxLifetimeMs());
            hikariConfig.setAutoCommit(true);

            if (snapshot.jdbcUrl() != null && snapshot.jdbcUrl().contains("postgresql")) {
                hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            }

            // Leak detection: -DHikariCP.leakDetectionThreshold=60000
            String leakThreshold = System.getProperty("HikariCP.leakDetectionThreshold");
            if (leakThreshold != null && !leakThreshold.isEmpty()) {
                try {
                    hikariConfig.setLeakDetectionThreshold(Long.parseLong(leakThreshold));
                } catch (NumberFormatException e) {
                    log.warn("[POOL] Ignoring HikariCP.leakDetectionThreshold={}: not a number", leakThreshold);
                }
            }

            hikariConfig.setPoolName("LedgerPool-" + poolIdCounter.incrementAndGet() + "-" + generateShortPoolKey(snapshot));

            HikariDataSource newDataSource = new HikariDataSource(hikariConfig);
            log.info("[POOL] Creating | connectionKey={} | maxPoolSize={}, minIdle={}",
                    sanitizeUrl(snapshot.jdbcUrl()), snapshot.maximumPoolSize(), effectiveMinIdle);
            ConnectionPoolLogger.logPoolStats(newDataSource, "created");
            return newDataSource;
        });
    }

    /** Closes and forgets the pool for {@code snapshot}, if any. */
    public void close(DbConfigSnapshot snapshot) {
        String connectionKey = generateConnectionKey(snapshot);
        HikariDataSource dataSource = dataSourceCache.remove(connectionKey);
        if (dataSource != null) {
            closeQuietly(connectionKey, dataSource);
            log.info("[POOL] Closed and removed pool for connection: {}", sanitizeUrl(snapshot.jdbcUrl()));
        }
    }

    public void closeAll() {
        log.info("[POOL] Closing all ledger pools (count: {})", dataSourceCache.size());
        dataSourceCache.forEach(this::closeQuietly);
        dataSourceCache.clear();
    }

    public int getActiveConnectionCount() {
        return dataSourceCache.size();
    }

    private void closeQuietly(String key, HikariDataSource dataSource) {
        try {
            dataSource.close();
        } catch (RuntimeException e) {
            log.warn("[POOL] Error closing pool for connection: {}", sanitizeUrl(key), e);
        }
    }

    /** The password is not part of the key; each URL and user pair gets its own pool. */
    private static String generateConnectionKey(DbConfigSnapshot snapshot) {
        return snapshot.jdbcUrl() + "|" + snapshot.username();
    }

    /**
     * Short, readable pool key for monitoring: host, database and user from the JDBC URL.
     */
    static String generateShortPoolKey(DbConfigSnapshot snapshot) {
        String url = snapshot.jdbcUrl();
        String user = snapshot.username() != null ? snapshot.username() : "unknown";
        if (url == null || url.isBlank()) {
            return user.replaceAll("[^a-zA-Z0-9_]", "_");
        }
        String safeUrl = url.replaceAll("password=[^;&]+", "password=***");
        String part = safeUrl;
        int slashSlash = safeUrl.indexOf("//");
        if (slashSlash >= 0) {
            part = safeUrl.substring(slashSlash + 2);
        } else if (safeUrl.startsWith("jdbc:h2:")) {
            part = "h2/" + safeUrl.substring("jdbc:h2:".length());
        }
        int slashDb = part.indexOf("/");
        String hostPort = slashDb >= 0 ? part.substring(0, slashDb) : part;
        String db = slashDb >= 0 && slashDb < part.length() - 1 ? part.substring(slashDb + 1).split("[?;]")[0] : "";
        String host = hostPort.split(":")[0];
        String safe = (host + "_" + db + "_" + user).replaceAll("[^a-zA-Z0-9_]", "_").replaceAll("_+", "_");
        return safe.isEmpty() ? "pool" : safe;
    }

    static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
