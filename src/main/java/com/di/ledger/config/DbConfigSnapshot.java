package com.di.ledger.config;

import java.io.Serializable;

/** Immutable view of the ledger's datasource settings; also the pool cache key. */
public record DbConfigSnapshot(String jdbcUrl, String username, String password, String driverClassName,
                               int maximumPoolSize, int minimumIdle, long idleTimeoutMs, long connectionTimeoutMs,
                               long maxLifetimeMs) implements Serializable {
}
