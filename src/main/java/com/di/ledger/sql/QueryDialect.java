package com.di.ledger.sql;

import java.util.Locale;

/**
 * Backing-store SQL dialects the ledger ships query variants for.
 * The dialect is chosen once per process and selects both the query overrides
 * ({@code sql/ledger-queries-<key>.yml}) and the DDL ({@code schema/ledger-<key>.sql}).
 */
public enum QueryDialect {

    H2("h2"),
    POSTGRESQL("postgresql");

    private final String key;

    QueryDialect(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public String queryResource() {
        return "sql/ledger-queries-" + key + ".yml";
    }

    public String schemaResource() {
        return "schema/ledger-" + key + ".sql";
    }

    /**
     * Resolves a dialect by name (case-insensitive; {@code postgres} is accepted for PostgreSQL).
     *
     * @throws IllegalArgumentException for blank or unsupported names
     */
    public static QueryDialect fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Dialect name cannot be null or blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if ("postgres".equals(normalized)) {
            return POSTGRESQL;
        }
        for (QueryDialect d : values()) {
            if (d.key.equals(normalized)) {
                return d;
            }
        }
        throw new IllegalArgumentException("Unsupported dialect: '" + name + "'. Supported: h2, postgresql");
    }

    /** Detects the dialect from a JDBC URL such as {@code jdbc:postgresql://host/db}. */
    public static QueryDialect fromJdbcUrl(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:")) {
            throw new IllegalArgumentException("Not a JDBC URL: " + jdbcUrl);
        }
        String rest = jdbcUrl.substring("jdbc:".length());
        int colon = rest.indexOf(':');
        return fromName(colon > 0 ? rest.substring(0, colon) : rest);
    }
}
