package com.di.ledger.config;

import com.di.ledger.sql.QueryDialect;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Ledger settings bound from {@code ledger.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private Datasource datasource = new Datasource();
    private Sql sql = new Sql();
    private Schema schema = new Schema();
    private Upload upload = new Upload();

    @Data
    public static class Datasource {
        private String jdbcUrl = "jdbc:h2:mem:ledger;DB_CLOSE_DELAY=-1";
        private String username = "sa";
        private String password = "";
        /** Blank = let the driver manager pick the driver from the URL. */
        private String driverClassName = "";
        private int maximumPoolSize = 10;
        private int minimumIdle = 1;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;
    }

    @Data
    public static class Sql {
        /** h2 or postgresql. Blank = detect from the JDBC URL. */
        private String dialect = "";
    }

    @Data
    public static class Schema {
        /** Run schema/ledger-&lt;dialect&gt;.sql at startup. Statements are idempotent. */
        private boolean initialize = true;
    }

    @Data
    public static class Upload {
        /** Default batch size of {@code UploadToCatalog.findUploadableFiles(dataset)}. */
        private int maxFiles = 500;
    }

    public DbConfigSnapshot toSnapshot() {
        return new DbConfigSnapshot(datasource.getJdbcUrl(), datasource.getUsername(), datasource.getPassword(),
                datasource.getDriverClassName(), datasource.getMaximumPoolSize(), datasource.getMinimumIdle(),
                datasource.getIdleTimeoutMs(), datasource.getConnectionTimeoutMs(), datasource.getMaxLifetimeMs());
    }

    public QueryDialect resolveDialect() {
        String configured = sql.getDialect();
        if (configured != null && !configured.isBlank()) {
            return QueryDialect.fromName(configured);
        }
        return QueryDialect.fromJdbcUrl(datasource.getJdbcUrl());
    }
}
