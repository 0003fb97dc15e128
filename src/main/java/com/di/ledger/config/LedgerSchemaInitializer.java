package com.di.ledger.config;

import com.di.ledger.sql.QueryDialect;
import com.di.ledger.util.ConnectionPoolLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * At startup, applies {@code schema/ledger-<dialect>.sql} when {@code ledger.schema.initialize}
 * is true. Every statement is {@code IF NOT EXISTS}, so running against an existing schema
 * changes nothing.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class LedgerSchemaInitializer implements ApplicationRunner {

    private final LedgerProperties properties;
    private final DataSource ledgerDataSource;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSchema().isInitialize()) {
            log.info("[SCHEMA] ledger.schema.initialize=false; leaving the schema as it is");
            return;
        }
        apply(ledgerDataSource, properties.resolveDialect());
        ConnectionPoolLogger.logPoolStats(ledgerDataSource, "after schema");
    }

    public static void apply(DataSource dataSource, QueryDialect dialect) {
        ClassPathResource script = new ClassPathResource(dialect.schemaResource());
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(script);
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("[SCHEMA] Applied {} ({})", dialect.schemaResource(), dialect.getKey());
    }
}
