package com.di.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Boots the ledger: pool, query catalog, schema and the managers. The store is configured
 * under {@code ledger.*}; Spring's own DataSource auto-configuration is off.
 */
@SpringBootApplication(exclude = {
        DataSourceAutoConfiguration.class,
        DataSourceTransactionManagerAutoConfiguration.class
})
@ConfigurationPropertiesScan
public class LineageLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(LineageLedgerApplication.class, args);
    }
}
