package com.di.ledger.config;

import com.di.ledger.sql.QueryCatalog;
import com.di.ledger.transaction.TransactionScopes;
import com.di.ledger.util.ConnectionPoolLogger;
import com.di.ledger.util.LedgerDataSources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Store wiring: one pooled DataSource, the query catalog for its dialect and the scope
 * factory handed to callers.
 */
@Slf4j
@Configuration
public class LedgerConfiguration implements DisposableBean {

    @Bean(destroyMethod = "")
    public DataSource ledgerDataSource(LedgerProperties properties) {
        ConnectionPoolLogger.logDatasourceSectionStart("ledger store");
        DataSource dataSource = LedgerDataSources.INSTANCE.getOrInit(properties.toSnapshot());
        ConnectionPoolLogger.logDatasourceSectionEnd();
        return dataSource;
    }

    @Bean
    public QueryCatalog queryCatalog(LedgerProperties properties) {
        return QueryCatalog.load(properties.resolveDialect());
    }

    @Bean
    public TransactionScopes transactionScopes(DataSource ledgerDataSource) {
        return new TransactionScopes(ledgerDataSource);
    }

    /** Pools are owned by {@link LedgerDataSources}; release them with the context. */
    @Override
    public void destroy() {
        LedgerDataSources.INSTANCE.closeAll();
    }
}
