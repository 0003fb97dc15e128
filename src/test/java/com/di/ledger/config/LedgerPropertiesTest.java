package com.di.ledger.config;

import com.di.ledger.sql.QueryDialect;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LedgerProperties Tests")
class LedgerPropertiesTest {

    @Test
    @DisplayName("Should default to an in-memory H2 store")
    void testDefaults() {
        LedgerProperties properties = new LedgerProperties();
        assertEquals(QueryDialect.H2, properties.resolveDialect());
        assertTrue(properties.getSchema().isInitialize());
        assertEquals(500, properties.getUpload().getMaxFiles());
    }

    @Test
    @DisplayName("Should detect the dialect from the JDBC URL when none is configured")
    void testResolveDialect_FromUrl() {
        LedgerProperties properties = new LedgerProperties();
        properties.getDatasource().setJdbcUrl("jdbc:postgresql://db:5432/ledger");
        assertEquals(QueryDialect.POSTGRESQL, properties.resolveDialect());
    }

    @Test
    @DisplayName("Should prefer an explicitly configured dialect")
    void testResolveDialect_Explicit() {
        LedgerProperties properties = new LedgerProperties();
        properties.getDatasource().setJdbcUrl("jdbc:postgresql://db:5432/ledger");
        properties.getSql().setDialect("h2");
        assertEquals(QueryDialect.H2, properties.resolveDialect());
    }
}
