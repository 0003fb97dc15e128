package com.di.ledger.location;

import com.di.ledger.LedgerTestStore;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.FileRecord;
import com.di.ledger.transaction.TransactionScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocationManager Tests")
class LocationManagerTest {

    private LedgerTestStore store;
    private LocationManager locations;

    @BeforeEach
    void setUp() {
        store = LedgerTestStore.create();
        locations = store.getLocations();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Should write locations immediately and ignore repeats")
    void testSetLocation() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/loc.root"));
        try (TransactionScope scope = store.open()) {
            locations.setLocation(scope, file, "se1.example.org");
            locations.setLocation(scope, file, List.of("se1.example.org", "se2.example.org"));

            assertEquals(Set.of("se1.example.org", "se2.example.org"), locations.loadLocations(scope, file.getId()));
            assertEquals(Set.of("se1.example.org", "se2.example.org"), file.getLocations());
        }
    }

    @Test
    @DisplayName("Should roll back locations set inside a transaction")
    void testSetLocation_Transaction() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/loc.root"));
        try (TransactionScope scope = store.open()) {
            scope.begin();
            locations.setLocation(scope, file, "se1.example.org");
            assertEquals(Set.of("se1.example.org"), locations.loadLocations(scope, file.getId()));
            scope.rollback();

            assertTrue(locations.loadLocations(scope, file.getId()).isEmpty());

            scope.begin();
            locations.setLocation(scope, file, "se2.example.org");
            scope.commit();
            assertEquals(Set.of("se2.example.org"), locations.loadLocations(scope, file.getId()));
        }
    }

    @Test
    @DisplayName("Should persist builder locations on create")
    void testConstructorLocations() {
        FileRecord file = FileRecord.builder()
                .lfn("/store/ctor.root")
                .location("se1.example.org")
                .location("se2.example.org")
                .build();
        file.setAlgorithm(LedgerTestStore.ALGORITHM);
        file.setDatasetPath(LedgerTestStore.DATASET);
        store.persist(file);
        try (TransactionScope scope = store.open()) {
            assertEquals(Set.of("se1.example.org", "se2.example.org"), locations.loadLocations(scope, file.getId()));
        }
    }

    @Test
    @DisplayName("Should not persist deferred locations until flushed")
    void testDeferLocation_Flush() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/defer.root"));
        try (TransactionScope scope = store.open()) {
            PendingLocations pending = locations.deferLocation(file, List.of("se1.example.org", "se2.example.org"));
            assertTrue(locations.loadLocations(scope, file.getId()).isEmpty());
            assertTrue(file.getLocations().isEmpty());
            assertEquals(Set.of("se1.example.org", "se2.example.org"), file.getPendingLocations());

            pending.flush(scope);
            assertEquals(Set.of("se1.example.org", "se2.example.org"), locations.loadLocations(scope, file.getId()));
            assertEquals(pending.sites(), file.getLocations());
            assertTrue(file.getPendingLocations().isEmpty());
        }
    }

    @Test
    @DisplayName("Should drop discarded deferred locations")
    void testDeferLocation_Discard() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/discard.root"));
        try (TransactionScope scope = store.open()) {
            PendingLocations pending = locations.deferLocation(file, "se1.example.org");
            pending.discard();
            locations.flush(scope, file);

            assertTrue(file.getPendingLocations().isEmpty());
            assertTrue(locations.loadLocations(scope, file.getId()).isEmpty());
        }
    }

    @Test
    @DisplayName("Should write pending locations together with an immediate one")
    void testSetLocation_FlushesPending() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/mixed.root"));
        try (TransactionScope scope = store.open()) {
            locations.deferLocation(file, "se1.example.org");
            locations.setLocation(scope, file, "se2.example.org");

            assertEquals(Set.of("se1.example.org", "se2.example.org"), locations.loadLocations(scope, file.getId()));
            assertTrue(file.getPendingLocations().isEmpty());
        }
    }

    @Test
    @DisplayName("Should write deferred locations of an uncreated file on create")
    void testDeferLocation_BeforeCreate() {
        FileRecord file = LedgerTestStore.newFile("/store/early.root");
        locations.deferLocation(file, "se1.example.org");
        store.persist(file);
        try (TransactionScope scope = store.open()) {
            assertEquals(Set.of("se1.example.org"), locations.loadLocations(scope, file.getId()));
            assertEquals(Set.of("se1.example.org"), file.getLocations());
        }
    }

    @Test
    @DisplayName("Should reject blank site identifiers")
    void testBlankSite() {
        FileRecord file = FileRecord.ofLfn("/store/blank.root");
        assertThrows(ValidationException.class, () -> locations.deferLocation(file, " "));
    }
}
