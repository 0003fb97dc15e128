package com.di.ledger.upload;

import com.di.ledger.LedgerTestStore;
import com.di.ledger.exception.NotFoundException;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.FileRecord;
import com.di.ledger.file.FileStatus;
import com.di.ledger.transaction.TransactionScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DiscoveryQueries Tests")
class DiscoveryQueriesTest {

    private static final String OTHER_DATASET = "/Primary/Processed-v1/AOD";

    private LedgerTestStore store;
    private DiscoveryQueries discovery;

    @BeforeEach
    void setUp() {
        store = LedgerTestStore.create();
        discovery = store.getDiscovery();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Should list datasets with files waiting for upload")
    void testFindUploadableDatasets() {
        FileRecord a = store.persist(LedgerTestStore.newFile("/store/a.root"));
        store.persist(LedgerTestStore.newFile("/store/b.root", OTHER_DATASET));
        try (TransactionScope scope = store.open()) {
            assertEquals(List.of(OTHER_DATASET, LedgerTestStore.DATASET), discovery.findUploadableDatasets(scope));

            discovery.updateFilesStatus(scope, List.of(a.getId()));
            assertEquals(List.of(OTHER_DATASET), discovery.findUploadableDatasets(scope));
        }
    }

    @Test
    @DisplayName("Should hold back children of parents that are not uploaded")
    void testFindUploadableFiles_ParentGate() {
        FileRecord parent = store.persist(LedgerTestStore.newFile("/store/parent.root"));
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        FileRecord orphan = store.persist(LedgerTestStore.newFile("/store/orphan.root"));
        try (TransactionScope scope = store.open()) {
            store.getLineage().addParent(scope, child, parent.getLfn());
            store.getLineage().addParent(scope, orphan, "/store/untracked.root");

            assertEquals(List.of(new FileIdentity(parent.getId(), parent.getLfn()),
                            new FileIdentity(orphan.getId(), orphan.getLfn())),
                    discovery.findUploadableFiles(scope, LedgerTestStore.DATASET, 10));

            discovery.updateFilesStatus(scope, List.of(parent.getId(), orphan.getId()));
            assertEquals(List.of(new FileIdentity(child.getId(), child.getLfn())),
                    discovery.findUploadableFiles(scope, LedgerTestStore.DATASET, 10));
        }
    }

    @Test
    @DisplayName("Should return at most maxFiles, oldest first")
    void testFindUploadableFiles_Limit() {
        FileRecord first = store.persist(LedgerTestStore.newFile("/store/1.root"));
        FileRecord second = store.persist(LedgerTestStore.newFile("/store/2.root"));
        store.persist(LedgerTestStore.newFile("/store/3.root"));
        try (TransactionScope scope = store.open()) {
            List<FileIdentity> batch = discovery.findUploadableFiles(scope, LedgerTestStore.DATASET, 2);
            assertEquals(List.of(new FileIdentity(first.getId(), first.getLfn()),
                    new FileIdentity(second.getId(), second.getLfn())), batch);
            assertThrows(ValidationException.class,
                    () -> discovery.findUploadableFiles(scope, LedgerTestStore.DATASET, 0));
            assertTrue(discovery.findUploadableFiles(scope, "/No/Such/DATASET", 5).isEmpty());
        }
    }

    @Test
    @DisplayName("Should change no status when any id is unknown")
    void testUpdateFilesStatus_AllOrNothing() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/a.root"));
        try (TransactionScope scope = store.open()) {
            assertThrows(NotFoundException.class,
                    () -> discovery.updateFilesStatus(scope, List.of(file.getId(), file.getId() + 999)));

            FileRecord loaded = FileRecord.ofId(file.getId());
            store.getFiles().load(scope, loaded);
            assertEquals(FileStatus.NOTUPLOADED, loaded.getStatus());
        }
    }

    @Test
    @DisplayName("Should undo only its own writes inside the caller's transaction")
    void testUpdateFilesStatus_Savepoint() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/a.root"));
        try (TransactionScope scope = store.open()) {
            scope.begin();
            store.getBlocks().setBlock(scope, file.getLfn(), "block#1");
            assertThrows(NotFoundException.class,
                    () -> discovery.updateFilesStatus(scope, List.of(file.getId(), -1L)));
            assertTrue(scope.isActive());
            scope.commit();

            FileRecord loaded = FileRecord.ofId(file.getId());
            store.getFiles().load(scope, loaded);
            assertEquals(FileStatus.NOTUPLOADED, loaded.getStatus());
            assertEquals("block#1", loaded.getBlockName());
        }
    }

    @Test
    @DisplayName("Should move files back to NOTUPLOADED on request")
    void testUpdateFilesStatus_ExplicitStatus() {
        FileRecord file = store.persist(LedgerTestStore.newFile("/store/a.root"));
        try (TransactionScope scope = store.open()) {
            discovery.updateFilesStatus(scope, List.of(file.getId()));
            discovery.updateFilesStatus(scope, List.of(file.getId()), FileStatus.NOTUPLOADED);
            assertEquals(1, discovery.findUploadableFiles(scope, LedgerTestStore.DATASET, 5).size());
            discovery.updateFilesStatus(scope, List.of());
        }
    }
}
