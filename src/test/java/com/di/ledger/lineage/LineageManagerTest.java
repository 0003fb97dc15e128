package com.di.ledger.lineage;

import com.di.ledger.LedgerTestStore;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.FileRecord;
import com.di.ledger.file.FileRecordRepository;
import com.di.ledger.file.FileStatus;
import com.di.ledger.transaction.TransactionScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LineageManager Tests")
class LineageManagerTest {

    private LedgerTestStore store;
    private LineageManager lineage;
    private FileRecordRepository files;

    @BeforeEach
    void setUp() {
        store = LedgerTestStore.create();
        lineage = store.getLineage();
        files = store.getFiles();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Should resolve parent LFNs from the store")
    void testGetParentLfns() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParents(scope, child, List.of("/store/parent1.root", "/store/parent2.root"));

            FileRecord fresh = FileRecord.ofId(child.getId());
            assertEquals(Set.of("/store/parent1.root", "/store/parent2.root"), lineage.getParentLfns(scope, fresh));
            assertEquals(Set.of("/store/parent1.root", "/store/parent2.root"), fresh.getKnownParentLfns().orElseThrow());
        }
    }

    @Test
    @DisplayName("Should accept parents that do not exist yet and load only existing ones")
    void testAddParents_NonexistentParents() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        FileRecord realParent = store.persist(LedgerTestStore.newFile("/store/real-parent.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParents(scope, child, List.of("/store/ghost.root", realParent.getLfn()));
            lineage.addParent(scope, child, "/store/ghost.root");

            FileRecord loaded = FileRecord.ofLfn(child.getLfn());
            files.load(scope, loaded, true);
            assertEquals(Set.of("/store/ghost.root", realParent.getLfn()), loaded.getKnownParentLfns().orElseThrow());
            assertEquals(1, loaded.getParents().size());
            assertEquals(realParent, loaded.getParents().get(0));
        }
    }

    @Test
    @DisplayName("Should attach edges declared before the parent was created")
    void testParentCreatedLater() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParent(scope, child, "/store/late-parent.root");
            assertTrue(lineage.getParentStatus(scope, child.getLfn()).isEmpty());
        }
        store.persist(LedgerTestStore.newFile("/store/late-parent.root"));
        try (TransactionScope scope = store.open()) {
            assertEquals(List.of(FileStatus.NOTUPLOADED), lineage.getParentStatus(scope, child.getLfn()));
            assertEquals(Set.of(child.getLfn()), lineage.getChildren(scope, "/store/late-parent.root"));
        }
    }

    @Test
    @DisplayName("Should attach every parent declared before any of them was created")
    void testParentsDeclaredBeforeCreate() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/x.root"));
        List<String> parentLfns = List.of("/store/a.root", "/store/b.root", "/store/c.root");
        try (TransactionScope scope = store.open()) {
            lineage.addParents(scope, child, parentLfns);
        }
        parentLfns.forEach(lfn -> store.persist(LedgerTestStore.newFile(lfn)));

        try (TransactionScope scope = store.open()) {
            FileRecord loaded = FileRecord.ofLfn(child.getLfn());
            files.load(scope, loaded, true);

            assertEquals(Set.copyOf(parentLfns), loaded.getKnownParentLfns().orElseThrow());
            assertEquals(3, loaded.getParents().size());
            Set<String> loadedParents = new HashSet<>();
            for (FileRecord parent : loaded.getParents()) {
                assertTrue(parent.isCreated());
                loadedParents.add(parent.getLfn());
            }
            assertEquals(Set.copyOf(parentLfns), loadedParents);
        }
    }

    @Test
    @DisplayName("Should not report parents added in a rolled-back transaction")
    void testAddParents_Rollback() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/x.root"));
        try (TransactionScope scope = store.open()) {
            assertTrue(lineage.getParentLfns(scope, child).isEmpty());

            scope.begin();
            lineage.addParents(scope, child, List.of("/store/a.root"));
            assertEquals(Set.of("/store/a.root"), lineage.getParentLfns(scope, child));
            scope.rollback();

            assertTrue(lineage.getParentLfns(scope, child.getLfn()).isEmpty());
            assertTrue(lineage.getParentLfns(scope, child).isEmpty());
            assertTrue(child.getKnownParentLfns().orElseThrow().isEmpty());
        }
    }

    @Test
    @DisplayName("Should restore removed parents when the removal is rolled back")
    void testRemoveParents_Rollback() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/x.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParents(scope, child, List.of("/p/a", "/p/b"));
            assertEquals(Set.of("/p/a", "/p/b"), lineage.getParentLfns(scope, child));

            scope.begin();
            lineage.removeParents(scope, child, List.of("/p/a"));
            assertTrue(child.getKnownParentLfns().isEmpty());
            scope.rollback();

            assertEquals(Set.of("/p/a", "/p/b"), lineage.getParentLfns(scope, child));
        }
    }

    @Test
    @DisplayName("Should drop child edges when the transaction is rolled back")
    void testAddChild_Rollback() {
        FileRecord parent = store.persist(LedgerTestStore.newFile("/store/parent.root"));
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        try (TransactionScope scope = store.open()) {
            scope.begin();
            lineage.addChild(scope, parent, child.getLfn());
            assertEquals(Set.of(child.getLfn()), lineage.getChildren(scope, parent.getLfn()));
            scope.rollback();

            assertTrue(lineage.getChildren(scope, parent.getLfn()).isEmpty());
            FileRecord loaded = FileRecord.ofLfn(child.getLfn());
            files.load(scope, loaded, true);
            assertTrue(loaded.getKnownParentLfns().orElseThrow().isEmpty());
            assertTrue(loaded.getParents().isEmpty());
        }
    }

    @Test
    @DisplayName("Should list children of a parent")
    void testGetChildren() {
        FileRecord parent = store.persist(LedgerTestStore.newFile("/store/parent.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addChildren(scope, parent, List.of("/store/c1.root", "/store/c2.root"));
            assertEquals(Set.of("/store/c1.root", "/store/c2.root"), lineage.getChildren(scope, parent.getLfn()));
            assertTrue(lineage.getChildren(scope, "/store/c1.root").isEmpty());
        }
    }

    @Test
    @DisplayName("Should report the status of tracked parents")
    void testGetParentStatus() {
        FileRecord parent = store.persist(LedgerTestStore.newFile("/store/parent.root"));
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParent(scope, child, parent.getLfn());
            assertEquals(List.of(FileStatus.NOTUPLOADED), lineage.getParentStatus(scope, child.getLfn()));

            store.getDiscovery().updateFilesStatus(scope, List.of(parent.getId()));
            assertEquals(List.of(FileStatus.UPLOADED), lineage.getParentStatus(scope, child.getLfn()));
        }
    }

    @Test
    @DisplayName("Should remove parent edges")
    void testRemoveParents() {
        FileRecord child = store.persist(LedgerTestStore.newFile("/store/child.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParents(scope, child, List.of("/p/a", "/p/b"));
            assertEquals(Set.of("/p/a", "/p/b"), lineage.getParentLfns(scope, child));
            lineage.removeParents(scope, child, List.of("/p/a"));
            assertEquals(Set.of("/p/b"), lineage.getParentLfns(scope, child));
            assertEquals(Set.of("/p/b"), lineage.getParentLfns(scope, child.getLfn()));
        }
    }

    @Test
    @DisplayName("Should walk ancestors transitively")
    void testGetAncestors() {
        try (TransactionScope scope = store.open()) {
            lineage.addParent(scope, FileRecord.ofLfn("/c"), "/b");
            lineage.addParent(scope, FileRecord.ofLfn("/b"), "/a");
            assertEquals(Set.of("/b", "/a"), lineage.getAncestors(scope, "/c"));
            assertTrue(lineage.getAncestors(scope, "/a").isEmpty());
        }
    }

    @Test
    @DisplayName("Should reject edges that would create a cycle")
    void testCycleRejected() {
        try (TransactionScope scope = store.open()) {
            FileRecord a = FileRecord.ofLfn("/a");
            assertThrows(ValidationException.class, () -> lineage.addParent(scope, a, "/a"));

            lineage.addParent(scope, FileRecord.ofLfn("/b"), "/a");
            lineage.addParent(scope, FileRecord.ofLfn("/c"), "/b");
            assertThrows(ValidationException.class, () -> lineage.addParent(scope, a, "/c"));
            assertThrows(ValidationException.class, () -> lineage.addChild(scope, FileRecord.ofLfn("/c"), "/a"));

            assertTrue(lineage.getParentLfns(scope, "/a").isEmpty());
        }
    }

    @Test
    @DisplayName("Should remove edges in both directions when a file is deleted")
    void testDeleteRemovesEdges() {
        FileRecord middle = store.persist(LedgerTestStore.newFile("/store/middle.root"));
        try (TransactionScope scope = store.open()) {
            lineage.addParent(scope, middle, "/store/top.root");
            lineage.addChild(scope, middle, "/store/bottom.root");
            files.delete(scope, middle);

            assertTrue(lineage.getChildren(scope, "/store/top.root").isEmpty());
            assertTrue(lineage.getParentLfns(scope, "/store/bottom.root").isEmpty());
        }
    }
}
