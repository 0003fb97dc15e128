package com.di.ledger.lineage;

import com.di.ledger.exception.NotFoundException;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.FileRecord;
import com.di.ledger.file.FileStatus;
import com.di.ledger.sql.QueryCatalog;
import com.di.ledger.sql.QueryOperation;
import com.di.ledger.sql.QuerySession;
import com.di.ledger.transaction.TransactionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parent/child edges between tracked files.
 *
 * <p>Edges are stored by LFN, so either end may name a file that has not been created yet.
 * Adding an edge twice is a no-op. An edge that would make a file its own ancestor is
 * rejected with {@link ValidationException} before anything is written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LineageManager {

    private final QueryCatalog catalog;

    public void addParent(TransactionScope scope, FileRecord child, String parentLfn) {
        addParents(scope, child, List.of(parentLfn));
    }

    public void addParents(TransactionScope scope, FileRecord child, Collection<String> parentLfns) {
        Set<String> parents = validLfns(parentLfns);
        QuerySession session = catalog.bind(scope);
        String childLfn = lfnOf(session, child);
        for (String parent : parents) {
            rejectCycle(session, childLfn, parent);
        }
        List<Object[]> edges = new ArrayList<>(parents.size());
        parents.forEach(p -> edges.add(new Object[]{childLfn, p}));
        insertEdges(scope, session, edges);
        child.forgetParentLfns();
        log.debug("[LINEAGE] {} <- parents {}", childLfn, parents);
    }

    public void addChild(TransactionScope scope, FileRecord parent, String childLfn) {
        addChildren(scope, parent, List.of(childLfn));
    }

    public void addChildren(TransactionScope scope, FileRecord parent, Collection<String> childLfns) {
        Set<String> children = validLfns(childLfns);
        QuerySession session = catalog.bind(scope);
        String parentLfn = lfnOf(session, parent);
        for (String child : children) {
            rejectCycle(session, child, parentLfn);
        }
        List<Object[]> edges = new ArrayList<>(children.size());
        children.forEach(c -> edges.add(new Object[]{c, parentLfn}));
        insertEdges(scope, session, edges);
        log.debug("[LINEAGE] {} -> children {}", parentLfn, children);
    }

    public void removeParents(TransactionScope scope, FileRecord child, Collection<String> parentLfns) {
        Set<String> parents = validLfns(parentLfns);
        QuerySession session = catalog.bind(scope);
        String childLfn = lfnOf(session, child);
        List<Object[]> args = new ArrayList<>(parents.size());
        parents.forEach(p -> args.add(new Object[]{childLfn, p}));
        scope.atomically(() -> {
            session.batchUpdate(QueryOperation.DELETE_PARENT, args);
        });
        child.forgetParentLfns();
    }

    /** Parent LFNs of the file, read from the store on every call and recorded on the record. */
    public Set<String> getParentLfns(TransactionScope scope, FileRecord file) {
        QuerySession session = catalog.bind(scope);
        Set<String> parents = parentsOf(session, lfnOf(session, file));
        file.setParentLfns(parents);
        return parents;
    }

    public Set<String> getParentLfns(TransactionScope scope, String lfn) {
        return parentsOf(catalog.bind(scope), lfn);
    }

    /**
     * Status of each parent of {@code lfn} that is itself tracked. Parents declared by LFN but
     * never created are not reported.
     */
    public List<FileStatus> getParentStatus(TransactionScope scope, String lfn) {
        return catalog.bind(scope).query(QueryOperation.GET_PARENT_STATUS,
                (rs, i) -> FileStatus.valueOf(rs.getString("status")), lfn);
    }

    public Set<String> getChildren(TransactionScope scope, String lfn) {
        return new LinkedHashSet<>(catalog.bind(scope).query(QueryOperation.GET_CHILDREN,
                (rs, i) -> rs.getString("child_lfn"), lfn));
    }

    /** Every LFN reachable through parent edges, nearest first. */
    public Set<String> getAncestors(TransactionScope scope, String lfn) {
        return ancestorsOf(catalog.bind(scope), lfn);
    }

    private static void insertEdges(TransactionScope scope, QuerySession session, List<Object[]> edges) {
        scope.atomically(() -> {
            session.batchUpdate(QueryOperation.INSERT_PARENTAGE, edges);
        });
    }

    private void rejectCycle(QuerySession session, String childLfn, String parentLfn) {
        if (childLfn.equals(parentLfn)) {
            throw new ValidationException("A file cannot be its own parent: " + childLfn);
        }
        if (ancestorsOf(session, parentLfn).contains(childLfn)) {
            throw new ValidationException(String.format(
                    "Edge %s -> %s would create a lineage cycle", parentLfn, childLfn));
        }
    }

    private Set<String> ancestorsOf(QuerySession session, String lfn) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(parentsOf(session, lfn));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(parentsOf(session, next));
            }
        }
        return seen;
    }

    private static Set<String> parentsOf(QuerySession session, String lfn) {
        return new LinkedHashSet<>(session.query(QueryOperation.GET_PARENT_LFNS,
                (rs, i) -> rs.getString("parent_lfn"), lfn));
    }

    private static String lfnOf(QuerySession session, FileRecord file) {
        if (file.getLfn() != null) {
            return file.getLfn();
        }
        return session.queryForOptional(QueryOperation.GET_FILE_LFN_BY_ID, (rs, i) -> rs.getString("lfn"), file.getId())
                .orElseThrow(() -> new NotFoundException("No file with id " + file.getId()));
    }

    private static Set<String> validLfns(Collection<String> lfns) {
        if (lfns == null) {
            throw new ValidationException("LFN list cannot be null");
        }
        Set<String> valid = new LinkedHashSet<>();
        for (String lfn : lfns) {
            if (lfn == null || lfn.isBlank()) {
                throw new ValidationException("LFN cannot be blank");
            }
            valid.add(lfn);
        }
        return valid;
    }
}
