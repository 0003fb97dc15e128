package com.di.ledger.location;

import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.FileRecord;
import com.di.ledger.sql.QueryCatalog;
import com.di.ledger.sql.QueryOperation;
import com.di.ledger.sql.QuerySession;
import com.di.ledger.transaction.TransactionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Replica locations of tracked files.
 *
 * <p>{@link #setLocation} writes through immediately; {@link #deferLocation} only buffers on the
 * record and hands back a {@link PendingLocations} that the caller flushes or discards. Sites
 * added to a file that is not created yet are kept on the record and written by
 * {@code FileRecordRepository.create}.
 *
 * <p>In-memory state changes only after the store accepted the write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocationManager {

    private final QueryCatalog catalog;

    public void setLocation(TransactionScope scope, FileRecord file, String site) {
        setLocation(scope, file, List.of(site));
    }

    /**
     * Adds {@code sites} to the file and writes them, together with anything still pending on
     * the record, in one atomic step.
     */
    public void setLocation(TransactionScope scope, FileRecord file, Collection<String> sites) {
        Set<String> requested = validSites(sites);
        if (!file.isCreated()) {
            file.addLocations(requested);
            log.debug("[LOCATION] {} not created yet; {} site(s) kept for create", file.getLfn(), requested.size());
            return;
        }
        Set<String> toWrite = new LinkedHashSet<>(file.getPendingLocations());
        toWrite.addAll(requested);
        persistLocations(scope, file.getId(), toWrite);
        file.addLocations(requested);
        file.drainPendingLocations();
    }

    public PendingLocations deferLocation(FileRecord file, String site) {
        return deferLocation(file, List.of(site));
    }

    /** Buffers {@code sites} on the record without touching the store. */
    public PendingLocations deferLocation(FileRecord file, Collection<String> sites) {
        Set<String> requested = validSites(sites);
        file.bufferLocations(requested);
        return new PendingLocations(this, file, requested);
    }

    /** Writes every pending site of the file. */
    public void flush(TransactionScope scope, FileRecord file) {
        flushSites(scope, file, new LinkedHashSet<>(file.getPendingLocations()));
    }

    void flushSites(TransactionScope scope, FileRecord file, Set<String> sites) {
        Set<String> stillPending = new LinkedHashSet<>(sites);
        stillPending.retainAll(file.getPendingLocations());
        if (stillPending.isEmpty()) {
            return;
        }
        if (file.isCreated()) {
            persistLocations(scope, file.getId(), stillPending);
        }
        file.discardPendingLocations(stillPending);
        file.addLocations(stillPending);
    }

    public Set<String> loadLocations(TransactionScope scope, long fileId) {
        return new LinkedHashSet<>(catalog.bind(scope)
                .query(QueryOperation.LOAD_LOCATIONS, (rs, i) -> rs.getString("se_name"), fileId));
    }

    /**
     * Registers each site and links it to the file. Both inserts are idempotent, so sites the
     * file already has are left as they are.
     */
    public void persistLocations(TransactionScope scope, long fileId, Collection<String> sites) {
        if (sites.isEmpty()) {
            return;
        }
        scope.atomically(() -> {
            QuerySession session = catalog.bind(scope);
            List<Object[]> siteArgs = new ArrayList<>(sites.size());
            List<Object[]> linkArgs = new ArrayList<>(sites.size());
            for (String site : sites) {
                siteArgs.add(new Object[]{site});
                linkArgs.add(new Object[]{fileId, site});
            }
            session.batchUpdate(QueryOperation.ADD_LOCATION, siteArgs);
            session.batchUpdate(QueryOperation.ADD_FILE_LOCATION, linkArgs);
        });
        log.debug("[LOCATION] file {} -> {}", fileId, sites);
    }

    private static Set<String> validSites(Collection<String> sites) {
        if (sites == null) {
            throw new ValidationException("sites cannot be null");
        }
        Set<String> valid = new LinkedHashSet<>();
        for (String site : sites) {
            if (site == null || site.isBlank()) {
                throw new ValidationException("site identifier cannot be blank");
            }
            valid.add(site);
        }
        return valid;
    }
}
