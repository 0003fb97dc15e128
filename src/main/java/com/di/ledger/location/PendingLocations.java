package com.di.ledger.location;

import com.di.ledger.file.FileRecord;
import com.di.ledger.transaction.TransactionScope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Sites buffered by {@link LocationManager#deferLocation}. Nothing reaches the store until
 * {@link #flush(TransactionScope)}; a handle that is dropped or {@link #discard() discarded}
 * leaves the store untouched.
 */
public final class PendingLocations {

    private final LocationManager manager;
    private final FileRecord file;
    private final Set<String> sites;

    PendingLocations(LocationManager manager, FileRecord file, Set<String> sites) {
        this.manager = manager;
        this.file = file;
        this.sites = Collections.unmodifiableSet(new LinkedHashSet<>(sites));
    }

    public Set<String> sites() {
        return sites;
    }

    public FileRecord file() {
        return file;
    }

    public void flush(TransactionScope scope) {
        manager.flushSites(scope, file, sites);
    }

    public void discard() {
        file.discardPendingLocations(sites);
    }
}
