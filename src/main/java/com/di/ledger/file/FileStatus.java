package com.di.ledger.file;

/**
 * Upload status of a tracked file. Stored by name.
 */
public enum FileStatus {
    /** Tracked but not yet registered in the catalog. Initial value. */
    NOTUPLOADED,
    /** Registered in the catalog. */
    UPLOADED
}
