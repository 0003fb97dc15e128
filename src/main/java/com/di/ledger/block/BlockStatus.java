package com.di.ledger.block;

/** Lifecycle of an upload block. Stored by name. */
public enum BlockStatus {
    OPEN,
    CLOSED,
    UPLOADED
}
