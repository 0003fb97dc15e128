package com.di.ledger.upload;

/** Id and LFN of a file returned by upload discovery. */
public record FileIdentity(long id, String lfn) {
}
