package com.di.ledger.block;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/** Snapshot of one block row with its locations and the number of files assigned to it. */
@Value
@Builder
public class Block {
    String name;
    BlockStatus status;
    @Singular
    Set<String> locations;
    long fileCount;
    Instant createTime;
}
