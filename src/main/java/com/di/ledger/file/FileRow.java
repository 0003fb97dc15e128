package com.di.ledger.file;

/** Scalar columns of one {@code ledger_file} row joined with its algorithm, dataset and block. */
record FileRow(long id, String lfn, long size, long events, Algorithm algorithm,
               String datasetPath, FileStatus status, String blockName) {
}
