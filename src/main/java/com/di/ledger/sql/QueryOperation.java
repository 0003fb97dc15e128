package com.di.ledger.sql;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every named query the ledger runs. The operation name is the key under
 * {@code queries:} in the catalog YAML files.
 */
public enum QueryOperation {

    // files
    INSERT_ALGO("InsertAlgo"),
    GET_ALGO_ID("GetAlgoId"),
    INSERT_DATASET("InsertDataset"),
    GET_DATASET_ID("GetDatasetId"),
    NEW_FILE("NewFile"),
    GET_FILE_ID_BY_LFN("GetFileIdByLfn"),
    GET_FILE_LFN_BY_ID("GetFileLfnById"),
    LOAD_FILE_BY_LFN("LoadFileByLfn"),
    LOAD_FILE_BY_ID("LoadFileById"),
    ADD_CHECKSUM("AddChecksum"),
    LOAD_CHECKSUMS("LoadChecksums"),
    ADD_RUN_LUMI("AddRunLumi"),
    LOAD_RUN_LUMIS("LoadRunLumis"),
    DELETE_CHECKSUMS("DeleteChecksums"),
    DELETE_RUN_LUMIS("DeleteRunLumis"),
    DELETE_FILE_LOCATIONS("DeleteFileLocations"),
    DELETE_FILE("DeleteFile"),
    COUNT_FILES("CountFiles"),

    // locations
    ADD_LOCATION("AddLocation"),
    ADD_FILE_LOCATION("AddFileLocation"),
    LOAD_LOCATIONS("LoadLocations"),

    // lineage
    INSERT_PARENTAGE("InsertParentage"),
    DELETE_PARENT("DeleteParent"),
    DELETE_PARENTAGE("DeleteParentage"),
    GET_PARENT_LFNS("GetParentLFNs"),
    GET_CHILDREN("GetChildren"),
    GET_PARENT_STATUS("GetParentStatus"),

    // blocks
    INSERT_BLOCK("InsertBlock"),
    SET_BLOCK_STATUS("SetBlockStatus"),
    ADD_BLOCK_LOCATION("AddBlockLocation"),
    SET_BLOCK("SetBlock"),
    GET_BLOCK("GetBlock"),
    LOAD_BLOCK("LoadBlock"),
    LOAD_BLOCK_LOCATIONS("LoadBlockLocations"),
    COUNT_BLOCK_FILES("CountBlockFiles"),

    // upload discovery
    FIND_UPLOADABLE_DATASETS("FindUploadableDatasets"),
    FIND_UPLOADABLE_FILES("FindUploadableFiles"),
    FIND_ALGOS("FindAlgos"),
    UPDATE_FILE_STATUS("UpdateFileStatus");

    private static final Map<String, QueryOperation> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(QueryOperation::getOperationName, Function.identity()));

    private final String operationName;

    QueryOperation(String operationName) {
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }

    public static Optional<QueryOperation> byName(String operationName) {
        return Optional.ofNullable(operationName == null ? null : BY_NAME.get(operationName.trim()));
    }
}
