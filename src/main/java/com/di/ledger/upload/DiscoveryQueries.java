package com.di.ledger.upload;

import com.di.ledger.exception.NotFoundException;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.Algorithm;
import com.di.ledger.file.FileStatus;
import com.di.ledger.sql.QueryCatalog;
import com.di.ledger.sql.QueryOperation;
import com.di.ledger.sql.QuerySession;
import com.di.ledger.transaction.TransactionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Read side of the upload cycle plus the bulk status transition that closes it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryQueries {

    private final QueryCatalog catalog;

    /** Dataset paths that still have at least one file waiting for upload. */
    public List<String> findUploadableDatasets(TransactionScope scope) {
        return catalog.bind(scope).query(QueryOperation.FIND_UPLOADABLE_DATASETS,
                (rs, i) -> rs.getString("dataset_path"), FileStatus.NOTUPLOADED.name());
    }

    /**
     * Up to {@code maxFiles} files of the dataset that are ready for upload, lowest id first.
     * A file is held back while any of its tracked parents is not yet uploaded; parents that
     * were only declared by LFN do not hold it back.
     */
    public List<FileIdentity> findUploadableFiles(TransactionScope scope, String datasetPath, int maxFiles) {
        if (maxFiles <= 0) {
            throw new ValidationException("maxFiles must be positive: " + maxFiles);
        }
        return catalog.bind(scope).query(QueryOperation.FIND_UPLOADABLE_FILES,
                (rs, i) -> new FileIdentity(rs.getLong("id"), rs.getString("lfn")),
                datasetPath, FileStatus.NOTUPLOADED.name(), FileStatus.UPLOADED.name(), maxFiles);
    }

    public List<Algorithm> findAlgos(TransactionScope scope, String datasetPath) {
        return catalog.bind(scope).query(QueryOperation.FIND_ALGOS,
                (rs, i) -> new Algorithm(rs.getString("app_name"), rs.getString("app_ver"),
                        rs.getString("app_fam"), rs.getString("pset_hash"), rs.getString("config_content")),
                datasetPath);
    }

    public void updateFilesStatus(TransactionScope scope, Collection<Long> fileIds) {
        updateFilesStatus(scope, fileIds, FileStatus.UPLOADED);
    }

    /**
     * Moves every file to {@code status} or none of them.
     *
     * @throws NotFoundException if any id is unknown; no status is changed
     */
    public void updateFilesStatus(TransactionScope scope, Collection<Long> fileIds, FileStatus status) {
        if (status == null) {
            throw new ValidationException("status cannot be null");
        }
        if (fileIds.isEmpty()) {
            return;
        }
        List<Object[]> args = new ArrayList<>(fileIds.size());
        List<Long> ids = new ArrayList<>(fileIds);
        ids.forEach(id -> args.add(new Object[]{status.name(), id}));
        scope.atomically(() -> {
            QuerySession session = catalog.bind(scope);
            int[] counts = session.batchUpdate(QueryOperation.UPDATE_FILE_STATUS, args);
            for (int i = 0; i < counts.length; i++) {
                if (counts[i] == 0) {
                    throw new NotFoundException("Cannot set status of unknown file id " + ids.get(i));
                }
            }
        });
        log.info("[UPLOAD] {} file(s) -> {}", ids.size(), status);
    }
}
