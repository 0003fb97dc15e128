package com.di.ledger.upload;

import com.di.ledger.config.LedgerProperties;
import com.di.ledger.file.Algorithm;
import com.di.ledger.file.FileStatus;
import com.di.ledger.transaction.TransactionScopes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;

/**
 * Entry point for the upload orchestrator. Each call runs in its own scope and transaction,
 * committed on return and rolled back on failure.
 */
@Slf4j
@Service
public class UploadToCatalog {

    private final TransactionScopes scopes;
    private final DiscoveryQueries discovery;
    private final int defaultMaxFiles;

    public UploadToCatalog(TransactionScopes scopes, DiscoveryQueries discovery, LedgerProperties properties) {
        this.scopes = scopes;
        this.discovery = discovery;
        this.defaultMaxFiles = properties.getUpload().getMaxFiles();
    }

    public List<String> findUploadableDatasets() {
        return scopes.inTransaction(discovery::findUploadableDatasets);
    }

    public List<FileIdentity> findUploadableFiles(String datasetPath) {
        return findUploadableFiles(datasetPath, defaultMaxFiles);
    }

    public List<FileIdentity> findUploadableFiles(String datasetPath, int maxFiles) {
        List<FileIdentity> files = scopes.inTransaction(scope -> discovery.findUploadableFiles(scope, datasetPath, maxFiles));
        log.debug("[UPLOAD] {} uploadable file(s) in {}", files.size(), datasetPath);
        return files;
    }

    public List<Algorithm> findAlgos(String datasetPath) {
        return scopes.inTransaction(scope -> discovery.findAlgos(scope, datasetPath));
    }

    public void updateFilesStatus(Collection<Long> fileIds) {
        updateFilesStatus(fileIds, FileStatus.UPLOADED);
    }

    public void updateFilesStatus(Collection<Long> fileIds, FileStatus status) {
        scopes.inTransaction(scope -> {
            discovery.updateFilesStatus(scope, fileIds, status);
            return null;
        });
    }
}
