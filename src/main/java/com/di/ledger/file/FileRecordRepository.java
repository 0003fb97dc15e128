package com.di.ledger.file;

import com.di.ledger.exception.DuplicateException;
import com.di.ledger.exception.NotFoundException;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.lineage.LineageManager;
import com.di.ledger.location.LocationManager;
import com.di.ledger.sql.QueryCatalog;
import com.di.ledger.sql.QueryOperation;
import com.di.ledger.sql.QuerySession;
import com.di.ledger.transaction.TransactionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * Persists {@link FileRecord}s. Every call takes the caller's {@link TransactionScope};
 * multi-statement writes run atomically inside it (own transaction, or a savepoint of the
 * caller's).
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class FileRecordRepository {

    private static final RowMapper<Long> ID_MAPPER = (rs, i) -> rs.getLong("id");

    private static final RowMapper<FileRow> FILE_ROW_MAPPER = (rs, i) -> new FileRow(
            rs.getLong("id"),
            rs.getString("lfn"),
            rs.getLong("filesize"),
            rs.getLong("events"),
            new Algorithm(rs.getString("app_name"), rs.getString("app_ver"), rs.getString("app_fam"),
                    rs.getString("pset_hash"), rs.getString("config_content")),
            rs.getString("dataset_path"),
            FileStatus.valueOf(rs.getString("status")),
            rs.getString("blockname"));

    private final QueryCatalog catalog;
    private final LocationManager locationManager;
    private final LineageManager lineageManager;

    /**
     * Inserts the file with its checksums, runs and locations (known and pending) and assigns
     * its id. The record is left untouched if anything fails.
     *
     * @throws ValidationException if the LFN, algorithm or dataset path is missing
     * @throws DuplicateException  if a file with the same LFN exists
     */
    public void create(TransactionScope scope, FileRecord file) {
        validateForCreate(file);
        Set<String> sites = new LinkedHashSet<>(file.getLocations());
        sites.addAll(file.getPendingLocations());

        long id = scope.atomically(() -> {
            QuerySession session = catalog.bind(scope);
            if (session.queryForOptional(QueryOperation.GET_FILE_ID_BY_LFN, ID_MAPPER, file.getLfn()).isPresent()) {
                throw new DuplicateException("File already exists: " + file.getLfn());
            }
            long algoId = algorithmId(scope, session, file.getAlgorithm());
            long datasetId = datasetId(session, file.getDatasetPath());
            session.update(QueryOperation.NEW_FILE, file.getLfn(), file.getSize(), file.getEvents(),
                    datasetId, algoId, FileStatus.NOTUPLOADED.name());
            long fileId = session.queryForOptional(QueryOperation.GET_FILE_ID_BY_LFN, ID_MAPPER, file.getLfn())
                    .orElseThrow(() -> new IllegalStateException("Inserted file not visible: " + file.getLfn()));

            List<Object[]> checksumArgs = new ArrayList<>();
            file.getChecksums().forEach((type, value) -> checksumArgs.add(new Object[]{fileId, type, value}));
            session.batchUpdate(QueryOperation.ADD_CHECKSUM, checksumArgs);
            session.batchUpdate(QueryOperation.ADD_RUN_LUMI, runLumiArgs(fileId, file.getRuns()));
            locationManager.persistLocations(scope, fileId, sites);
            return fileId;
        });

        file.assignId(id);
        file.setStatus(FileStatus.NOTUPLOADED);
        file.drainPendingLocations();
        log.info("[LEDGER] Created file id={} lfn={} dataset={}", id, file.getLfn(), file.getDatasetPath());
    }

    /**
     * Removes the file with its checksums, runs, locations and every lineage edge that names it.
     *
     * @throws NotFoundException if the file does not exist
     */
    public void delete(TransactionScope scope, FileRecord file) {
        scope.atomically(() -> {
            QuerySession session = catalog.bind(scope);
            FileKey key = resolveKey(session, file)
                    .orElseThrow(() -> new NotFoundException("No such file: " + describe(file)));
            session.update(QueryOperation.DELETE_CHECKSUMS, key.id());
            session.update(QueryOperation.DELETE_RUN_LUMIS, key.id());
            session.update(QueryOperation.DELETE_FILE_LOCATIONS, key.id());
            session.update(QueryOperation.DELETE_PARENTAGE, key.lfn(), key.lfn());
            session.update(QueryOperation.DELETE_FILE, key.id());
        });
        log.info("[LEDGER] Deleted file {}", describe(file));
    }

    /** The id of the file if it exists as seen by {@code scope}; empty otherwise. */
    public OptionalLong exists(TransactionScope scope, FileRecord file) {
        return resolveKey(catalog.bind(scope), file)
                .map(key -> OptionalLong.of(key.id()))
                .orElse(OptionalLong.empty());
    }

    public void load(TransactionScope scope, FileRecord file) {
        load(scope, file, false);
    }

    /**
     * Refreshes the record from the store, by id when known and by LFN otherwise. With
     * {@code parentage} the parent LFNs are re-read and the parents that exist are loaded one
     * level deep; without it, cached lineage is dropped and resolved again on demand.
     *
     * @throws NotFoundException if the file does not exist
     */
    public void load(TransactionScope scope, FileRecord file, boolean parentage) {
        QuerySession session = catalog.bind(scope);
        Optional<FileRow> row = file.getId() != null
                ? session.queryForOptional(QueryOperation.LOAD_FILE_BY_ID, FILE_ROW_MAPPER, file.getId())
                : session.queryForOptional(QueryOperation.LOAD_FILE_BY_LFN, FILE_ROW_MAPPER, file.getLfn());
        FileRow loaded = row.orElseThrow(() -> new NotFoundException("No such file: " + describe(file)));

        Map<String, String> checksums = new TreeMap<>();
        session.query(QueryOperation.LOAD_CHECKSUMS, (rs, i) -> checksums.put(rs.getString("cktype"), rs.getString("cksum")),
                loaded.id());
        List<Run> runs = loadRuns(session, loaded.id());
        Set<String> locations = locationManager.loadLocations(scope, loaded.id());

        List<FileRecord> parents = new ArrayList<>();
        Set<String> parentLfns = null;
        if (parentage) {
            parentLfns = lineageManager.getParentLfns(scope, loaded.lfn());
            for (String parentLfn : parentLfns) {
                FileRecord parent = FileRecord.ofLfn(parentLfn);
                if (exists(scope, parent).isPresent()) {
                    load(scope, parent, false);
                    parents.add(parent);
                }
            }
        }

        file.applyRow(loaded);
        file.replaceChecksums(checksums);
        file.replaceRuns(runs);
        file.replaceLocations(locations);
        file.replaceParents(parents);
        if (parentLfns != null) {
            file.setParentLfns(parentLfns);
        } else {
            file.forgetParentLfns();
        }
    }

    /**
     * Merges {@code runs} into the record and, when the file is created, writes the new
     * run/lumi pairs. Pairs already stored are kept as they are.
     */
    public void addRunSet(TransactionScope scope, FileRecord file, Collection<Run> runs) {
        if (file.isCreated()) {
            long fileId = file.getId();
            scope.atomically(() -> {
                catalog.bind(scope).batchUpdate(QueryOperation.ADD_RUN_LUMI, runLumiArgs(fileId, runs));
            });
        }
        file.addRunSet(runs);
    }

    public long countFiles(TransactionScope scope) {
        return catalog.bind(scope).count(QueryOperation.COUNT_FILES);
    }

    private static void validateForCreate(FileRecord file) {
        if (file.getLfn() == null || file.getLfn().isBlank()) {
            throw new ValidationException("Cannot create a file without an LFN");
        }
        if (file.getAlgorithm() == null) {
            throw new ValidationException("Cannot create " + file.getLfn() + " without an algorithm");
        }
        if (file.getDatasetPath() == null) {
            throw new ValidationException("Cannot create " + file.getLfn() + " without a dataset path");
        }
    }

    /**
     * Looks the algorithm up and inserts it when absent. A concurrent writer may insert the
     * same tuple first; the insert then runs under its own savepoint and the row is re-read.
     */
    private static long algorithmId(TransactionScope scope, QuerySession session, Algorithm algo) {
        Object[] key = {algo.getAppName(), algo.getAppVer(), algo.getAppFam(), algo.getPsetHash()};
        Optional<Long> existing = session.queryForOptional(QueryOperation.GET_ALGO_ID, ID_MAPPER, key);
        if (existing.isPresent()) {
            return existing.get();
        }
        try {
            scope.atomically(() -> {
                session.update(QueryOperation.INSERT_ALGO, algo.getAppName(), algo.getAppVer(), algo.getAppFam(),
                        algo.getPsetHash(), algo.getConfigContent());
            });
        } catch (DuplicateException e) {
            log.debug("[LEDGER] Algorithm {} inserted concurrently; re-reading", algo);
        }
        return session.queryForOptional(QueryOperation.GET_ALGO_ID, ID_MAPPER, key)
                .orElseThrow(() -> new IllegalStateException("Algorithm row not visible after insert: " + algo));
    }

    private static long datasetId(QuerySession session, String datasetPath) {
        session.update(QueryOperation.INSERT_DATASET, datasetPath);
        return session.queryForOptional(QueryOperation.GET_DATASET_ID, ID_MAPPER, datasetPath)
                .orElseThrow(() -> new IllegalStateException("Dataset row not visible after insert: " + datasetPath));
    }

    private static List<Object[]> runLumiArgs(long fileId, Collection<Run> runs) {
        List<Object[]> args = new ArrayList<>();
        for (Run run : runs) {
            for (Integer lumi : run.getLumis()) {
                args.add(new Object[]{fileId, run.getRunNumber(), lumi});
            }
        }
        return args;
    }

    private static List<Run> loadRuns(QuerySession session, long fileId) {
        Map<Integer, List<Integer>> lumisByRun = new LinkedHashMap<>();
        session.query(QueryOperation.LOAD_RUN_LUMIS,
                (rs, i) -> lumisByRun.computeIfAbsent(rs.getInt("run_number"), r -> new ArrayList<>()).add(rs.getInt("lumi")),
                fileId);
        List<Run> runs = new ArrayList<>(lumisByRun.size());
        lumisByRun.forEach((run, lumis) -> runs.add(new Run(run, lumis)));
        return runs;
    }

    private static Optional<FileKey> resolveKey(QuerySession session, FileRecord file) {
        if (file.getLfn() != null) {
            return session.queryForOptional(QueryOperation.GET_FILE_ID_BY_LFN, ID_MAPPER, file.getLfn())
                    .map(id -> new FileKey(id, file.getLfn()));
        }
        return session.queryForOptional(QueryOperation.GET_FILE_LFN_BY_ID, (rs, i) -> rs.getString("lfn"), file.getId())
                .map(lfn -> new FileKey(file.getId(), lfn));
    }

    private static String describe(FileRecord file) {
        return file.getLfn() != null ? file.getLfn() : "id=" + file.getId();
    }

    private record FileKey(long id, String lfn) {
    }
}
