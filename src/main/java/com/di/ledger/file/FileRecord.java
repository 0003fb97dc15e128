package com.di.ledger.file;

import com.di.ledger.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One tracked output file.
 *
 * <p>A record is addressed by its numeric id, its LFN, or both; loading through
 * {@link FileRecordRepository} resolves whichever is missing. The instance holds state only:
 * every read and write of the store goes through the repository and managers with an
 * explicit transaction scope.
 *
 * <p>Locations are split in two: {@link #getLocations()} is the persisted (or to-be-created)
 * set and takes part in equality; {@link #getPendingLocations()} holds deferred additions
 * that reach the store only when flushed.
 *
 * <p>Not thread-safe.
 */
@Getter
public class FileRecord {

    private Long id;
    private String lfn;
    private long size;
    private long events;
    private Algorithm algorithm;
    private String datasetPath;
    private FileStatus status = FileStatus.NOTUPLOADED;
    private String blockName;

    @Getter(lombok.AccessLevel.NONE)
    private final SortedMap<String, String> checksums = new TreeMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final SortedMap<Integer, Run> runs = new TreeMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final SortedSet<String> locations = new TreeSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> pendingLocations = new LinkedHashSet<>();
    @Getter(lombok.AccessLevel.NONE)
    private final List<FileRecord> parents = new ArrayList<>();

    /** Parent LFNs as of the last read from the store; null when not read or since invalidated. */
    @Getter(lombok.AccessLevel.NONE)
    private SortedSet<String> parentLfns;

    @Builder
    private FileRecord(Long id, String lfn, long size, long events,
                       @Singular Map<String, String> checksums,
                       @Singular Collection<String> locations) {
        if (id == null && (lfn == null || lfn.isBlank())) {
            throw new ValidationException("A file record needs an id or an LFN");
        }
        if (size < 0) {
            throw new ValidationException("size cannot be negative: " + size);
        }
        if (events < 0) {
            throw new ValidationException("events cannot be negative: " + events);
        }
        this.id = id;
        this.lfn = lfn;
        this.size = size;
        this.events = events;
        if (checksums != null) {
            this.checksums.putAll(checksums);
        }
        if (locations != null) {
            this.locations.addAll(locations);
        }
    }

    public static FileRecord ofLfn(String lfn) {
        return FileRecord.builder().lfn(lfn).build();
    }

    public static FileRecord ofId(long id) {
        return FileRecord.builder().id(id).build();
    }

    // ------------------------------------------------------------------
    // Provenance, set before create
    // ------------------------------------------------------------------

    public void setAlgorithm(String appName, String appVer, String appFam, String psetHash, String configContent) {
        this.algorithm = new Algorithm(appName, appVer, appFam, psetHash, configContent);
    }

    public void setAlgorithm(Algorithm algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm, "algorithm");
    }

    public void setDatasetPath(String datasetPath) {
        if (datasetPath == null || datasetPath.isBlank()) {
            throw new ValidationException("dataset path cannot be blank");
        }
        this.datasetPath = datasetPath;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    /** Merges a run into the file; lumis of an existing entry for the same run are unioned. */
    public void addRun(Run run) {
        runs.merge(run.getRunNumber(), run, Run::merge);
    }

    public void addRunSet(Collection<Run> runSet) {
        runSet.forEach(this::addRun);
    }

    public Set<Run> getRuns() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(runs.values()));
    }

    // ------------------------------------------------------------------
    // Checksums
    // ------------------------------------------------------------------

    public void addChecksum(String type, String value) {
        checksums.put(type, value);
    }

    public Map<String, String> getChecksums() {
        return Collections.unmodifiableMap(checksums);
    }

    // ------------------------------------------------------------------
    // Locations (mutated through LocationManager)
    // ------------------------------------------------------------------

    public Set<String> getLocations() {
        return Collections.unmodifiableSet(locations);
    }

    public Set<String> getPendingLocations() {
        return Collections.unmodifiableSet(pendingLocations);
    }

    public void addLocations(Collection<String> sites) {
        locations.addAll(sites);
    }

    public void bufferLocations(Collection<String> sites) {
        pendingLocations.addAll(sites);
    }

    public void discardPendingLocations(Collection<String> sites) {
        pendingLocations.removeAll(sites);
    }

    /** Moves every pending site into the persisted set and returns what was pending. */
    public Set<String> drainPendingLocations() {
        Set<String> drained = new LinkedHashSet<>(pendingLocations);
        locations.addAll(drained);
        pendingLocations.clear();
        return drained;
    }

    // ------------------------------------------------------------------
    // Lineage (mutated through LineageManager and FileRecordRepository)
    // ------------------------------------------------------------------

    /**
     * Parent LFNs seen by the last {@code load(parentage=true)} or {@code getParentLfns} on this
     * record. Edge writes through the lineage manager clear it, so it never reflects work a
     * rollback may later undo.
     */
    public Optional<Set<String>> getKnownParentLfns() {
        return parentLfns == null ? Optional.empty() : Optional.of(Collections.unmodifiableSet(parentLfns));
    }

    public void setParentLfns(Collection<String> lfns) {
        this.parentLfns = new TreeSet<>(lfns);
    }

    public void forgetParentLfns() {
        this.parentLfns = null;
    }

    /** Parent records materialized by {@code load(scope, file, true)}; one level only. */
    public List<FileRecord> getParents() {
        return Collections.unmodifiableList(parents);
    }

    void replaceParents(Collection<FileRecord> loaded) {
        parents.clear();
        parents.addAll(loaded);
    }

    // ------------------------------------------------------------------
    // State applied by the repository
    // ------------------------------------------------------------------

    void assignId(long id) {
        this.id = id;
    }

    void applyRow(FileRow row) {
        this.id = row.id();
        this.lfn = row.lfn();
        this.size = row.size();
        this.events = row.events();
        this.algorithm = row.algorithm();
        this.datasetPath = row.datasetPath();
        this.status = row.status();
        this.blockName = row.blockName();
    }

    void replaceChecksums(Map<String, String> loaded) {
        checksums.clear();
        checksums.putAll(loaded);
    }

    void replaceRuns(Collection<Run> loaded) {
        runs.clear();
        addRunSet(loaded);
    }

    void replaceLocations(Collection<String> loaded) {
        locations.clear();
        locations.addAll(loaded);
    }

    public void setStatus(FileStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public void setBlockName(String blockName) {
        this.blockName = blockName;
    }

    public boolean isCreated() {
        return id != null;
    }

    /**
     * Equal when id, LFN, descriptors, checksums, algorithm, dataset path, runs and persisted
     * locations all match. Status, block, lineage and pending locations are not compared.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileRecord other)) return false;
        return size == other.size
                && events == other.events
                && Objects.equals(id, other.id)
                && Objects.equals(lfn, other.lfn)
                && checksums.equals(other.checksums)
                && Objects.equals(algorithm, other.algorithm)
                && Objects.equals(datasetPath, other.datasetPath)
                && runs.equals(other.runs)
                && locations.equals(other.locations);
    }

    /**
     * Hashes the LFN only. A record built with {@link #ofId(long)} has no LFN until it is
     * loaded, so its hash changes on load: load records before putting them in hash-based
     * collections.
     */
    @Override
    public int hashCode() {
        return Objects.hash(lfn);
    }

    @Override
    public String toString() {
        return "FileRecord(id=" + id + ", lfn=" + lfn + ", size=" + size + ", events=" + events
                + ", dataset=" + datasetPath + ", status=" + status + ", locations=" + locations + ")";
    }
}
