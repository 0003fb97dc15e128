package com.di.ledger.block;

import com.di.ledger.exception.NotFoundException;
import com.di.ledger.exception.ValidationException;
import com.di.ledger.file.FileRecord;
import com.di.ledger.sql.QueryCatalog;
import com.di.ledger.sql.QueryOperation;
import com.di.ledger.sql.QuerySession;
import com.di.ledger.transaction.TransactionScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Groups files into named upload blocks. A block row is created the first time its name is
 * used, either by {@link #setBlock} or by {@link #setBlockStatus}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BlockManager {

    private final QueryCatalog catalog;

    /**
     * Assigns the file to {@code blockName}, creating the block if needed. A file already in
     * another block is moved.
     *
     * @throws NotFoundException if no file has that LFN; the block is not created either
     */
    public void setBlock(TransactionScope scope, String lfn, String blockName) {
        requireText(lfn, "LFN");
        requireText(blockName, "block name");
        scope.atomically(() -> {
            QuerySession session = catalog.bind(scope);
            session.update(QueryOperation.INSERT_BLOCK, blockName);
            int updated = session.update(QueryOperation.SET_BLOCK, blockName, lfn);
            if (updated == 0) {
                throw new NotFoundException("Cannot assign block " + blockName + ": no file " + lfn);
            }
        });
        log.debug("[BLOCK] {} -> {}", lfn, blockName);
    }

    public void setBlock(TransactionScope scope, FileRecord file, String blockName) {
        setBlock(scope, file.getLfn(), blockName);
        file.setBlockName(blockName);
    }

    public Optional<String> getBlock(TransactionScope scope, String lfn) {
        return catalog.bind(scope).queryForOptional(QueryOperation.GET_BLOCK, (rs, i) -> rs.getString("blockname"), lfn);
    }

    public void setBlockStatus(TransactionScope scope, String blockName, Collection<String> locations) {
        setBlockStatus(scope, blockName, locations, BlockStatus.OPEN);
    }

    /**
     * Creates the block if needed, sets its status and adds {@code locations} to it. Repeating
     * the call with the same arguments changes nothing.
     */
    public void setBlockStatus(TransactionScope scope, String blockName, Collection<String> locations,
                               BlockStatus status) {
        requireText(blockName, "block name");
        if (status == null) {
            throw new ValidationException("block status cannot be null");
        }
        List<Object[]> siteArgs = new ArrayList<>();
        List<Object[]> linkArgs = new ArrayList<>();
        for (String site : locations) {
            requireText(site, "site identifier");
            siteArgs.add(new Object[]{site});
            linkArgs.add(new Object[]{blockName, site});
        }
        scope.atomically(() -> {
            QuerySession session = catalog.bind(scope);
            session.update(QueryOperation.INSERT_BLOCK, blockName);
            session.update(QueryOperation.SET_BLOCK_STATUS, status.name(), blockName);
            session.batchUpdate(QueryOperation.ADD_LOCATION, siteArgs);
            session.batchUpdate(QueryOperation.ADD_BLOCK_LOCATION, linkArgs);
        });
        log.info("[BLOCK] {} status={} locations={}", blockName, status, locations);
    }

    public Optional<Block> findBlock(TransactionScope scope, String blockName) {
        QuerySession session = catalog.bind(scope);
        return session.queryForOptional(QueryOperation.LOAD_BLOCK, (rs, i) -> {
            Timestamp created = rs.getTimestamp("create_time");
            return Block.builder()
                    .name(rs.getString("blockname"))
                    .status(BlockStatus.valueOf(rs.getString("status")))
                    .createTime(created != null ? created.toInstant() : null);
        }, blockName).map(builder -> builder
                .locations(session.query(QueryOperation.LOAD_BLOCK_LOCATIONS, (rs, i) -> rs.getString("se_name"), blockName))
                .fileCount(session.count(QueryOperation.COUNT_BLOCK_FILES, blockName))
                .build());
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(what + " cannot be blank");
        }
    }
}
