package com.di.ledger.sql;

import com.di.ledger.transaction.TransactionScope;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Registry of the ledger's named queries for one {@link QueryDialect}.
 *
 * <p>Built once per process: {@code sql/ledger-queries.yml} holds the portable statements and
 * {@code sql/ledger-queries-<dialect>.yml} overrides the ones that differ per backend
 * (idempotent inserts). Loading fails fast if any {@link QueryOperation} is left without SQL
 * or if a file names an unknown operation.
 *
 * <p>No SQL is hardcoded in the repository classes; they resolve statements here and run
 * them through a {@link QuerySession} bound to the caller's {@link TransactionScope}.
 */
@Slf4j
public final class QueryCatalog {

    static final String COMMON_RESOURCE = "sql/ledger-queries.yml";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final QueryDialect dialect;
    private final Map<QueryOperation, String> statements;

    private QueryCatalog(QueryDialect dialect, Map<QueryOperation, String> statements) {
        this.dialect = dialect;
        this.statements = Collections.unmodifiableMap(new EnumMap<>(statements));
    }

    public static QueryCatalog load(QueryDialect dialect) {
        if (dialect == null) {
            throw new IllegalArgumentException("dialect cannot be null");
        }
        Map<String, String> merged = new LinkedHashMap<>(readQueries(COMMON_RESOURCE));
        Map<String, String> overrides = readQueries(dialect.queryResource());
        merged.putAll(overrides);
        QueryCatalog catalog = of(dialect, merged);
        log.info("[LEDGER] Query catalog ready: dialect={}, {} operation(s), {} dialect override(s)",
                dialect.getKey(), catalog.statements.size(), overrides.size());
        return catalog;
    }

    /**
     * Builds a catalog from already-resolved statements keyed by operation name.
     *
     * @throws IllegalStateException if a name is unknown or an operation has no statement
     */
    public static QueryCatalog of(QueryDialect dialect, Map<String, String> statementsByName) {
        Map<QueryOperation, String> resolved = new EnumMap<>(QueryOperation.class);
        for (Map.Entry<String, String> e : statementsByName.entrySet()) {
            QueryOperation op = QueryOperation.byName(e.getKey())
                    .orElseThrow(() -> new IllegalStateException(
                            String.format("Unknown query operation '%s' in %s catalog", e.getKey(), dialect.getKey())));
            String sql = e.getValue();
            if (sql == null || sql.isBlank()) {
                throw new IllegalStateException(String.format("Query '%s' is blank for dialect %s",
                        e.getKey(), dialect.getKey()));
            }
            resolved.put(op, sql.trim());
        }
        List<String> missing = Stream.of(QueryOperation.values())
                .filter(op -> !resolved.containsKey(op))
                .map(QueryOperation::getOperationName)
                .collect(Collectors.toList());
        if (!missing.isEmpty()) {
            throw new IllegalStateException(String.format("No SQL for operation(s) %s in %s catalog",
                    missing, dialect.getKey()));
        }
        return new QueryCatalog(dialect, resolved);
    }

    public QueryDialect getDialect() {
        return dialect;
    }

    public String sql(QueryOperation operation) {
        return statements.get(operation);
    }

    /** Resolves an operation by its catalog name, e.g. {@code "AddLocation"}. */
    public Optional<QueryOperation> resolve(String operationName) {
        return QueryOperation.byName(operationName).filter(statements::containsKey);
    }

    /** Binds the catalog to the scope's connection for the duration of one call. */
    public QuerySession bind(TransactionScope scope) {
        if (scope == null) {
            throw new IllegalArgumentException("A transaction scope is required");
        }
        return new QuerySession(this, scope);
    }

    private static Map<String, String> readQueries(String path) {
        Resource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new IllegalStateException("Query catalog resource not found: classpath:" + path);
        }
        try (InputStream in = resource.getInputStream()) {
            QueryFile file = YAML_MAPPER.readValue(in, QueryFile.class);
            if (file == null || file.getQueries() == null) {
                return Map.of();
            }
            return file.getQueries();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read query catalog " + path + ": " + e.getMessage(), e);
        }
    }

    @Data
    public static class QueryFile {
        private Map<String, String> queries = new LinkedHashMap<>();
    }
}
