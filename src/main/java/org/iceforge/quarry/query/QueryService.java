package org.iceforge.quarry.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.quarry.ErrorType;
import org.iceforge.quarry.QuarryException;
import org.iceforge.quarry.cache.CacheKey;
import org.iceforge.quarry.cache.CacheStats;
import org.iceforge.quarry.cache.PersistentCacheStats;
import org.iceforge.quarry.cache.QueryOutcome;
import org.iceforge.quarry.cache.QueryResult;
import org.iceforge.quarry.cache.TieredResultCache;
import org.iceforge.quarry.dataset.DatasetFormat;
import org.iceforge.quarry.dataset.DatasetService;
import org.iceforge.quarry.dataset.ValidationResult;
import org.iceforge.quarry.filecache.CachedFile;
import org.iceforge.quarry.filecache.FileCache;
import org.iceforge.quarry.filecache.FileCacheStats;
import org.iceforge.quarry.quota.QuotaService;
import org.iceforge.quarry.quota.QuotaStatus;
import org.iceforge.quarry.quota.TokenEstimator;
import org.iceforge.quarry.worker.WorkerFunction;
import org.iceforge.quarry.worker.WorkerPool;
import org.iceforge.quarry.worker.WorkerResult;
import org.iceforge.quarry.worker.functions.ExecuteQueryFunction;
import org.iceforge.quarry.worker.functions.ExtractSchemaFunction;
import org.iceforge.quarry.worker.functions.ProfileColumnsFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for query execution.
 * <p>
 * A query passes, in order: the user's quota, the result cache, dataset materialization (the
 * file leases are held until the worker answers), a worker process, the cache write, and finally
 * the usage charge. Only successful results are cached; a failed step throws a
 * {@link QuarryException} subclass naming what went wrong.
 */
public class QueryService {
    private static final Logger logger = LoggerFactory.getLogger(QueryService.class);

    private final WorkerPool workerPool;
    private final DatasetService datasets;
    private final FileCache fileCache;
    private final TieredResultCache resultCache;
    private final QuotaService quota;
    private final ObjectMapper mapper;
    private final ExecutorService queryExecutor;
    private final Duration defaultTimeout;

    public QueryService(WorkerPool workerPool,
                        DatasetService datasets,
                        FileCache fileCache,
                        TieredResultCache resultCache,
                        QuotaService quota,
                        ObjectMapper mapper,
                        ExecutorService queryExecutor,
                        Duration defaultTimeout) {
        this.workerPool = Objects.requireNonNull(workerPool);
        this.datasets = Objects.requireNonNull(datasets);
        this.fileCache = Objects.requireNonNull(fileCache);
        this.resultCache = Objects.requireNonNull(resultCache);
        this.quota = Objects.requireNonNull(quota);
        this.mapper = Objects.requireNonNull(mapper);
        this.queryExecutor = Objects.requireNonNull(queryExecutor);
        this.defaultTimeout = Objects.requireNonNull(defaultTimeout);
    }

    /**
     * Runs {@code req} and returns at most 1000 rows of its result.
     *
     * @throws org.iceforge.quarry.quota.QuotaExceededException the user has no tokens left
     * @throws DatasetUnavailableException                      a dataset could not be fetched or validated
     * @throws QueryTimeoutException                            the worker did not answer in time
     * @throws QueryExecutionException                          the statement failed
     */
    public QueryResult executeQuery(QueryModels.QueryRequest req) {
        Objects.requireNonNull(req, "req");
        if (req.sql() == null || req.sql().isBlank()) {
            throw new QueryExecutionException(ErrorType.VALIDATION, "Query is empty", null);
        }
        if (req.userId() != null) {
            quota.requireAllowed(req.userId());
        }

        List<String> urls = req.datasetUrls();
        CacheKey key = CacheKey.of(req.sql(), urls);
        Optional<QueryResult> hit = resultCache.get(key);
        if (hit.isPresent()) {
            logger.debug("Query {} served from cache", key);
            chargeUsage(req, hit.get());
            return hit.get();
        }

        Duration timeout = req.timeout() == null ? defaultTimeout : req.timeout();
        WorkerResult r;
        List<CachedFile> leases = materializeAll(req.datasets());
        try {
            ObjectNode args = mapper.createObjectNode().put("sql", req.sql());
            ArrayNode specs = args.putArray("datasets");
            for (int i = 0; i < leases.size(); i++) {
                QueryModels.DatasetRef ref = req.datasets().get(i);
                specs.addObject()
                        .put("tableName", ref.effectiveTableName())
                        .put("path", leases.get(i).path().toString())
                        .put("format", DatasetFormat.fromUrl(ref.url()).name());
            }
            r = workerPool.submit(ExecuteQueryFunction.class, args, timeout);
        } finally {
            leases.forEach(CachedFile::close);
        }

        if (!r.success()) {
            resultCache.put(key, req.sql(), urls, QueryOutcome.failure(r.errorType(), r.message()));
            throw toException(r, timeout);
        }
        QueryResult result = readResult(r.value());
        resultCache.put(key, req.sql(), urls, QueryOutcome.success(result));
        logger.debug("Query {} returned {} of {} rows in {} ms", key, result.rowCount(), result.totalRows(), result.executionTimeMs());
        chargeUsage(req, result);
        return result;
    }

    /** {@link #executeQuery} on the query executor, off the caller's thread. */
    public CompletableFuture<QueryResult> executeQueryAsync(QueryModels.QueryRequest req) {
        return CompletableFuture.supplyAsync(() -> executeQuery(req), queryExecutor);
    }

    public ValidationResult prefetchDataset(String url) {
        return datasets.prefetch(url);
    }

    public QueryModels.DatasetSchema datasetSchema(String url) {
        JsonNode out = runOnDataset(url, ExtractSchemaFunction.class);
        List<QueryModels.ColumnSchema> columns = new ArrayList<>();
        for (JsonNode c : out.path("columns")) {
            columns.add(new QueryModels.ColumnSchema(c.path("name").asText(), c.path("type").asText()));
        }
        return new QueryModels.DatasetSchema(url, columns, out.path("rowCount").asLong());
    }

    public QueryModels.DatasetProfile profileColumns(String url) {
        JsonNode out = runOnDataset(url, ProfileColumnsFunction.class);
        List<QueryModels.ColumnProfile> profiles = new ArrayList<>();
        for (JsonNode p : out.path("profiles")) {
            profiles.add(mapper.convertValue(p, QueryModels.ColumnProfile.class));
        }
        return new QueryModels.DatasetProfile(url, out.path("sampledRows").asLong(), profiles);
    }

    public CacheStats cacheStats() {
        return resultCache.memory().stats();
    }

    public PersistentCacheStats persistentCacheStats() {
        return resultCache.persistent().stats();
    }

    public FileCacheStats fileCacheStats() {
        return fileCache.stats();
    }

    public QuotaStatus quotaStatus(String userId) {
        return quota.checkLimit(userId);
    }

    private JsonNode runOnDataset(String url, Class<? extends WorkerFunction> function) {
        WorkerResult r;
        try (CachedFile file = materializeAll(List.of(QueryModels.DatasetRef.of(url))).get(0)) {
            ObjectNode args = mapper.createObjectNode()
                    .put("path", file.path().toString())
                    .put("format", DatasetFormat.fromUrl(url).name());
            r = workerPool.submit(function, args, defaultTimeout);
        }
        if (!r.success()) {
            throw toException(r, defaultTimeout);
        }
        return r.value();
    }

    /**
     * Leases every dataset, or none: on any failure the leases already taken are released and
     * all failures are reported together.
     */
    private List<CachedFile> materializeAll(List<QueryModels.DatasetRef> refs) {
        List<CachedFile> leases = new ArrayList<>(refs.size());
        List<QueryModels.DatasetFailure> failures = new ArrayList<>();
        for (QueryModels.DatasetRef ref : refs) {
            try {
                leases.add(datasets.materialize(ref.url()));
            } catch (QuarryException e) {
                logger.info("Dataset {} unavailable: {}", ref.url(), e.getMessage());
                failures.add(new QueryModels.DatasetFailure(ref.url(), e.errorType(), e.getMessage()));
            }
        }
        if (!failures.isEmpty()) {
            leases.forEach(CachedFile::close);
            throw new DatasetUnavailableException(failures);
        }
        return leases;
    }

    private QuarryException toException(WorkerResult r, Duration timeout) {
        return switch (r.errorType()) {
            case TIMEOUT -> new QueryTimeoutException("Query exceeded the " + timeout.toSeconds()
                    + "s time limit. Try adding a LIMIT clause, filtering with WHERE, or selecting fewer columns.");
            case SQL -> {
                String raw = r.details() != null ? r.details() : r.message();
                String translated = ErrorTranslator.translate(raw, availableColumns(r.context()));
                yield new QueryExecutionException(ErrorType.SQL, Objects.equals(translated, raw) ? r.message() : translated, raw);
            }
            default -> new QueryExecutionException(r.errorType(), r.message(), r.details());
        };
    }

    private static List<String> availableColumns(JsonNode context) {
        if (context == null || !context.path("availableColumns").isArray()) {
            return null;
        }
        List<String> cols = new ArrayList<>();
        context.get("availableColumns").forEach(c -> cols.add(c.asText()));
        return cols;
    }

    private QueryResult readResult(JsonNode value) {
        try {
            return mapper.treeToValue(value, QueryResult.class);
        } catch (JsonProcessingException e) {
            throw new QueryExecutionException(ErrorType.INTERNAL, "Unreadable query result", e.getOriginalMessage());
        }
    }

    /** Charges the SQL as input and the serialized result as output, the text a caller hands on. */
    private void chargeUsage(QueryModels.QueryRequest req, QueryResult result) {
        if (req.userId() == null) {
            return;
        }
        long input = TokenEstimator.estimate(req.sql());
        long output = TokenEstimator.estimate(mapper.valueToTree(result).toString());
        try {
            quota.recordUsage(req.userId(), input, output);
        } catch (QuarryException e) {
            logger.warn("Could not record {} tokens for {}: {}", input + output, req.userId(), e.getMessage(), e);
        }
    }
}
