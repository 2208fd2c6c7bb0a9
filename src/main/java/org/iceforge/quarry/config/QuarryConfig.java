package org.iceforge.quarry.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.iceforge.quarry.cache.InMemoryResultCache;
import org.iceforge.quarry.cache.PersistentResultCache;
import org.iceforge.quarry.cache.ResultCacheProperties;
import org.iceforge.quarry.cache.TieredResultCache;
import org.iceforge.quarry.dataset.DatasetFetcher;
import org.iceforge.quarry.dataset.DatasetService;
import org.iceforge.quarry.filecache.FileCache;
import org.iceforge.quarry.filecache.FileCacheProperties;
import org.iceforge.quarry.query.QueryService;
import org.iceforge.quarry.quota.QuotaProperties;
import org.iceforge.quarry.quota.QuotaService;
import org.iceforge.quarry.quota.UsageLedger;
import org.iceforge.quarry.worker.ProcessWorkerPool;
import org.iceforge.quarry.worker.WorkerPool;
import org.iceforge.quarry.worker.WorkerPoolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.concurrent.ExecutorService;

@Configuration
public class QuarryConfig {
    private static final Logger logger = LoggerFactory.getLogger(QuarryConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public HikariDataSource quarryDataSource(StoreProperties props) {
        HikariConfig cfg = new HikariConfig();
        cfg.setPoolName("quarry-store");
        cfg.setJdbcUrl(props.getJdbcUrl());
        cfg.setUsername(props.getUsername());
        cfg.setPassword(props.getPassword());
        cfg.setMaximumPoolSize(props.getMaxPoolSize() <= 0 ? 5 : props.getMaxPoolSize());
        return new HikariDataSource(cfg);
    }

    @Bean
    public FileCache fileCache(FileCacheProperties props, Clock clock) {
        FileCache cache = new FileCache(props, clock);
        int removed = cache.startupCleanup();
        logger.info("File cache at {} ({} stale files removed, limit {})", cache.root(), removed, props.getMaxCacheSize());
        return cache;
    }

    @Bean
    public DatasetFetcher datasetFetcher(WebClient.Builder webClientBuilder, FileCacheProperties props) {
        return new DatasetFetcher(webClientBuilder, props.getHeadTimeout(), props.getDownloadTimeout());
    }

    @Bean
    public DatasetService datasetService(DatasetFetcher fetcher, FileCache fileCache, FileCacheProperties props) {
        return new DatasetService(fetcher, fileCache, props.maxFileBytes());
    }

    @Bean(destroyMethod = "shutdown")
    public ProcessWorkerPool workerPool(WorkerPoolProperties props, ObjectMapper mapper) {
        return ProcessWorkerPool.start(props, mapper);
    }

    @Bean
    public InMemoryResultCache inMemoryResultCache(ResultCacheProperties props, Clock clock) {
        return new InMemoryResultCache(props.getMaxSize(), props.getTtl(), clock);
    }

    @Bean
    public PersistentResultCache persistentResultCache(DataSource dataSource, ObjectMapper mapper,
                                                       ResultCacheProperties props, Clock clock) {
        PersistentResultCache cache = new PersistentResultCache(dataSource, mapper,
                props.getPersistentTtl(), props.getPersistentMaxEntries(), clock);
        cache.initializeSchema();
        return cache;
    }

    @Bean
    public TieredResultCache tieredResultCache(InMemoryResultCache memory, PersistentResultCache persistent) {
        return new TieredResultCache(memory, persistent);
    }

    @Bean
    public UsageLedger usageLedger(DataSource dataSource) {
        UsageLedger ledger = new UsageLedger(dataSource);
        ledger.initializeSchema();
        return ledger;
    }

    @Bean
    public QuotaService quotaService(UsageLedger ledger, QuotaProperties props, Clock clock) {
        return new QuotaService(ledger, props, clock);
    }

    @Bean
    public QueryService queryService(WorkerPool workerPool,
                                     DatasetService datasetService,
                                     FileCache fileCache,
                                     TieredResultCache resultCache,
                                     QuotaService quotaService,
                                     ObjectMapper mapper,
                                     ExecutorService queryExecutor,
                                     WorkerPoolProperties workerProps) {
        return new QueryService(workerPool, datasetService, fileCache, resultCache, quotaService,
                mapper, queryExecutor, workerProps.getTaskTimeout());
    }
}
