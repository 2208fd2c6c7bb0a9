package org.iceforge.quarry.query;

import org.iceforge.quarry.worker.WorkerPoolProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class QueryConfig {
    private static final Logger logger = LoggerFactory.getLogger(QueryConfig.class);

    /**
     * Threads that block on worker answers for {@link QueryService#executeQueryAsync}. Sized to
     * the worker pool: more callers than workers would only queue inside the pool.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(WorkerPoolProperties props) {
        int threads = Math.max(1, props.getPoolSize());
        logger.info("Query executor: {} threads", threads);
        return Executors.newFixedThreadPool(threads, queryThreadFactory());
    }

    /** Daemon threads named {@code quarry-query-N}. */
    static ThreadFactory queryThreadFactory() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "quarry-query-" + seq.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, e) -> logger.error("Uncaught error on {}", th.getName(), e));
            return t;
        };
    }
}
