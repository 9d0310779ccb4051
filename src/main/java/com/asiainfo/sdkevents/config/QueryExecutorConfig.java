package com.asiainfo.sdkevents.config;

import io.quarkus.runtime.ShutdownEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 查询线程池配置
 * 后端查询是阻塞 JDBC 调用，统一放到有界线程池中执行，避免占用 IO 线程
 */
@ApplicationScoped
public class QueryExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutorConfig.class);

    @Inject
    SdkEventMetricsConfig metricsConfig;

    private ExecutorService queryExecutor;

    @PostConstruct
    void init() {
        int threads = Math.max(1, metricsConfig.getExecutorThreads());
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = r -> {
            Thread t = new Thread(r, "sdk-events-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.queryExecutor = Executors.newFixedThreadPool(threads, threadFactory);
        log.info("Query executor initialized with {} threads", threads);
    }

    void onStop(@Observes ShutdownEvent event) {
        queryExecutor.shutdown();
        try {
            if (!queryExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                queryExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            queryExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Query executor stopped");
    }

    /**
     * 获取查询执行器
     */
    public ExecutorService getQueryExecutor() {
        return queryExecutor;
    }
}
