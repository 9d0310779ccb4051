package com.asiainfo.sdkevents.config;

import com.asiainfo.sdkevents.infra.persistence.DuckDbAnalyticsDataSource;
import com.asiainfo.sdkevents.infra.persistence.JdbcAnalyticsDataSource;
import com.asiainfo.sdkevents.infra.persistence.SqliteAnalyticsDataSource;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.agroal.api.AgroalDataSource;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 分析后端工厂
 * 根据配置选择 SQLite 或 DuckDB 后端，启动时创建一次
 */
@ApplicationScoped
public class AnalyticsDataSourceFactory {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsDataSourceFactory.class);

    @Inject
    SdkEventMetricsConfig metricsConfig;

    @Inject
    QueryExecutorConfig executorConfig;

    @Inject
    MeterRegistry registry;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    @io.quarkus.agroal.DataSource("sqlite")
    AgroalDataSource sqliteDataSource;

    @Inject
    @io.quarkus.agroal.DataSource("duckdb")
    AgroalDataSource duckdbDataSource;

    private JdbcAnalyticsDataSource dataSource;

    @PostConstruct
    void init() {
        if (metricsConfig.isDuckDbEnabled()) {
            log.info("使用DuckDB分析后端");
            dataSource = new DuckDbAnalyticsDataSource(
                    duckdbDataSource, executorConfig.getQueryExecutor(), registry, objectMapper);
        } else {
            log.info("使用SQLite分析后端");
            dataSource = new SqliteAnalyticsDataSource(
                    sqliteDataSource, executorConfig.getQueryExecutor(), registry, objectMapper);
        }
    }

    /**
     * 获取当前配置的分析后端
     */
    public JdbcAnalyticsDataSource getDataSource() {
        return dataSource;
    }

    public String getEngineDescription() {
        return metricsConfig.isDuckDbEnabled() ? "DuckDB引擎 (列式分析)" : "SQLite引擎 (嵌入式)";
    }
}
