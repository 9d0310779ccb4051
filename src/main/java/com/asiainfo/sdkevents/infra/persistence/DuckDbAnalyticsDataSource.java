package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.query.SqlDialect;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;

import javax.sql.DataSource;
import java.util.concurrent.Executor;

/**
 * DuckDB 分析后端（列式，适合大范围扫描）
 */
public class DuckDbAnalyticsDataSource extends JdbcAnalyticsDataSource {

    public DuckDbAnalyticsDataSource(DataSource dataSource, Executor executor,
                                     MeterRegistry registry, ObjectMapper objectMapper) {
        super(dataSource, executor, registry, objectMapper);
    }

    @Override
    public String getEngineName() {
        return "duckdb";
    }

    @Override
    public SqlDialect dialect() {
        return DuckDbDialect.INSTANCE;
    }
}
