package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.query.SqlDialect;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;

import javax.sql.DataSource;
import java.util.concurrent.Executor;

/**
 * SQLite 分析后端
 */
public class SqliteAnalyticsDataSource extends JdbcAnalyticsDataSource {

    public SqliteAnalyticsDataSource(DataSource dataSource, Executor executor,
                                     MeterRegistry registry, ObjectMapper objectMapper) {
        super(dataSource, executor, registry, objectMapper);
    }

    @Override
    public String getEngineName() {
        return "sqlite";
    }

    @Override
    public SqlDialect dialect() {
        return SqliteDialect.INSTANCE;
    }
}
