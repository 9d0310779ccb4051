package com.asiainfo.sdkevents.infra.persistence;

import com.asiainfo.sdkevents.core.datasource.AnalyticsDataSource;
import com.asiainfo.sdkevents.core.datasource.SdkEventFilterAnalytics;
import com.asiainfo.sdkevents.core.datasource.SdkEventMetricAnalytics;
import com.asiainfo.sdkevents.core.exception.QueryExecutionException;
import com.asiainfo.sdkevents.core.model.SdkEventFilterRow;
import com.asiainfo.sdkevents.core.model.SdkEventMetricRow;
import com.asiainfo.sdkevents.core.model.SqlRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 基于 JDBC 的分析后端
 * 查询在独立线程池上执行，连接池由容器管理，这里只借用连接
 */
public abstract class JdbcAnalyticsDataSource
        implements AnalyticsDataSource, SdkEventMetricAnalytics, SdkEventFilterAnalytics {

    private static final Logger log = LoggerFactory.getLogger(JdbcAnalyticsDataSource.class);

    private final DataSource dataSource;
    private final Executor executor;
    private final Timer queryTimer;
    private final JacksonRowLoader<SdkEventMetricRow> metricRowLoader;
    private final JacksonRowLoader<SdkEventFilterRow> filterRowLoader;

    protected JdbcAnalyticsDataSource(DataSource dataSource, Executor executor,
                                      MeterRegistry registry, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.executor = executor;
        this.queryTimer = Timer.builder("sdk_events.query.time")
                .description("Analytics backend query execution time")
                .tag("engine", getEngineName())
                .register(registry);
        this.metricRowLoader = new JacksonRowLoader<>(objectMapper, SdkEventMetricRow.class);
        this.filterRowLoader = new JacksonRowLoader<>(objectMapper, SdkEventFilterRow.class);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> execute(SqlRequest request) {
        return CompletableFuture.supplyAsync(() -> executeBlocking(request), executor);
    }

    @Override
    public SdkEventMetricRow loadMetricRow(Map<String, Object> row) {
        return metricRowLoader.load(row);
    }

    @Override
    public SdkEventFilterRow loadFilterRow(Map<String, Object> row) {
        return filterRowLoader.load(row);
    }

    List<Map<String, Object>> executeBlocking(SqlRequest request) {
        try {
            return queryTimer.recordCallable(() -> {
                long start = System.currentTimeMillis();
                try (Connection conn = dataSource.getConnection();
                     PreparedStatement stmt = conn.prepareStatement(request.sql())) {
                    List<Object> params = request.params();
                    for (int i = 0; i < params.size(); i++) {
                        stmt.setObject(i + 1, params.get(i));
                    }
                    try (ResultSet rs = stmt.executeQuery()) {
                        List<Map<String, Object>> rows = resultSetToList(rs);
                        log.debug("[{}] Executed in {} ms, rows: {}",
                                getEngineName(), System.currentTimeMillis() - start, rows.size());
                        return rows;
                    }
                }
            });
        } catch (SQLException e) {
            log.error("[{}] Query failed: {}", getEngineName(), request.sql(), e);
            throw new QueryExecutionException(getEngineName() + " query failed: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("[{}] Execution failed", getEngineName(), e);
            throw new QueryExecutionException(getEngineName() + " execution failed", e);
        }
    }

    private List<Map<String, Object>> resultSetToList(ResultSet rs) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columns = md.getColumnCount();
        List<Map<String, Object>> list = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columns; ++i) {
                row.put(md.getColumnLabel(i), rs.getObject(i));
            }
            list.add(row);
        }
        return list;
    }
}
