package com.asiainfo.sdkevents.core.query;

import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.model.AnalyticsCollection;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilters;
import com.asiainfo.sdkevents.core.model.SqlRequest;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.asiainfo.sdkevents.infra.persistence.DuckDbDialect;
import com.asiainfo.sdkevents.infra.persistence.SqliteDialect;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryBuilder 单元测试
 */
class QueryBuilderTest {

    private static final TimeRange RANGE = new TimeRange(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"));

    private QueryBuilder<?> paymentAttemptsByPlatform() {
        QueryBuilder<?> builder = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS)
                .addSelectColumn("platform")
                .addSelectColumn(Aggregate.count("count"))
                .addGranularityInMins(Granularity.ONE_DAY, TimeRange.CREATED_AT)
                .addFilterClause("merchant_id", "pk_1")
                .addFilterClause("event_name", "PAYMENT_ATTEMPT");
        SdkEventFilters.of(Map.of(SdkEventDimensions.PLATFORM, List.of("web", "ios"))).setFilterClause(builder);
        RANGE.setFilterClause(builder);
        builder.addGroupByClause("platform");
        return builder;
    }

    @Test
    void testBuildSqlite() {
        SqlRequest request = paymentAttemptsByPlatform().build(SqliteDialect.INSTANCE);

        assertEquals("SELECT platform, COUNT(*) AS count, strftime('%Y-%m-%d', created_at) AS time_bucket"
                + " FROM sdk_events"
                + " WHERE merchant_id = ? AND event_name = ? AND platform IN (?, ?)"
                + " AND created_at >= '2024-01-01 00:00:00' AND created_at < '2024-01-02 00:00:00'"
                + " GROUP BY strftime('%Y-%m-%d', created_at), platform", request.sql());
        assertEquals(List.of("pk_1", "PAYMENT_ATTEMPT", "web", "ios"), request.params());
    }

    @Test
    void testBuildDuckDb() {
        SqlRequest request = paymentAttemptsByPlatform().build(DuckDbDialect.INSTANCE);

        assertTrue(request.sql().contains("strftime(date_trunc('day', created_at), '%Y-%m-%d') AS time_bucket"),
                request.sql());
        assertTrue(request.sql().contains("created_at >= TIMESTAMP '2024-01-01 00:00:00'"), request.sql());
        assertTrue(request.sql().contains("created_at < TIMESTAMP '2024-01-02 00:00:00'"), request.sql());
        assertEquals(List.of("pk_1", "PAYMENT_ATTEMPT", "web", "ios"), request.params());
    }

    @Test
    void testBuildIsDeterministic() {
        // 相同输入多次构建结果一致
        SqlRequest first = paymentAttemptsByPlatform().build(SqliteDialect.INSTANCE);
        SqlRequest second = paymentAttemptsByPlatform().build(SqliteDialect.INSTANCE);
        assertEquals(first, second);
    }

    @Test
    void testDistinctAndNotNull() {
        SqlRequest request = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS)
                .distinct()
                .addSelectColumn("browser_name")
                .addNotNullClause("browser_name")
                .build(SqliteDialect.INSTANCE);

        assertEquals("SELECT DISTINCT browser_name FROM sdk_events WHERE browser_name IS NOT NULL", request.sql());
        assertTrue(request.params().isEmpty());
    }

    @Test
    void testNegatedFilters() {
        SqlRequest request = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS)
                .addSelectColumn(Aggregate.count("count"))
                .addCustomFilterClause("log_type", "ERROR", FilterType.NOT_EQUAL)
                .build(SqliteDialect.INSTANCE);

        assertEquals("SELECT COUNT(*) AS count FROM sdk_events WHERE log_type <> ?", request.sql());
        assertEquals(List.of("ERROR"), request.params());
    }

    @Test
    void testEmptyInListIsBuildError() {
        QueryBuilder<?> builder = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS)
                .addSelectColumn(Aggregate.count("count"))
                .addFilterInClause("platform", List.of());

        assertThrows(QueryBuildException.class, () -> builder.build(SqliteDialect.INSTANCE));
    }

    @Test
    void testNoColumnsIsBuildError() {
        QueryBuilder<?> builder = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS)
                .addFilterClause("merchant_id", "pk_1");

        assertThrows(QueryBuildException.class, () -> builder.build(SqliteDialect.INSTANCE));
    }

    @Test
    void testMissingFilterValueIsBuildError() {
        QueryBuilder<?> builder = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS)
                .addSelectColumn(Aggregate.count("count"))
                .addFilterClause("merchant_id", null);

        assertThrows(QueryBuildException.class, () -> builder.build(DuckDbDialect.INSTANCE));
    }
}
