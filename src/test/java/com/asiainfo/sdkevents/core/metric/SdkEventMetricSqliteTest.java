package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.SdkEventsTestDatabase;
import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.exception.QueryExecutionException;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.MetricBucket;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilters;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.QueryBuilder;
import com.asiainfo.sdkevents.infra.persistence.SqliteAnalyticsDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 指标策略在 SQLite 后端上的端到端测试
 */
class SdkEventMetricSqliteTest {

    private static final String MERCHANT = "pk_dev_001";
    private static final TimeRange JAN_FIRST = new TimeRange(
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-02T00:00:00Z"));

    @TempDir
    Path tempDir;

    private SdkEventsTestDatabase db;
    private SqliteAnalyticsDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        db = SdkEventsTestDatabase.create(tempDir);
        dataSource = db.analyticsDataSource();

        // 支付尝试：web 2 次首次事件，android 1 次
        db.event(MERCHANT, SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 10:00:00")
                .with("first_event", 1).info().api().with("latency", 100).platform("web").insert();
        db.event(MERCHANT, SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 10:07:30")
                .with("first_event", 1).info().api().with("latency", 200).platform("web").insert();
        db.event(MERCHANT, SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 23:59:59")
                .with("first_event", 1).info().api().with("latency", 300).platform("android").insert();
        // 非首次事件
        db.event(MERCHANT, SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 11:00:00")
                .with("first_event", 0).error().api().with("latency", 5000).platform("web").insert();
        // 超出时间范围（右开）
        db.event(MERCHANT, SdkEventNames.PAYMENT_ATTEMPT, "2024-01-02 00:00:00")
                .with("first_event", 1).info().api().with("latency", 900).platform("web").insert();
        // 其他租户
        db.event("pk_other", SdkEventNames.PAYMENT_ATTEMPT, "2024-01-01 12:00:00")
                .with("first_event", 1).info().api().with("latency", 700).platform("ios").insert();
        // 其他事件
        db.event(MERCHANT, SdkEventNames.APP_RENDERED, "2024-01-01 09:00:00").platform("web").insert();
        db.event(MERCHANT, SdkEventNames.APP_RENDERED, "2024-01-01 09:30:00").platform("ios").insert();
        db.event(MERCHANT, SdkEventNames.THREE_DS_METHOD, "2024-01-01 10:01:00")
                .with("value", "Skipped").platform("web").insert();
        db.event(MERCHANT, SdkEventNames.THREE_DS_METHOD, "2024-01-01 10:02:00")
                .with("value", "Invoked").platform("web").insert();
    }

    @Test
    void testPaymentAttemptsByPlatformPerDay() {
        List<MetricBucket> buckets = new PaymentAttempts(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(SdkEventDimensions.PLATFORM), MERCHANT, SdkEventFilters.empty(),
                Granularity.ONE_DAY, JAN_FIRST, dataSource).join();

        assertEquals(2, buckets.size());
        Map<String, MetricBucket> byPlatform = byPlatform(buckets);
        assertEquals(Set.of("web", "android"), byPlatform.keySet());

        MetricBucket web = byPlatform.get("web");
        assertEquals(2L, web.row().count());
        assertNull(web.row().total());
        assertEquals("2024-01-01", web.row().timeBucket());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), web.identifier().timeBucket());
        assertEquals(Map.of(SdkEventDimensions.PLATFORM, "web"), web.identifier().dimensions());

        assertEquals(1L, byPlatform.get("android").row().count());
    }

    @Test
    void testAveragePaymentTimeWithoutDimensions() {
        List<MetricBucket> buckets = new AveragePaymentTime(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(), MERCHANT, SdkEventFilters.empty(), null, JAN_FIRST, dataSource).join();

        assertEquals(1, buckets.size());
        MetricBucket bucket = buckets.get(0);
        // 只统计 INFO + API，平均 (100 + 200 + 300) / 3
        assertEquals(0, new BigDecimal("200").compareTo(bucket.row().total()));
        assertEquals(3L, bucket.row().count());
        assertNull(bucket.row().timeBucket());
        assertNull(bucket.identifier().timeBucket());
        assertTrue(bucket.identifier().dimensions().isEmpty());
    }

    @Test
    void testBasePredicateIsolatesMetrics() {
        List<MetricBucket> rendered = new SdkRenderedCount(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(SdkEventDimensions.PLATFORM), MERCHANT, SdkEventFilters.empty(),
                null, JAN_FIRST, dataSource).join();
        Map<String, MetricBucket> byPlatform = byPlatform(rendered);
        assertEquals(Set.of("web", "ios"), byPlatform.keySet());
        assertEquals(1L, byPlatform.get("web").row().count());

        List<MetricBucket> skipped = new ThreeDsMethodSkippedCount(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(SdkEventDimensions.PLATFORM), MERCHANT, SdkEventFilters.empty(),
                null, JAN_FIRST, dataSource).join();
        assertEquals(1, skipped.size());
        assertEquals(1L, skipped.get(0).row().count());
    }

    @Test
    void testCallerFiltersAreApplied() {
        SdkEventFilters filters = SdkEventFilters.of(Map.of(SdkEventDimensions.PLATFORM, List.of("android")));

        List<MetricBucket> buckets = new PaymentAttempts(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(SdkEventDimensions.PLATFORM), MERCHANT, filters, null, JAN_FIRST, dataSource).join();

        assertEquals(1, buckets.size());
        assertEquals("android", buckets.get(0).identifier().dimension(SdkEventDimensions.PLATFORM));
    }

    @Test
    void testTenantScoping() {
        List<MetricBucket> buckets = new PaymentAttempts(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(SdkEventDimensions.PLATFORM), "pk_other", SdkEventFilters.empty(),
                null, JAN_FIRST, dataSource).join();

        assertEquals(1, buckets.size());
        assertEquals("ios", buckets.get(0).row().platform());
    }

    @Test
    void testFiveMinuteBuckets() {
        List<MetricBucket> buckets = new PaymentAttempts(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(), MERCHANT, SdkEventFilters.of(Map.of(SdkEventDimensions.PLATFORM, List.of("web"))),
                Granularity.FIVE_MIN, JAN_FIRST, dataSource).join();

        Map<LocalDateTime, Long> counts = new HashMap<>();
        buckets.forEach(b -> counts.put(b.identifier().timeBucket(), b.row().count()));
        assertEquals(Map.of(
                LocalDateTime.of(2024, 1, 1, 10, 0), 1L,
                LocalDateTime.of(2024, 1, 1, 10, 5), 1L), counts);
    }

    @Test
    void testUnsupportedDimensionDroppedOrRejected() {
        List<MetricBucket> dropped = new PlatformOnlyMetric(UnsupportedDimensionPolicy.DROP).loadMetrics(
                List.of(SdkEventDimensions.PLATFORM, SdkEventDimensions.BROWSER_NAME), MERCHANT,
                SdkEventFilters.empty(), null, JAN_FIRST, dataSource).join();
        assertEquals(Set.of("web", "ios"), byPlatform(dropped).keySet());
        dropped.forEach(b -> assertNull(b.identifier().dimension(SdkEventDimensions.BROWSER_NAME)));

        CompletionException ex = assertThrows(CompletionException.class,
                () -> new PlatformOnlyMetric(UnsupportedDimensionPolicy.REJECT).loadMetrics(
                        List.of(SdkEventDimensions.PLATFORM, SdkEventDimensions.BROWSER_NAME), MERCHANT,
                        SdkEventFilters.empty(), null, JAN_FIRST, dataSource).join());
        assertInstanceOf(QueryBuildException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("[browser_name]"), ex.getCause().getMessage());
        assertFalse(ex.getCause().getMessage().contains("BROWSER_NAME"), ex.getCause().getMessage());
    }

    @Test
    void testMissingArgumentsFailTheFuture() {
        PaymentAttempts metric = new PaymentAttempts(UnsupportedDimensionPolicy.DROP);

        CompletionException noFilters = assertThrows(CompletionException.class,
                () -> metric.loadMetrics(List.of(), MERCHANT, null, null, JAN_FIRST, dataSource).join());
        assertInstanceOf(QueryBuildException.class, noFilters.getCause());

        CompletionException noDimensions = assertThrows(CompletionException.class,
                () -> metric.loadMetrics(null, MERCHANT, SdkEventFilters.empty(), null, JAN_FIRST, dataSource).join());
        assertInstanceOf(QueryBuildException.class, noDimensions.getCause());
    }

    @Test
    void testDuplicateDimensionsGroupedOnce() {
        PaymentAttempts metric = new PaymentAttempts(UnsupportedDimensionPolicy.DROP);

        assertEquals(List.of(SdkEventDimensions.SOURCE, SdkEventDimensions.PLATFORM),
                metric.resolveDimensions(List.of(
                        SdkEventDimensions.SOURCE, SdkEventDimensions.PLATFORM, SdkEventDimensions.SOURCE)));
    }

    @Test
    void testExecutionFailureSurfacesAsQueryExecutionException() throws Exception {
        // 未建表的库
        Path otherDir = Files.createDirectories(tempDir.resolve("broken"));
        SqliteAnalyticsDataSource broken = SdkEventsTestDatabase.empty(otherDir).analyticsDataSource();

        CompletionException ex = assertThrows(CompletionException.class,
                () -> new PaymentAttempts(UnsupportedDimensionPolicy.DROP).loadMetrics(
                        List.of(), MERCHANT, SdkEventFilters.empty(), null, JAN_FIRST, broken).join());
        assertInstanceOf(QueryExecutionException.class, ex.getCause());
    }

    private static Map<String, MetricBucket> byPlatform(List<MetricBucket> buckets) {
        Map<String, MetricBucket> map = new HashMap<>();
        buckets.forEach(b -> map.put(b.identifier().dimension(SdkEventDimensions.PLATFORM), b));
        return map;
    }

    /**
     * 只支持 platform 维度的渲染计数
     */
    static class PlatformOnlyMetric extends AbstractSdkEventMetric {

        PlatformOnlyMetric(UnsupportedDimensionPolicy policy) {
            super(SdkEventMetrics.SDK_RENDERED_COUNT, policy);
        }

        @Override
        protected Set<SdkEventDimensions> supportedDimensions() {
            return EnumSet.of(SdkEventDimensions.PLATFORM);
        }

        @Override
        protected void addEventFilters(QueryBuilder<?> queryBuilder) {
            queryBuilder.addFilterClause(EVENT_NAME, eventName(SdkEventNames.APP_RENDERED));
        }
    }
}
