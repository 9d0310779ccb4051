package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.datasource.AnalyticsDataSource;
import com.asiainfo.sdkevents.core.datasource.SdkEventMetricAnalytics;
import com.asiainfo.sdkevents.core.exception.MetricsException;
import com.asiainfo.sdkevents.core.exception.QueryBuildException;
import com.asiainfo.sdkevents.core.model.AnalyticsCollection;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.MetricBucket;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilters;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventNames;
import com.asiainfo.sdkevents.core.model.TimeRange;
import com.asiainfo.sdkevents.core.model.UnsupportedDimensionPolicy;
import com.asiainfo.sdkevents.core.query.Aggregate;
import com.asiainfo.sdkevents.core.query.QueryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * SDK 事件指标抽象基类
 * 模板方法模式：定义了所有指标共用的加载流程，子类只提供聚合列和事件过滤条件
 *
 * 流程：
 * 1. 选择聚合列（默认 COUNT(*) AS count）
 * 2. 租户条件 + 指标自身的事件条件 + 调用方过滤条件 + 时间范围
 * 3. GROUP BY = 请求维度 ∩ 支持维度，有粒度时再加时间桶
 * 4. 通过后端方言翻译并执行
 * 5. 每行加载为 SdkEventMetricRow，并由该行自身推导桶标识
 */
public abstract class AbstractSdkEventMetric implements SdkEventMetric {

    private static final Logger log = LoggerFactory.getLogger(AbstractSdkEventMetric.class);

    protected static final String MERCHANT_ID = "merchant_id";
    protected static final String EVENT_NAME = "event_name";
    protected static final String LOG_TYPE = "log_type";
    protected static final String CATEGORY = "category";
    protected static final String VALUE = "value";
    protected static final String FIRST_EVENT = "first_event";
    protected static final String LATENCY = "latency";

    private final SdkEventMetrics kind;
    private final UnsupportedDimensionPolicy dimensionPolicy;

    protected AbstractSdkEventMetric(SdkEventMetrics kind, UnsupportedDimensionPolicy dimensionPolicy) {
        this.kind = kind;
        this.dimensionPolicy = dimensionPolicy;
    }

    public SdkEventMetrics getKind() {
        return kind;
    }

    public UnsupportedDimensionPolicy getDimensionPolicy() {
        return dimensionPolicy;
    }

    @Override
    public <T extends AnalyticsDataSource & SdkEventMetricAnalytics> CompletableFuture<List<MetricBucket>> loadMetrics(
            List<SdkEventDimensions> dimensions,
            String publishableKey,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            T dataSource) {

        if (dimensions == null || publishableKey == null || filters == null || timeRange == null
                || dataSource == null) {
            return CompletableFuture.failedFuture(new QueryBuildException(String.format(
                    "Metric %s requires dimensions, publishable key, filters, time range and data source",
                    kind.getName())));
        }

        QueryBuilder<T> queryBuilder = new QueryBuilder<>(AnalyticsCollection.SDK_EVENTS);
        try {
            List<SdkEventDimensions> groupBy = resolveDimensions(dimensions);

            for (SdkEventDimensions dim : groupBy) {
                queryBuilder.addSelectColumn(dim.getColumn());
            }
            addAggregates(queryBuilder);
            if (granularity != null) {
                queryBuilder.addGranularityInMins(granularity, TimeRange.CREATED_AT);
            }

            queryBuilder.addFilterClause(MERCHANT_ID, publishableKey);
            addEventFilters(queryBuilder);
            filters.setFilterClause(queryBuilder);
            timeRange.setFilterClause(queryBuilder);

            for (SdkEventDimensions dim : groupBy) {
                queryBuilder.addGroupByClause(dim.getColumn());
            }
        } catch (MetricsException e) {
            return CompletableFuture.failedFuture(e);
        }

        log.debug("Loading metric {} on {} grouped by {}", kind.getName(), dataSource.getEngineName(), dimensions);
        return queryBuilder.executeQuery(dataSource, dataSource::loadMetricRow)
                .thenApply(rows -> {
                    List<MetricBucket> buckets = new ArrayList<>(rows.size());
                    rows.forEach(row -> buckets.add(MetricBucket.of(row)));
                    return buckets;
                });
    }

    /**
     * 本指标可以分组的维度，默认全部
     */
    protected Set<SdkEventDimensions> supportedDimensions() {
        return EnumSet.allOf(SdkEventDimensions.class);
    }

    /**
     * 聚合列（钩子方法，子类可覆盖）
     */
    protected void addAggregates(QueryBuilder<?> queryBuilder) {
        queryBuilder.addSelectColumn(Aggregate.count("count"));
    }

    /**
     * 指标自身的事件过滤条件（子类必须实现）
     */
    protected abstract void addEventFilters(QueryBuilder<?> queryBuilder);

    protected static String eventName(SdkEventNames name) {
        return name.name();
    }

    /**
     * 请求维度 ∩ 支持维度，保持请求顺序并去重
     */
    List<SdkEventDimensions> resolveDimensions(List<SdkEventDimensions> requested) {
        Set<SdkEventDimensions> supported = supportedDimensions();
        Set<SdkEventDimensions> resolved = new LinkedHashSet<>();
        List<SdkEventDimensions> unsupported = new ArrayList<>();
        for (SdkEventDimensions dim : requested) {
            if (supported.contains(dim)) {
                resolved.add(dim);
            } else {
                unsupported.add(dim);
            }
        }
        if (!unsupported.isEmpty()) {
            List<String> columns = unsupported.stream()
                    .map(SdkEventDimensions::getColumn)
                    .collect(Collectors.toList());
            if (dimensionPolicy == UnsupportedDimensionPolicy.REJECT) {
                throw new QueryBuildException(
                        String.format("Metric %s does not support dimensions %s", kind.getName(), columns));
            }
            log.debug("Metric {} ignores unsupported dimensions {}", kind.getName(), columns);
        }
        return new ArrayList<>(resolved);
    }
}
