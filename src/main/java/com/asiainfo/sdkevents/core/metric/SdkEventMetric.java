package com.asiainfo.sdkevents.core.metric;

import com.asiainfo.sdkevents.core.datasource.AnalyticsDataSource;
import com.asiainfo.sdkevents.core.datasource.SdkEventMetricAnalytics;
import com.asiainfo.sdkevents.core.model.Granularity;
import com.asiainfo.sdkevents.core.model.MetricBucket;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventFilters;
import com.asiainfo.sdkevents.core.model.TimeRange;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * 单个指标的加载策略
 * 实现只依赖 AnalyticsDataSource 抽象，不感知具体后端
 */
public interface SdkEventMetric {

    /**
     * 加载指标
     *
     * @param dimensions     分组维度（顺序只影响展示）
     * @param publishableKey 租户标识
     * @param filters        维度过滤条件
     * @param granularity    时间粒度，null 表示整个时间范围一个桶
     * @param timeRange      时间范围 [start, end)
     * @param dataSource     后端，调用期间由调用方持有
     * @return (桶标识, 结果行) 列表，不保证顺序；任何失败都使 future 整体失败
     */
    <T extends AnalyticsDataSource & SdkEventMetricAnalytics> CompletableFuture<List<MetricBucket>> loadMetrics(
            List<SdkEventDimensions> dimensions,
            String publishableKey,
            SdkEventFilters filters,
            Granularity granularity,
            TimeRange timeRange,
            T dataSource);
}
