package com.asiainfo.sdkevents.application;

import com.asiainfo.sdkevents.api.dto.GetSdkEventFiltersRequest;
import com.asiainfo.sdkevents.api.dto.GetSdkEventMetricRequest;
import com.asiainfo.sdkevents.config.AnalyticsDataSourceFactory;
import com.asiainfo.sdkevents.core.filter.SdkEventFilterLoader;
import com.asiainfo.sdkevents.core.metric.SdkEventMetricRegistry;
import com.asiainfo.sdkevents.core.model.MetricBucket;
import com.asiainfo.sdkevents.core.model.SdkEventDimensions;
import com.asiainfo.sdkevents.core.model.SdkEventMetrics;
import com.asiainfo.sdkevents.core.model.SdkEventMetricsBucketIdentifier;
import com.asiainfo.sdkevents.infra.persistence.JdbcAnalyticsDataSource;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * SDK 事件分析服务
 * 并发加载请求的全部指标，再按桶标识合并为一行一桶的结果
 */
@ApplicationScoped
public class SdkEventAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(SdkEventAnalyticsService.class);

    @Inject
    SdkEventMetricRegistry metricRegistry;

    @Inject
    SdkEventFilterLoader filterLoader;

    @Inject
    AnalyticsDataSourceFactory dataSourceFactory;

    public CompletableFuture<List<SdkEventMetricsBucketResponse>> getMetrics(
            String publishableKey, GetSdkEventMetricRequest request) {

        JdbcAnalyticsDataSource dataSource = dataSourceFactory.getDataSource();
        Map<SdkEventMetrics, CompletableFuture<List<MetricBucket>>> pending = new EnumMap<>(SdkEventMetrics.class);
        for (SdkEventMetrics metric : request.metrics()) {
            pending.put(metric, metricRegistry.loadMetrics(
                    metric,
                    request.groupByNames(),
                    publishableKey,
                    request.filters(),
                    request.granularity(),
                    request.timeRange(),
                    dataSource));
        }
        log.info("加载 {} 个指标, 维度: {}, 粒度: {}", pending.size(), request.groupByNames(), request.granularity());

        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    // 同一个桶在不同指标的结果合并到一起
                    Map<SdkEventMetricsBucketIdentifier, SdkEventMetricsAccumulator> merged = new LinkedHashMap<>();
                    pending.forEach((metric, future) -> {
                        for (MetricBucket bucket : future.join()) {
                            merged.computeIfAbsent(bucket.identifier(), id -> new SdkEventMetricsAccumulator())
                                    .add(metric, bucket.row());
                        }
                    });

                    List<SdkEventMetricsBucketResponse> responses = new ArrayList<>(merged.size());
                    merged.forEach((identifier, accumulator) ->
                            responses.add(new SdkEventMetricsBucketResponse(identifier, accumulator.collect())));
                    return responses;
                });
    }

    public CompletableFuture<List<SdkEventFilterValue>> getFilters(
            String publishableKey, GetSdkEventFiltersRequest request) {

        JdbcAnalyticsDataSource dataSource = dataSourceFactory.getDataSource();
        List<SdkEventDimensions> dimensions = request.groupByNames().isEmpty()
                ? Arrays.asList(SdkEventDimensions.values())
                : request.groupByNames();

        Map<SdkEventDimensions, CompletableFuture<List<String>>> pending = new LinkedHashMap<>();
        for (SdkEventDimensions dimension : dimensions) {
            pending.putIfAbsent(dimension,
                    filterLoader.loadFilterValues(dimension, publishableKey, request.timeRange(), dataSource));
        }

        return CompletableFuture.allOf(pending.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    List<SdkEventFilterValue> values = new ArrayList<>(pending.size());
                    pending.forEach((dimension, future) -> values.add(new SdkEventFilterValue(dimension, future.join())));
                    return values;
                });
    }

    public String getEngineDescription() {
        return dataSourceFactory.getEngineDescription();
    }
}
