package com.asiainfo.sdkevents.core.model;

/**
 * 单个指标的一条聚合结果：(桶标识, 原始行)
 */
public record MetricBucket(SdkEventMetricsBucketIdentifier identifier, SdkEventMetricRow row) {

    public static MetricBucket of(SdkEventMetricRow row) {
        return new MetricBucket(SdkEventMetricsBucketIdentifier.fromRow(row), row);
    }
}
